package com.phillippitts.audiolink.service.audio;

/**
 * Single source of truth for the modem's audio format.
 * Required: 48 kHz, 16-bit signed PCM, mono, little-endian.
 */
public final class AudioFormat {

    /** Sample rate the modem modulates and demodulates at, in Hz. */
    public static final int MODEM_SAMPLE_RATE = 48_000;
    /** Bit depth the modem works with. */
    public static final int MODEM_BITS_PER_SAMPLE = 16;
    /** Only mono audio is produced or accepted. */
    public static final int MODEM_CHANNELS = 1;

    /** Bytes per PCM frame at the modem format. */
    public static final int MODEM_BLOCK_ALIGN = (MODEM_BITS_PER_SAMPLE / 8) * MODEM_CHANNELS; // 2 bytes
    /** Bytes per second at the modem format. */
    public static final int MODEM_BYTE_RATE = MODEM_SAMPLE_RATE * MODEM_BLOCK_ALIGN;          // 96,000

    /** MIME type of the container we emit. */
    public static final String WAV_CONTENT_TYPE = "audio/wav";

    // Canonical 44-byte header offsets (what WavCodec writes)
    public static final int WAV_HEADER_SIZE = 44;
    public static final int WAV_CHANNELS_OFFSET = 22;            // 2 bytes (LE)
    public static final int WAV_SAMPLE_RATE_OFFSET = 24;         // 4 bytes (LE)
    public static final int WAV_BYTE_RATE_OFFSET = 28;           // 4 bytes (LE)
    public static final int WAV_BLOCK_ALIGN_OFFSET = 32;         // 2 bytes (LE)
    public static final int WAV_BITS_PER_SAMPLE_OFFSET = 34;     // 2 bytes (LE)
    public static final int WAV_DATA_SIZE_OFFSET = 40;           // 4 bytes (LE)

    private AudioFormat() {}
}
