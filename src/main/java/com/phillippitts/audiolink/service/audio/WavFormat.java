package com.phillippitts.audiolink.service.audio;

/**
 * Structural constants of the RIFF/WAVE container.
 *
 * <pre>
 * ┌─────────────────────────────────────┐
 * │ RIFF Header (12 bytes)              │  RIFF_HEADER_SIZE
 * ├─────────────────────────────────────┤
 * │ fmt chunk:                          │
 * │   - Chunk ID + Size (8 bytes)       │  CHUNK_HEADER_SIZE
 * │   - Chunk Data (≥16 bytes)          │  FMT_CHUNK_MIN_SIZE
 * ├─────────────────────────────────────┤
 * │ optional chunks (LIST, fact, ...)   │  skipped
 * ├─────────────────────────────────────┤
 * │ data chunk:                         │
 * │   - Chunk ID + Size (8 bytes)       │
 * │   - PCM samples (variable)          │
 * ├─────────────────────────────────────┤
 * │ optional trailing chunks            │  ignored
 * └─────────────────────────────────────┘
 * </pre>
 *
 * @see WavCodec
 */
public final class WavFormat {

    /** "RIFF" + size + "WAVE". */
    public static final int RIFF_HEADER_SIZE = 12;

    /** 4-character chunk ID + little-endian uint32 size. */
    public static final int CHUNK_HEADER_SIZE = 8;

    /** Smallest fmt chunk body: format, channels, rate, byte rate, block align, bits. */
    public static final int FMT_CHUNK_MIN_SIZE = 16;

    /** fmt body size of WAVE_FORMAT_EXTENSIBLE (cbSize=22). */
    public static final int FMT_EXTENSIBLE_SIZE = 40;

    /** Offset of the sub-format GUID inside an extensible fmt body. */
    public static final int FMT_EXTENSIBLE_SUBFORMAT_OFFSET = 24;

    /** Format tag for uncompressed integer PCM. */
    public static final int AUDIO_FORMAT_PCM = 1;

    /** Format tag meaning "see the sub-format GUID". */
    public static final int AUDIO_FORMAT_EXTENSIBLE = 0xFFFE;

    public static final String RIFF_ID = "RIFF";
    public static final String WAVE_ID = "WAVE";
    public static final String FMT_ID = "fmt ";
    public static final String DATA_ID = "data";

    private WavFormat() {
    }
}
