package com.phillippitts.audiolink.service.modem.fsk;

import java.util.Optional;
import java.util.zip.CRC32;

/**
 * Frame layout below the preamble, expressed in 4-bit symbols (high nibble first):
 *
 * <pre>
 * | length (2 bytes, big-endian) | payload (length bytes) | CRC-32 of length+payload (4 bytes) |
 * </pre>
 */
final class FrameCodec {

    static final int HEADER_SYMBOLS = 4;
    static final int TRAILER_SYMBOLS = 8;
    static final int MAX_FRAME_PAYLOAD = 0xFFFF;

    private FrameCodec() {
    }

    /**
     * Number of symbols of a frame (header, payload and trailer) carrying {@code payloadLength} bytes.
     */
    static int symbolCount(int payloadLength) {
        return HEADER_SYMBOLS + 2 * payloadLength + TRAILER_SYMBOLS;
    }

    static int[] toSymbols(byte[] payload) {
        if (payload.length > MAX_FRAME_PAYLOAD) {
            throw new IllegalArgumentException("Payload exceeds frame limit: " + payload.length);
        }
        byte[] body = new byte[2 + payload.length];
        body[0] = (byte) (payload.length >>> 8);
        body[1] = (byte) payload.length;
        System.arraycopy(payload, 0, body, 2, payload.length);
        long crc = crc32(body);

        int[] symbols = new int[symbolCount(payload.length)];
        int i = 0;
        for (byte b : body) {
            symbols[i++] = (b >>> 4) & 0x0F;
            symbols[i++] = b & 0x0F;
        }
        for (int shift = 28; shift >= 0; shift -= 4) {
            symbols[i++] = (int) ((crc >>> shift) & 0x0F);
        }
        return symbols;
    }

    /**
     * Payload length announced by the first {@value #HEADER_SYMBOLS} symbols.
     */
    static int readLength(int[] header) {
        int length = 0;
        for (int i = 0; i < HEADER_SYMBOLS; i++) {
            length = (length << 4) | header[i];
        }
        return length;
    }

    /**
     * Checks the CRC of a complete frame and extracts its payload.
     *
     * @param symbols exactly {@code symbolCount(readLength(symbols))} symbols
     * @return the payload, or empty when the checksum does not match
     */
    static Optional<byte[]> unpack(int[] symbols) {
        int length = readLength(symbols);
        if (symbols.length != symbolCount(length)) {
            return Optional.empty();
        }
        byte[] body = new byte[2 + length];
        for (int b = 0; b < body.length; b++) {
            body[b] = (byte) ((symbols[2 * b] << 4) | symbols[2 * b + 1]);
        }
        long expected = 0;
        for (int i = 2 * body.length; i < symbols.length; i++) {
            expected = (expected << 4) | symbols[i];
        }
        if (crc32(body) != expected) {
            return Optional.empty();
        }
        byte[] payload = new byte[length];
        System.arraycopy(body, 2, payload, 0, length);
        return Optional.of(payload);
    }

    private static long crc32(byte[] data) {
        CRC32 crc = new CRC32();
        crc.update(data, 0, data.length);
        return crc.getValue();
    }
}
