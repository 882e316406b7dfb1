package com.phillippitts.audiolink.service.audio;

import com.phillippitts.audiolink.domain.SampleBuffer;
import com.phillippitts.audiolink.exception.MalformedContainerException;
import com.phillippitts.audiolink.exception.UnsupportedChannelLayoutException;
import org.springframework.stereotype.Component;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

import static com.phillippitts.audiolink.service.audio.AudioFormat.WAV_HEADER_SIZE;

/**
 * Converts mono PCM sample buffers to RIFF/WAVE bytes and back.
 *
 * <p>Encoding always writes the canonical 44-byte header (fmt chunk of 16 bytes followed by
 * the data chunk). Decoding walks the chunk list, so files carrying {@code LIST}/{@code fact}
 * chunks or an extensible fmt chunk are accepted as long as the audio itself is mono
 * 8- or 16-bit integer PCM.
 *
 * <p>Stateless and thread-safe.
 */
@Component
public class WavCodec {

    /**
     * Encodes samples at the buffer's own rate and depth.
     */
    public byte[] encode(SampleBuffer buffer) {
        Objects.requireNonNull(buffer, "buffer must not be null");
        return encode(buffer.samples(), buffer.sampleRate(), buffer.bitDepth());
    }

    /**
     * Writes a canonical mono PCM WAV file.
     *
     * @param samples    signed samples; for 8-bit they must lie in {@code -128..127}
     * @param sampleRate sample rate in Hz (must be positive)
     * @param bitDepth   8 or 16
     * @return 44 header bytes followed by {@code samples.length * bitDepth / 8} data bytes
     * @throws IllegalArgumentException on an invalid format or an out-of-range 8-bit sample
     */
    public byte[] encode(short[] samples, int sampleRate, int bitDepth) {
        Objects.requireNonNull(samples, "samples must not be null");
        if (sampleRate <= 0) {
            throw new IllegalArgumentException("Sample rate must be positive, got: " + sampleRate);
        }
        if (bitDepth != 8 && bitDepth != 16) {
            throw new IllegalArgumentException("Unsupported bit depth: " + bitDepth + " (expected 8 or 16)");
        }
        int bytesPerSample = bitDepth / 8;
        int dataSize;
        int totalSize;
        try {
            dataSize = Math.multiplyExact(samples.length, bytesPerSample);
            totalSize = Math.addExact(WAV_HEADER_SIZE, dataSize);
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("Too many samples for a WAV container: " + samples.length, e);
        }

        ByteBuffer out = ByteBuffer.allocate(totalSize).order(ByteOrder.LITTLE_ENDIAN);
        out.put(ascii(WavFormat.RIFF_ID));
        out.putInt(totalSize - 8);
        out.put(ascii(WavFormat.WAVE_ID));

        out.put(ascii(WavFormat.FMT_ID));
        out.putInt(WavFormat.FMT_CHUNK_MIN_SIZE);
        out.putShort((short) WavFormat.AUDIO_FORMAT_PCM);
        out.putShort((short) AudioFormat.MODEM_CHANNELS);
        out.putInt(sampleRate);
        out.putInt(sampleRate * bytesPerSample);
        out.putShort((short) bytesPerSample);
        out.putShort((short) bitDepth);

        out.put(ascii(WavFormat.DATA_ID));
        out.putInt(dataSize);
        if (bitDepth == 16) {
            for (short s : samples) {
                out.putShort(s);
            }
        } else {
            for (int i = 0; i < samples.length; i++) {
                short s = samples[i];
                if (s < Byte.MIN_VALUE || s > Byte.MAX_VALUE) {
                    throw new IllegalArgumentException("Sample " + i + " out of 8-bit range: " + s);
                }
                out.put((byte) (s + 128)); // 8-bit WAV is unsigned
            }
        }
        return out.array();
    }

    /**
     * Parses a WAV container into its samples.
     *
     * @param wav complete file bytes
     * @return mono samples at the container's sample rate and bit depth
     * @throws MalformedContainerException       if the bytes are not a readable PCM WAV file
     * @throws UnsupportedChannelLayoutException if the file is not mono
     */
    public SampleBuffer decode(byte[] wav) {
        Objects.requireNonNull(wav, "wav must not be null");
        int size = wav.length;
        if (size < WavFormat.RIFF_HEADER_SIZE) {
            throw new MalformedContainerException(size, "truncated header, a RIFF header needs "
                    + WavFormat.RIFF_HEADER_SIZE + " bytes");
        }
        if (!WavFormat.RIFF_ID.equals(readChunkId(wav, 0)) || !WavFormat.WAVE_ID.equals(readChunkId(wav, 8))) {
            throw new MalformedContainerException(size, "unrecognized format tag, expected RIFF/WAVE");
        }

        FmtChunk fmt = null;
        long offset = WavFormat.RIFF_HEADER_SIZE;
        while (offset + WavFormat.CHUNK_HEADER_SIZE <= size) {
            int chunkStart = (int) offset;
            String chunkId = readChunkId(wav, chunkStart);
            long chunkSize = readLEUInt(wav, chunkStart + 4);
            int body = chunkStart + WavFormat.CHUNK_HEADER_SIZE;
            long remaining = (long) size - body;

            if (WavFormat.DATA_ID.equals(chunkId)) {
                if (fmt == null) {
                    throw new MalformedContainerException(size, "data chunk precedes fmt chunk");
                }
                if (chunkSize > remaining) {
                    throw new MalformedContainerException(size, "declared data length " + chunkSize
                            + " exceeds the " + remaining + " bytes remaining");
                }
                return readSamples(wav, body, (int) chunkSize, fmt);
            }
            if (chunkSize > remaining) {
                throw new MalformedContainerException(size, "chunk '" + printable(chunkId) + "' declares "
                        + chunkSize + " bytes but only " + remaining + " remain");
            }
            if (WavFormat.FMT_ID.equals(chunkId)) {
                fmt = parseFmt(wav, body, (int) chunkSize);
            }
            // Chunks are padded to even sizes
            offset = body + chunkSize + (chunkSize & 1);
        }

        if (fmt == null) {
            throw new MalformedContainerException(size, "missing fmt chunk");
        }
        throw new MalformedContainerException(size, "missing data chunk");
    }

    private FmtChunk parseFmt(byte[] wav, int offset, int chunkSize) {
        if (chunkSize < WavFormat.FMT_CHUNK_MIN_SIZE) {
            throw new MalformedContainerException(wav.length, "fmt chunk too small: " + chunkSize
                    + " bytes (expected at least " + WavFormat.FMT_CHUNK_MIN_SIZE + ")");
        }
        int audioFormat = readLEUShort(wav, offset);
        int channels = readLEUShort(wav, offset + 2);
        long sampleRate = readLEUInt(wav, offset + 4);
        int blockAlign = readLEUShort(wav, offset + 12);
        int bitsPerSample = readLEUShort(wav, offset + 14);

        if (audioFormat == WavFormat.AUDIO_FORMAT_EXTENSIBLE) {
            if (chunkSize < WavFormat.FMT_EXTENSIBLE_SIZE
                    || readLEUShort(wav, offset + WavFormat.FMT_EXTENSIBLE_SUBFORMAT_OFFSET)
                        != WavFormat.AUDIO_FORMAT_PCM) {
                throw new MalformedContainerException(wav.length,
                        "unsupported extensible sub-format (only integer PCM)");
            }
        } else if (audioFormat != WavFormat.AUDIO_FORMAT_PCM) {
            throw new MalformedContainerException(wav.length, "unsupported audio format " + audioFormat
                    + " (expected " + WavFormat.AUDIO_FORMAT_PCM + " for PCM)");
        }
        if (channels == 0) {
            throw new MalformedContainerException(wav.length, "channel count is zero");
        }
        if (channels != AudioFormat.MODEM_CHANNELS) {
            throw new UnsupportedChannelLayoutException(wav.length, channels);
        }
        if (sampleRate == 0 || sampleRate > Integer.MAX_VALUE) {
            throw new MalformedContainerException(wav.length, "invalid sample rate: " + sampleRate);
        }
        if (bitsPerSample != 8 && bitsPerSample != 16) {
            throw new MalformedContainerException(wav.length, "unsupported bit depth: " + bitsPerSample
                    + "-bit (expected 8 or 16)");
        }
        if (blockAlign != bitsPerSample / 8) {
            throw new MalformedContainerException(wav.length, "invalid block align: " + blockAlign
                    + " for " + bitsPerSample + "-bit mono");
        }
        return new FmtChunk((int) sampleRate, bitsPerSample);
    }

    private SampleBuffer readSamples(byte[] wav, int offset, int dataSize, FmtChunk fmt) {
        int bytesPerSample = fmt.bitsPerSample() / 8;
        if (dataSize % bytesPerSample != 0) {
            throw new MalformedContainerException(wav.length, "data length " + dataSize
                    + " not aligned to " + bytesPerSample + "-byte samples");
        }
        short[] samples = new short[dataSize / bytesPerSample];
        if (bytesPerSample == 2) {
            ByteBuffer.wrap(wav, offset, dataSize).order(ByteOrder.LITTLE_ENDIAN).asShortBuffer().get(samples);
        } else {
            for (int i = 0; i < samples.length; i++) {
                samples[i] = (short) ((wav[offset + i] & 0xFF) - 128);
            }
        }
        return SampleBuffer.wrap(samples, fmt.sampleRate(), fmt.bitsPerSample());
    }

    private static byte[] ascii(String id) {
        return id.getBytes(StandardCharsets.US_ASCII);
    }

    private static String readChunkId(byte[] wav, int offset) {
        return new String(wav, offset, 4, StandardCharsets.US_ASCII);
    }

    private static String printable(String chunkId) {
        return chunkId.replaceAll("[^\\x20-\\x7E]", "?");
    }

    private static int readLEUShort(byte[] a, int off) {
        return (a[off] & 0xFF) | ((a[off + 1] & 0xFF) << 8);
    }

    private static long readLEUInt(byte[] a, int off) {
        return (a[off] & 0xFFL)
             | ((a[off + 1] & 0xFFL) << 8)
             | ((a[off + 2] & 0xFFL) << 16)
             | ((a[off + 3] & 0xFFL) << 24);
    }

    private record FmtChunk(int sampleRate, int bitsPerSample) {
    }
}
