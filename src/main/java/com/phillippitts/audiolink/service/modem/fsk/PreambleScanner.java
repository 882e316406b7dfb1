package com.phillippitts.audiolink.service.modem.fsk;

import com.phillippitts.audiolink.domain.TransmissionProfile;

import java.util.Optional;

/**
 * Searches an accumulated sample stream for frames of one profile.
 *
 * <p>The search is a small state machine driven by {@link #scan}:
 * <ol>
 *   <li>Coarse scan: slide a symbol-long window in steps of 1/8 symbol, skipping silence, until
 *       the first preamble tone dominates it</li>
 *   <li>Gate: the second preamble tone must show up in one of the windows half a symbol, one
 *       symbol or one and a half symbols later</li>
 *   <li>Refine: test offsets around the hit in steps of 1/32 symbol and keep the one that best
 *       matches the whole preamble</li>
 *   <li>Verify every preamble symbol, read the length header, wait for the rest of the frame,
 *       check its CRC</li>
 * </ol>
 * A failed refine moves the search half a symbol forward, since refine already covered the
 * offsets in between; any other failure moves it one coarse step. When more samples are needed
 * the scan returns and resumes from the same state on the next call.
 *
 * <p>Windows below {@value #SILENCE_RMS} RMS (about -72 dBFS) count as silence. A capture
 * recorded quieter than that never matches and demodulates as no signal.
 */
final class PreambleScanner {

    /** Minimum share of window energy the expected tone must carry. */
    static final double MIN_TONE_RATIO = 0.5;

    /** Windows quieter than this RMS level are skipped. */
    static final double SILENCE_RMS = 8.0;

    /** Share of window energy the second preamble tone needs to pass the gate. */
    static final double GATE_TONE_RATIO = 0.25;

    private final TransmissionProfile profile;
    private final ToneDetector detector;
    private final int[] preamble;
    private final int symbolLength;
    private final int hop;
    private final int refineStep;
    private final int refineBefore;
    private final int refineAfter;
    private final double silenceEnergy;

    private long position;

    PreambleScanner(TransmissionProfile profile, int sampleRate) {
        this.profile = profile;
        this.detector = new ToneDetector(profile, sampleRate);
        this.preamble = Preamble.tonesFor(profile);
        this.symbolLength = profile.samplesPerSymbol();
        this.hop = symbolLength / 8;
        this.refineStep = symbolLength / 32;
        this.refineBefore = symbolLength / 4;
        this.refineAfter = symbolLength / 2 + symbolLength / 8;
        this.silenceEnergy = SILENCE_RMS * SILENCE_RMS * symbolLength;
    }

    TransmissionProfile profile() {
        return profile;
    }

    /**
     * Earliest absolute sample this scanner may still read.
     */
    long earliestNeeded() {
        return Math.max(0, position - refineBefore);
    }

    void reset() {
        position = 0;
    }

    /**
     * Advances the search over everything accumulated so far.
     *
     * @return the payload of the first complete, checksum-valid frame
     */
    Optional<byte[]> scan(SampleAccumulator acc) {
        short[] buf = acc.buffer();
        while (position + symbolLength <= acc.end()) {
            int idx = acc.indexOf(position);
            if (detector.energy(buf, idx) < silenceEnergy
                    || detector.ratio(buf, idx, preamble[0]) <= MIN_TONE_RATIO) {
                position += hop;
                continue;
            }

            long refineEnd = position + refineAfter + (long) Preamble.LENGTH * symbolLength;
            if (refineEnd > acc.end()) {
                return Optional.empty();
            }
            if (!secondToneFollows(acc)) {
                position += hop;
                continue;
            }
            long start = refine(acc);
            if (!preambleMatches(acc, start)) {
                position += symbolLength / 2;
                continue;
            }

            long headerStart = start + (long) Preamble.LENGTH * symbolLength;
            if (headerStart + (long) FrameCodec.HEADER_SYMBOLS * symbolLength > acc.end()) {
                return Optional.empty();
            }
            int length = FrameCodec.readLength(readSymbols(acc, headerStart, FrameCodec.HEADER_SYMBOLS));
            if (length > profile.maxPayloadBytes()) {
                position += hop;
                continue;
            }

            int frameSymbols = FrameCodec.symbolCount(length);
            long frameEnd = headerStart + (long) frameSymbols * symbolLength;
            if (frameEnd > acc.end()) {
                return Optional.empty();
            }
            Optional<byte[]> payload = FrameCodec.unpack(readSymbols(acc, headerStart, frameSymbols));
            if (payload.isEmpty()) {
                position += hop;
                continue;
            }
            position = frameEnd;
            return payload;
        }
        return Optional.empty();
    }

    private boolean secondToneFollows(SampleAccumulator acc) {
        short[] buf = acc.buffer();
        for (int half = 1; half <= 3; half++) {
            long at = position + (long) half * symbolLength / 2;
            if (detector.ratio(buf, acc.indexOf(at), preamble[1]) > GATE_TONE_RATIO) {
                return true;
            }
        }
        return false;
    }

    private long refine(SampleAccumulator acc) {
        short[] buf = acc.buffer();
        long from = Math.max(acc.start(), position - refineBefore);
        long best = position;
        double bestScore = -1.0;
        for (long candidate = from; candidate <= position + refineAfter; candidate += refineStep) {
            double score = 0.0;
            for (int k = 0; k < Preamble.LENGTH; k++) {
                score += detector.ratio(buf, acc.indexOf(candidate + (long) k * symbolLength), preamble[k]);
            }
            if (score > bestScore) {
                bestScore = score;
                best = candidate;
            }
        }
        return best;
    }

    private boolean preambleMatches(SampleAccumulator acc, long start) {
        for (int k = 0; k < Preamble.LENGTH; k++) {
            ToneDetector.Detection d = detector.detect(acc.buffer(), acc.indexOf(start + (long) k * symbolLength));
            if (d.tone() != preamble[k] || d.ratio() <= MIN_TONE_RATIO) {
                return false;
            }
        }
        return true;
    }

    private int[] readSymbols(SampleAccumulator acc, long from, int count) {
        int[] symbols = new int[count];
        for (int i = 0; i < count; i++) {
            symbols[i] = detector.detect(acc.buffer(), acc.indexOf(from + (long) i * symbolLength)).tone();
        }
        return symbols;
    }
}
