package com.phillippitts.audiolink.exception;

import com.phillippitts.audiolink.domain.DecodeResult;

/**
 * Raised at the HTTP boundary for a {@link DecodeResult} that did not decode.
 * The message is the result's caller-safe detail.
 */
public class DecodeFailedException extends AudioLinkException {

    public DecodeFailedException(DecodeResult result) {
        super(requireFailure(result).failure(), result.detail());
    }

    private static DecodeResult requireFailure(DecodeResult result) {
        if (result.isDecoded()) {
            throw new IllegalArgumentException("Result is a successful decode");
        }
        return result;
    }
}
