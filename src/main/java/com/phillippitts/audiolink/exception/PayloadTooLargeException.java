package com.phillippitts.audiolink.exception;

import com.phillippitts.audiolink.domain.ErrorKind;

/**
 * Thrown before any modem call when a text payload exceeds the effective ceiling.
 */
public class PayloadTooLargeException extends AudioLinkException {

    private final int payloadBytes;
    private final int maxBytes;

    public PayloadTooLargeException(int payloadBytes, int maxBytes) {
        super(ErrorKind.PAYLOAD_TOO_LARGE,
                "Payload too large: " + payloadBytes + " bytes. Max: " + maxBytes + " bytes");
        this.payloadBytes = payloadBytes;
        this.maxBytes = maxBytes;
    }

    public int getPayloadBytes() {
        return payloadBytes;
    }

    public int getMaxBytes() {
        return maxBytes;
    }
}
