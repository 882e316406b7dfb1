package com.phillippitts.audiolink.exception;

import com.phillippitts.audiolink.domain.ErrorKind;

/**
 * Thrown when a request declares a body larger than the endpoint accepts. Raised before the
 * body is read.
 */
public class RequestTooLargeException extends AudioLinkException {

    private final long contentLength;

    public RequestTooLargeException(long contentLength, long maxBytes) {
        super(ErrorKind.PAYLOAD_TOO_LARGE,
                "Request body too large: " + contentLength + " bytes. Max: " + maxBytes + " bytes");
        this.contentLength = contentLength;
    }

    public long getContentLength() {
        return contentLength;
    }
}
