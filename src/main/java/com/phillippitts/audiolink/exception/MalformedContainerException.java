package com.phillippitts.audiolink.exception;

import com.phillippitts.audiolink.domain.ErrorKind;

/**
 * Thrown when uploaded bytes are not a WAV container we can read: truncated header,
 * unknown format tag, unsupported bit depth, or a data chunk longer than the file.
 */
public class MalformedContainerException extends AudioLinkException {

    private final int containerSize;
    private final String reason;

    public MalformedContainerException(int containerSize, String reason) {
        this(ErrorKind.MALFORMED_CONTAINER, containerSize, reason);
    }

    protected MalformedContainerException(ErrorKind kind, int containerSize, String reason) {
        super(kind, "Malformed WAV container (" + containerSize + " bytes): " + reason);
        this.containerSize = containerSize;
        this.reason = reason;
    }

    public int getContainerSize() {
        return containerSize;
    }

    public String getReason() {
        return reason;
    }
}
