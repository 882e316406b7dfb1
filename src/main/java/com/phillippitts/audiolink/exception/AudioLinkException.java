package com.phillippitts.audiolink.exception;

import com.phillippitts.audiolink.domain.ErrorKind;

import java.util.Objects;

/**
 * Base exception for all AudioLink application-specific errors.
 * Every subclass carries the {@link ErrorKind} used to pick the HTTP status.
 */
public class AudioLinkException extends RuntimeException {

    private final ErrorKind kind;

    public AudioLinkException(ErrorKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public AudioLinkException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public ErrorKind getKind() {
        return kind;
    }
}
