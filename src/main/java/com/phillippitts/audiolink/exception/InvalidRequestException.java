package com.phillippitts.audiolink.exception;

import com.phillippitts.audiolink.domain.ErrorKind;

/**
 * Thrown when a request is structurally valid but names something we do not know,
 * such as an unknown transmission profile.
 */
public class InvalidRequestException extends AudioLinkException {

    public InvalidRequestException(String message) {
        super(ErrorKind.INVALID_REQUEST, message);
    }
}
