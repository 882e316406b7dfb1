package com.phillippitts.audiolink.presentation.exception;

import com.phillippitts.audiolink.domain.ErrorKind;
import org.springframework.http.HttpStatus;

/**
 * HTTP status for each {@link ErrorKind}.
 */
final class ErrorStatus {

    private ErrorStatus() {
    }

    static HttpStatus of(ErrorKind kind) {
        return switch (kind) {
            case INVALID_REQUEST, EMPTY_UPLOAD, MALFORMED_CONTAINER -> HttpStatus.BAD_REQUEST;
            case PAYLOAD_TOO_LARGE, UPLOAD_TOO_LARGE -> HttpStatus.PAYLOAD_TOO_LARGE;
            case UNSUPPORTED_CHANNEL_LAYOUT -> HttpStatus.UNSUPPORTED_MEDIA_TYPE;
            case NO_SIGNAL_DETECTED -> HttpStatus.UNPROCESSABLE_ENTITY;
            case MODEM_UNAVAILABLE -> HttpStatus.SERVICE_UNAVAILABLE;
            case DECODE_TIMEOUT -> HttpStatus.GATEWAY_TIMEOUT;
            case INTERNAL_ERROR -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }
}
