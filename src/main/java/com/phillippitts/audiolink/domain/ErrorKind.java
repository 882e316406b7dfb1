package com.phillippitts.audiolink.domain;

/**
 * Classification of every way an encode or decode request can fail.
 *
 * <p>{@link #NO_SIGNAL_DETECTED} is not a fault: the audio was well-formed but carried no
 * decodable transmission. It is kept apart from {@link #MALFORMED_CONTAINER} all the way to
 * the HTTP response.
 */
public enum ErrorKind {
    INVALID_REQUEST,
    PAYLOAD_TOO_LARGE,
    UPLOAD_TOO_LARGE,
    EMPTY_UPLOAD,
    MALFORMED_CONTAINER,
    UNSUPPORTED_CHANNEL_LAYOUT,
    NO_SIGNAL_DETECTED,
    DECODE_TIMEOUT,
    MODEM_UNAVAILABLE,
    INTERNAL_ERROR;

    /**
     * Whether the failure was caused by the caller's input rather than by the service.
     *
     * @return true for validation and format errors
     */
    public boolean isClientError() {
        return switch (this) {
            case DECODE_TIMEOUT, MODEM_UNAVAILABLE, INTERNAL_ERROR -> false;
            default -> true;
        };
    }
}
