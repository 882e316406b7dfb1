package com.phillippitts.audiolink.presentation.exception;

import com.phillippitts.audiolink.domain.ErrorKind;
import com.phillippitts.audiolink.exception.AudioLinkException;
import com.phillippitts.audiolink.exception.ModemException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.MultipartException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

import java.time.Instant;
import java.util.stream.Collectors;

/**
 * Global exception handler for REST API boundary.
 *
 * <p>Converts domain exceptions to HTTP responses with the status of their {@link ErrorKind}.
 * Client errors are logged at WARN with their detail; server errors at ERROR with the stack
 * trace, and the client only sees a generic detail.
 */
@ControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    static final String INTERNAL_DETAIL = "An unexpected error occurred. Please contact support with the request ID.";
    static final String UNAVAILABLE_DETAIL = "All modem instances are busy. Please retry shortly.";

    /**
     * Modem failures never expose their diagnostic message.
     */
    @ExceptionHandler(ModemException.class)
    ResponseEntity<ApiError> handleModemFailure(ModemException ex) {
        if (ex.getKind() == ErrorKind.MODEM_UNAVAILABLE) {
            LOG.warn("Modem unavailable: operation={}", ex.getOperation());
            return respond(ErrorKind.MODEM_UNAVAILABLE, UNAVAILABLE_DETAIL);
        }
        LOG.error("Modem failure: operation={}", ex.getOperation(), ex);
        return respond(ex.getKind(), ex.getKind() == ErrorKind.INTERNAL_ERROR ? INTERNAL_DETAIL : ex.getMessage());
    }

    /**
     * Classified failures: validation, upload, container, no-signal, timeout.
     */
    @ExceptionHandler(AudioLinkException.class)
    ResponseEntity<ApiError> handleAudioLinkFailure(AudioLinkException ex) {
        ErrorKind kind = ex.getKind();
        if (kind == ErrorKind.INTERNAL_ERROR) {
            LOG.error("Request failed: kind={}", kind, ex);
            return respond(kind, INTERNAL_DETAIL);
        }
        LOG.warn("Request rejected: kind={}, detail={}", kind, ex.getMessage());
        return respond(kind, ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    ResponseEntity<ApiError> handleInvalidBody(MethodArgumentNotValidException ex) {
        String detail = ex.getBindingResult().getFieldErrors().stream()
                .map(FieldError::getDefaultMessage)
                .collect(Collectors.joining(" "));
        LOG.warn("Invalid request body: {}", detail);
        return respond(ErrorKind.INVALID_REQUEST, detail.isEmpty() ? "Invalid request body." : detail);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    ResponseEntity<ApiError> handleUnreadableBody(HttpMessageNotReadableException ex) {
        LOG.warn("Unreadable request body: {}", ex.getMostSpecificCause().getMessage());
        return respond(ErrorKind.INVALID_REQUEST,
                "Request body must be a JSON object with a string field 'text'.");
    }

    @ExceptionHandler(MissingServletRequestPartException.class)
    ResponseEntity<ApiError> handleMissingPart(MissingServletRequestPartException ex) {
        LOG.warn("Missing multipart field: {}", ex.getRequestPartName());
        return respond(ErrorKind.INVALID_REQUEST,
                "Required multipart field '" + ex.getRequestPartName() + "' is missing.");
    }

    /**
     * Container-level multipart limit, hit before the decode pipeline sees the upload.
     */
    @ExceptionHandler(MaxUploadSizeExceededException.class)
    ResponseEntity<ApiError> handleUploadTooLarge(MaxUploadSizeExceededException ex) {
        LOG.warn("Upload exceeded multipart limit: maxUploadSize={}", ex.getMaxUploadSize());
        return respond(ErrorKind.UPLOAD_TOO_LARGE, "Uploaded file too large.");
    }

    @ExceptionHandler(MultipartException.class)
    ResponseEntity<ApiError> handleMultipart(MultipartException ex) {
        LOG.warn("Malformed multipart request: {}", ex.getMessage());
        return respond(ErrorKind.INVALID_REQUEST, "Request must be multipart/form-data with a 'file' field.");
    }

    /**
     * Catch-all for unexpected errors (HTTP 500).
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        if (ex instanceof ErrorResponse framework && framework.getStatusCode().is4xxClientError()) {
            // Unknown route, wrong method, and similar MVC rejections keep their status
            LOG.warn("Request rejected by framework: {}", ex.getMessage());
            return ResponseEntity
                    .status(framework.getStatusCode())
                    .body(new ApiError(framework.getBody().getDetail(), ErrorKind.INVALID_REQUEST.name(), Instant.now()));
        }
        LOG.error("Unexpected error", ex);
        return respond(ErrorKind.INTERNAL_ERROR, INTERNAL_DETAIL);
    }

    private static ResponseEntity<ApiError> respond(ErrorKind kind, String detail) {
        return ResponseEntity
                .status(ErrorStatus.of(kind))
                .body(new ApiError(detail, kind.name(), Instant.now()));
    }

    /**
     * Standardized error response for API clients.
     */
    record ApiError(
            String detail,
            String errorCode,
            Instant timestamp
    ) {}
}
