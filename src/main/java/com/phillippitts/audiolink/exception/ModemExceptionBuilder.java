package com.phillippitts.audiolink.exception;

import com.phillippitts.audiolink.domain.ErrorKind;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for {@link ModemException} with contextual diagnostics.
 *
 * <p><b>Usage:</b>
 * <pre>
 * throw ModemExceptionBuilder.create("Demodulation timed out")
 *         .kind(ErrorKind.DECODE_TIMEOUT)
 *         .operation("demodulate")
 *         .durationMs(elapsed)
 *         .metadata("samples", buffer.length())
 *         .build();
 * </pre>
 *
 * <p>The message ends up in logs only. Callers facing HTTP clients use their own wording.
 */
public final class ModemExceptionBuilder {

    private final String message;
    private ErrorKind kind = ErrorKind.INTERNAL_ERROR;
    private String operation;
    private Throwable cause;
    private Long durationMs;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private ModemExceptionBuilder(String message) {
        this.message = message;
    }

    /**
     * @param message base error message (must not be null or empty)
     */
    public static ModemExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new ModemExceptionBuilder(message);
    }

    /** Defaults to {@link ErrorKind#INTERNAL_ERROR}. */
    public ModemExceptionBuilder kind(ErrorKind kind) {
        if (kind != null) {
            this.kind = kind;
        }
        return this;
    }

    public ModemExceptionBuilder operation(String operation) {
        this.operation = operation;
        return this;
    }

    public ModemExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    public ModemExceptionBuilder durationMs(long durationMs) {
        this.durationMs = durationMs;
        return this;
    }

    /**
     * Adds a key-value pair to the message; null keys or values are ignored.
     */
    public ModemExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    /**
     * Message format: {@code {message} (durationMs={ms}, {key1}={val1}, ...) (operation: {op})}.
     */
    public ModemException build() {
        String op = operation != null ? operation : "unknown";
        String detailed = buildDetailedMessage();
        return cause != null
                ? new ModemException(kind, detailed, op, cause)
                : new ModemException(kind, detailed, op);
    }

    private String buildDetailedMessage() {
        if (durationMs == null && metadata.isEmpty()) {
            return message;
        }
        StringBuilder sb = new StringBuilder(message).append(" (");
        boolean first = true;
        if (durationMs != null) {
            sb.append("durationMs=").append(durationMs);
            first = false;
        }
        for (Map.Entry<String, String> entry : metadata.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(entry.getKey()).append('=').append(entry.getValue());
            first = false;
        }
        return sb.append(')').toString();
    }
}
