package com.phillippitts.audiolink.exception;

import com.phillippitts.audiolink.domain.ErrorKind;

/**
 * Thrown when a modem operation fails: timeout, pool exhaustion, or an error inside the modem.
 */
public class ModemException extends AudioLinkException {

    private final String operation;

    public ModemException(ErrorKind kind, String message, String operation) {
        super(kind, message + " (operation: " + operation + ")");
        this.operation = operation;
    }

    public ModemException(ErrorKind kind, String message, String operation, Throwable cause) {
        super(kind, message + " (operation: " + operation + ")", cause);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
