package com.phillippitts.audiolink.exception;

import com.phillippitts.audiolink.domain.ErrorKind;

/**
 * Thrown when no modem instance becomes free within the acquire timeout.
 */
public class ModemUnavailableException extends ModemException {

    public ModemUnavailableException(String operation, long waitedMs) {
        super(ErrorKind.MODEM_UNAVAILABLE, "No modem instance free after " + waitedMs + "ms wait", operation);
    }

    public ModemUnavailableException(String operation, Throwable cause) {
        super(ErrorKind.MODEM_UNAVAILABLE, "Interrupted while waiting for a modem instance", operation, cause);
    }
}
