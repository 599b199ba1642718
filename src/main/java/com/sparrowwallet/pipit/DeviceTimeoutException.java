package com.sparrowwallet.pipit;

/**
 * Exception thrown when the daemon does not answer within the read bound.
 */
public class DeviceTimeoutException extends DeviceException {

    public DeviceTimeoutException(String message) {
        super(message);
    }

    public DeviceTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
