package com.sparrowwallet.pipit;

/**
 * Base class for all failures talking to the debug daemon.
 */
public class DeviceException extends Exception {
    public DeviceException(String message) {
        super(message);
    }

    public DeviceException(String message, Throwable cause) {
        super(message, cause);
    }
}
