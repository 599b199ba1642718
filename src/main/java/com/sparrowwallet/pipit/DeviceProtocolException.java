package com.sparrowwallet.pipit;

public class DeviceProtocolException extends DeviceException {
    public DeviceProtocolException(String message) {
        super(message);
    }

    public DeviceProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
