package com.sparrowwallet.pipit;

public class DeviceNotTrustedException extends DeviceException {
    public DeviceNotTrustedException() {
        super("Daemon did not accept the public key");
    }

    public DeviceNotTrustedException(String message) {
        super(message);
    }

    public DeviceNotTrustedException(String message, Throwable cause) {
        super(message, cause);
    }
}
