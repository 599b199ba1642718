package com.sparrowwallet.pipit;

/**
 * Nothing is listening on the daemon port. Network debugging is usually not enabled on the device.
 */
public class DeviceConnectionRefusedException extends DeviceException {
    public DeviceConnectionRefusedException(String message) {
        super(message);
    }

    public DeviceConnectionRefusedException(String message, Throwable cause) {
        super(message, cause);
    }
}
