package com.sparrowwallet.pipit;

/**
 * Android key codes used to drive apps on the device.
 */
public enum KeyCode {
    HOME(3), BACK(4), DPAD_UP(19), DPAD_DOWN(20), DPAD_LEFT(21), DPAD_RIGHT(22), DPAD_CENTER(23),
    VOLUME_UP(24), VOLUME_DOWN(25), POWER(26), ENTER(66), MENU(82), MEDIA_PLAY_PAUSE(85), MEDIA_STOP(86),
    MEDIA_PLAY(126), MEDIA_PAUSE(127), SLEEP(223), WAKEUP(224);

    private final int code;

    KeyCode(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    /**
     * Parse a key code given either as a number or as a name, with or without the KEYCODE_ prefix.
     *
     * @throws IllegalArgumentException if the value is neither
     */
    public static int parse(String value) {
        String trimmed = value.trim();
        try {
            return Integer.parseInt(trimmed);
        } catch(NumberFormatException e) {
            String name = trimmed.toUpperCase(java.util.Locale.ROOT);
            if(name.startsWith("KEYCODE_")) {
                name = name.substring("KEYCODE_".length());
            }
            return KeyCode.valueOf(name).getCode();
        }
    }
}
