package com.sparrowwallet.pipit.adb;

/**
 * Message commands, packed as four ASCII characters in little-endian order.
 */
public enum AdbCommand {
    CNXN(0x4e584e43), OPEN(0x4e45504f), OKAY(0x59414b4f), CLSE(0x45534c43), AUTH(0x48545541), WRTE(0x45545257);

    private final int code;

    AdbCommand(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    public int getMagic() {
        return ~code;
    }

    public static AdbCommand fromCode(int code) {
        for(AdbCommand command : values()) {
            if(command.code == code) {
                return command;
            }
        }

        return null;
    }

    public static String toString(int code) {
        AdbCommand command = fromCode(code);
        return command == null ? String.format("0x%08x", code) : command.name();
    }
}
