package com.sparrowwallet.pipit.adb;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * A single frame: a command, two arguments and an optional payload.
 */
public class AdbMessage {
    private static final byte[] EMPTY = new byte[0];

    private final int command;
    private final int arg0;
    private final int arg1;
    private final byte[] payload;

    public AdbMessage(int command, int arg0, int arg1, byte[] payload) {
        this.command = command;
        this.arg0 = arg0;
        this.arg1 = arg1;
        this.payload = payload == null ? EMPTY : payload;
    }

    public AdbMessage(AdbCommand command, int arg0, int arg1, byte[] payload) {
        this(command.getCode(), arg0, arg1, payload);
    }

    public AdbMessage(AdbCommand command, int arg0, int arg1) {
        this(command.getCode(), arg0, arg1, EMPTY);
    }

    public static AdbMessage connect(int version, int maxPayload, String identity) {
        return new AdbMessage(AdbCommand.CNXN, version, maxPayload, nulTerminated(identity));
    }

    public static AdbMessage auth(AuthType authType, byte[] payload) {
        return new AdbMessage(AdbCommand.AUTH, authType.getType(), 0, payload);
    }

    public static AdbMessage open(int localId, String destination) {
        return new AdbMessage(AdbCommand.OPEN, localId, 0, nulTerminated(destination));
    }

    public static AdbMessage okay(int localId, int remoteId) {
        return new AdbMessage(AdbCommand.OKAY, localId, remoteId);
    }

    public static AdbMessage close(int localId, int remoteId) {
        return new AdbMessage(AdbCommand.CLSE, localId, remoteId);
    }

    public static AdbMessage write(int localId, int remoteId, byte[] payload) {
        return new AdbMessage(AdbCommand.WRTE, localId, remoteId, payload);
    }

    static byte[] nulTerminated(String value) {
        return (value + "\0").getBytes(StandardCharsets.UTF_8);
    }

    public int getCommandCode() {
        return command;
    }

    /**
     * @return the command, or null if the code is not one this library understands
     */
    public AdbCommand getCommand() {
        return AdbCommand.fromCode(command);
    }

    public boolean is(AdbCommand adbCommand) {
        return command == adbCommand.getCode();
    }

    public int getArg0() {
        return arg0;
    }

    public int getArg1() {
        return arg1;
    }

    public byte[] getPayload() {
        return payload;
    }

    /**
     * Returns the payload as text, stopping at the first NUL.
     */
    public String getPayloadString() {
        int end = 0;
        while(end < payload.length && payload[end] != 0) {
            end++;
        }

        return new String(payload, 0, end, StandardCharsets.UTF_8);
    }

    @Override
    public boolean equals(Object o) {
        if(this == o) {
            return true;
        }
        if(o == null || getClass() != o.getClass()) {
            return false;
        }
        AdbMessage that = (AdbMessage)o;
        return command == that.command && arg0 == that.arg0 && arg1 == that.arg1 && Arrays.equals(payload, that.payload);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(command, arg0, arg1);
        result = 31 * result + Arrays.hashCode(payload);
        return result;
    }

    @Override
    public String toString() {
        return AdbCommand.toString(command) + "(" + Integer.toUnsignedString(arg0) + ", " + Integer.toUnsignedString(arg1) + ", " + payload.length + " bytes)";
    }
}
