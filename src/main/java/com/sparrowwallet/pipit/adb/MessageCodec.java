package com.sparrowwallet.pipit.adb;

import com.sparrowwallet.pipit.DeviceProtocolException;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * Frame encoding and decoding.
 *
 * Every frame starts with a 24 byte little-endian header:
 * command(4) + arg0(4) + arg1(4) + data length(4) + checksum(4) + magic(4)
 * followed by exactly data length payload bytes.
 */
public class MessageCodec {

    public static final int HEADER_SIZE = 24;

    public static final int VERSION = 0x01000000;

    /** Largest payload this host advertises and sends */
    public static final int MAX_PAYLOAD = 4096;

    /** Largest payload accepted from the daemon, checked before anything is allocated */
    public static final int MAX_INCOMING_PAYLOAD = 256 * MAX_PAYLOAD;

    /**
     * Decoded header fields.
     */
    public static class Header {
        public final int command;
        public final int arg0;
        public final int arg1;
        public final int dataLength;
        public final int checksum;
        public final int magic;

        public Header(int command, int arg0, int arg1, int dataLength, int checksum, int magic) {
            this.command = command;
            this.arg0 = arg0;
            this.arg1 = arg1;
            this.dataLength = dataLength;
            this.checksum = checksum;
            this.magic = magic;
        }
    }

    /**
     * Encode the header for a frame.
     *
     * @param command The command code
     * @param arg0 First argument
     * @param arg1 Second argument
     * @param payload The payload that will follow the header (may be null)
     * @return 24 byte header
     */
    public static byte[] encodeHeader(int command, int arg0, int arg1, byte[] payload) {
        int length = payload == null ? 0 : payload.length;
        ByteBuffer buffer = ByteBuffer.allocate(HEADER_SIZE).order(ByteOrder.LITTLE_ENDIAN);
        buffer.putInt(command);
        buffer.putInt(arg0);
        buffer.putInt(arg1);
        buffer.putInt(length);
        buffer.putInt(checksum(payload));
        buffer.putInt(~command);
        return buffer.array();
    }

    /**
     * Decode a header, validating the magic and the declared payload length.
     *
     * @param header 24 header bytes
     * @return The decoded header
     * @throws DeviceProtocolException if the header is malformed or declares an oversized payload
     */
    public static Header decodeHeader(byte[] header) throws DeviceProtocolException {
        if(header == null || header.length != HEADER_SIZE) {
            throw new DeviceProtocolException("Invalid header size: " + (header == null ? 0 : header.length));
        }

        ByteBuffer buffer = ByteBuffer.wrap(header).order(ByteOrder.LITTLE_ENDIAN);
        Header decoded = new Header(buffer.getInt(), buffer.getInt(), buffer.getInt(), buffer.getInt(), buffer.getInt(), buffer.getInt());

        if(decoded.magic != ~decoded.command) {
            throw new DeviceProtocolException("Invalid magic for command " + AdbCommand.toString(decoded.command));
        }

        if(decoded.dataLength < 0 || decoded.dataLength > MAX_INCOMING_PAYLOAD) {
            throw new DeviceProtocolException("Declared payload length " + Integer.toUnsignedString(decoded.dataLength) + " exceeds maximum of " + MAX_INCOMING_PAYLOAD);
        }

        return decoded;
    }

    /**
     * Sum of the unsigned payload bytes, truncated to 32 bits.
     */
    public static int checksum(byte[] payload) {
        int sum = 0;
        if(payload != null) {
            for(byte b : payload) {
                sum += b & 0xFF;
            }
        }

        return sum;
    }

    /**
     * Read one frame, looping on short reads.
     *
     * @param in The stream to read from
     * @return The message, or null if the stream ended before a full frame arrived
     * @throws IOException if the read fails or times out
     * @throws DeviceProtocolException if the frame is malformed
     */
    public static AdbMessage readMessage(InputStream in) throws IOException, DeviceProtocolException {
        byte[] headerBytes = new byte[HEADER_SIZE];
        if(!readFully(in, headerBytes)) {
            return null;
        }

        Header header = decodeHeader(headerBytes);
        byte[] payload = new byte[header.dataLength];
        if(!readFully(in, payload)) {
            return null;
        }

        if(checksum(payload) != header.checksum) {
            throw new DeviceProtocolException("Checksum mismatch for " + AdbCommand.toString(header.command) + " frame");
        }

        return new AdbMessage(header.command, header.arg0, header.arg1, payload);
    }

    /**
     * Write one frame and flush.
     */
    public static void writeMessage(OutputStream out, AdbMessage message) throws IOException {
        byte[] payload = message.getPayload();
        out.write(encodeHeader(message.getCommandCode(), message.getArg0(), message.getArg1(), payload));
        if(payload.length > 0) {
            out.write(payload);
        }
        out.flush();
    }

    private static boolean readFully(InputStream in, byte[] buffer) throws IOException {
        int read = 0;
        while(read < buffer.length) {
            int n = in.read(buffer, read, buffer.length - read);
            if(n < 0) {
                return false;
            }
            read += n;
        }

        return true;
    }
}
