package com.sparrowwallet.pipit.adb;

import com.sparrowwallet.pipit.DeviceProtocolException;

import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.interfaces.RSAPublicKey;
import java.security.spec.RSAPublicKeySpec;
import java.util.Base64;

/**
 * The daemon's own RSA public key format. This is not X.509: it is a fixed 524 byte structure
 * carrying Montgomery parameters for a 2048 bit modulus:
 *
 * <pre>
 * uint32  modulus size in 32 bit words (64)
 * uint32  n0inv = -1 / n[0] mod 2^32
 * uint8   modulus[256]    little-endian
 * uint8   rr[256]         R^2 mod n, R = 2^2048, little-endian
 * uint32  exponent
 * </pre>
 *
 * The structure is base64 encoded and followed by a space, a label and a NUL terminator.
 */
public class AdbPublicKey {
    public static final int KEY_SIZE_BITS = 2048;
    public static final int MODULUS_SIZE_BYTES = KEY_SIZE_BITS / 8;
    public static final int MODULUS_SIZE_WORDS = MODULUS_SIZE_BYTES / 4;
    public static final int STRUCT_SIZE = 4 + 4 + MODULUS_SIZE_BYTES + MODULUS_SIZE_BYTES + 4;

    private static final BigInteger TWO_POW_32 = BigInteger.ONE.shiftLeft(32);
    private static final BigInteger R = BigInteger.ONE.shiftLeft(KEY_SIZE_BITS);

    private AdbPublicKey() {}

    /**
     * Encode an RSA public key as the payload of an AUTH(RSAPUBLICKEY) message.
     *
     * @param publicKey 2048 bit RSA public key
     * @param label human readable label shown on the device's trust prompt
     * @return base64(struct) + " " + label + "\0", UTF-8 encoded
     */
    public static byte[] encode(RSAPublicKey publicKey, String label) {
        return encode(publicKey.getModulus(), publicKey.getPublicExponent(), label);
    }

    public static byte[] encode(BigInteger modulus, BigInteger exponent, String label) {
        String structBase64 = Base64.getEncoder().encodeToString(encodeStruct(modulus, exponent));
        return (structBase64 + " " + label + "\0").getBytes(StandardCharsets.UTF_8);
    }

    /**
     * Build the raw 524 byte structure.
     */
    public static byte[] encodeStruct(BigInteger modulus, BigInteger exponent) {
        if(modulus.signum() <= 0 || modulus.bitLength() > KEY_SIZE_BITS) {
            throw new IllegalArgumentException("Modulus must be a positive integer of at most " + KEY_SIZE_BITS + " bits");
        }
        if(!modulus.testBit(0)) {
            throw new IllegalArgumentException("Modulus must be odd");
        }

        ByteBuffer buffer = ByteBuffer.allocate(STRUCT_SIZE).order(ByteOrder.LITTLE_ENDIAN);
        buffer.putInt(MODULUS_SIZE_WORDS);
        buffer.putInt(computeN0inv(modulus));
        buffer.put(toLittleEndianPadded(modulus, MODULUS_SIZE_BYTES));
        buffer.put(toLittleEndianPadded(computeRR(modulus), MODULUS_SIZE_BYTES));
        buffer.putInt(exponent.intValueExact());
        return buffer.array();
    }

    /**
     * Parse an encoded public key blob (with or without label) back into an RSA public key.
     *
     * @throws DeviceProtocolException if the blob is not a valid encoded key
     */
    public static RSAPublicKey decode(byte[] encoded) throws DeviceProtocolException {
        String text = new String(encoded, StandardCharsets.UTF_8);
        int end = 0;
        while(end < text.length() && text.charAt(end) != ' ' && text.charAt(end) != '\0') {
            end++;
        }

        byte[] struct;
        try {
            struct = Base64.getDecoder().decode(text.substring(0, end));
        } catch(IllegalArgumentException e) {
            throw new DeviceProtocolException("Public key is not valid base64", e);
        }

        return decodeStruct(struct);
    }

    public static RSAPublicKey decodeStruct(byte[] struct) throws DeviceProtocolException {
        if(struct.length != STRUCT_SIZE) {
            throw new DeviceProtocolException("Invalid public key size " + struct.length + ", expected " + STRUCT_SIZE);
        }

        ByteBuffer buffer = ByteBuffer.wrap(struct).order(ByteOrder.LITTLE_ENDIAN);
        int words = buffer.getInt();
        if(words != MODULUS_SIZE_WORDS) {
            throw new DeviceProtocolException("Unsupported modulus size of " + words + " words");
        }
        buffer.getInt();
        byte[] modulusBytes = new byte[MODULUS_SIZE_BYTES];
        buffer.get(modulusBytes);
        buffer.position(buffer.position() + MODULUS_SIZE_BYTES);
        int exponent = buffer.getInt();

        try {
            RSAPublicKeySpec spec = new RSAPublicKeySpec(fromLittleEndian(modulusBytes), BigInteger.valueOf(Integer.toUnsignedLong(exponent)));
            return (RSAPublicKey)KeyFactory.getInstance("RSA").generatePublic(spec);
        } catch(GeneralSecurityException e) {
            throw new DeviceProtocolException("Invalid RSA public key", e);
        }
    }

    /**
     * Compute -(n^-1) mod 2^32, the Montgomery constant for the low word of the modulus.
     */
    public static int computeN0inv(BigInteger modulus) {
        BigInteger inverse = modulus.mod(TWO_POW_32).modInverse(TWO_POW_32);
        return TWO_POW_32.subtract(inverse).intValue();
    }

    /**
     * Compute R^2 mod n where R = 2^2048.
     */
    public static BigInteger computeRR(BigInteger modulus) {
        return R.multiply(R).mod(modulus);
    }

    /**
     * Convert a non-negative integer to a little-endian byte array of the given size.
     * The leading sign byte of the big-endian two's complement form is dropped before reversing.
     */
    public static byte[] toLittleEndianPadded(BigInteger value, int size) {
        byte[] bigEndian = value.toByteArray();
        int start = (bigEndian.length > 1 && bigEndian[0] == 0) ? 1 : 0;
        int length = bigEndian.length - start;
        if(length > size) {
            throw new IllegalArgumentException("Value needs " + length + " bytes, only " + size + " available");
        }

        byte[] result = new byte[size];
        for(int i = 0; i < length; i++) {
            result[i] = bigEndian[bigEndian.length - 1 - i];
        }

        return result;
    }

    public static BigInteger fromLittleEndian(byte[] littleEndian) {
        byte[] bigEndian = new byte[littleEndian.length];
        for(int i = 0; i < littleEndian.length; i++) {
            bigEndian[i] = littleEndian[littleEndian.length - 1 - i];
        }

        return new BigInteger(1, bigEndian);
    }
}
