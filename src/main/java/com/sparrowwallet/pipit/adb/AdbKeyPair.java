package com.sparrowwallet.pipit.adb;

import java.security.PrivateKey;
import java.security.interfaces.RSAPublicKey;

/**
 * The host's RSA identity: the private key used to sign auth tokens and the public key
 * in the daemon's encoded form.
 */
public class AdbKeyPair {
    private final PrivateKey privateKey;
    private final RSAPublicKey publicKey;
    private final byte[] encodedPublicKey;

    public AdbKeyPair(PrivateKey privateKey, RSAPublicKey publicKey, byte[] encodedPublicKey) {
        this.privateKey = privateKey;
        this.publicKey = publicKey;
        this.encodedPublicKey = encodedPublicKey;
    }

    public PrivateKey getPrivateKey() {
        return privateKey;
    }

    public RSAPublicKey getPublicKey() {
        return publicKey;
    }

    /**
     * @return the payload sent with AUTH(RSAPUBLICKEY)
     */
    public byte[] getEncodedPublicKey() {
        return encodedPublicKey.clone();
    }
}
