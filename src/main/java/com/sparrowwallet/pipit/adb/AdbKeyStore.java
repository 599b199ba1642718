package com.sparrowwallet.pipit.adb;

import com.sparrowwallet.pipit.DeviceException;
import com.sparrowwallet.pipit.DeviceInitializationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.PrivateKey;
import java.security.interfaces.RSAPrivateCrtKey;
import java.security.interfaces.RSAPublicKey;
import java.security.spec.PKCS8EncodedKeySpec;
import java.security.spec.RSAPublicKeySpec;

/**
 * File-based storage for the host key pair.
 *
 * The private key is stored as PKCS#8 DER in {@code adbkey}, the encoded public key in {@code adbkey.pub}.
 * Both files must be present, readable and consistent with each other for the stored pair to be used.
 * If either is missing or corrupt a new key pair is generated and written, and the device will ask to
 * trust this host again.
 */
public class AdbKeyStore {
    private static final Logger log = LoggerFactory.getLogger(AdbKeyStore.class);

    public static final String PRIVATE_KEY_FILE = "adbkey";
    public static final String PUBLIC_KEY_FILE = "adbkey.pub";

    private final File privateKeyFile;
    private final File publicKeyFile;
    private final String label;

    public AdbKeyStore(File storageDir, String label) {
        this.privateKeyFile = new File(storageDir, PRIVATE_KEY_FILE);
        this.publicKeyFile = new File(storageDir, PUBLIC_KEY_FILE);
        this.label = label;
    }

    /**
     * Load the stored key pair, generating and persisting a new one if none exists.
     *
     * @return The key pair
     * @throws DeviceException if keys can neither be loaded nor generated and written
     */
    public synchronized AdbKeyPair loadOrGenerate() throws DeviceException {
        RSAPrivateCrtKey privateKey = readPrivateKey();
        if(privateKey == null) {
            return generate();
        }

        RSAPublicKey publicKey = derivePublicKey(privateKey);
        byte[] encodedPublicKey = readEncodedPublicKey(publicKey);
        if(encodedPublicKey == null) {
            return generate();
        }

        log.debug("Loaded existing key pair from {}", privateKeyFile.getParentFile().getAbsolutePath());
        return new AdbKeyPair(privateKey, publicKey, encodedPublicKey);
    }

    private AdbKeyPair generate() throws DeviceException {
        if(privateKeyFile.exists() || publicKeyFile.exists()) {
            log.warn("Stored key pair in " + privateKeyFile.getParentFile().getAbsolutePath() + " is incomplete or unreadable, generating a new key pair. The device will ask to trust this host again.");
        }

        KeyPair keyPair;
        try {
            KeyPairGenerator generator = KeyPairGenerator.getInstance("RSA");
            generator.initialize(AdbPublicKey.KEY_SIZE_BITS);
            keyPair = generator.generateKeyPair();
        } catch(GeneralSecurityException e) {
            throw new DeviceInitializationException("Could not generate RSA key pair", e);
        }

        RSAPublicKey publicKey = (RSAPublicKey)keyPair.getPublic();
        byte[] encodedPublicKey = AdbPublicKey.encode(publicKey, label);

        writeFile(privateKeyFile, keyPair.getPrivate().getEncoded());
        writeFile(publicKeyFile, encodedPublicKey);
        log.info("Generated new key pair in " + privateKeyFile.getParentFile().getAbsolutePath());

        return new AdbKeyPair(keyPair.getPrivate(), publicKey, encodedPublicKey);
    }

    private RSAPrivateCrtKey readPrivateKey() {
        if(!privateKeyFile.exists()) {
            return null;
        }

        try {
            byte[] encoded = Files.readAllBytes(privateKeyFile.toPath());
            PrivateKey privateKey = KeyFactory.getInstance("RSA").generatePrivate(new PKCS8EncodedKeySpec(encoded));
            if(privateKey instanceof RSAPrivateCrtKey crtKey && crtKey.getModulus().bitLength() == AdbPublicKey.KEY_SIZE_BITS) {
                return crtKey;
            }
            log.warn("Private key in " + privateKeyFile.getAbsolutePath() + " is not a " + AdbPublicKey.KEY_SIZE_BITS + " bit RSA key");
        } catch(IOException | GeneralSecurityException e) {
            log.warn("Could not read " + privateKeyFile.getAbsolutePath(), e);
        }

        return null;
    }

    private byte[] readEncodedPublicKey(RSAPublicKey expected) {
        if(!publicKeyFile.exists()) {
            return null;
        }

        try {
            byte[] encoded = Files.readAllBytes(publicKeyFile.toPath());
            RSAPublicKey stored = AdbPublicKey.decode(encoded);
            if(stored.getModulus().equals(expected.getModulus()) && stored.getPublicExponent().equals(expected.getPublicExponent())) {
                return encoded;
            }
            log.warn("Public key in " + publicKeyFile.getAbsolutePath() + " does not match the private key");
        } catch(IOException | DeviceException e) {
            log.warn("Could not read " + publicKeyFile.getAbsolutePath(), e);
        }

        return null;
    }

    private static RSAPublicKey derivePublicKey(RSAPrivateCrtKey privateKey) throws DeviceException {
        try {
            RSAPublicKeySpec spec = new RSAPublicKeySpec(privateKey.getModulus(), privateKey.getPublicExponent());
            return (RSAPublicKey)KeyFactory.getInstance("RSA").generatePublic(spec);
        } catch(GeneralSecurityException e) {
            throw new DeviceInitializationException("Could not derive public key", e);
        }
    }

    private static void writeFile(File file, byte[] data) throws DeviceException {
        try {
            File parent = file.getParentFile();
            if(parent != null && !parent.exists() && !parent.mkdirs()) {
                throw new IOException("Could not create directory " + parent.getAbsolutePath());
            }
            Files.write(file.toPath(), data);
        } catch(IOException e) {
            throw new DeviceInitializationException("Could not write " + file.getAbsolutePath(), e);
        }
    }
}
