package com.sparrowwallet.pipit.adb;

import com.sparrowwallet.pipit.DeviceException;
import com.sparrowwallet.pipit.DeviceInitializationException;
import com.sparrowwallet.pipit.DeviceNotTrustedException;
import com.sparrowwallet.pipit.DeviceProtocolException;
import com.sparrowwallet.pipit.DeviceTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.GeneralSecurityException;
import java.security.PrivateKey;
import java.security.Signature;

/**
 * Connection handshake state machine.
 *
 * Handshake flow:
 * 1. Send CNXN with protocol version, max payload and host identity
 * 2. CNXN in reply: no authentication required, done
 * 3. AUTH(TOKEN) in reply: sign the token and send AUTH(SIGNATURE)
 * 4. CNXN in reply: key already trusted, done
 * 5. AUTH in reply: key unknown, send AUTH(RSAPUBLICKEY) and wait for the user to accept it on the device
 *
 * The token is treated as an already computed SHA-1 digest. It is wrapped in a DigestInfo structure and
 * signed with raw PKCS#1 v1.5 padding, without hashing it again.
 */
public class HandshakeStateMachine {
    private static final Logger log = LoggerFactory.getLogger(HandshakeStateMachine.class);

    public static final String HOST_IDENTITY = "host::";
    public static final int TOKEN_SIZE = 20;

    /** ASN.1 DigestInfo prefix for a SHA-1 digest */
    private static final byte[] SHA1_DIGEST_INFO_PREFIX = new byte[] {
        0x30, 0x21, 0x30, 0x09, 0x06, 0x05, 0x2b, 0x0e, 0x03, 0x02, 0x1a, 0x05, 0x00, 0x04, 0x14
    };

    /**
     * Host handshake states.
     */
    public enum State {
        INITIAL,                    // Ready to send CNXN
        AWAITING_CONNECT,           // CNXN sent
        AWAITING_SIGNATURE_RESULT,  // AUTH(SIGNATURE) sent
        AWAITING_TRUST,             // AUTH(RSAPUBLICKEY) sent, user must accept on the device
        COMPLETE,
        FAILED
    }

    /**
     * How the daemon accepted this host.
     */
    public enum AuthMethod {
        NONE, SIGNATURE, PUBLIC_KEY
    }

    /**
     * Handshake result.
     */
    public static class Result {
        public final int protocolVersion;
        public final int maxPayload;
        public final String banner;
        public final AuthMethod authMethod;

        public Result(int protocolVersion, int maxPayload, String banner, AuthMethod authMethod) {
            this.protocolVersion = protocolVersion;
            this.maxPayload = maxPayload;
            this.banner = banner;
            this.authMethod = authMethod;
        }
    }

    private final Transport transport;
    private final AdbKeyPair keyPair;
    private final int trustTimeoutMs;
    private State state;

    /**
     * Create handshake state machine.
     *
     * @param transport Freshly opened transport
     * @param keyPair Host key pair
     * @param trustTimeoutMs How long to wait for the user to accept an unknown public key
     */
    public HandshakeStateMachine(Transport transport, AdbKeyPair keyPair, int trustTimeoutMs) {
        this.transport = transport;
        this.keyPair = keyPair;
        this.trustTimeoutMs = trustTimeoutMs;
        this.state = State.INITIAL;
    }

    public State getState() {
        return state;
    }

    /**
     * Execute the handshake. The caller owns the transport and must close it if this fails.
     *
     * @return Negotiated connection parameters
     * @throws DeviceException if the handshake fails
     */
    public Result executeHandshake() throws DeviceException {
        if(state != State.INITIAL) {
            throw new DeviceException("Invalid state for handshake: " + state);
        }

        try {
            transport.write(AdbMessage.connect(MessageCodec.VERSION, MessageCodec.MAX_PAYLOAD, HOST_IDENTITY));
            state = State.AWAITING_CONNECT;

            AdbMessage response = readResponse("CNXN");
            if(response.is(AdbCommand.CNXN)) {
                return complete(response, AuthMethod.NONE);
            }

            requireAuth(response, AuthType.TOKEN);
            byte[] token = response.getPayload();
            if(token.length != TOKEN_SIZE) {
                throw new DeviceProtocolException("Invalid auth token size " + token.length + ", expected " + TOKEN_SIZE);
            }

            byte[] signature = signToken(keyPair.getPrivateKey(), token);
            if(log.isDebugEnabled()) {
                log.debug("Auth token received, sending {} byte signature", signature.length);
            }
            transport.write(AdbMessage.auth(AuthType.SIGNATURE, signature));
            state = State.AWAITING_SIGNATURE_RESULT;

            response = readResponse("AUTH_SIGNATURE");
            if(response.is(AdbCommand.CNXN)) {
                return complete(response, AuthMethod.SIGNATURE);
            }

            if(!response.is(AdbCommand.AUTH)) {
                throw new DeviceProtocolException("Unexpected message after signature: " + response);
            }
            log.info("Signature not recognised, sending public key. Accept the debugging prompt on the device.");
            transport.write(AdbMessage.auth(AuthType.RSAPUBLICKEY, keyPair.getEncodedPublicKey()));
            state = State.AWAITING_TRUST;

            try {
                response = transport.read(trustTimeoutMs);
            } catch(DeviceException e) {
                throw new DeviceNotTrustedException("No response to public key after " + trustTimeoutMs + "ms, the debugging prompt was not accepted", e);
            }

            if(!response.is(AdbCommand.CNXN)) {
                throw new DeviceNotTrustedException("Public key rejected, received " + response);
            }

            return complete(response, AuthMethod.PUBLIC_KEY);
        } catch(DeviceException e) {
            state = State.FAILED;
            throw e;
        }
    }

    /**
     * Sign an auth token that the daemon treats as a pre-computed SHA-1 digest.
     *
     * @param privateKey The host RSA private key
     * @param token The 20 byte token
     * @return PKCS#1 v1.5 signature over DigestInfo(SHA-1, token)
     */
    public static byte[] signToken(PrivateKey privateKey, byte[] token) throws DeviceException {
        byte[] digestInfo = new byte[SHA1_DIGEST_INFO_PREFIX.length + token.length];
        System.arraycopy(SHA1_DIGEST_INFO_PREFIX, 0, digestInfo, 0, SHA1_DIGEST_INFO_PREFIX.length);
        System.arraycopy(token, 0, digestInfo, SHA1_DIGEST_INFO_PREFIX.length, token.length);

        try {
            Signature signature = Signature.getInstance("NONEwithRSA");
            signature.initSign(privateKey);
            signature.update(digestInfo);
            return signature.sign();
        } catch(GeneralSecurityException e) {
            throw new DeviceInitializationException("Could not sign auth token: " + e.getMessage(), e);
        }
    }

    private AdbMessage readResponse(String after) throws DeviceException {
        try {
            return transport.read();
        } catch(DeviceTimeoutException e) {
            throw new DeviceTimeoutException("No response from daemon after " + after, e);
        }
    }

    private static void requireAuth(AdbMessage response, AuthType expected) throws DeviceProtocolException {
        if(!response.is(AdbCommand.AUTH)) {
            throw new DeviceProtocolException("Unexpected message during handshake: " + response);
        }
        if(response.getArg0() != expected.getType()) {
            throw new DeviceProtocolException("Unexpected auth type " + response.getArg0() + ", expected " + expected);
        }
    }

    private Result complete(AdbMessage cnxn, AuthMethod authMethod) {
        state = State.COMPLETE;
        int version = Integer.compareUnsigned(cnxn.getArg0(), MessageCodec.VERSION) < 0 ? cnxn.getArg0() : MessageCodec.VERSION;
        int maxPayload = cnxn.getArg1() > 0 ? Math.min(cnxn.getArg1(), MessageCodec.MAX_PAYLOAD) : MessageCodec.MAX_PAYLOAD;
        String banner = cnxn.getPayloadString();
        log.info("Connected to daemon (auth: " + authMethod + ", version: 0x" + Integer.toHexString(version) + ", banner: " + banner + ")");
        return new Result(version, maxPayload, banner, authMethod);
    }
}
