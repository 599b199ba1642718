package com.sparrowwallet.pipit.args;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameters;
import com.sparrowwallet.pipit.Pipit;
import com.sparrowwallet.pipit.PipitConfig;
import com.sparrowwallet.pipit.adb.AdbKeyPair;
import com.sparrowwallet.pipit.adb.AdbKeyStore;

import java.nio.charset.StandardCharsets;

@Parameters(commandDescription = "Print the host public key, generating the key pair if necessary")
public class PubkeyCommand extends AbstractCommand {
    public static final String NAME = "pubkey";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    protected boolean requiresKeys() {
        return false;
    }

    @Override
    public void run(JCommander jCommander, Pipit pipit, Args args) throws Exception {
        super.run(jCommander, pipit, args);
        PipitConfig config = PipitConfig.load(args.dir);
        AdbKeyPair keyPair = new AdbKeyStore(args.dir, config.keyLabel).loadOrGenerate();
        String encoded = new String(keyPair.getEncodedPublicKey(), StandardCharsets.UTF_8);
        value(new PublicKeyValue(encoded.substring(0, encoded.length() - 1)));
    }
}
