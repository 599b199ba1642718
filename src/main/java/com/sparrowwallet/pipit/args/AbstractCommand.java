package com.sparrowwallet.pipit.args;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.sparrowwallet.pipit.Main;
import com.sparrowwallet.pipit.Pipit;

public abstract class AbstractCommand implements Command {
    @Parameter(names = { "--help", "-h" }, description = "Show this help message and exit", help = true)
    public boolean help;

    @Override
    public void run(JCommander jCommander, Pipit pipit, Args args) throws Exception {
        if(help) {
            System.out.print(usage(jCommander, getName()));
            System.exit(0);
        }
        if(requiresKeys() && !pipit.init()) {
            error("Could not load or generate host keys in " + args.dir.getAbsolutePath());
        }
    }

    static String usage(JCommander jCommander, String commandName) {
        StringBuilder out = new StringBuilder();
        jCommander.getUsageFormatter().usage(commandName, out);
        return out.toString();
    }

    protected boolean requiresKeys() {
        return true;
    }

    protected void success(boolean success) {
        Main.showSuccess(success);
    }

    protected void value(Object value) {
        Main.showValue(value);
    }

    protected void error(String errorMessage) {
        Main.showErrorAndExit(errorMessage);
    }

    protected record PublicKeyValue(String publicKey) {}
}
