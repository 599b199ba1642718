package com.sparrowwallet.pipit.args;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.Parameters;
import com.sparrowwallet.pipit.Pipit;

import java.util.ArrayList;
import java.util.List;

@Parameters(commandDescription = "Run a shell command on the device")
public class ShellCommand extends AbstractCommand {
    public static final String NAME = "shell";

    @Parameter(description = "command line", required = true)
    public List<String> words = new ArrayList<>();

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public void run(JCommander jCommander, Pipit pipit, Args args) throws Exception {
        super.run(jCommander, pipit, args);
        success(pipit.sendShellCommand(String.join(" ", words)));
    }
}
