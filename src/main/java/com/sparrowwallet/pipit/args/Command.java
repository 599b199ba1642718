package com.sparrowwallet.pipit.args;

import com.beust.jcommander.JCommander;
import com.sparrowwallet.pipit.Pipit;

public interface Command {
    String getName();
    void run(JCommander jCommander, Pipit pipit, Args args) throws Exception;
}
