package com.sparrowwallet.pipit.args;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.Parameters;
import com.sparrowwallet.pipit.KeyCode;
import com.sparrowwallet.pipit.Pipit;

import java.util.ArrayList;
import java.util.List;

@Parameters(commandDescription = "Send a key event, given as a number or a name such as DPAD_CENTER")
public class KeyEventCommand extends AbstractCommand {
    public static final String NAME = "keyevent";

    @Parameter(description = "key code", required = true, arity = 1)
    public List<String> keyCode = new ArrayList<>();

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public void run(JCommander jCommander, Pipit pipit, Args args) throws Exception {
        int code;
        try {
            code = KeyCode.parse(keyCode.get(0));
        } catch(IllegalArgumentException e) {
            error("Unknown key code " + keyCode.get(0));
            return;
        }

        super.run(jCommander, pipit, args);
        success(pipit.sendKeyEvent(code));
    }
}
