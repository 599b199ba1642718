package com.sparrowwallet.pipit.args;

import com.beust.jcommander.JCommander;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class AbstractCommandTest {
    private static JCommander newJCommander(Args args, ShellCommand shell, KeyEventCommand keyEvent) {
        return JCommander.newBuilder().addObject(args).programName("pipit")
                .addCommand(shell.getName(), shell)
                .addCommand(keyEvent.getName(), keyEvent)
                .addCommand(PubkeyCommand.NAME, new PubkeyCommand())
                .build();
    }

    @Test
    public void testCommandUsage() {
        ShellCommand shell = new ShellCommand();
        KeyEventCommand keyEvent = new KeyEventCommand();
        JCommander jCommander = newJCommander(new Args(), shell, keyEvent);

        String shellUsage = AbstractCommand.usage(jCommander, ShellCommand.NAME);
        assertTrue(shellUsage.contains("Run a shell command on the device"), shellUsage);
        assertTrue(shellUsage.contains("--help"), shellUsage);

        String keyEventUsage = AbstractCommand.usage(jCommander, KeyEventCommand.NAME);
        assertTrue(keyEventUsage.contains("Send a key event"), keyEventUsage);
    }

    @Test
    public void testParseShellCommand() {
        Args args = new Args();
        ShellCommand shell = new ShellCommand();
        KeyEventCommand keyEvent = new KeyEventCommand();
        JCommander jCommander = newJCommander(args, shell, keyEvent);

        jCommander.parse("--port", "5556", "shell", "input", "keyevent", "23");

        assertEquals(ShellCommand.NAME, jCommander.getParsedCommand());
        assertEquals(Integer.valueOf(5556), args.port);
        assertEquals("input keyevent 23", String.join(" ", shell.words));
        assertFalse(shell.help);
    }
}
