package com.sparrowwallet.pipit;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.ParameterException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sparrowwallet.pipit.args.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Command line entry point. Results are printed as JSON.
 */
public class Main {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    private static final ObjectMapper mapper = new ObjectMapper();

    public static void main(String[] argv) {
        Args args = new Args();
        List<Command> commands = List.of(new ShellCommand(), new KeyEventCommand(), new PubkeyCommand());
        JCommander jCommander = newJCommander(args, commands);

        try {
            jCommander.parse(argv);
        } catch(ParameterException e) {
            showErrorAndExit(e.getMessage());
        }

        if(args.help || jCommander.getParsedCommand() == null) {
            jCommander.usage();
            System.exit(args.help ? 0 : 1);
        }

        PipitConfig config = PipitConfig.load(args.dir);
        if(args.host != null) {
            config.host = args.host;
        }
        if(args.port != null) {
            config.port = args.port;
        }

        Command command = commands.stream().filter(c -> c.getName().equals(jCommander.getParsedCommand())).findFirst().orElseThrow();
        try(Pipit pipit = new Pipit(args.dir, config)) {
            command.run(jCommander, pipit, args);
        } catch(Exception e) {
            log.debug("Command " + command.getName() + " failed", e);
            showErrorAndExit(e.getMessage());
        }
    }

    static JCommander newJCommander(Args args, List<Command> commands) {
        JCommander.Builder builder = JCommander.newBuilder().addObject(args).programName("pipit");
        for(Command command : commands) {
            builder.addCommand(command.getName(), command);
        }

        return builder.build();
    }

    public static void showSuccess(boolean success) {
        showValue(Map.of("success", success));
    }

    public static void showValue(Object value) {
        try {
            System.out.println(mapper.writeValueAsString(value));
        } catch(JsonProcessingException e) {
            showErrorAndExit("Could not serialize " + value + ": " + e.getMessage());
        }
    }

    public static void showErrorAndExit(String errorMessage) {
        try {
            System.out.println(mapper.writeValueAsString(Map.of("error", errorMessage == null ? "Unknown error" : errorMessage)));
        } catch(JsonProcessingException e) {
            System.out.println("{\"error\":\"Unknown error\"}");
        }
        System.exit(1);
    }
}
