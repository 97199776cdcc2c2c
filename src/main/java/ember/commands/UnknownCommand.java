package ember.commands;

import ember.ServerContext;
import ember.protocol.Frame;

/**
 * A well-formed request naming a command this server does not implement.
 */
public class UnknownCommand implements Command {
    private static final int MAX_ECHOED_NAME = 128;

    private final String name;

    public UnknownCommand(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    @Override
    public CommandType type() {
        return CommandType.UNKNOWN;
    }

    @Override
    public Frame execute(ServerContext server) {
        String shown = name.length() > MAX_ECHOED_NAME ? name.substring(0, MAX_ECHOED_NAME) : name;
        // Error lines cannot carry CR or LF.
        shown = shown.replace('\r', ' ').replace('\n', ' ');
        return Frame.error("ERR unknown command '" + shown + "'");
    }
}
