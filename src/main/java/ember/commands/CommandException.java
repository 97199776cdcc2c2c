package ember.commands;

import java.util.Locale;

/**
 * A request that cannot be carried out. Rendered to the client as an error reply;
 * the connection stays open.
 */
public class CommandException extends RuntimeException {

    public CommandException(String message) {
        super(message);
    }

    public static CommandException wrongArity(String commandName) {
        return new CommandException("ERR wrong number of arguments for '" + commandName.toLowerCase(Locale.ROOT) + "' command");
    }

    public static CommandException syntax() {
        return new CommandException("ERR syntax error");
    }

    public static CommandException notAnInteger() {
        return new CommandException("ERR value is not an integer or out of range");
    }

    public static CommandException invalidExpire(String commandName) {
        return new CommandException("ERR invalid expire time in '" + commandName.toLowerCase(Locale.ROOT) + "' command");
    }

    public static CommandException protocol(String detail) {
        return new CommandException("ERR Protocol error: " + detail);
    }
}
