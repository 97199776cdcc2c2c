package ember.commands;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * The closed set of commands this server understands.
 * <p>
 * Arity counts the command name itself: a positive value is an exact count, a
 * negative value {@code -n} means "at least n".
 */
public enum CommandType {
    // Connection
    PING(-1),
    ECHO(2),
    QUIT(1),

    // String
    GET(2),
    SET(-3),

    // Generic
    DEL(-2),
    EXISTS(-2),
    EXPIRE(3),
    PEXPIRE(3),
    TTL(2),
    PTTL(2),
    PERSIST(2),

    // Server
    DBSIZE(1),
    INFO(-1),

    UNKNOWN(0);

    private static final Map<String, CommandType> BY_NAME = new HashMap<>();

    static {
        for (CommandType type : values()) {
            if (type != UNKNOWN) {
                BY_NAME.put(type.name(), type);
            }
        }
    }

    private final int arity;

    CommandType(int arity) {
        this.arity = arity;
    }

    public int getArity() {
        return arity;
    }

    public boolean acceptsArgCount(int argc) {
        return arity >= 0 ? argc == arity : argc >= -arity;
    }

    /** Case-insensitive lookup; {@link #UNKNOWN} for anything unrecognized. */
    public static CommandType lookup(String name) {
        CommandType type = BY_NAME.get(name.toUpperCase(Locale.ROOT));
        return type == null ? UNKNOWN : type;
    }
}
