package ember.commands.generic;

import ember.ServerContext;
import ember.commands.Command;
import ember.commands.CommandType;
import ember.db.BinaryKey;
import ember.protocol.Frame;

/**
 * TTL (seconds, rounded) and PTTL (millis). Negative replies: -2 absent, -1 no deadline.
 */
public class TtlCommand implements Command {
    private final CommandType type;
    private final BinaryKey key;

    public TtlCommand(CommandType type, BinaryKey key) {
        if (type != CommandType.TTL && type != CommandType.PTTL) {
            throw new IllegalArgumentException("not a ttl command: " + type);
        }
        this.type = type;
        this.key = key;
    }

    @Override
    public CommandType type() {
        return type;
    }

    @Override
    public Frame execute(ServerContext server) {
        long ttl = server.getDatabase().ttlMillis(key);
        if (ttl < 0 || type == CommandType.PTTL) {
            return Frame.integer(ttl);
        }
        return Frame.integer((ttl + 500) / 1000);
    }
}
