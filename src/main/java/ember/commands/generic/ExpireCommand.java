package ember.commands.generic;

import ember.ServerContext;
import ember.commands.Command;
import ember.commands.CommandException;
import ember.commands.CommandParser;
import ember.commands.CommandType;
import ember.db.BinaryKey;
import ember.protocol.Frame;
import ember.utils.Time;

import java.util.List;

/**
 * EXPIRE (seconds) and PEXPIRE (millis). A non-positive timeout deletes the key.
 */
public class ExpireCommand implements Command {
    private final CommandType type;
    private final BinaryKey key;
    private final long timeoutMillis;

    public ExpireCommand(CommandType type, BinaryKey key, long timeoutMillis) {
        this.type = type;
        this.key = key;
        this.timeoutMillis = timeoutMillis;
    }

    public static ExpireCommand parse(CommandType type, List<byte[]> args) {
        BinaryKey key = BinaryKey.of(args.get(1));
        long amount = CommandParser.parseLong(args.get(2));
        if (type == CommandType.EXPIRE) {
            if (amount > Long.MAX_VALUE / 1000 || amount < Long.MIN_VALUE / 1000) {
                throw CommandException.invalidExpire("expire");
            }
            amount *= 1000;
        }
        return new ExpireCommand(type, key, amount);
    }

    @Override
    public CommandType type() {
        return type;
    }

    @Override
    public Frame execute(ServerContext server) {
        long deadline = Time.deadlineAfter(timeoutMillis);
        if (deadline == Time.OVERFLOW) {
            throw CommandException.invalidExpire(type.name());
        }
        return Frame.integer(server.getDatabase().expireAt(key, deadline) ? 1 : 0);
    }
}
