package ember.commands.string;

import ember.ServerContext;
import ember.commands.Command;
import ember.commands.CommandException;
import ember.commands.CommandParser;
import ember.commands.CommandType;
import ember.db.BinaryKey;
import ember.db.Database;
import ember.db.ValueEntry;
import ember.protocol.Frame;
import ember.utils.Time;

import java.util.List;
import java.util.Locale;

/**
 * {@code SET key value [EX seconds | PX milliseconds] [NX | XX]}
 */
public class SetCommand implements Command {
    public static final long NO_TTL = -1;

    public enum Condition {
        ALWAYS,
        IF_ABSENT,
        IF_PRESENT
    }

    private final BinaryKey key;
    private final byte[] value;
    private final long ttlMillis;
    private final Condition condition;

    public SetCommand(BinaryKey key, byte[] value, long ttlMillis, Condition condition) {
        this.key = key;
        this.value = value;
        this.ttlMillis = ttlMillis;
        this.condition = condition;
    }

    public static SetCommand parse(List<byte[]> args) {
        BinaryKey key = BinaryKey.of(args.get(1));
        byte[] value = args.get(2);
        long ttl = NO_TTL;
        Condition condition = Condition.ALWAYS;

        for (int i = 3; i < args.size(); i++) {
            String opt = CommandParser.text(args.get(i)).toUpperCase(Locale.ROOT);
            switch (opt) {
                case "EX":
                case "PX":
                    if (ttl != NO_TTL || i + 1 >= args.size()) {
                        throw CommandException.syntax();
                    }
                    long amount = CommandParser.parseLong(args.get(++i));
                    if (amount <= 0) {
                        throw CommandException.invalidExpire("set");
                    }
                    if (opt.equals("EX")) {
                        if (amount > Long.MAX_VALUE / 1000) {
                            throw CommandException.invalidExpire("set");
                        }
                        amount *= 1000;
                    }
                    ttl = amount;
                    break;
                case "NX":
                    if (condition != Condition.ALWAYS) throw CommandException.syntax();
                    condition = Condition.IF_ABSENT;
                    break;
                case "XX":
                    if (condition != Condition.ALWAYS) throw CommandException.syntax();
                    condition = Condition.IF_PRESENT;
                    break;
                default:
                    throw CommandException.syntax();
            }
        }
        return new SetCommand(key, value, ttl, condition);
    }

    public BinaryKey getKey() {
        return key;
    }

    public long getTtlMillis() {
        return ttlMillis;
    }

    public Condition getCondition() {
        return condition;
    }

    @Override
    public CommandType type() {
        return CommandType.SET;
    }

    @Override
    public Frame execute(ServerContext server) {
        long expireAt = ValueEntry.NO_EXPIRY;
        if (ttlMillis != NO_TTL) {
            expireAt = Time.deadlineAfter(ttlMillis);
            if (expireAt == Time.OVERFLOW) {
                throw CommandException.invalidExpire("set");
            }
        }

        Database db = server.getDatabase();
        switch (condition) {
            case IF_ABSENT:
                return db.setIfAbsent(key, value, expireAt) ? Frame.ok() : Frame.nullBulk();
            case IF_PRESENT:
                return db.setIfPresent(key, value, expireAt) ? Frame.ok() : Frame.nullBulk();
            default:
                db.set(key, value, expireAt);
                return Frame.ok();
        }
    }
}
