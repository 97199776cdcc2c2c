package ember.commands.generic;

import ember.ServerContext;
import ember.commands.Command;
import ember.commands.CommandType;
import ember.db.BinaryKey;
import ember.db.Database;
import ember.protocol.Frame;

import java.util.List;

/**
 * Counts live keys among the arguments. A key named twice is counted twice.
 */
public class ExistsCommand implements Command {
    private final List<BinaryKey> keys;

    public ExistsCommand(List<BinaryKey> keys) {
        this.keys = List.copyOf(keys);
    }

    @Override
    public CommandType type() {
        return CommandType.EXISTS;
    }

    @Override
    public Frame execute(ServerContext server) {
        Database db = server.getDatabase();
        long count = 0;
        for (BinaryKey key : keys) {
            if (db.exists(key)) count++;
        }
        return Frame.integer(count);
    }
}
