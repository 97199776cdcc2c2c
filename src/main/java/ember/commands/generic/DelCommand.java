package ember.commands.generic;

import ember.ServerContext;
import ember.commands.Command;
import ember.commands.CommandType;
import ember.db.BinaryKey;
import ember.db.Database;
import ember.protocol.Frame;

import java.util.List;

public class DelCommand implements Command {
    private final List<BinaryKey> keys;

    public DelCommand(List<BinaryKey> keys) {
        this.keys = List.copyOf(keys);
    }

    @Override
    public CommandType type() {
        return CommandType.DEL;
    }

    @Override
    public Frame execute(ServerContext server) {
        Database db = server.getDatabase();
        long deleted = 0;
        for (BinaryKey key : keys) {
            if (db.delete(key)) deleted++;
        }
        return Frame.integer(deleted);
    }
}
