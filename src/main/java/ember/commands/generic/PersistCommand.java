package ember.commands.generic;

import ember.ServerContext;
import ember.commands.Command;
import ember.commands.CommandType;
import ember.db.BinaryKey;
import ember.protocol.Frame;

public class PersistCommand implements Command {
    private final BinaryKey key;

    public PersistCommand(BinaryKey key) {
        this.key = key;
    }

    @Override
    public CommandType type() {
        return CommandType.PERSIST;
    }

    @Override
    public Frame execute(ServerContext server) {
        return Frame.integer(server.getDatabase().persist(key) ? 1 : 0);
    }
}
