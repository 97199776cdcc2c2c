package ember.commands.server;

import ember.ServerContext;
import ember.commands.Command;
import ember.commands.CommandType;
import ember.protocol.Frame;

public class DbSizeCommand implements Command {

    @Override
    public CommandType type() {
        return CommandType.DBSIZE;
    }

    @Override
    public Frame execute(ServerContext server) {
        return Frame.integer(server.getDatabase().size());
    }
}
