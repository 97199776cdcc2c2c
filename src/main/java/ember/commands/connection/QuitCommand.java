package ember.commands.connection;

import ember.ServerContext;
import ember.commands.Command;
import ember.commands.CommandType;
import ember.protocol.Frame;

/**
 * Replies OK; the connection handler closes the channel once the reply is flushed.
 */
public class QuitCommand implements Command {

    @Override
    public CommandType type() {
        return CommandType.QUIT;
    }

    @Override
    public Frame execute(ServerContext server) {
        return Frame.ok();
    }
}
