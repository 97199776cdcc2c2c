package ember.commands.connection;

import ember.ServerContext;
import ember.commands.Command;
import ember.commands.CommandType;
import ember.protocol.Frame;

public class EchoCommand implements Command {
    private final byte[] message;

    public EchoCommand(byte[] message) {
        this.message = message;
    }

    @Override
    public CommandType type() {
        return CommandType.ECHO;
    }

    @Override
    public Frame execute(ServerContext server) {
        return Frame.bulk(message);
    }
}
