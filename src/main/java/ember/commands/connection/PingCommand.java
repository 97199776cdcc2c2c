package ember.commands.connection;

import ember.ServerContext;
import ember.commands.Command;
import ember.commands.CommandException;
import ember.commands.CommandType;
import ember.protocol.Frame;

import java.util.List;

public class PingCommand implements Command {
    private final byte[] message;

    public PingCommand(byte[] message) {
        this.message = message;
    }

    public static PingCommand parse(List<byte[]> args) {
        if (args.size() > 2) {
            throw CommandException.wrongArity("ping");
        }
        return new PingCommand(args.size() == 2 ? args.get(1) : null);
    }

    @Override
    public CommandType type() {
        return CommandType.PING;
    }

    @Override
    public Frame execute(ServerContext server) {
        if (message == null) {
            return Frame.simple("PONG");
        }
        return Frame.bulk(message);
    }
}
