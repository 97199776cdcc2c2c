package ember.commands.string;

import ember.ServerContext;
import ember.commands.Command;
import ember.commands.CommandType;
import ember.db.BinaryKey;
import ember.protocol.Frame;

public class GetCommand implements Command {
    private final BinaryKey key;

    public GetCommand(BinaryKey key) {
        this.key = key;
    }

    public BinaryKey getKey() {
        return key;
    }

    @Override
    public CommandType type() {
        return CommandType.GET;
    }

    @Override
    public Frame execute(ServerContext server) {
        byte[] value = server.getDatabase().get(key);
        return value == null ? Frame.nullBulk() : Frame.bulk(value);
    }
}
