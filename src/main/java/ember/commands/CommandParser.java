package ember.commands;

import ember.commands.connection.EchoCommand;
import ember.commands.connection.PingCommand;
import ember.commands.connection.QuitCommand;
import ember.commands.generic.DelCommand;
import ember.commands.generic.ExistsCommand;
import ember.commands.generic.ExpireCommand;
import ember.commands.generic.PersistCommand;
import ember.commands.generic.TtlCommand;
import ember.commands.server.DbSizeCommand;
import ember.commands.server.InfoCommand;
import ember.commands.string.GetCommand;
import ember.commands.string.SetCommand;
import ember.db.BinaryKey;
import ember.protocol.Frame;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns a request frame into a typed {@link Command}.
 * <p>
 * A request must be a non-empty array of non-null bulk strings. The first element
 * picks the command (case-insensitive); its arity is checked here, the shape of the
 * remaining arguments by the command's own {@code parse}.
 */
public final class CommandParser {

    private CommandParser() {
    }

    public static Command parse(Frame frame) {
        if (frame.type() != Frame.Type.ARRAY || frame.isNull()) {
            throw CommandException.protocol("expected an array of bulk strings, got " + describe(frame));
        }
        List<Frame> elements = frame.elements();
        if (elements.isEmpty()) {
            throw CommandException.protocol("empty command");
        }

        List<byte[]> args = new ArrayList<>(elements.size());
        for (Frame element : elements) {
            if (element.type() != Frame.Type.BULK || element.isNull()) {
                throw CommandException.protocol("expected bulk string argument, got " + describe(element));
            }
            args.add(element.bytes());
        }

        String name = new String(args.get(0), StandardCharsets.UTF_8);
        CommandType type = CommandType.lookup(name);
        if (type == CommandType.UNKNOWN) {
            return new UnknownCommand(name);
        }
        if (!type.acceptsArgCount(args.size())) {
            throw CommandException.wrongArity(name);
        }

        switch (type) {
            case PING:
                return PingCommand.parse(args);
            case ECHO:
                return new EchoCommand(args.get(1));
            case QUIT:
                return new QuitCommand();
            case GET:
                return new GetCommand(BinaryKey.of(args.get(1)));
            case SET:
                return SetCommand.parse(args);
            case DEL:
                return new DelCommand(keys(args, 1));
            case EXISTS:
                return new ExistsCommand(keys(args, 1));
            case EXPIRE:
            case PEXPIRE:
                return ExpireCommand.parse(type, args);
            case TTL:
            case PTTL:
                return new TtlCommand(type, BinaryKey.of(args.get(1)));
            case PERSIST:
                return new PersistCommand(BinaryKey.of(args.get(1)));
            case DBSIZE:
                return new DbSizeCommand();
            case INFO:
                return InfoCommand.parse(args);
            default:
                throw new IllegalStateException("no parser for " + type);
        }
    }

    private static List<BinaryKey> keys(List<byte[]> args, int from) {
        List<BinaryKey> keys = new ArrayList<>(args.size() - from);
        for (int i = from; i < args.size(); i++) {
            keys.add(BinaryKey.of(args.get(i)));
        }
        return keys;
    }

    /** Parses a decimal argument, rejecting anything that is not a 64-bit integer. */
    public static long parseLong(byte[] arg) {
        String s = new String(arg, StandardCharsets.US_ASCII);
        if (s.isEmpty() || s.charAt(0) == '+') {
            throw CommandException.notAnInteger();
        }
        try {
            return Long.parseLong(s);
        } catch (NumberFormatException e) {
            throw CommandException.notAnInteger();
        }
    }

    public static String text(byte[] arg) {
        return new String(arg, StandardCharsets.UTF_8);
    }

    private static String describe(Frame frame) {
        if (frame.isNull()) return "null " + frame.type().name().toLowerCase();
        return frame.type().name().toLowerCase();
    }
}
