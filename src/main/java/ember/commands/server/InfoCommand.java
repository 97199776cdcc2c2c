package ember.commands.server;

import ember.ServerContext;
import ember.commands.Command;
import ember.commands.CommandException;
import ember.commands.CommandParser;
import ember.commands.CommandType;
import ember.db.Database;
import ember.protocol.Frame;

import java.util.List;
import java.util.Locale;

/**
 * {@code INFO [section]} with the server, clients, stats and keyspace sections.
 */
public class InfoCommand implements Command {
    private static final String[] SECTIONS = {"server", "clients", "stats", "keyspace"};

    private final String section;

    public InfoCommand(String section) {
        this.section = section;
    }

    public static InfoCommand parse(List<byte[]> args) {
        if (args.size() > 2) {
            throw CommandException.syntax();
        }
        String section = args.size() == 2 ? CommandParser.text(args.get(1)).toLowerCase(Locale.ROOT) : "all";
        return new InfoCommand(section);
    }

    @Override
    public CommandType type() {
        return CommandType.INFO;
    }

    @Override
    public Frame execute(ServerContext server) {
        StringBuilder sb = new StringBuilder();
        for (String name : SECTIONS) {
            if (section.equals("all") || section.equals("default") || section.equals(name)) {
                appendSection(sb, name, server);
            }
        }
        return Frame.bulk(sb.toString());
    }

    private static void appendSection(StringBuilder sb, String name, ServerContext server) {
        Database db = server.getDatabase();
        if (sb.length() > 0) sb.append("\r\n");
        switch (name) {
            case "server":
                sb.append("# Server\r\n");
                sb.append("ember_version:").append(server.getVersion()).append("\r\n");
                sb.append("os:").append(server.getOsName()).append("\r\n");
                sb.append("java_version:").append(server.getJavaVersion()).append("\r\n");
                sb.append("tcp_port:").append(server.getPort()).append("\r\n");
                sb.append("uptime_in_seconds:").append(server.getUptime() / 1000).append("\r\n");
                break;
            case "clients":
                sb.append("# Clients\r\n");
                sb.append("connected_clients:").append(server.getActiveConnections()).append("\r\n");
                break;
            case "stats":
                sb.append("# Stats\r\n");
                sb.append("total_commands_processed:").append(server.getTotalCommandsProcessed()).append("\r\n");
                sb.append("keyspace_hits:").append(db.getKeyspaceHits()).append("\r\n");
                sb.append("keyspace_misses:").append(db.getKeyspaceMisses()).append("\r\n");
                sb.append("expired_keys:").append(db.getExpiredKeys()).append("\r\n");
                break;
            case "keyspace":
                sb.append("# Keyspace\r\n");
                if (db.size() > 0) {
                    sb.append("db0:keys=").append(db.size()).append("\r\n");
                }
                break;
            default:
                break;
        }
    }
}
