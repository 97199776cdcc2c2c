package ember.commands.server;

import ember.Config;
import ember.EmberServerContext;
import ember.commands.CommandException;
import ember.commands.CommandParser;
import ember.db.Database;
import ember.protocol.Frame;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ServerCommandsTest {

    private final EmberServerContext server = new EmberServerContext(new Config(), new Database());

    private Frame exec(String... parts) {
        try {
            return CommandParser.parse(Frame.command(parts)).execute(server);
        } catch (CommandException e) {
            return Frame.error(e.getMessage());
        }
    }

    @Test
    public void testDbSize() {
        assertEquals(Frame.integer(0), exec("DBSIZE"));
        exec("SET", "a", "1");
        exec("SET", "b", "1");
        assertEquals(Frame.integer(2), exec("DBSIZE"));
    }

    @Test
    public void testInfoAllSections() {
        exec("SET", "a", "1");
        exec("GET", "a");
        exec("GET", "missing");
        String info = exec("INFO").bulkString();
        assertTrue(info.contains("# Server"));
        assertTrue(info.contains("ember_version:0.1.0"));
        assertTrue(info.contains("# Clients"));
        assertTrue(info.contains("keyspace_hits:1"));
        assertTrue(info.contains("keyspace_misses:1"));
        assertTrue(info.contains("db0:keys=1"));
    }

    @Test
    public void testInfoSingleSection() {
        String info = exec("INFO", "Stats").bulkString();
        assertTrue(info.startsWith("# Stats"));
        assertFalse(info.contains("# Server"));
        assertEquals("", exec("INFO", "nosuchsection").bulkString());
    }

    @Test
    public void testInfoTooManyArguments() {
        assertEquals(Frame.error("ERR syntax error"), exec("INFO", "server", "clients"));
    }

    @Test
    public void testQuitRepliesOk() {
        assertEquals(Frame.ok(), exec("QUIT"));
    }
}
