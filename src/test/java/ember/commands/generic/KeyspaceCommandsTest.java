package ember.commands.generic;

import ember.Config;
import ember.EmberServerContext;
import ember.commands.CommandException;
import ember.commands.CommandParser;
import ember.db.Database;
import ember.protocol.Frame;
import ember.utils.MockClock;
import ember.utils.Time;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class KeyspaceCommandsTest {

    private MockClock clock;
    private EmberServerContext server;

    @BeforeEach
    public void setup() {
        clock = new MockClock(3_000_000);
        Time.setClock(clock);
        server = new EmberServerContext(new Config(), new Database());
    }

    @AfterEach
    public void tearDown() {
        Time.useSystemClock();
    }

    private Frame exec(String... parts) {
        try {
            return CommandParser.parse(Frame.command(parts)).execute(server);
        } catch (CommandException e) {
            return Frame.error(e.getMessage());
        }
    }

    @Test
    public void testDelCountsRemovedKeys() {
        exec("SET", "a", "1");
        exec("SET", "b", "2");
        assertEquals(Frame.integer(2), exec("DEL", "a", "b", "c"));
        assertEquals(Frame.integer(0), exec("DEL", "a"));
        // Duplicates are removed once.
        exec("SET", "a", "1");
        assertEquals(Frame.integer(1), exec("DEL", "a", "a"));
    }

    @Test
    public void testExistsCountsDuplicates() {
        exec("SET", "a", "1");
        assertEquals(Frame.integer(2), exec("EXISTS", "a", "a", "missing"));
    }

    @Test
    public void testExpireAndTtl() {
        exec("SET", "k", "v");
        assertEquals(Frame.integer(-1), exec("TTL", "k"));
        assertEquals(Frame.integer(1), exec("EXPIRE", "k", "10"));
        assertEquals(Frame.integer(10), exec("TTL", "k"));
        assertEquals(Frame.integer(10_000), exec("PTTL", "k"));

        clock.advance(2_400);
        assertEquals(Frame.integer(8), exec("TTL", "k"));
        assertEquals(Frame.integer(7_600), exec("PTTL", "k"));

        clock.advance(7_600);
        assertEquals(Frame.integer(-2), exec("TTL", "k"));
        assertTrue(exec("GET", "k").isNull());
    }

    @Test
    public void testPexpire() {
        exec("SET", "k", "v");
        assertEquals(Frame.integer(1), exec("PEXPIRE", "k", "250"));
        assertEquals(Frame.integer(250), exec("PTTL", "k"));
        assertEquals(Frame.integer(0), exec("PEXPIRE", "missing", "250"));
    }

    @Test
    public void testNonPositiveExpireDeletes() {
        exec("SET", "k", "v");
        assertEquals(Frame.integer(1), exec("EXPIRE", "k", "0"));
        assertEquals(Frame.integer(0), exec("EXISTS", "k"));

        exec("SET", "k", "v");
        assertEquals(Frame.integer(1), exec("PEXPIRE", "k", "-100"));
        assertTrue(exec("GET", "k").isNull());
    }

    @Test
    public void testExpireRejectsBadNumbers() {
        exec("SET", "k", "v");
        assertEquals(Frame.error("ERR value is not an integer or out of range"), exec("EXPIRE", "k", "soon"));
        assertEquals(Frame.error("ERR invalid expire time in 'expire' command"), exec("EXPIRE", "k", "9223372036854775807"));
        assertEquals(Frame.integer(-1), exec("TTL", "k"));
    }

    @Test
    public void testPersist() {
        exec("SET", "k", "v", "EX", "5");
        assertEquals(Frame.integer(1), exec("PERSIST", "k"));
        assertEquals(Frame.integer(0), exec("PERSIST", "k"));
        assertEquals(Frame.integer(-1), exec("TTL", "k"));
        assertEquals(Frame.integer(0), exec("PERSIST", "missing"));
    }

    @Test
    public void testTtlRoundsToNearestSecond() {
        exec("SET", "k", "v", "PX", "1499");
        assertEquals(Frame.integer(1), exec("TTL", "k"));
        exec("SET", "k", "v", "PX", "1500");
        assertEquals(Frame.integer(2), exec("TTL", "k"));
    }
}
