package ember.client;

import ember.protocol.Frame;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ReplyFormatterTest {

    @Test
    public void testScalars() {
        assertEquals("OK", ReplyFormatter.format(Frame.ok()));
        assertEquals("(error) ERR syntax error", ReplyFormatter.format(Frame.error("ERR syntax error")));
        assertEquals("(integer) 42", ReplyFormatter.format(Frame.integer(42)));
        assertEquals("\"bar\"", ReplyFormatter.format(Frame.bulk("bar")));
        assertEquals("(nil)", ReplyFormatter.format(Frame.nullBulk()));
        assertEquals("(nil)", ReplyFormatter.format(Frame.nullArray()));
    }

    @Test
    public void testArrays() {
        assertEquals("(empty array)", ReplyFormatter.format(Frame.array()));
        assertEquals("1) \"a\"\n2) (integer) 2",
                ReplyFormatter.format(Frame.array(Frame.bulk("a"), Frame.integer(2))));
    }

    @Test
    public void testNestedArrayIsIndented() {
        Frame nested = Frame.array(Frame.bulk("x"), Frame.array(Frame.bulk("y"), Frame.bulk("z")));
        assertEquals("1) \"x\"\n2) 1) \"y\"\n   2) \"z\"", ReplyFormatter.format(nested));
    }
}
