package ember.network;

import ember.Config;
import ember.EmberServerContext;
import ember.db.Database;
import ember.protocol.Frame;
import ember.protocol.netty.NettyRespDecoder;
import ember.protocol.netty.NettyRespEncoder;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelOutboundBuffer;
import io.netty.channel.ChannelOutboundHandlerAdapter;
import io.netty.channel.ChannelPromise;
import io.netty.channel.embedded.EmbeddedChannel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

public class ClientHandlerTest {

    private EmberServerContext server;

    @BeforeEach
    public void setup() {
        server = new EmberServerContext(new Config(), new Database());
    }

    private EmbeddedChannel newChannel() {
        return new EmbeddedChannel(new NettyRespDecoder(), new NettyRespEncoder(), new ClientHandler(server));
    }

    private static void send(EmbeddedChannel channel, String wire) {
        channel.writeInbound(Unpooled.copiedBuffer(wire, StandardCharsets.UTF_8));
    }

    private static String replies(EmbeddedChannel channel) {
        StringBuilder sb = new StringBuilder();
        ByteBuf buf;
        while ((buf = channel.readOutbound()) != null) {
            sb.append(buf.toString(StandardCharsets.UTF_8));
            buf.release();
        }
        return sb.toString();
    }

    @Test
    public void testPing() {
        EmbeddedChannel channel = newChannel();
        send(channel, "*1\r\n$4\r\nPING\r\n");
        assertEquals("+PONG\r\n", replies(channel));
        assertTrue(channel.isActive());
    }

    @Test
    public void testReadsPauseUntilRepliesDrain() {
        EmbeddedChannel channel = newChannel();
        ChannelOutboundBuffer outbound = channel.unsafe().outboundBuffer();
        channel.pipeline().addFirst(new ChannelOutboundHandlerAdapter() {
            @Override
            public void write(ChannelHandlerContext ctx, Object msg, ChannelPromise promise) {
                // Every reply overflows the write buffer, as with a peer that never reads.
                outbound.setUserDefinedWritability(1, false);
                ctx.write(msg, promise);
            }
        });

        send(channel, "*1\r\n$4\r\nPING\r\n*1\r\n$4\r\nPING\r\n");
        assertEquals("+PONG\r\n", replies(channel));
        assertFalse(channel.config().isAutoRead());
        assertEquals(1, server.getTotalCommandsProcessed());

        outbound.setUserDefinedWritability(1, true);
        assertTrue(channel.config().isAutoRead());
        channel.runPendingTasks();
        assertEquals("+PONG\r\n", replies(channel));
        assertEquals(2, server.getTotalCommandsProcessed());
    }

    @Test
    public void testSetThenGet() {
        EmbeddedChannel channel = newChannel();
        send(channel, "*3\r\n$3\r\nSET\r\n$3\r\nfoo\r\n$3\r\nbar\r\n");
        assertEquals("+OK\r\n", replies(channel));
        send(channel, "*2\r\n$3\r\nGET\r\n$3\r\nfoo\r\n");
        assertEquals("$3\r\nbar\r\n", replies(channel));
    }

    @Test
    public void testGetMissingKey() {
        EmbeddedChannel channel = newChannel();
        send(channel, "*2\r\n$3\r\nGET\r\n$4\r\nnope\r\n");
        assertEquals("$-1\r\n", replies(channel));
    }

    @Test
    public void testUnknownCommandKeepsConnection() {
        EmbeddedChannel channel = newChannel();
        send(channel, "*1\r\n$3\r\nFOO\r\n");
        assertEquals("-ERR unknown command 'FOO'\r\n", replies(channel));
        assertTrue(channel.isActive());

        send(channel, "*1\r\n$4\r\nPING\r\n");
        assertEquals("+PONG\r\n", replies(channel));
    }

    @Test
    public void testNonArrayRequestIsAnErrorReply() {
        EmbeddedChannel channel = newChannel();
        send(channel, ":5\r\n");
        String reply = replies(channel);
        assertTrue(reply.startsWith("-ERR Protocol error"), reply);
        assertTrue(channel.isActive());
    }

    @Test
    public void testPipelinedRequestsAnsweredInOrder() {
        EmbeddedChannel channel = newChannel();
        send(channel, "*3\r\n$3\r\nSET\r\n$1\r\nk\r\n$1\r\n1\r\n"
                + "*2\r\n$3\r\nGET\r\n$1\r\nk\r\n"
                + "*2\r\n$3\r\nDEL\r\n$1\r\nk\r\n"
                + "*2\r\n$3\r\nGET\r\n$1\r\nk\r\n");
        assertEquals("+OK\r\n$1\r\n1\r\n:1\r\n$-1\r\n", replies(channel));
    }

    @Test
    public void testSplitRequest() {
        EmbeddedChannel channel = newChannel();
        send(channel, "*1\r\n$4\r\nPI");
        assertEquals("", replies(channel));
        send(channel, "NG\r\n");
        assertEquals("+PONG\r\n", replies(channel));
    }

    @Test
    public void testQuitClosesAfterReply() {
        EmbeddedChannel channel = newChannel();
        send(channel, "*1\r\n$4\r\nQUIT\r\n");
        assertEquals("+OK\r\n", replies(channel));
        assertFalse(channel.isOpen());
    }

    @Test
    public void testMalformedInputClosesConnection() {
        EmbeddedChannel channel = newChannel();
        send(channel, "*ABC\r\n");
        assertFalse(channel.isOpen());
        assertEquals("", replies(channel));
    }

    @Test
    public void testConnectionAndCommandCounters() {
        EmbeddedChannel channel = newChannel();
        assertEquals(1, server.getActiveConnections());
        send(channel, "*1\r\n$4\r\nPING\r\n*1\r\n$4\r\nPING\r\n");
        replies(channel);
        assertEquals(2, server.getTotalCommandsProcessed());
        channel.close();
        assertEquals(0, server.getActiveConnections());
    }

    @Test
    public void testSharedStoreAcrossConnections() {
        EmbeddedChannel a = newChannel();
        EmbeddedChannel b = newChannel();
        send(a, "*3\r\n$3\r\nSET\r\n$1\r\nk\r\n$1\r\nv\r\n");
        replies(a);
        a.close();
        send(b, "*2\r\n$3\r\nGET\r\n$1\r\nk\r\n");
        assertEquals("$1\r\nv\r\n", replies(b));
        assertEquals(1, server.getDatabase().size());
    }

    @Test
    public void testUnexpectedMessageIsDropped() {
        EmbeddedChannel channel = new EmbeddedChannel(new ClientHandler(server));
        channel.writeInbound("not a frame");
        assertNull(channel.readOutbound());
        assertTrue(channel.isActive());
        channel.writeInbound(Frame.command("PING"));
        assertEquals(Frame.simple("PONG"), channel.readOutbound());
    }
}
