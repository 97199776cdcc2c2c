package ember.network;

import ember.ServerContext;
import ember.commands.Command;
import ember.commands.CommandException;
import ember.commands.CommandParser;
import ember.commands.CommandType;
import ember.protocol.Frame;
import ember.protocol.ProtocolException;
import ember.utils.Log;

import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.util.ReferenceCountUtil;

import java.io.IOException;

/**
 * One per connection. Runs parse, execute and reply for each decoded frame, in
 * arrival order, on the channel's event loop. Replies are written in the same order
 * the requests arrived.
 * <p>
 * Reads pause while the channel is not writable, so a peer that pipelines requests
 * without reading replies holds at most the write buffer's high water mark plus one
 * reply in memory.
 * <p>
 * Per-request failures become error replies. Malformed input and I/O failures close
 * this channel only; the store keeps no per-connection state, so nothing else needs
 * releasing.
 */
public class ClientHandler extends ChannelInboundHandlerAdapter {
    private final ServerContext server;
    private ChannelHandlerContext ctx;

    public ClientHandler(ServerContext server) {
        this.server = server;
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception {
        this.ctx = ctx;
        server.connectionOpened();
        if (Log.isDebugEnabled()) {
            Log.debug("Client connected: " + getRemoteAddress() + " (" + server.getActiveConnections() + " open)");
        }
        super.channelActive(ctx);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        server.connectionClosed();
        Log.debug("Client disconnected: " + getRemoteAddress());
        super.channelInactive(ctx);
    }

    @Override
    public void channelRead(ChannelHandlerContext ctx, Object msg) throws Exception {
        if (msg instanceof Frame) {
            handleFrame((Frame) msg);
        } else {
            ReferenceCountUtil.release(msg);
            Log.warn("Dropping unexpected message type " + msg.getClass().getName());
        }
    }

    private void handleFrame(Frame frame) {
        if (!ctx.channel().isActive()) return;
        server.commandProcessed();

        Command command;
        Frame reply;
        try {
            command = CommandParser.parse(frame);
            reply = command.execute(server);
        } catch (CommandException e) {
            command = null;
            reply = Frame.error(e.getMessage());
        } catch (RuntimeException e) {
            Log.error("Command failed for " + getRemoteAddress(), e);
            command = null;
            reply = Frame.error("ERR internal error");
        }

        if (command != null && command.type() == CommandType.QUIT) {
            ctx.writeAndFlush(reply).addListener(ChannelFutureListener.CLOSE);
            return;
        }
        ctx.writeAndFlush(reply).addListener(ChannelFutureListener.CLOSE_ON_FAILURE);
        if (!ctx.channel().isWritable()) {
            // Peer is not draining replies: stop reading until the outbound buffer falls
            // below the low water mark.
            ctx.channel().config().setAutoRead(false);
        }
    }

    @Override
    public void channelWritabilityChanged(ChannelHandlerContext ctx) throws Exception {
        if (ctx.channel().isWritable() && !ctx.channel().config().isAutoRead()) {
            ctx.channel().config().setAutoRead(true);
        }
        super.channelWritabilityChanged(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        if (cause instanceof ProtocolException) {
            Log.warn("Closing " + getRemoteAddress() + ": " + cause.getMessage());
        } else if (cause instanceof IOException) {
            Log.debug("I/O error on " + getRemoteAddress() + ": " + cause.getMessage());
        } else {
            Log.error("Unexpected error on " + getRemoteAddress(), cause);
        }
        ctx.close();
    }

    public String getRemoteAddress() {
        if (ctx != null && ctx.channel().remoteAddress() != null) {
            return ctx.channel().remoteAddress().toString();
        }
        return "0.0.0.0:0";
    }
}
