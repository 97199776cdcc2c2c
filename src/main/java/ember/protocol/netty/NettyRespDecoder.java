package ember.protocol.netty;

import ember.protocol.FrameCodec;
import ember.protocol.ParseResult;
import ember.protocol.ProtocolException;
import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ByteToMessageDecoder;

import java.util.ArrayList;
import java.util.List;

/**
 * Netty decoder for RESP frames.
 * <p>
 * The cumulation buffer inherited from {@link ByteToMessageDecoder} is the connection's
 * read buffer: bytes stay in it until {@link FrameCodec} can account for a whole frame.
 * Emits {@link ember.protocol.Frame} messages, one per {@code decode} call.
 * <p>
 * While the channel is not writable no further frames are emitted; pipelined requests
 * wait in the buffer and are released once the peer drains its replies.
 */
public class NettyRespDecoder extends ByteToMessageDecoder {

    private final FrameCodec codec;
    private boolean resumeScheduled;

    public NettyRespDecoder() {
        this(new FrameCodec());
    }

    public NettyRespDecoder(FrameCodec codec) {
        this.codec = codec;
    }

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) throws Exception {
        if (!ctx.channel().isWritable()) {
            return; // resumed from channelWritabilityChanged
        }
        decodeOne(in, out);
    }

    private void decodeOne(ByteBuf in, List<Object> out) {
        ParseResult result = codec.tryParse(in);
        switch (result.status()) {
            case INCOMPLETE:
                return; // Wait for more data
            case MALFORMED:
                in.skipBytes(in.readableBytes());
                throw new ProtocolException(result.reason());
            case PARSED:
                in.skipBytes(result.consumed());
                out.add(result.frame());
                return;
            default:
                throw new IllegalStateException("unexpected parse status " + result.status());
        }
    }

    @Override
    public void channelWritabilityChanged(ChannelHandlerContext ctx) throws Exception {
        // Writability can flip back inside a flush issued from our own decode loop,
        // so the buffered frames are drained from a fresh event loop task.
        if (ctx.channel().isWritable() && !resumeScheduled && internalBuffer().isReadable()) {
            resumeScheduled = true;
            ctx.channel().eventLoop().execute(() -> resume(ctx));
        }
        super.channelWritabilityChanged(ctx);
    }

    @Override
    public void channelReadComplete(ChannelHandlerContext ctx) throws Exception {
        if (!ctx.channel().isWritable()) {
            // The base class would issue another read when auto-read is off.
            ctx.fireChannelReadComplete();
            return;
        }
        super.channelReadComplete(ctx);
    }

    private void resume(ChannelHandlerContext ctx) {
        resumeScheduled = false;
        if (ctx.isRemoved() || !ctx.channel().isActive()) return;
        List<Object> out = new ArrayList<>();
        try {
            callDecode(ctx, internalBuffer(), out);
            for (Object msg : out) {
                ctx.fireChannelRead(msg);
            }
        } catch (RuntimeException e) {
            ctx.fireExceptionCaught(e);
        }
    }

    @Override
    protected void decodeLast(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) throws Exception {
        // The peer is gone, so writability no longer gates; whole frames still go out.
        while (in.isReadable()) {
            int before = in.readableBytes();
            decodeOne(in, out);
            if (in.readableBytes() == before) break;
        }
        if (in.isReadable()) {
            int leftover = in.readableBytes();
            in.skipBytes(leftover);
            throw new ProtocolException("connection closed with " + leftover + " bytes of an unfinished frame");
        }
    }
}
