package ember.protocol.netty;

import ember.protocol.Frame;
import ember.protocol.FrameCodec;
import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToByteEncoder;

/**
 * Encodes {@link Frame} replies into RESP bytes.
 */
@ChannelHandler.Sharable
public class NettyRespEncoder extends MessageToByteEncoder<Frame> {

    @Override
    protected void encode(ChannelHandlerContext ctx, Frame msg, ByteBuf out) throws Exception {
        FrameCodec.encode(msg, out);
    }
}
