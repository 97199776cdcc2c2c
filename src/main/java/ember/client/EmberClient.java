package ember.client;

import ember.protocol.Frame;
import ember.protocol.FrameCodec;
import ember.protocol.ParseResult;
import ember.protocol.ProtocolException;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;

import java.io.Closeable;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Blocking client over a plain socket. Not thread-safe; one request is in flight at a time.
 */
public class EmberClient implements Closeable {
    private static final int READ_CHUNK = 8192;

    private final Socket socket;
    private final InputStream in;
    private final OutputStream out;
    private final FrameCodec codec = new FrameCodec();
    private final ByteBuf buffer = Unpooled.buffer(READ_CHUNK);
    private final byte[] chunk = new byte[READ_CHUNK];

    EmberClient(Socket socket) throws IOException {
        this.socket = socket;
        this.in = socket.getInputStream();
        this.out = socket.getOutputStream();
    }

    public static EmberClient connect(String host, int port) throws IOException {
        return connect(host, port, Duration.ofSeconds(5));
    }

    public static EmberClient connect(String host, int port, Duration timeout) throws IOException {
        Socket socket = new Socket();
        try {
            socket.setTcpNoDelay(true);
            socket.connect(new InetSocketAddress(host, port), (int) timeout.toMillis());
            socket.setSoTimeout((int) timeout.toMillis());
            return new EmberClient(socket);
        } catch (IOException e) {
            socket.close();
            throw e;
        }
    }

    /** Writes one frame and blocks for its reply. */
    public Frame send(Frame request) throws IOException {
        write(request);
        return readFrame();
    }

    public Frame command(String... parts) throws IOException {
        return send(Frame.command(parts));
    }

    public void write(Frame frame) throws IOException {
        out.write(FrameCodec.toBytes(frame));
        out.flush();
    }

    /** Sends raw bytes, for callers that need to split or pipeline requests themselves. */
    public void writeRaw(byte[] bytes) throws IOException {
        out.write(bytes);
        out.flush();
    }

    /**
     * Reads until one whole frame is buffered. Bytes past that frame stay buffered for
     * the next call.
     */
    public Frame readFrame() throws IOException {
        while (true) {
            if (buffer.isReadable()) {
                ParseResult result = codec.tryParse(buffer);
                if (result.isParsed()) {
                    buffer.skipBytes(result.consumed());
                    buffer.discardSomeReadBytes();
                    return result.frame();
                }
                if (result.isMalformed()) {
                    throw new ProtocolException(result.reason());
                }
            }
            int n = in.read(chunk);
            if (n == -1) {
                if (buffer.isReadable()) {
                    throw new ProtocolException("connection closed with " + buffer.readableBytes() + " bytes of an unfinished reply");
                }
                throw new EOFException("connection closed by server");
            }
            buffer.writeBytes(chunk, 0, n);
        }
    }

    // --- CONVENIENCE ---

    public String ping() throws IOException {
        Frame reply = checked(command("PING"));
        return reply.type() == Frame.Type.SIMPLE ? reply.text() : reply.bulkString();
    }

    public byte[] get(String key) throws IOException {
        return checked(command("GET", key)).bytes();
    }

    public String getString(String key) throws IOException {
        byte[] value = get(key);
        return value == null ? null : new String(value, StandardCharsets.UTF_8);
    }

    public void set(String key, String value) throws IOException {
        checked(command("SET", key, value));
    }

    public void set(String key, byte[] value) throws IOException {
        checked(send(Frame.array(Frame.bulk("SET"), Frame.bulk(key), Frame.bulk(value))));
    }

    public void set(String key, String value, Duration ttl) throws IOException {
        checked(command("SET", key, value, "PX", String.valueOf(ttl.toMillis())));
    }

    public long del(String... keys) throws IOException {
        List<String> parts = new ArrayList<>(keys.length + 1);
        parts.add("DEL");
        for (String key : keys) parts.add(key);
        return checked(command(parts.toArray(new String[0]))).integer();
    }

    private static Frame checked(Frame reply) {
        if (reply.isError()) {
            throw new ReplyException(reply.text());
        }
        return reply;
    }

    public boolean isConnected() {
        return socket.isConnected() && !socket.isClosed();
    }

    @Override
    public void close() throws IOException {
        try {
            socket.close();
        } finally {
            if (buffer.refCnt() > 0) buffer.release();
        }
    }
}
