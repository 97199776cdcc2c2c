package ember.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import io.netty.util.ByteProcessor;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Stateless RESP codec.
 * <p>
 * {@link #tryParse(ByteBuf)} decodes at most one frame from the readable bytes of a
 * buffer without moving its reader index. The caller skips {@link ParseResult#consumed()}
 * bytes on success, waits for more input on {@code INCOMPLETE}, and drops the connection
 * on {@code MALFORMED}. Numbers are scanned straight out of the buffer.
 */
public class FrameCodec {

    public static final int DEFAULT_MAX_BULK_LENGTH = 512 * 1024 * 1024;
    public static final int DEFAULT_MAX_ARRAY_LENGTH = 1024 * 1024;
    public static final int DEFAULT_MAX_DEPTH = 32;
    /** Arrays are parsed recursively; deeper limits risk the event loop's stack. */
    public static final int MAX_SUPPORTED_DEPTH = 256;

    // "-9223372036854775808" is 20 characters; leave room for leading zeros.
    private static final int MAX_NUMBER_LINE = 32;
    private static final int MAX_LENGTH_HEADER = 20;
    private static final int INITIAL_ARRAY_CAPACITY = 16;
    private static final byte CR = '\r';
    private static final byte LF = '\n';
    private static final byte[] CRLF = {CR, LF};

    private final int maxBulkLength;
    private final int maxArrayLength;
    private final int maxDepth;

    public FrameCodec() {
        this(DEFAULT_MAX_BULK_LENGTH, DEFAULT_MAX_ARRAY_LENGTH, DEFAULT_MAX_DEPTH);
    }

    public FrameCodec(int maxBulkLength, int maxArrayLength, int maxDepth) {
        if (maxBulkLength < 0 || maxBulkLength > Integer.MAX_VALUE - 2) {
            throw new IllegalArgumentException("maxBulkLength out of range: " + maxBulkLength);
        }
        if (maxArrayLength < 0) {
            throw new IllegalArgumentException("maxArrayLength out of range: " + maxArrayLength);
        }
        if (maxDepth < 1 || maxDepth > MAX_SUPPORTED_DEPTH) {
            throw new IllegalArgumentException("maxDepth must be in [1, " + MAX_SUPPORTED_DEPTH + "]: " + maxDepth);
        }
        this.maxBulkLength = maxBulkLength;
        this.maxArrayLength = maxArrayLength;
        this.maxDepth = maxDepth;
    }

    // --- DECODING ---

    public ParseResult tryParse(ByteBuf buf) {
        Cursor cursor = new Cursor(buf);
        int start = cursor.pos;
        try {
            Frame frame = parseFrame(cursor, 0);
            if (frame == null) return ParseResult.incomplete();
            return ParseResult.parsed(frame, cursor.pos - start);
        } catch (MalformedFrameException e) {
            return ParseResult.malformed(e.getMessage());
        }
    }

    public ParseResult tryParse(byte[] bytes) {
        return tryParse(Unpooled.wrappedBuffer(bytes));
    }

    private static final class Cursor {
        final ByteBuf buf;
        final int end;
        int pos;

        Cursor(ByteBuf buf) {
            this.buf = buf;
            this.pos = buf.readerIndex();
            this.end = buf.writerIndex();
        }

        int remaining() {
            return end - pos;
        }
    }

    /** Returns null when more bytes are needed. */
    private Frame parseFrame(Cursor c, int depth) throws MalformedFrameException {
        if (c.remaining() < 1) return null;
        byte sigil = c.buf.getByte(c.pos);
        switch (sigil) {
            case '+':
                return parseText(c, Frame.Type.SIMPLE);
            case '-':
                return parseText(c, Frame.Type.ERROR);
            case ':':
                return parseInteger(c);
            case '$':
                return parseBulk(c);
            case '*':
                return parseArray(c, depth);
            default:
                throw new MalformedFrameException("unknown frame type byte 0x" + Integer.toHexString(sigil & 0xff));
        }
    }

    private Frame parseText(Cursor c, Frame.Type type) throws MalformedFrameException {
        int from = c.pos + 1;
        int cr = findLineEnd(c.buf, from, c.end, maxBulkLength);
        if (cr < 0) return null;
        int length = cr - from;
        if (!ByteBufUtil.isText(c.buf, from, length, StandardCharsets.UTF_8)) {
            throw new MalformedFrameException("invalid UTF-8 in " + (type == Frame.Type.SIMPLE ? "simple string" : "error"));
        }
        String text = c.buf.toString(from, length, StandardCharsets.UTF_8);
        c.pos = cr + 2;
        return Frame.trustedText(type, text);
    }

    private Frame parseInteger(Cursor c) throws MalformedFrameException {
        int from = c.pos + 1;
        int cr = findLineEnd(c.buf, from, c.end, MAX_NUMBER_LINE);
        if (cr < 0) return null;
        long value = parseLong(c.buf, from, cr, "integer");
        c.pos = cr + 2;
        return Frame.integer(value);
    }

    private Frame parseBulk(Cursor c) throws MalformedFrameException {
        int from = c.pos + 1;
        int cr = findLineEnd(c.buf, from, c.end, MAX_LENGTH_HEADER);
        if (cr < 0) return null;
        long length = parseLong(c.buf, from, cr, "bulk length");
        if (length == -1) {
            c.pos = cr + 2;
            return Frame.nullBulk();
        }
        if (length < -1) throw new MalformedFrameException("invalid bulk length " + length);
        if (length > maxBulkLength) throw new MalformedFrameException("bulk length " + length + " exceeds limit " + maxBulkLength);

        int payloadStart = cr + 2;
        int n = (int) length;
        if ((long) c.end - payloadStart < length + 2) return null;
        if (c.buf.getByte(payloadStart + n) != CR || c.buf.getByte(payloadStart + n + 1) != LF) {
            throw new MalformedFrameException("bulk string of length " + n + " not terminated by CRLF");
        }
        byte[] payload = new byte[n];
        c.buf.getBytes(payloadStart, payload);
        c.pos = payloadStart + n + 2;
        return Frame.ownedBulk(payload);
    }

    private Frame parseArray(Cursor c, int depth) throws MalformedFrameException {
        if (depth >= maxDepth) throw new MalformedFrameException("array nesting deeper than " + maxDepth);
        int from = c.pos + 1;
        int cr = findLineEnd(c.buf, from, c.end, MAX_LENGTH_HEADER);
        if (cr < 0) return null;
        long count = parseLong(c.buf, from, cr, "array length");
        if (count == -1) {
            c.pos = cr + 2;
            return Frame.nullArray();
        }
        if (count < -1) throw new MalformedFrameException("invalid array length " + count);
        if (count > maxArrayLength) throw new MalformedFrameException("array length " + count + " exceeds limit " + maxArrayLength);

        int n = (int) count;
        c.pos = cr + 2;
        // Capacity is not trusted from the header; it grows with bytes actually present.
        List<Frame> elements = new ArrayList<>(Math.min(n, INITIAL_ARRAY_CAPACITY));
        for (int i = 0; i < n; i++) {
            Frame element = parseFrame(c, depth + 1);
            if (element == null) return null;
            elements.add(element);
        }
        return Frame.ownedArray(elements);
    }

    /**
     * Index of the CR that ends the line starting at {@code from}, or -1 when the
     * terminator has not arrived yet. A line longer than {@code maxLength}, a bare LF,
     * or a CR followed by anything but LF is malformed.
     */
    private static int findLineEnd(ByteBuf buf, int from, int end, int maxLength) throws MalformedFrameException {
        int searchEnd = (int) Math.min(end, (long) from + maxLength + 1);
        int i = searchEnd > from ? buf.forEachByte(from, searchEnd - from, ByteProcessor.FIND_CRLF) : -1;
        if (i < 0) {
            if ((long) end - from > maxLength) {
                throw new MalformedFrameException("line longer than " + maxLength + " bytes");
            }
            return -1;
        }
        if (buf.getByte(i) == LF) throw new MalformedFrameException("LF without preceding CR");
        if (i + 1 >= end) return -1;
        if (buf.getByte(i + 1) != LF) throw new MalformedFrameException("CR not followed by LF");
        return i;
    }

    /** Parses a signed decimal in [from, to) without allocating. */
    static long parseLong(ByteBuf buf, int from, int to, String what) throws MalformedFrameException {
        if (from >= to) throw new MalformedFrameException("empty " + what);
        int i = from;
        boolean negative = false;
        byte first = buf.getByte(i);
        if (first == '-' || first == '+') {
            negative = first == '-';
            i++;
            if (i == to) throw new MalformedFrameException("invalid " + what);
        }
        // Accumulate negatively so Long.MIN_VALUE fits.
        long limit = negative ? Long.MIN_VALUE : -Long.MAX_VALUE;
        long multmin = limit / 10;
        long result = 0;
        for (; i < to; i++) {
            int digit = buf.getByte(i) - '0';
            if (digit < 0 || digit > 9) throw new MalformedFrameException("invalid " + what);
            if (result < multmin) throw new MalformedFrameException(what + " out of range");
            result *= 10;
            if (result < limit + digit) throw new MalformedFrameException(what + " out of range");
            result -= digit;
        }
        return negative ? result : -result;
    }

    static final class MalformedFrameException extends Exception {
        MalformedFrameException(String message) {
            super(message, null, false, false);
        }
    }

    // --- ENCODING ---

    public static void encode(Frame frame, ByteBuf out) {
        out.writeByte(frame.type().sigil());
        switch (frame.type()) {
            case SIMPLE:
            case ERROR:
                out.writeCharSequence(frame.text(), StandardCharsets.UTF_8);
                out.writeBytes(CRLF);
                break;
            case INTEGER:
                writeDecimal(out, frame.integer());
                break;
            case BULK:
                byte[] payload = frame.rawBytes();
                if (payload == null) {
                    writeDecimal(out, -1);
                } else {
                    writeDecimal(out, payload.length);
                    out.writeBytes(payload);
                    out.writeBytes(CRLF);
                }
                break;
            case ARRAY:
                if (frame.isNull()) {
                    writeDecimal(out, -1);
                } else {
                    List<Frame> elements = frame.elements();
                    writeDecimal(out, elements.size());
                    for (Frame element : elements) {
                        encode(element, out);
                    }
                }
                break;
            default:
                throw new IllegalStateException("unknown frame type " + frame.type());
        }
    }

    public static byte[] toBytes(Frame frame) {
        ByteBuf buf = Unpooled.buffer();
        try {
            encode(frame, buf);
            return ByteBufUtil.getBytes(buf);
        } finally {
            buf.release();
        }
    }

    private static void writeDecimal(ByteBuf out, long value) {
        out.writeCharSequence(Long.toString(value), StandardCharsets.US_ASCII);
        out.writeBytes(CRLF);
    }
}
