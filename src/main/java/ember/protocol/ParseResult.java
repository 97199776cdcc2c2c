package ember.protocol;

/**
 * Outcome of one {@link FrameCodec#tryParse} attempt.
 */
public final class ParseResult {

    public enum Status {
        PARSED,
        INCOMPLETE,
        MALFORMED
    }

    private static final ParseResult INCOMPLETE = new ParseResult(Status.INCOMPLETE, null, 0, null);

    private final Status status;
    private final Frame frame;
    private final int consumed;
    private final String reason;

    private ParseResult(Status status, Frame frame, int consumed, String reason) {
        this.status = status;
        this.frame = frame;
        this.consumed = consumed;
        this.reason = reason;
    }

    static ParseResult parsed(Frame frame, int consumed) {
        return new ParseResult(Status.PARSED, frame, consumed, null);
    }

    static ParseResult incomplete() {
        return INCOMPLETE;
    }

    static ParseResult malformed(String reason) {
        return new ParseResult(Status.MALFORMED, null, 0, reason);
    }

    public Status status() {
        return status;
    }

    public boolean isParsed() {
        return status == Status.PARSED;
    }

    public boolean isIncomplete() {
        return status == Status.INCOMPLETE;
    }

    public boolean isMalformed() {
        return status == Status.MALFORMED;
    }

    public Frame frame() {
        return frame;
    }

    /** Bytes the caller must discard from the front of its buffer. */
    public int consumed() {
        return consumed;
    }

    public String reason() {
        return reason;
    }

    @Override
    public String toString() {
        switch (status) {
            case PARSED:
                return "Parsed(" + frame + ", " + consumed + ")";
            case MALFORMED:
                return "Malformed(" + reason + ")";
            default:
                return "Incomplete";
        }
    }
}
