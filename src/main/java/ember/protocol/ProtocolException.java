package ember.protocol;

import io.netty.handler.codec.DecoderException;

/**
 * A byte stream that cannot be decoded as RESP. Fatal to the connection it came from.
 */
public class ProtocolException extends DecoderException {

    public ProtocolException(String message) {
        super("Protocol error: " + message);
    }
}
