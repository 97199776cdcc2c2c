package ember.client;

/**
 * The server answered with an error reply.
 */
public class ReplyException extends RuntimeException {

    public ReplyException(String message) {
        super(message);
    }
}
