package ember.commands;

import ember.ServerContext;
import ember.protocol.Frame;

/**
 * A parsed, validated request. Instances are immutable and live for one
 * request/response cycle.
 */
public interface Command {

    CommandType type();

    /**
     * Applies the command and renders its reply. Failures that should reach the client
     * as an error reply are thrown as {@link CommandException}; they never leave the
     * store partially updated.
     */
    Frame execute(ServerContext server);
}
