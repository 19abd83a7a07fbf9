package io.relaychat.server.session;

/**
 * A live session already holds the requested handle.
 */
public class HandleTakenException extends Exception {

    public HandleTakenException(String handle) {
        super("Handle '" + handle + "' is already registered");
    }
}
