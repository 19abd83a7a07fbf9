package io.relaychat.server.chat;

/**
 * Both sides of a requested chat are the same handle.
 */
public class InvalidPairException extends IllegalArgumentException {

    public InvalidPairException(String handle) {
        super("A chat needs two distinct handles, got '" + handle + "' twice");
    }
}
