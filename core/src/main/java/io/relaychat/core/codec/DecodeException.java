package io.relaychat.core.codec;

/**
 * A frame payload is not a valid encoding of the expected message family.
 * <p>
 * The frame boundary is intact, so the connection itself can keep going.
 * </p>
 */
public class DecodeException extends Exception {

    public DecodeException(String message) {
        super(message);
    }

    public DecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
