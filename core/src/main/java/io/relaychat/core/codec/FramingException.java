package io.relaychat.core.codec;

import java.io.IOException;

/**
 * The length prefix of a frame is outside the accepted range.
 * <p>
 * Once the prefix is rejected the stream position is lost, so the connection must be closed.
 * </p>
 */
public class FramingException extends IOException {

    public FramingException(String message) {
        super(message);
    }
}
