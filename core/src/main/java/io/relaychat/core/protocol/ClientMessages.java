package io.relaychat.core.protocol;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

/**
 * Requests a client may send.
 * <p>
 * {@link Register} must be the first frame on a connection; the others are only
 * valid once the connection is registered.
 * </p>
 */
public final class ClientMessages {
    private ClientMessages() {
    }

    /**
     * Claims a handle for the lifetime of the connection.
     */
    @Value
    public static class Register implements ClientMessage {
        @JsonProperty("handle")
        String handle;

        @JsonCreator
        public Register(@JsonProperty(value = "handle", required = true) String handle) {
            this.handle = handle;
        }
    }

    /**
     * Asks for the handles currently registered, the caller included.
     */
    @Value
    public static class ListUsers implements ClientMessage {
        @JsonCreator
        public ListUsers() {
        }
    }

    /**
     * Appends {@code content} to the chat with {@code target} and relays it to them.
     */
    @Value
    public static class SendMessage implements ClientMessage {
        @JsonProperty("content")
        String content;

        @JsonProperty("target")
        String target;

        @JsonCreator
        public SendMessage(
            @JsonProperty(value = "content", required = true) String content,
            @JsonProperty(value = "target", required = true) String target
        ) {
            this.content = content;
            this.target = target;
        }
    }

    /**
     * Fetches the chat log shared with {@code target}.
     */
    @Value
    public static class GetMessages implements ClientMessage {
        @JsonProperty("target")
        String target;

        @JsonCreator
        public GetMessages(@JsonProperty(value = "target", required = true) String target) {
            this.target = target;
        }
    }
}
