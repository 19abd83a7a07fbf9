package io.relaychat.core.protocol;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.util.List;

/**
 * Messages the server sends to clients.
 */
public final class ServerMessages {
    public static final String HANDLE_TAKEN = "Handle already taken";
    public static final String UNKNOWN_TARGET = "Target handle doesn't exist.";
    public static final String BLANK_HANDLE = "Handle must not be blank.";
    public static final String SELF_CHAT = "Cannot chat with yourself.";

    private ServerMessages() {
    }

    /**
     * Successful registration; always the first frame a registered client receives.
     */
    @Value
    public static class Registered implements ServerMessage {
        @JsonProperty("handle")
        String handle;

        @JsonCreator
        public Registered(@JsonProperty(value = "handle", required = true) String handle) {
            this.handle = handle;
        }
    }

    /**
     * Snapshot of registered handles, sorted.
     */
    @Value
    public static class UserList implements ServerMessage {
        @JsonProperty("users")
        List<String> users;

        @JsonCreator
        public UserList(@JsonProperty(value = "users", required = true) List<String> users) {
            this.users = List.copyOf(users);
        }
    }

    /**
     * Chat log shared with {@code partner}, oldest first. Empty if the pair never exchanged a message.
     */
    @Value
    public static class ChatMessages implements ServerMessage {
        @JsonProperty("partner")
        String partner;

        @JsonProperty("messages")
        List<Message> messages;

        @JsonCreator
        public ChatMessages(
            @JsonProperty(value = "partner", required = true) String partner,
            @JsonProperty(value = "messages", required = true) List<Message> messages
        ) {
            this.partner = partner;
            this.messages = List.copyOf(messages);
        }
    }

    /**
     * A message relayed live from {@code sender}.
     */
    @Value
    public static class ChatMessage implements ServerMessage {
        @JsonProperty("sender")
        String sender;

        @JsonProperty("content")
        String content;

        @JsonCreator
        public ChatMessage(
            @JsonProperty(value = "sender", required = true) String sender,
            @JsonProperty(value = "content", required = true) String content
        ) {
            this.sender = sender;
            this.content = content;
        }
    }

    /**
     * Domain or request error reported to the requesting client.
     */
    @Value
    public static class Error implements ServerMessage {
        @JsonProperty("message")
        String message;

        @JsonCreator
        public Error(@JsonProperty(value = "message", required = true) String message) {
            this.message = message;
        }
    }
}
