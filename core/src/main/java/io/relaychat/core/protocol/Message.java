package io.relaychat.core.protocol;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

/**
 * One entry of a chat log.
 * <p>
 * Immutable once appended; carried inside {@link ServerMessages.ChatMessages}.
 * </p>
 */
@Value
public class Message {
    /**
     * Handle of the participant who sent the message.
     */
    @JsonProperty("sender")
    String sender;

    @JsonProperty("content")
    String content;

    @JsonCreator
    public Message(
        @JsonProperty(value = "sender", required = true) String sender,
        @JsonProperty(value = "content", required = true) String content
    ) {
        this.sender = sender;
        this.content = content;
    }
}
