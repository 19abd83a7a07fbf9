package io.relaychat.core.protocol;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * A reply or relayed message sent from the server to a client.
 * <p>
 * Same externally tagged encoding as {@link ClientMessage}; variants live in {@link ServerMessages}.
 * </p>
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.WRAPPER_OBJECT)
@JsonSubTypes({
    @JsonSubTypes.Type(value = ServerMessages.Registered.class, name = "Registered"),
    @JsonSubTypes.Type(value = ServerMessages.UserList.class, name = "UserList"),
    @JsonSubTypes.Type(value = ServerMessages.ChatMessages.class, name = "ChatMessages"),
    @JsonSubTypes.Type(value = ServerMessages.ChatMessage.class, name = "ChatMessage"),
    @JsonSubTypes.Type(value = ServerMessages.Error.class, name = "Error")
})
public interface ServerMessage {
}
