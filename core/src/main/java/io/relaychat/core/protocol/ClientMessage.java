package io.relaychat.core.protocol;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * A request sent from a client to the server.
 * <p>
 * Encoded as an externally tagged JSON object, e.g.
 * {@code {"SendMessage":{"content":"hi","target":"bob"}}}. The set of variants is closed:
 * see {@link ClientMessages}.
 * </p>
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.WRAPPER_OBJECT)
@JsonSubTypes({
    @JsonSubTypes.Type(value = ClientMessages.Register.class, name = "Register"),
    @JsonSubTypes.Type(value = ClientMessages.ListUsers.class, name = "ListUsers"),
    @JsonSubTypes.Type(value = ClientMessages.SendMessage.class, name = "SendMessage"),
    @JsonSubTypes.Type(value = ClientMessages.GetMessages.class, name = "GetMessages")
})
public interface ClientMessage {
}
