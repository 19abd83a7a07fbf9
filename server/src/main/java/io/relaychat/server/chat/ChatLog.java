package io.relaychat.server.chat;

import io.relaychat.core.protocol.Message;

import java.util.ArrayList;
import java.util.List;

/**
 * Append-only message history of one {@link ChatKey}.
 * <p>
 * Appends and snapshots share one monitor, so a snapshot is always a prefix of the final log.
 * </p>
 */
class ChatLog {
    private final List<Message> messages = new ArrayList<>();

    synchronized int append(Message message) {
        messages.add(message);
        return messages.size();
    }

    synchronized List<Message> snapshot() {
        return List.copyOf(messages);
    }
}
