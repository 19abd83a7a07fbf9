package io.relaychat.server.chat;

import io.relaychat.core.protocol.Message;

import java.util.List;

/**
 * Pairwise chat history shared by all connections.
 */
public interface IChatStore {

    /**
     * Canonical key for the chat between {@code a} and {@code b}.
     *
     * @throws InvalidPairException if {@code a} equals {@code b}
     */
    default ChatKey normalizeKey(String a, String b) {
        return ChatKey.of(a, b);
    }

    /**
     * Appends a message, creating the log for {@code key} on first use.
     *
     * @return the log length after the append
     */
    int append(ChatKey key, Message message);

    /**
     * Point-in-time copy of the log for {@code key}; empty, and nothing created, if there is none.
     */
    List<Message> getLog(ChatKey key);

    boolean hasLog(ChatKey key);

    /**
     * Number of logs held.
     */
    int size();
}
