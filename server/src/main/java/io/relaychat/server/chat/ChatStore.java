package io.relaychat.server.chat;

import io.relaychat.core.protocol.Message;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory {@link IChatStore}.
 * <p>
 * Log creation goes through {@link ConcurrentHashMap#computeIfAbsent}, so exactly one log
 * exists per pair; each log serializes its own appends and snapshots. Nothing survives a restart.
 * </p>
 */
public class ChatStore implements IChatStore {
    private static final Logger log = LoggerFactory.getLogger(ChatStore.class);

    private final Map<ChatKey, ChatLog> logs = new ConcurrentHashMap<>();

    @Override
    public int append(ChatKey key, Message message) {
        ChatLog chatLog = logs.computeIfAbsent(key, k -> {
            log.debug("Opening chat log for {} <-> {}", k.getFirst(), k.getSecond());
            return new ChatLog();
        });
        return chatLog.append(message);
    }

    @Override
    public List<Message> getLog(ChatKey key) {
        ChatLog chatLog = logs.get(key);
        return chatLog == null ? List.of() : chatLog.snapshot();
    }

    @Override
    public boolean hasLog(ChatKey key) {
        return logs.containsKey(key);
    }

    @Override
    public int size() {
        return logs.size();
    }
}
