package io.relaychat.server.chat;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.Objects;

/**
 * Order-independent identifier of the chat shared by two handles.
 * <p>
 * The handles are stored in lexicographic order, so {@code of(a, b).equals(of(b, a))}.
 * </p>
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ChatKey {
    String first;
    String second;

    /**
     * @throws InvalidPairException if {@code a} and {@code b} are the same handle
     */
    public static ChatKey of(String a, String b) {
        Objects.requireNonNull(a, "a");
        Objects.requireNonNull(b, "b");
        int order = a.compareTo(b);
        if (order == 0) {
            throw new InvalidPairException(a);
        }
        return order < 0 ? new ChatKey(a, b) : new ChatKey(b, a);
    }
}
