package io.relaychat.client;

import lombok.Value;

/**
 * One line typed into the console client.
 */
@Value
public class ConsoleCommand {

    public enum Kind {
        /**
         * Not a command: text for the current chat partner.
         */
        TEXT,
        USERS,
        CHAT,
        EXIT,
        HELP,
        INVALID
    }

    Kind kind;
    /**
     * Text for {@link Kind#TEXT}, target handle for {@link Kind#CHAT}, reason for {@link Kind#INVALID}.
     */
    String argument;

    public static ConsoleCommand parse(String line) {
        if (!line.startsWith("/")) {
            return new ConsoleCommand(Kind.TEXT, line);
        }

        String[] parts = line.trim().split("\\s+");
        return switch (parts[0]) {
            case "/users" -> new ConsoleCommand(Kind.USERS, null);
            case "/chat" -> parts.length < 2
                ? new ConsoleCommand(Kind.INVALID, "Usage: /chat <user>")
                : new ConsoleCommand(Kind.CHAT, parts[1]);
            case "/exit" -> new ConsoleCommand(Kind.EXIT, null);
            case "/help" -> new ConsoleCommand(Kind.HELP, null);
            default -> new ConsoleCommand(Kind.INVALID, "Unknown command " + parts[0] + ", try /help");
        };
    }
}
