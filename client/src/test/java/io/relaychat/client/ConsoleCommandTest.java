package io.relaychat.client;

import io.relaychat.client.ConsoleCommand.Kind;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ConsoleCommandTest {

    @Test
    void plainTextIsAMessage() {
        assertEquals(new ConsoleCommand(Kind.TEXT, "hello /chat bob"), ConsoleCommand.parse("hello /chat bob"));
    }

    @Test
    void recognisesCommands() {
        assertEquals(Kind.USERS, ConsoleCommand.parse("/users").getKind());
        assertEquals(Kind.EXIT, ConsoleCommand.parse("/exit").getKind());
        assertEquals(Kind.HELP, ConsoleCommand.parse("/help").getKind());
        assertEquals(new ConsoleCommand(Kind.CHAT, "bob"), ConsoleCommand.parse("/chat   bob "));
    }

    @Test
    void chatWithoutTargetIsInvalid() {
        ConsoleCommand command = ConsoleCommand.parse("/chat");

        assertEquals(Kind.INVALID, command.getKind());
        assertEquals("Usage: /chat <user>", command.getArgument());
    }

    @Test
    void unknownCommandIsInvalid() {
        ConsoleCommand command = ConsoleCommand.parse("/shrug");

        assertEquals(Kind.INVALID, command.getKind());
        assertTrue(command.getArgument().contains("/shrug"));
    }
}
