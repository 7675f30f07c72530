package io.github.respkv;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ApplicationTest {

    @Test
    void defaultPort() {
        assertEquals(Application.DEFAULT_PORT, Application.getPort(new String[0]));
    }

    @Test
    void port() {
        assertEquals(6380, Application.getPort(new String[]{"--port", "6380"}));
        assertEquals(6381, Application.getPort(new String[]{"--port=6381"}));
        assertEquals(1, Application.getPort(new String[]{"--port", "1"}));
        assertEquals(65535, Application.getPort(new String[]{"--port=65535"}));
    }

    @Test
    void lastPortWins() {
        assertEquals(7000, Application.getPort(new String[]{"--port", "6380", "--port=7000"}));
    }

    @Test
    void invalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> Application.getPort(new String[]{"--port"}));
        assertThrows(IllegalArgumentException.class, () -> Application.getPort(new String[]{"--port", "0"}));
        assertThrows(IllegalArgumentException.class, () -> Application.getPort(new String[]{"--port=65536"}));
        assertThrows(IllegalArgumentException.class, () -> Application.getPort(new String[]{"--port", "abc"}));
        assertThrows(IllegalArgumentException.class, () -> Application.getPort(new String[]{"--verbose"}));
    }
}
