package com.ciro.jcss.standalone;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ServerConfigTest {

    @Test
    void portFromFirstArgument() {
        assertEquals(9090, ServerConfig.fromArgs(new String[]{"9090"}).port());
        assertEquals(ServerConfig.DEFAULT_PORT, ServerConfig.fromArgs(new String[0]).port());
    }

    @Test
    void badPortIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> ServerConfig.fromArgs(new String[]{"abc"}));
    }
}
