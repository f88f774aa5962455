package com.apiserver.config;

import com.apiserver.hal.CollectionMetadata;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ServerConfigTest {

    @Test
    void testFromVariables_Defaults() {
        ServerConfig config = ServerConfig.fromVariables(Map.of());
        assertEquals(ServerConfig.DEFAULT_PORT, config.port());
        assertEquals(CollectionMetadata.DEFAULT_PAGE_SIZE, config.pageSize());
    }

    @Test
    void testFromVariables_Overrides() {
        ServerConfig config = ServerConfig.fromVariables(Map.of(
            ServerConfig.PORT_VARIABLE, "9000",
            ServerConfig.PAGE_SIZE_VARIABLE, " 10 "));
        assertEquals(9000, config.port());
        assertEquals(10, config.pageSize());
    }

    @Test
    void testFromVariables_InvalidValuesFallBack() {
        ServerConfig config = ServerConfig.fromVariables(Map.of(
            ServerConfig.PORT_VARIABLE, "not-a-port",
            ServerConfig.PAGE_SIZE_VARIABLE, "0"));
        assertEquals(ServerConfig.DEFAULT_PORT, config.port());
        assertEquals(CollectionMetadata.DEFAULT_PAGE_SIZE, config.pageSize());
    }

    @Test
    void testConstructor_RejectsInvalidPageSize() {
        assertThrows(IllegalArgumentException.class, () -> new ServerConfig(8080, 0));
        assertThrows(IllegalArgumentException.class, () -> new ServerConfig(70000, 5));
    }
}
