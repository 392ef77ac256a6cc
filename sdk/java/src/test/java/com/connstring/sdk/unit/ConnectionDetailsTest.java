package com.connstring.sdk.unit;

import com.connstring.sdk.config.ConnectionDetails;
import com.google.gson.JsonParseException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for connection details and their JSON form
 */
class ConnectionDetailsTest {

    @Test
    void testBuilder() {
        ConnectionDetails details = ConnectionDetails.builder()
            .username("user")
            .password("pass")
            .host("localhost")
            .port(5432)
            .database("mydb")
            .connectTimeout(10)
            .parameter("sslmode", "require")
            .build();

        assertEquals("user", details.getUsername());
        assertEquals("pass", details.getPassword());
        assertEquals("localhost", details.getHost());
        assertEquals(5432, details.getPort());
        assertEquals("mydb", details.getDatabase());
        assertEquals(10, details.getConnectTimeout());
        assertEquals("require", details.getParameters().get("sslmode"));
    }

    @Test
    void testEmptyBuilder() {
        ConnectionDetails details = ConnectionDetails.builder().build();

        assertNull(details.getUsername());
        assertNull(details.getHost());
        assertNull(details.getPort());
        assertTrue(details.getParameters().isEmpty());
    }

    @Test
    void testPasswordRequiresUsername() {
        assertThrows(IllegalArgumentException.class,
            () -> ConnectionDetails.builder().password("pass").build());
    }

    @Test
    void testPortRequiresHost() {
        assertThrows(IllegalArgumentException.class,
            () -> ConnectionDetails.builder().port(5432).build());
    }

    @Test
    void testNegativeValuesRejected() {
        assertThrows(IllegalArgumentException.class,
            () -> ConnectionDetails.builder().host("h").port(-1).build());
        assertThrows(IllegalArgumentException.class,
            () -> ConnectionDetails.builder().connectTimeout(-1).build());
    }

    @Test
    void testInvalidParameter() {
        assertThrows(IllegalArgumentException.class,
            () -> ConnectionDetails.builder().parameter("", "value"));
        assertThrows(IllegalArgumentException.class,
            () -> ConnectionDetails.builder().parameter("key", null));
    }

    @Test
    void testParametersAreUnmodifiable() {
        ConnectionDetails details = ConnectionDetails.builder().parameter("a", "b").build();
        assertThrows(UnsupportedOperationException.class, () -> details.getParameters().put("c", "d"));
    }

    @Test
    void testToStringMasksPassword() {
        ConnectionDetails details = ConnectionDetails.builder()
            .username("user")
            .password("hunter2")
            .build();

        assertFalse(details.toString().contains("hunter2"));
        assertTrue(details.toString().contains("****"));
    }

    @Test
    void testFromJson() {
        String json = "{"
            + "\"username\": \"user\","
            + "\"password\": \"p@ss\","
            + "\"host\": \"db.example.com\","
            + "\"port\": 6543,"
            + "\"database\": \"orders\","
            + "\"connectTimeout\": 30,"
            + "\"parameters\": {\"sslmode\": \"verify-full\", \"application_name\": \"api\"}"
            + "}";

        ConnectionDetails details = ConnectionDetails.fromJson(json);

        assertEquals("user", details.getUsername());
        assertEquals("p@ss", details.getPassword());
        assertEquals("db.example.com", details.getHost());
        assertEquals(6543, details.getPort());
        assertEquals("orders", details.getDatabase());
        assertEquals(30, details.getConnectTimeout());
        assertEquals(2, details.getParameters().size());
        assertEquals("verify-full", details.getParameters().get("sslmode"));
    }

    @Test
    void testFromJsonWithMissingFields() {
        ConnectionDetails details = ConnectionDetails.fromJson("{\"host\": \"localhost\"}");

        assertEquals("localhost", details.getHost());
        assertNull(details.getUsername());
        assertNull(details.getPort());
        assertTrue(details.getParameters().isEmpty());
    }

    @Test
    void testFromMalformedJson() {
        IllegalArgumentException thrown = assertThrows(IllegalArgumentException.class,
            () -> ConnectionDetails.fromJson("{\"host\": "));
        assertTrue(thrown.getCause() instanceof JsonParseException);

        assertThrows(IllegalArgumentException.class, () -> ConnectionDetails.fromJson("{\"port\": \"abc\"}"));
    }

    @Test
    void testFromEmptyJson() {
        assertThrows(IllegalArgumentException.class, () -> ConnectionDetails.fromJson(""));
        assertThrows(IllegalArgumentException.class, () -> ConnectionDetails.fromJson(null));
    }

    @Test
    void testFromJsonValidates() {
        assertThrows(IllegalArgumentException.class,
            () -> ConnectionDetails.fromJson("{\"password\": \"secret\"}"));
    }
}
