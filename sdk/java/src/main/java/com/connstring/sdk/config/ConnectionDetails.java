package com.connstring.sdk.config;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Dialect-neutral description of a database connection.
 * Every field is optional; a dialect only renders what has been set.
 */
public class ConnectionDetails {
    private static final Gson gson = new GsonBuilder().create();

    private final String username;
    private final String password;
    private final String host;
    private final Integer port;
    private final String database;
    private final Integer connectTimeout;
    private final Map<String, String> parameters;

    private ConnectionDetails(Builder builder) {
        this.username = builder.username;
        this.password = builder.password;
        this.host = builder.host;
        this.port = builder.port;
        this.database = builder.database;
        this.connectTimeout = builder.connectTimeout;
        this.parameters = Collections.unmodifiableMap(new HashMap<>(builder.parameters));
    }

    public String getUsername() { return username; }
    public String getPassword() { return password; }
    public String getHost() { return host; }
    public Integer getPort() { return port; }
    public String getDatabase() { return database; }
    public Integer getConnectTimeout() { return connectTimeout; }
    public Map<String, String> getParameters() { return parameters; }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Read connection details from a JSON object such as
     * {@code {"username": "app", "host": "db", "port": 5432, "parameters": {"sslmode": "require"}}}
     *
     * @param json JSON text
     * @return Validated connection details
     * @throws IllegalArgumentException if the JSON is malformed or describes invalid details
     */
    public static ConnectionDetails fromJson(String json) {
        if (json == null || json.trim().isEmpty()) {
            throw new IllegalArgumentException("JSON must be a non-empty string");
        }

        JsonDetails parsed;
        try {
            parsed = gson.fromJson(json, JsonDetails.class);
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("Invalid connection details JSON: " + e.getMessage(), e);
        }
        if (parsed == null) {
            throw new IllegalArgumentException("Invalid connection details JSON: " + json);
        }

        Builder builder = builder()
            .username(parsed.username)
            .password(parsed.password)
            .host(parsed.host)
            .port(parsed.port)
            .database(parsed.database)
            .connectTimeout(parsed.connectTimeout);
        if (parsed.parameters != null) {
            parsed.parameters.forEach(builder::parameter);
        }
        return builder.build();
    }

    @Override
    public String toString() {
        return "ConnectionDetails{" +
                "username='" + username + '\'' +
                ", password=" + (password != null ? "'****'" : "null") +
                ", host='" + host + '\'' +
                ", port=" + port +
                ", database='" + database + '\'' +
                ", connectTimeout=" + connectTimeout +
                ", parameters=" + parameters.keySet() +
                '}';
    }

    // Shape of the JSON document, filled in by Gson
    private static class JsonDetails {
        String username;
        String password;
        String host;
        Integer port;
        String database;
        Integer connectTimeout;
        Map<String, String> parameters;
    }

    public static class Builder {
        private String username;
        private String password;
        private String host;
        private Integer port;
        private String database;
        private Integer connectTimeout;
        private final Map<String, String> parameters = new HashMap<>();

        public Builder username(String username) {
            this.username = username;
            return this;
        }

        public Builder password(String password) {
            this.password = password;
            return this;
        }

        public Builder host(String host) {
            this.host = host;
            return this;
        }

        public Builder port(Integer port) {
            this.port = port;
            return this;
        }

        public Builder database(String database) {
            this.database = database;
            return this;
        }

        public Builder connectTimeout(Integer connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        public Builder parameter(String key, String value) {
            if (key == null || key.isEmpty()) {
                throw new IllegalArgumentException("parameter key must be a non-empty string");
            }
            if (value == null) {
                throw new IllegalArgumentException("parameter '" + key + "' has no value");
            }
            this.parameters.put(key, value);
            return this;
        }

        public ConnectionDetails build() {
            if (password != null && username == null) {
                throw new IllegalArgumentException("password requires a username");
            }
            if (port != null && host == null) {
                throw new IllegalArgumentException("port requires a host");
            }
            if (port != null && port < 0) {
                throw new IllegalArgumentException("port must not be negative");
            }
            if (connectTimeout != null && connectTimeout < 0) {
                throw new IllegalArgumentException("connectTimeout must not be negative");
            }
            return new ConnectionDetails(this);
        }
    }
}
