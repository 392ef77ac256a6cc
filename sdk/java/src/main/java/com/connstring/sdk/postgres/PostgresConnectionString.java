package com.connstring.sdk.postgres;

import com.connstring.sdk.config.ConnectionDetails;
import com.connstring.sdk.encoding.PercentEncoder;
import com.connstring.sdk.types.HostPort;
import com.connstring.sdk.types.UsernamePassword;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * Immutable PostgreSQL connection URI of the form
 * {@code postgres://[user[:password]@][host[:port]][/database][?key=value&...]}
 *
 * <p>Every setter returns a new instance and leaves the receiver untouched.
 * All string values are percent encoded before they are stored.
 *
 * <pre>{@code
 * String url = new PostgresConnectionString()
 *     .setUsernameAndPassword("user", "password")
 *     .setHostWithPort("localhost", 5432)
 *     .setDatabaseName("db_name")
 *     .setConnectTimeout(30)
 *     .toString();
 * }</pre>
 *
 * <p>Parameters are kept in a hash map, so their order in the rendered
 * string is unspecified.
 */
public final class PostgresConnectionString {
    static final String SCHEME = "postgres://";
    static final String CONNECT_TIMEOUT = "connect_timeout";

    private final UserSpec userSpec;
    private final HostSpec hostSpec;
    private final String database;
    private final Map<String, String> parameters;

    /**
     * Creates an empty connection string, rendered as {@code postgres://}
     */
    public PostgresConnectionString() {
        this(null, null, null, Collections.emptyMap());
    }

    private PostgresConnectionString(UserSpec userSpec, HostSpec hostSpec, String database,
                                     Map<String, String> parameters) {
        this.userSpec = userSpec;
        this.hostSpec = hostSpec;
        this.database = database;
        this.parameters = parameters;
    }

    /**
     * Build a connection string from dialect-neutral connection details
     */
    public static PostgresConnectionString from(ConnectionDetails details) {
        PostgresConnectionString connectionString = new PostgresConnectionString();

        if (details.getUsername() != null) {
            connectionString = details.getPassword() != null
                ? connectionString.setUsernameAndPassword(details.getUsername(), details.getPassword())
                : connectionString.setUsernameWithoutPassword(details.getUsername());
        }
        if (details.getHost() != null) {
            connectionString = details.getPort() != null
                ? connectionString.setHostWithPort(details.getHost(), details.getPort())
                : connectionString.setHostWithDefaultPort(details.getHost());
        }
        if (details.getDatabase() != null) {
            connectionString = connectionString.setDatabaseName(details.getDatabase());
        }
        if (details.getConnectTimeout() != null) {
            connectionString = connectionString.setConnectTimeout(details.getConnectTimeout());
        }
        for (Map.Entry<String, String> parameter : details.getParameters().entrySet()) {
            connectionString = connectionString.dangerouslySetParameter(parameter.getKey(), parameter.getValue());
        }

        return connectionString;
    }

    /**
     * Sets/replaces the username and omits the password
     */
    public PostgresConnectionString setUsernameWithoutPassword(String username) {
        return withUserSpec(UserSpec.username(encode(username, "username")));
    }

    /**
     * Sets/replaces the username and the password
     */
    public PostgresConnectionString setUsernameAndPassword(String username, String password) {
        return withUserSpec(UserSpec.usernameAndPassword(
            new UsernamePassword(encode(username, "username"), encode(password, "password"))));
    }

    /**
     * Sets/replaces the host and omits the port, so the driver falls back to its default port
     */
    public PostgresConnectionString setHostWithDefaultPort(String host) {
        return withHostSpec(HostSpec.host(encode(host, "host")));
    }

    /**
     * Sets/replaces the host and the port
     *
     * @throws IllegalArgumentException if the port is negative
     */
    public PostgresConnectionString setHostWithPort(String host, int port) {
        return withHostSpec(HostSpec.hostAndPort(new HostPort(encode(host, "host"), port)));
    }

    /**
     * Sets/replaces the database name
     */
    public PostgresConnectionString setDatabaseName(String database) {
        return new PostgresConnectionString(userSpec, hostSpec, encode(database, "database"), parameters);
    }

    /**
     * Sets/replaces the {@code connect_timeout} parameter (in seconds)
     *
     * @throws IllegalArgumentException if the timeout is negative
     */
    public PostgresConnectionString setConnectTimeout(int seconds) {
        if (seconds < 0) {
            throw new IllegalArgumentException("connect timeout must not be negative: " + seconds);
        }
        return withParameter(CONNECT_TIMEOUT, PercentEncoder.encode(Integer.toString(seconds)));
    }

    /**
     * Sets/replaces any parameter, including ones this class has no dedicated setter for.
     * Both key and value are percent encoded.
     */
    public PostgresConnectionString dangerouslySetParameter(String key, String value) {
        return withParameter(encode(key, "parameter key"), encode(value, "parameter value"));
    }

    /**
     * Stored parameters with their encoded keys and values
     */
    public Map<String, String> getParameters() {
        return Collections.unmodifiableMap(parameters);
    }

    private PostgresConnectionString withUserSpec(UserSpec userSpec) {
        return new PostgresConnectionString(userSpec, hostSpec, database, parameters);
    }

    private PostgresConnectionString withHostSpec(HostSpec hostSpec) {
        return new PostgresConnectionString(userSpec, hostSpec, database, parameters);
    }

    private PostgresConnectionString withParameter(String key, String value) {
        Map<String, String> updated = new HashMap<>(parameters);
        updated.put(key, value);
        return new PostgresConnectionString(userSpec, hostSpec, database, updated);
    }

    private static String encode(String value, String name) {
        if (value == null) {
            throw new IllegalArgumentException(name + " must not be null");
        }
        return PercentEncoder.encode(value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PostgresConnectionString)) return false;
        PostgresConnectionString that = (PostgresConnectionString) o;
        return renderWithoutParameters().equals(that.renderWithoutParameters()) && parameters.equals(that.parameters);
    }

    @Override
    public int hashCode() {
        return Objects.hash(renderWithoutParameters(), parameters);
    }

    // Separators inside values are percent encoded, so distinct slots never render alike
    private String renderWithoutParameters() {
        StringBuilder connectionString = new StringBuilder(SCHEME);

        if (userSpec != null) {
            connectionString.append(userSpec.render());
        }
        if (hostSpec != null) {
            connectionString.append(hostSpec.render());
        }
        if (database != null) {
            connectionString.append('/').append(database);
        }

        return connectionString.toString();
    }

    /**
     * Renders the connection URI
     */
    @Override
    public String toString() {
        StringBuilder connectionString = new StringBuilder(renderWithoutParameters());

        if (!parameters.isEmpty()) {
            StringJoiner joiner = new StringJoiner("&", "?", "");
            parameters.forEach((key, value) -> joiner.add(key + "=" + value));
            connectionString.append(joiner);
        }

        return connectionString.toString();
    }
}
