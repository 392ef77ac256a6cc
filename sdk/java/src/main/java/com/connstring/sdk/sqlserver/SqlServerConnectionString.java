package com.connstring.sdk.sqlserver;

import com.connstring.sdk.config.ConnectionDetails;
import com.connstring.sdk.encoding.QuotingEncoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Immutable Microsoft SQL Server connection string of the form
 * {@code key1=value1;key2=value2;...}
 *
 * <p>Every setter returns a new instance and leaves the receiver untouched.
 * All values are quoted where SQL Server requires it; keys are stored verbatim.
 *
 * <pre>{@code
 * String connectionString = new SqlServerConnectionString()
 *     .setUsernameAndPassword("user", "password")
 *     .setHostWithPort("localhost", 1433)
 *     .setDatabaseName("db_name")
 *     .setConnectTimeout(30)
 *     .enableEncryptionAndTrustServerCertificate()
 *     .toString();
 * }</pre>
 *
 * <p>Parameters are kept in a hash map, so their order in the rendered
 * string is unspecified.
 */
public final class SqlServerConnectionString {
    private static final Logger logger = LoggerFactory.getLogger(SqlServerConnectionString.class);

    static final String USER = "user";
    static final String PASSWORD = "password";
    static final String SERVER = "server";
    static final String DATABASE = "database";
    static final String ENCRYPT = "encrypt";
    static final String TRUST_SERVER_CERTIFICATE = "trustServerCertificate";
    static final String TIMEOUT = "timeout";
    static final String COMMAND_TIMEOUT = "command timeout";
    static final String CONNECT_RETRY_COUNT = "connectRetryCount";
    static final String CONNECT_RETRY_INTERVAL = "connectRetryInterval";

    static final int MIN_CONNECT_RETRY_INTERVAL = 1;
    static final int MAX_CONNECT_RETRY_INTERVAL = 60;
    static final int MAX_CONNECT_RETRY_COUNT = 255;

    private final Map<String, String> parameters;

    /**
     * Creates an empty connection string, rendered as the empty string
     */
    public SqlServerConnectionString() {
        this(Collections.emptyMap());
    }

    private SqlServerConnectionString(Map<String, String> parameters) {
        this.parameters = parameters;
    }

    /**
     * Build a connection string from dialect-neutral connection details
     */
    public static SqlServerConnectionString from(ConnectionDetails details) {
        SqlServerConnectionString connectionString = new SqlServerConnectionString();

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
     * Sets/replaces any parameter, including ones this class has no dedicated setter for.
     * The value is quoted if SQL Server requires it, the key is used as given.
     */
    public SqlServerConnectionString dangerouslySetParameter(String key, String value) {
        if (key == null) {
            throw new IllegalArgumentException("parameter key must not be null");
        }
        if (value == null) {
            throw new IllegalArgumentException("value of parameter '" + key + "' must not be null");
        }

        Map<String, String> updated = new HashMap<>(parameters);
        updated.put(key, QuotingEncoder.encode(value));
        return new SqlServerConnectionString(updated);
    }

    /**
     * Sets/replaces the username and removes a previously set password.
     *
     * <p>Parameters: {@code user=<username>}
     */
    public SqlServerConnectionString setUsernameWithoutPassword(String username) {
        return dangerouslySetParameter(USER, requireValue(username, "username")).withoutParameter(PASSWORD);
    }

    /**
     * Sets/replaces the username and the password.
     *
     * <p>Parameters: {@code user=<username>;password=<password>}
     */
    public SqlServerConnectionString setUsernameAndPassword(String username, String password) {
        return dangerouslySetParameter(USER, requireValue(username, "username"))
            .dangerouslySetParameter(PASSWORD, requireValue(password, "password"));
    }

    /**
     * Sets/replaces the host without a port, so the driver uses its default port.
     *
     * <p>Parameters: {@code server=<host>}
     */
    public SqlServerConnectionString setHostWithDefaultPort(String host) {
        return dangerouslySetParameter(SERVER, requireValue(host, "host"));
    }

    /**
     * Sets/replaces the host and the port.
     *
     * <p>Parameters: {@code server=<host>,<port>}
     *
     * @throws IllegalArgumentException if the port is negative
     */
    public SqlServerConnectionString setHostWithPort(String host, int port) {
        if (port < 0) {
            throw new IllegalArgumentException("port must not be negative: " + port);
        }
        return dangerouslySetParameter(SERVER, requireValue(host, "host") + "," + port);
    }

    /**
     * Enables encryption.
     *
     * <p>Parameters: {@code encrypt=true}
     */
    public SqlServerConnectionString enableEncryption() {
        return dangerouslySetParameter(ENCRYPT, "true");
    }

    /**
     * Enables encryption and trusts the server certificate, <b>even if it would not
     * normally be trusted</b> (self-signed, unknown root CA, ...).
     *
     * <p>Parameters: {@code encrypt=true;trustServerCertificate=true}
     */
    public SqlServerConnectionString enableEncryptionAndTrustServerCertificate() {
        return enableEncryption().dangerouslySetParameter(TRUST_SERVER_CERTIFICATE, "true");
    }

    /**
     * Sets/replaces the database name.
     *
     * <p>Parameters: {@code database=<database>}
     */
    public SqlServerConnectionString setDatabaseName(String database) {
        return dangerouslySetParameter(DATABASE, requireValue(database, "database"));
    }

    /**
     * Sets/replaces the connect timeout in seconds. Negative values are ignored.
     *
     * <p>Parameters: {@code timeout=<seconds>}
     */
    public SqlServerConnectionString setConnectTimeout(int seconds) {
        if (seconds < 0) {
            logger.debug("Ignoring negative connect timeout: {}", seconds);
            return this;
        }
        return dangerouslySetParameter(TIMEOUT, Integer.toString(seconds));
    }

    /**
     * Sets/replaces the command timeout in seconds. Negative values are ignored.
     *
     * <p>Parameters: {@code command timeout=<seconds>}
     */
    public SqlServerConnectionString setCommandTimeout(int seconds) {
        if (seconds < 0) {
            logger.debug("Ignoring negative command timeout: {}", seconds);
            return this;
        }
        return dangerouslySetParameter(COMMAND_TIMEOUT, Integer.toString(seconds));
    }

    /**
     * Sets/replaces the number of reconnect attempts after an idle connection failure.
     *
     * <p>Parameters: {@code connectRetryCount=<count>}
     *
     * @param count Unsigned byte, 0 to 255
     * @throws IllegalArgumentException if the count is not an unsigned byte
     */
    public SqlServerConnectionString setConnectRetryCount(int count) {
        if (count < 0 || count > MAX_CONNECT_RETRY_COUNT) {
            throw new IllegalArgumentException(
                "connect retry count must be between 0 and " + MAX_CONNECT_RETRY_COUNT + ": " + count);
        }
        return dangerouslySetParameter(CONNECT_RETRY_COUNT, Integer.toString(count));
    }

    /**
     * Sets/replaces the time between reconnect attempts in seconds.
     * SQL Server accepts 1 to 60; values outside that range are clamped into it.
     *
     * <p>Parameters: {@code connectRetryInterval=<seconds>}
     */
    public SqlServerConnectionString setConnectRetryInterval(int seconds) {
        int clamped = Math.min(Math.max(MIN_CONNECT_RETRY_INTERVAL, seconds), MAX_CONNECT_RETRY_INTERVAL);
        if (clamped != seconds) {
            logger.debug("Clamped connect retry interval from {} to {}", seconds, clamped);
        }
        return dangerouslySetParameter(CONNECT_RETRY_INTERVAL, Integer.toString(clamped));
    }

    /**
     * Stored parameters, values already quoted
     */
    public Map<String, String> getParameters() {
        return Collections.unmodifiableMap(parameters);
    }

    private SqlServerConnectionString withoutParameter(String key) {
        if (!parameters.containsKey(key)) {
            return this;
        }
        Map<String, String> updated = new HashMap<>(parameters);
        updated.remove(key);
        return new SqlServerConnectionString(updated);
    }

    private static String requireValue(String value, String name) {
        if (value == null) {
            throw new IllegalArgumentException(name + " must not be null");
        }
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SqlServerConnectionString)) return false;
        return parameters.equals(((SqlServerConnectionString) o).parameters);
    }

    @Override
    public int hashCode() {
        return parameters.hashCode();
    }

    /**
     * Renders the connection string
     */
    @Override
    public String toString() {
        StringJoiner joiner = new StringJoiner(";");
        parameters.forEach((key, value) -> joiner.add(key + "=" + value));
        return joiner.toString();
    }
}
