package com.connstring.sdk.config;

import com.connstring.sdk.postgres.PostgresConnectionString;
import com.connstring.sdk.sqlserver.SqlServerConnectionString;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Supported connection string dialects
 */
public enum Dialect {
    POSTGRES("postgres", "postgresql") {
        @Override
        String render(ConnectionDetails details) {
            return PostgresConnectionString.from(details).toString();
        }
    },
    SQLSERVER("sqlserver", "mssql") {
        @Override
        String render(ConnectionDetails details) {
            return SqlServerConnectionString.from(details).toString();
        }
    };

    private static final Logger logger = LoggerFactory.getLogger(Dialect.class);

    private final List<String> names;

    Dialect(String... names) {
        this.names = Arrays.asList(names);
    }

    /**
     * Names accepted by {@link #fromString(String)} for this dialect
     */
    public List<String> getNames() {
        return names;
    }

    abstract String render(ConnectionDetails details);

    /**
     * Render connection details in this dialect
     */
    public String generate(ConnectionDetails details) {
        if (details == null) {
            throw new IllegalArgumentException("connection details are required");
        }
        logger.debug("Generating {} connection string for host {}", name(), details.getHost());
        return render(details);
    }

    /**
     * Parse a dialect name (case-insensitive)
     */
    public static Dialect fromString(String name) {
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalArgumentException("Dialect name cannot be null or empty");
        }

        String normalized = name.trim();
        for (Dialect dialect : values()) {
            for (String candidate : dialect.getNames()) {
                if (candidate.equalsIgnoreCase(normalized)) {
                    return dialect;
                }
            }
        }

        List<String> supported = new ArrayList<>();
        for (Dialect dialect : values()) {
            supported.addAll(dialect.getNames());
        }
        throw new IllegalArgumentException("Unsupported dialect: " + name + ". Expected one of " + supported);
    }
}
