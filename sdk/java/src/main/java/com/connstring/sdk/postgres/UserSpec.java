package com.connstring.sdk.postgres;

import com.connstring.sdk.types.UsernamePassword;

/**
 * The {@code userspec} part of a PostgreSQL connection URI.
 * Either a username on its own or a username with a password.
 */
abstract class UserSpec {

    private UserSpec() {
    }

    static UserSpec username(String username) {
        return new Username(username);
    }

    static UserSpec usernameAndPassword(UsernamePassword credentials) {
        return new UsernameAndPassword(credentials);
    }

    abstract String render();

    static final class Username extends UserSpec {
        private final String username;

        private Username(String username) {
            this.username = username;
        }

        @Override
        String render() {
            return username + "@";
        }
    }

    static final class UsernameAndPassword extends UserSpec {
        private final UsernamePassword credentials;

        private UsernameAndPassword(UsernamePassword credentials) {
            this.credentials = credentials;
        }

        @Override
        String render() {
            return credentials.getUsername() + ":" + credentials.getPassword() + "@";
        }
    }
}
