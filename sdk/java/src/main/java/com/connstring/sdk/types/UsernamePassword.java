package com.connstring.sdk.types;

import java.util.Objects;

/**
 * Username and password bundled as one immutable value
 */
public final class UsernamePassword {
    private final String username;
    private final String password;

    public UsernamePassword(String username, String password) {
        if (username == null) {
            throw new IllegalArgumentException("username is required");
        }
        if (password == null) {
            throw new IllegalArgumentException("password is required");
        }
        this.username = username;
        this.password = password;
    }

    public String getUsername() { return username; }
    public String getPassword() { return password; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof UsernamePassword)) return false;
        UsernamePassword that = (UsernamePassword) o;
        return username.equals(that.username) && password.equals(that.password);
    }

    @Override
    public int hashCode() {
        return Objects.hash(username, password);
    }

    @Override
    public String toString() {
        return "UsernamePassword{" +
                "username='" + username + '\'' +
                ", password='****'" +
                '}';
    }
}
