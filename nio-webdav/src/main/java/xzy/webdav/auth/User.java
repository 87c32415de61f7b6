package xzy.webdav.auth;

import java.util.List;

/**
 * An account loaded from configuration. Immutable once created.
 */
public record User(String username, String password, List<String> permissions, boolean admin) {

    public User {
        permissions = List.copyOf(permissions);
    }

    @Override
    public String toString() {
        return "User[username=" + username + ", permissions=" + permissions + ", admin=" + admin + "]";
    }
}
