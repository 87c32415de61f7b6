package xzy.webdav.auth;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xzy.webdav.config.DavConfig;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Users known to the server, indexed by username and by their precomputed Basic credential.
 * <p>
 * Built once at startup and shared read-only by every request, so plain maps wrapped as
 * unmodifiable views are enough.
 */
public final class CredentialStore {
    private static final Logger log = LoggerFactory.getLogger(CredentialStore.class);

    private final Map<String, User> usersByName;
    private final Map<String, User> usersByBasicCredential;

    private CredentialStore(Map<String, User> usersByName, Map<String, User> usersByBasicCredential) {
        this.usersByName = Collections.unmodifiableMap(usersByName);
        this.usersByBasicCredential = Collections.unmodifiableMap(usersByBasicCredential);
    }

    public static CredentialStore of(Collection<User> users) {
        Map<String, User> byName = new LinkedHashMap<>();
        Map<String, User> byCredential = new HashMap<>();
        for (User user : users) {
            byName.put(user.username(), user);
            // two users with the same credential string: last one wins
            byCredential.put(basicCredential(user.username(), user.password()), user);
            log.info("Register user: {}", user);
        }
        return new CredentialStore(byName, byCredential);
    }

    public static CredentialStore fromConfig(DavConfig config) {
        List<User> users = config.accounts().stream()
                .map(account -> new User(account.username(), account.password(),
                        account.permissions(), account.admin()))
                .toList();
        return of(users);
    }

    /**
     * The token part of a Basic authorization header: {@code base64(username:password)}.
     */
    public static String basicCredential(String username, String password) {
        String raw = username + ":" + password;
        return Base64.getEncoder().encodeToString(raw.getBytes(StandardCharsets.UTF_8));
    }

    public User userByName(String username) {
        return username == null ? null : usersByName.get(username);
    }

    public User userByBasicCredential(String credential) {
        return credential == null ? null : usersByBasicCredential.get(credential);
    }

    public int size() {
        return usersByName.size();
    }
}
