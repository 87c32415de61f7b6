package xzy.webdav.auth;

import org.junit.jupiter.api.Test;
import xzy.webdav.config.ConfigLoader;

import java.util.List;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;

class CredentialStoreTest {

    @Test
    void basicCredentialIsBase64OfUsernameAndPassword() {
        assertThat(CredentialStore.basicCredential("alice", "secret")).isEqualTo("YWxpY2U6c2VjcmV0");
    }

    @Test
    void looksUpUsersByNameAndCredential() {
        User alice = new User("alice", "secret", List.of("+"), false);
        User bob = new User("bob", "hunter2", List.of(), true);
        CredentialStore store = CredentialStore.of(List.of(alice, bob));

        assertThat(store.size()).isEqualTo(2);
        assertThat(store.userByName("alice")).isEqualTo(alice);
        assertThat(store.userByName("carol")).isNull();
        assertThat(store.userByName(null)).isNull();
        assertThat(store.userByBasicCredential(CredentialStore.basicCredential("bob", "hunter2"))).isEqualTo(bob);
        assertThat(store.userByBasicCredential(CredentialStore.basicCredential("bob", "secret"))).isNull();
    }

    @Test
    void buildsUsersFromConfiguredAccounts() {
        Properties props = new Properties();
        props.setProperty("account.alice.password", "secret");
        props.setProperty("account.alice.permissions", "+^/docs, -^/docs/private");
        props.setProperty("account.root.password", "toor");
        props.setProperty("account.root.admin", "true");

        CredentialStore store = CredentialStore.fromConfig(ConfigLoader.fromProperties(props));

        assertThat(store.size()).isEqualTo(2);
        assertThat(store.userByName("alice").permissions()).containsExactly("+^/docs", "-^/docs/private");
        assertThat(store.userByName("root").admin()).isTrue();
    }

    @Test
    void userToStringHidesPassword() {
        assertThat(new User("alice", "secret", List.of(), false).toString())
                .contains("alice")
                .doesNotContain("secret");
    }
}
