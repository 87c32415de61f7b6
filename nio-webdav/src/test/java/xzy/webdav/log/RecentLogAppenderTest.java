package xzy.webdav.log;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RecentLogAppenderTest {
    private static final String LOGGER = "xzy.webdav.log.recent-test";

    private RecentLogAppender appender;

    @BeforeEach
    void setUp() {
        appender = RecentLogAppender.attach(LOGGER, 3);
    }

    @AfterEach
    void tearDown() {
        appender.detach(LOGGER);
    }

    @Test
    void keepsOnlyTheLatestMessages() {
        Logger log = LoggerFactory.getLogger(LOGGER);
        for (int i = 1; i <= 5; i++) {
            log.info("message {}", i);
        }

        assertThat(appender.messages()).hasSize(3);
        assertThat(appender.messages().get(0)).endsWith("INFO : [" + LOGGER + "] message 3");
        assertThat(appender.messages().get(2)).endsWith("message 5");
    }

    @Test
    void stopsCollectingAfterDetach() {
        Logger log = LoggerFactory.getLogger(LOGGER);
        log.info("before");
        appender.detach(LOGGER);
        log.info("after");

        assertThat(appender.messages()).hasSize(1);
        assertThat(appender.messages().get(0)).endsWith("before");
    }

    @Test
    void capacityMustBePositive() {
        assertThatThrownBy(() -> new RecentLogAppender(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
