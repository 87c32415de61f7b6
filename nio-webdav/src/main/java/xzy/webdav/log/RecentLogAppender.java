package xzy.webdav.log;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.PatternLayout;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.AppenderBase;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * A Logback appender keeping the last few formatted log messages in memory, for status
 * pages and diagnostics. Owned by whoever creates it; nothing global.
 */
public class RecentLogAppender extends AppenderBase<ILoggingEvent> {
    public static final String PATTERN = "%d{yyyy-MM-dd HH:mm:ss} %-5level: [%logger] %msg";

    private final int capacity;
    private final Deque<String> messages = new ArrayDeque<>();
    private PatternLayout layout;

    public RecentLogAppender(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        setName("recent");
    }

    /**
     * Creates an appender and attaches it to the logger with the given name.
     */
    public static RecentLogAppender attach(String loggerName, int capacity) {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        RecentLogAppender appender = new RecentLogAppender(capacity);
        appender.setContext(context);
        appender.start();
        Logger logger = context.getLogger(loggerName);
        logger.addAppender(appender);
        return appender;
    }

    @Override
    public void start() {
        layout = new PatternLayout();
        layout.setContext(getContext());
        layout.setPattern(PATTERN);
        layout.start();
        super.start();
    }

    @Override
    protected void append(ILoggingEvent event) {
        String line = layout.doLayout(event);
        synchronized (messages) {
            if (messages.size() == capacity) {
                messages.removeFirst();
            }
            messages.addLast(line);
        }
    }

    /**
     * @return a snapshot, oldest first
     */
    public List<String> messages() {
        synchronized (messages) {
            return List.copyOf(messages);
        }
    }

    /**
     * Detaches this appender from the logger and stops it.
     */
    public void detach(String loggerName) {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        context.getLogger(loggerName).detachAppender(this);
        stop();
    }
}
