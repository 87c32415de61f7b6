package xzy.webdav.log;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Access log writer.
 * <p>
 * Log format:
 * <pre>
 * timestamp duration client method path status size user scheme encoding content-type
 * </pre>
 * <p>
 * Example output:
 * <pre>
 * 2025-12-31 10:30:45 12 192.168.1.100 PROPFIND /docs/ 207 1234 alice Digest - application/xml
 * 2025-12-31 10:30:46 3 192.168.1.100 GET /docs/a.txt 401 178 - - - text/html
 * </pre>
 * <p>
 * The log writer uses an async queue to avoid blocking request handling.
 */
public final class AccessLog implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(AccessLog.class);

    /** Timestamp format: yyyy-MM-dd HH:mm:ss for high readability */
    private static final DateTimeFormatter TIMESTAMP_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final BlockingQueue<String> logQueue = new LinkedBlockingQueue<>(10000);

    private final AtomicBoolean running = new AtomicBoolean(true);

    /** Log file path (null for no file output) */
    private final Path logFilePath;

    private PrintWriter fileWriter;

    private final Thread writerThread;

    private final boolean consoleOutput;

    /**
     * Creates an access log instance.
     *
     * @param logFile       Path to log file (null or empty for no file)
     * @param consoleOutput Whether to also output to console
     */
    public AccessLog(String logFile, boolean consoleOutput) {
        this.consoleOutput = consoleOutput;

        if (logFile != null && !logFile.isBlank()) {
            this.logFilePath = Path.of(logFile);
            initFileWriter();
        } else {
            this.logFilePath = null;
        }

        this.writerThread = new Thread(this::writeLoop, "access-log-writer");
        this.writerThread.setDaemon(true);
        this.writerThread.start();

        log.info("Access log initialized: file={}, console={}",
                logFilePath != null ? logFilePath : "disabled", consoleOutput);
    }

    private void initFileWriter() {
        try {
            if (logFilePath.getParent() != null) {
                Files.createDirectories(logFilePath.getParent());
            }

            OutputStream out = Files.newOutputStream(logFilePath,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
            this.fileWriter = new PrintWriter(new BufferedWriter(
                    new OutputStreamWriter(out, StandardCharsets.UTF_8)), true);

            log.debug("Access log file opened: {}", logFilePath);
        } catch (IOException e) {
            log.error("Failed to open access log file {}: {}", logFilePath, e.getMessage());
            this.fileWriter = null;
        }
    }

    /**
     * Queues a completed request for writing.
     */
    public void log(AccessLogEntry entry) {
        String line = formatEntry(entry);
        if (!logQueue.offer(line)) {
            log.warn("Access log queue full, dropping entry");
        }
    }

    /**
     * Logs a request that has been answered.
     *
     * @param clientAddress Client IP address
     * @param method        HTTP method
     * @param path          Request path
     * @param statusCode    Response status code
     * @param durationMs    Request duration in milliseconds
     * @param bytesWritten  Response body bytes
     * @param user          Authenticated username, null when anonymous
     * @param scheme        Authentication scheme, null when none
     * @param encoding      Content-Encoding of the response, null when uncompressed
     * @param contentType   Response content type
     */
    public void logRequest(String clientAddress, String method, String path, int statusCode,
                           long durationMs, long bytesWritten, String user, String scheme,
                           String encoding, String contentType) {
        log(new AccessLogEntry(
                LocalDateTime.now(),
                durationMs,
                clientAddress,
                method,
                path,
                statusCode,
                bytesWritten,
                orDash(user),
                orDash(scheme),
                orDash(encoding),
                orDash(contentType)));
    }

    static String formatEntry(AccessLogEntry entry) {
        return String.format("%s %d %s %s %s %d %d %s %s %s %s",
                TIMESTAMP_FORMAT.format(entry.timestamp()),
                entry.durationMs(),
                entry.clientAddress(),
                entry.method(),
                entry.path(),
                entry.statusCode(),
                entry.bytesWritten(),
                entry.user(),
                entry.scheme(),
                entry.encoding(),
                entry.contentType()
        );
    }

    private static String orDash(String value) {
        return value == null || value.isEmpty() ? "-" : value;
    }

    private void writeLoop() {
        while (running.get() || !logQueue.isEmpty()) {
            try {
                String line = logQueue.poll(100, TimeUnit.MILLISECONDS);
                if (line != null) {
                    writeLine(line);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }

        // Flush remaining entries
        String line;
        while ((line = logQueue.poll()) != null) {
            writeLine(line);
        }
    }

    private void writeLine(String line) {
        if (fileWriter != null) {
            fileWriter.println(line);
        }
        if (consoleOutput) {
            System.out.println(line);
        }
    }

    /**
     * Closes the access log and flushes remaining entries.
     */
    @Override
    public void close() {
        running.set(false);
        try {
            writerThread.join(5000);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }

        if (fileWriter != null) {
            fileWriter.close();
        }
    }

    public record AccessLogEntry(
            LocalDateTime timestamp,
            long durationMs,
            String clientAddress,
            String method,
            String path,
            int statusCode,
            long bytesWritten,
            String user,
            String scheme,
            String encoding,
            String contentType
    ) {
    }
}
