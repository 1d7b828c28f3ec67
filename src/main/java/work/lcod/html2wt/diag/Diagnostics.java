package work.lcod.html2wt.diag;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.slf4j.LoggerFactory;
import work.lcod.html2wt.api.LogLevel;

/**
 * Collects warnings and recoverable errors raised during a serialization. Entries below the threshold
 * are dropped; the rest are kept and forwarded to SLF4J.
 */
public final class Diagnostics {
    private static final String ROOT_LOGGER = "html2wt";

    private final LogLevel threshold;
    private final List<LogData> entries = new ArrayList<>();

    public Diagnostics(LogLevel threshold) {
        this.threshold = threshold == null ? LogLevel.WARN : threshold;
    }

    public void log(String logType, Object... values) {
        var data = LogData.of(logType, values);
        if (!threshold.includes(data.level())) {
            return;
        }
        entries.add(data);
        var log = LoggerFactory.getLogger(loggerName(data.logType()));
        switch (data.level()) {
            case FATAL, ERROR -> log.error("[{}] {}", data.logType(), data.message(), data.error());
            case WARN -> log.warn("[{}] {}", data.logType(), data.message());
            case INFO -> log.info("[{}] {}", data.logType(), data.message());
            case DEBUG -> log.debug("[{}] {}", data.logType(), data.message());
            case TRACE -> log.trace("[{}] {}", data.logType(), data.message());
        }
    }

    /**
     * Maps a log type to its family logger: {@code debug/wts/sep} logs to {@code html2wt.wts.sep}.
     */
    static String loggerName(String logType) {
        int slash = logType.indexOf('/');
        var family = slash < 0 ? "" : logType.substring(slash + 1).replace('/', '.');
        if (family.isEmpty() || family.equals(ROOT_LOGGER)) {
            return ROOT_LOGGER;
        }
        return ROOT_LOGGER + "." + family;
    }

    public boolean enabled(LogLevel level) {
        return threshold.includes(level);
    }

    public List<LogData> entries() {
        return Collections.unmodifiableList(entries);
    }

    public boolean hasEntries(String logTypePrefix) {
        for (var entry : entries) {
            if (entry.logType().startsWith(logTypePrefix)) {
                return true;
            }
        }
        return false;
    }
}
