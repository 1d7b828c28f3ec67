package work.lcod.html2wt.diag;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import work.lcod.html2wt.api.LogLevel;
import work.lcod.html2wt.dom.Element;

/**
 * One diagnostic: its log type and the flattened message built from the logged values.
 *
 * @param logType slash separated type, e.g. {@code error/html2wt}
 * @param message message text
 * @param error attached throwable, or {@code null}
 */
public record LogData(String logType, String message, Throwable error) {
    private static final Pattern STACK_TYPES = Pattern.compile("^(error|fatal)(/|$)");

    /**
     * Flattens {@code values}: elements are described by their opening tag, throwables contribute their
     * message and are kept as the error, everything else uses {@code String.valueOf}.
     */
    public static LogData of(String logType, Object... values) {
        List<String> pieces = new ArrayList<>();
        Throwable error = null;
        for (Object value : values) {
            if (value instanceof Throwable throwable) {
                error = throwable;
                pieces.add(throwable.getMessage() == null ? throwable.getClass().getSimpleName() : throwable.getMessage());
            } else if (value instanceof Element element) {
                pieces.add(element.describe());
            } else {
                pieces.add(String.valueOf(value));
            }
        }
        return new LogData(logType, String.join(" ", pieces), error);
    }

    public LogLevel level() {
        return LogLevel.fromLogType(logType);
    }

    /**
     * Message plus stack trace, the latter only for error and fatal types.
     */
    public String fullMsg() {
        if (error == null || !STACK_TYPES.matcher(logType).find()) {
            return message;
        }
        var trace = new StringWriter();
        error.printStackTrace(new PrintWriter(trace));
        return message + "\n" + trace;
    }
}
