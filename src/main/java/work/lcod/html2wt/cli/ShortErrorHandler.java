package work.lcod.html2wt.cli;

import java.io.UncheckedIOException;
import picocli.CommandLine;
import work.lcod.html2wt.runtime.SerializationException;

/**
 * Prints one {@code [code] message} line per failure; {@code -Dhtml2wt.debug=true} adds the stack trace.
 */
final class ShortErrorHandler implements CommandLine.IExecutionExceptionHandler {
    static final String INTERNAL_ERROR = SerializationException.INTERNAL_ERROR;
    static final String IO_ERROR = "io_error";
    static final String INVALID_CONFIG = "invalid_config";

    @Override
    public int handleExecutionException(
        Exception ex,
        CommandLine commandLine,
        CommandLine.ParseResult parseResult
    ) {
        report(commandLine, codeOf(ex), messageOf(ex));
        if (Boolean.getBoolean("html2wt.debug")) {
            ex.printStackTrace(commandLine.getErr());
        }
        return commandLine.getCommandSpec().exitCodeOnExecutionException();
    }

    static void report(CommandLine commandLine, String code, String message) {
        var line = code == null ? message : "[" + code + "] " + message;
        commandLine.getErr().println(commandLine.getColorScheme().errorText(line));
    }

    private static String codeOf(Exception ex) {
        if (ex instanceof SerializationException serialization) {
            return serialization.code();
        }
        if (ex instanceof UncheckedIOException) {
            return IO_ERROR;
        }
        return ex instanceof IllegalArgumentException ? INVALID_CONFIG : INTERNAL_ERROR;
    }

    private static String messageOf(Exception ex) {
        Throwable cause = ex instanceof UncheckedIOException && ex.getCause() != null ? ex.getCause() : ex;
        var message = cause.getMessage();
        return message == null || message.isBlank() ? cause.getClass().getSimpleName() : message;
    }
}
