package work.lcod.html2wt.cli;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.lcod.html2wt.api.LogLevel;
import work.lcod.html2wt.api.SerializeResult;
import work.lcod.html2wt.api.SerializerConfigLoader;
import work.lcod.html2wt.api.SerializerOptions;
import work.lcod.html2wt.api.WikitextSerializer;

@CommandLine.Command(
    name = "lcod-html2wt",
    description = "Serialize annotated HTML back to wikitext.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class Html2WtCommand implements Callable<Integer> {
    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(
        names = {"-i", "--input"},
        paramLabel = "PATH|-",
        description = "HTML input file; use '-' to read from stdin.",
        defaultValue = "-"
    )
    private String input;

    @CommandLine.Option(
        names = {"-s", "--source"},
        paramLabel = "PATH",
        description = "Original wikitext; enables reuse of unmodified source.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path source;

    @CommandLine.Option(
        names = {"-c", "--config"},
        paramLabel = "PATH",
        description = "TOML file with a [serializer] table.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path config;

    @CommandLine.Option(
        names = "--rt-test-mode",
        description = "Drop content the parser inserted on its own."
    )
    private boolean rtTestMode;

    @CommandLine.Option(
        names = "--max-newlines",
        description = "Newline ceiling for unbounded separators.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Integer maxNewlines;

    @CommandLine.Option(
        names = "--log-level",
        description = "Diagnostics threshold (trace|debug|info|warn|error|fatal).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String logLevelRaw;

    @CommandLine.Option(
        names = "--no-selser",
        description = "Always synthesize markup, even when the source is available."
    )
    private boolean noSelser;

    @CommandLine.Option(
        names = "--json",
        description = "Print the whole result as JSON."
    )
    private boolean json;

    @Override
    public Integer call() throws Exception {
        var options = resolveOptions();
        var html = readInput();
        var wikitext = source == null ? null : readFile(source, "source");
        SerializeResult result = new WikitextSerializer().serializeHtml(html, wikitext, options);
        var out = spec.commandLine().getOut();
        if (json) {
            out.println(result.toPrettyJson());
        } else if (result.isSuccess()) {
            out.print(result.wikitext());
        } else {
            ShortErrorHandler.report(spec.commandLine(), result.errorCode(), result.error());
        }
        out.flush();
        return result.status().exitCode();
    }

    private SerializerOptions resolveOptions() {
        var builder = config == null
            ? SerializerOptions.builder()
            : SerializerConfigLoader.load(config).toBuilder();
        if (rtTestMode) {
            builder.rtTestMode(true);
        }
        if (maxNewlines != null) {
            if (maxNewlines < 0) {
                throw new CommandLine.ParameterException(spec.commandLine(), "--max-newlines must be non-negative");
            }
            builder.maxNewlines(maxNewlines);
        }
        if (logLevelRaw != null) {
            try {
                builder.logLevel(LogLevel.from(logLevelRaw));
            } catch (IllegalArgumentException ex) {
                throw new CommandLine.ParameterException(spec.commandLine(), ex.getMessage());
            }
        }
        if (noSelser) {
            builder.selser(false);
        }
        return builder.build();
    }

    private String readInput() {
        if ("-".equals(input)) {
            try {
                InputStream stdin = System.in;
                return new String(stdin.readAllBytes(), StandardCharsets.UTF_8);
            } catch (IOException ex) {
                throw new CommandLine.ExecutionException(spec.commandLine(), "Unable to read stdin: " + ex.getMessage(), ex);
            }
        }
        return readFile(Paths.get(input), "input");
    }

    private String readFile(Path path, String label) {
        var resolved = path.toAbsolutePath().normalize();
        try {
            return Files.readString(resolved, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Cannot read " + label + " file: " + resolved);
        }
    }
}
