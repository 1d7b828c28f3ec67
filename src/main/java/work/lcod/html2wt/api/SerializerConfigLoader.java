package work.lcod.html2wt.api;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Collectors;
import org.tomlj.Toml;
import org.tomlj.TomlInvalidTypeException;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;

/**
 * Reads {@link SerializerOptions} from the {@code [serializer]} table of a TOML file. Missing keys keep
 * their defaults.
 */
public final class SerializerConfigLoader {
    public static final String SECTION = "serializer";

    private SerializerConfigLoader() {}

    public static SerializerOptions load(Path path) {
        try {
            return parse(Files.readString(path), SerializerOptions.builder());
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to read config file " + path, ex);
        }
    }

    public static SerializerOptions parse(String toml) {
        return parse(toml, SerializerOptions.builder());
    }

    /**
     * Applies the keys present in {@code toml} on top of {@code base}.
     */
    public static SerializerOptions parse(String toml, SerializerOptions.Builder base) {
        TomlParseResult result = Toml.parse(toml);
        if (result.hasErrors()) {
            var errors = result.errors().stream().map(Object::toString).collect(Collectors.joining("; "));
            throw new IllegalArgumentException("Invalid serializer config: " + errors);
        }
        TomlTable section = result.getTable(SECTION);
        if (section == null) {
            return base.build();
        }
        try {
            var rtTestMode = section.getBoolean("rtTestMode");
            if (rtTestMode != null) {
                base.rtTestMode(rtTestMode);
            }
            var maxNewlines = section.getLong("maxNewlines");
            if (maxNewlines != null) {
                base.maxNewlines(Math.toIntExact(maxNewlines));
            }
            var selser = section.getBoolean("selser");
            if (selser != null) {
                base.selser(selser);
            }
            var logLevel = section.getString("logLevel");
            if (logLevel != null) {
                base.logLevel(LogLevel.from(logLevel));
            }
        } catch (TomlInvalidTypeException | ArithmeticException ex) {
            throw new IllegalArgumentException("Invalid serializer config: " + ex.getMessage(), ex);
        }
        return base.build();
    }
}
