package work.lcod.html2wt.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

final class SerializerConfigLoaderTest {
    @Test
    void readsTheSerializerTable() {
        var options = SerializerConfigLoader.parse(String.join("\n",
            "[serializer]",
            "rtTestMode = true",
            "maxNewlines = 3",
            "selser = false",
            "logLevel = \"debug\""
        ));
        assertTrue(options.rtTestMode());
        assertEquals(3, options.maxNewlines());
        assertFalse(options.selser());
        assertEquals(LogLevel.DEBUG, options.logLevel());
    }

    @Test
    void missingTableKeepsTheDefaults() {
        assertEquals(SerializerOptions.defaults(), SerializerConfigLoader.parse("[other]\nx = 1\n"));
    }

    @Test
    void explicitBaseIsOverriddenOnlyByPresentKeys() {
        var base = SerializerOptions.builder().rtTestMode(true);
        var options = SerializerConfigLoader.parse("[serializer]\nmaxNewlines = 1\n", base);
        assertTrue(options.rtTestMode());
        assertEquals(1, options.maxNewlines());
    }

    @Test
    void wrongTypeIsRejected() {
        var error = assertThrows(
            IllegalArgumentException.class,
            () -> SerializerConfigLoader.parse("[serializer]\nmaxNewlines = \"two\"\n")
        );
        assertTrue(error.getMessage().startsWith("Invalid serializer config"));
    }

    @Test
    void syntaxErrorIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> SerializerConfigLoader.parse("[serializer\n"));
    }

    @Test
    void negativeCeilingIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> SerializerConfigLoader.parse("[serializer]\nmaxNewlines = -1\n"));
    }

    @Test
    void unknownLogLevelIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> SerializerConfigLoader.parse("[serializer]\nlogLevel = \"loud\"\n"));
    }

    @Test
    void loadsFromAFile(@TempDir Path dir) throws Exception {
        var file = dir.resolve("html2wt.toml");
        Files.writeString(file, "[serializer]\nselser = false\n");
        assertFalse(SerializerConfigLoader.load(file).selser());
    }
}
