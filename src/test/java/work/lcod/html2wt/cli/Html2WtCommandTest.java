package work.lcod.html2wt.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

final class Html2WtCommandTest {
    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private int run(String... args) {
        CommandLine commandLine = Main.commandLine();
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(err));
        return commandLine.execute(args);
    }

    @Test
    void printsTheWikitextOfAnHtmlFile(@TempDir Path dir) throws Exception {
        var input = dir.resolve("page.html");
        Files.writeString(input, "<h2>Foo</h2><p>bar</p>");
        assertEquals(0, run("--input", input.toString()));
        assertEquals("== Foo ==\nbar\n", out.toString());
    }

    @Test
    void reusesTheSourceFile(@TempDir Path dir) throws Exception {
        var input = dir.resolve("page.html");
        var source = dir.resolve("page.wikitext");
        Files.writeString(input, "<p data-parsoid='{\"dsr\":[0,4,0,0]}'>a  b</p>");
        Files.writeString(source, "a  b\n");
        assertEquals(0, run("-i", input.toString(), "-s", source.toString()));
        assertEquals("a  b\n", out.toString());
    }

    @Test
    void jsonOutputReportsTheStatus(@TempDir Path dir) throws Exception {
        var input = dir.resolve("page.html");
        Files.writeString(input, "<p>a</p>");
        assertEquals(0, run("-i", input.toString(), "--json"));
        assertTrue(out.toString().contains("\"status\" : \"success\""));
    }

    @Test
    void fatalSerializationErrorExitsWithOne(@TempDir Path dir) throws Exception {
        var input = dir.resolve("page.html");
        Files.writeString(input, "<span about=\"#mwt1\" typeof=\"mw:Transclusion\">x</span>");
        assertEquals(1, run("-i", input.toString()));
        assertTrue(err.toString().contains("[missing_reconstruction_data]"), err.toString());
        assertTrue(err.toString().contains("transclusion"));
    }

    @Test
    void malformedProvenanceIsReportedWithItsCode(@TempDir Path dir) throws Exception {
        var input = dir.resolve("page.html");
        Files.writeString(input, "<p data-parsoid='{bad'>x</p>");
        assertEquals(1, run("-i", input.toString()));
        assertTrue(err.toString().startsWith("[invalid_provenance] "), err.toString());
    }

    @Test
    void configFileSuppliesOptions(@TempDir Path dir) throws Exception {
        var input = dir.resolve("page.html");
        var config = dir.resolve("html2wt.toml");
        Files.writeString(input, "<b data-parsoid='{\"autoInsertedEnd\":true}'>a</b>");
        Files.writeString(config, "[serializer]\nrtTestMode = true\n");
        assertEquals(0, run("-i", input.toString(), "-c", config.toString()));
        assertEquals("'''a", out.toString());
    }

    @Test
    void brokenConfigFileIsReportedWithItsCode(@TempDir Path dir) throws Exception {
        var input = dir.resolve("page.html");
        var config = dir.resolve("html2wt.toml");
        Files.writeString(input, "<p>a</p>");
        Files.writeString(config, "[serializer]\nmaxNewlines = \"many\"\n");
        assertEquals(1, run("-i", input.toString(), "-c", config.toString()));
        assertTrue(err.toString().startsWith("[invalid_config] Invalid serializer config"), err.toString());
    }

    @Test
    void unreadableConfigFileIsAnIoError(@TempDir Path dir) throws Exception {
        var input = dir.resolve("page.html");
        Files.writeString(input, "<p>a</p>");
        assertEquals(1, run("-i", input.toString(), "-c", dir.resolve("absent.toml").toString()));
        assertTrue(err.toString().startsWith("[io_error] "), err.toString());
    }

    @Test
    void missingInputFileIsAUsageError(@TempDir Path dir) {
        assertNotEquals(0, run("-i", dir.resolve("absent.html").toString()));
        assertTrue(err.toString().contains("Cannot read input file"));
    }

    @Test
    void invalidLogLevelIsAUsageError(@TempDir Path dir) throws Exception {
        var input = dir.resolve("page.html");
        Files.writeString(input, "<p>a</p>");
        assertNotEquals(0, run("-i", input.toString(), "--log-level", "loud"));
    }

    @Test
    void versionNamesTheTool() {
        assertEquals(0, run("--version"));
        assertTrue(out.toString().startsWith("lcod-html2wt (java) "));
        assertTrue(out.toString().contains("defaults: maxNewlines="));
    }
}
