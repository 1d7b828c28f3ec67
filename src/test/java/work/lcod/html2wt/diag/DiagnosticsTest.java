package work.lcod.html2wt.diag;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import work.lcod.html2wt.api.LogLevel;
import work.lcod.html2wt.dom.Element;

final class DiagnosticsTest {
    @Test
    void entriesBelowTheThresholdAreDropped() {
        var diagnostics = new Diagnostics(LogLevel.WARN);
        diagnostics.log("debug/wts/sep", "dropped");
        diagnostics.log("warn", "kept");
        diagnostics.log("error/html2wt", "kept too");
        assertEquals(2, diagnostics.entries().size());
        assertTrue(diagnostics.hasEntries("error"));
        assertFalse(diagnostics.hasEntries("debug"));
    }

    @Test
    void entriesLogToTheirFamilyLogger() {
        assertEquals("html2wt.wts.sep", Diagnostics.loggerName("debug/wts/sep"));
        assertEquals("html2wt.selser", Diagnostics.loggerName("trace/selser"));
        assertEquals("html2wt", Diagnostics.loggerName("fatal/html2wt"));
        assertEquals("html2wt", Diagnostics.loggerName("warn"));
    }

    @Test
    void missingThresholdDefaultsToWarn() {
        var diagnostics = new Diagnostics(null);
        assertTrue(diagnostics.enabled(LogLevel.WARN));
        assertFalse(diagnostics.enabled(LogLevel.INFO));
    }

    @Test
    void messageFlattensElementsAndValues() {
        var node = Element.builder("li").attr("class", "x").build();
        var data = LogData.of("error/html2wt", "Top-level", node, 3);
        assertEquals("Top-level <li class=\"x\"> 3", data.message());
        assertEquals(LogLevel.ERROR, data.level());
    }

    @Test
    void throwableBecomesTheErrorAndAddsItsStackToFatalEntries() {
        var failure = new IllegalStateException("boom");
        var data = LogData.of("fatal/html2wt", failure);
        assertSame(failure, data.error());
        assertEquals("boom", data.message());
        assertTrue(data.fullMsg().contains("IllegalStateException"));
        assertEquals("boom", LogData.of("warn", failure).fullMsg());
    }

    @Test
    void logTypeFamiliesMapToLevels() {
        assertEquals(LogLevel.WARN, LogLevel.fromLogType("warning"));
        assertEquals(LogLevel.TRACE, LogLevel.fromLogType("trace/selser"));
        assertEquals(LogLevel.INFO, LogLevel.fromLogType("html2wt"));
    }
}
