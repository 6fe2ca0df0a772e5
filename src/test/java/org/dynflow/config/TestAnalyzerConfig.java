package org.dynflow.config;

import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

public class TestAnalyzerConfig {

    private static Properties props(String... kv) {
        Properties p = new Properties();
        for (int i = 0; i < kv.length; i += 2) {
            p.setProperty(kv[i], kv[i + 1]);
        }
        return p;
    }

    @Test
    public void testDefaults() {
        AnalyzerConfig c = AnalyzerConfig.from(new Properties(), new Properties());
        assertEquals(1_000_000, c.maxLineEvents);
        assertEquals(200, c.maxCallDepth);
        assertEquals(AnalyzerConfig.OutputFormat.CSV, c.outputFormat);
        assertTrue(c.prettyJson);
    }

    @Test
    public void testFileValues() {
        AnalyzerConfig c = AnalyzerConfig.from(
                props("maxLineEvents", "5_000", "outputFormat", "json", "prettyJson", "false"), new Properties());
        assertEquals(5000, c.maxLineEvents);
        assertEquals(AnalyzerConfig.OutputFormat.JSON, c.outputFormat);
        assertFalse(c.prettyJson);
    }

    @Test
    public void testOverridesWin() {
        AnalyzerConfig c = AnalyzerConfig.from(
                props("maxCallDepth", "10"), props("dynflow.maxCallDepth", "30", "maxCallDepth", "99"));
        assertEquals(30, c.maxCallDepth);
    }

    @Test
    public void testInvalidValues() {
        assertThrows(IllegalArgumentException.class,
                () -> AnalyzerConfig.from(props("maxLineEvents", "lots"), new Properties()));
        assertThrows(IllegalArgumentException.class,
                () -> AnalyzerConfig.from(props("outputFormat", "xml"), new Properties()));
        assertThrows(IllegalArgumentException.class,
                () -> AnalyzerConfig.from(props("maxCallDepth", "0"), new Properties()));
    }

    @Test
    public void testLoadFromClasspath() {
        AnalyzerConfig c = AnalyzerConfig.load();
        assertTrue(c.maxLineEvents > 0);
        assertEquals(AnalyzerConfig.OutputFormat.JSON,
                c.withOutputFormat(AnalyzerConfig.OutputFormat.JSON).outputFormat);
    }
}
