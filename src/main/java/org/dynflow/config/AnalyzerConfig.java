package org.dynflow.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;
import java.util.Properties;

/**
 * 分析器的运行参数。
 * <p>
 * 默认值来自 classpath 上的 {@code dynflow.properties}，每一项都可以用 {@code -Ddynflow.<key>=...} 覆盖。
 */
public class AnalyzerConfig {

    private static final Logger LOGGER = LoggerFactory.getLogger(AnalyzerConfig.class);

    public static final String RESOURCE = "dynflow.properties";
    public static final String PREFIX = "dynflow.";

    public enum OutputFormat {
        CSV, JSON
    }

    public final int maxLineEvents;
    public final int maxCallDepth;
    public final OutputFormat outputFormat;
    public final boolean prettyJson;

    public AnalyzerConfig(int maxLineEvents, int maxCallDepth, OutputFormat outputFormat, boolean prettyJson) {
        if (maxLineEvents <= 0) throw new IllegalArgumentException("maxLineEvents must be positive: " + maxLineEvents);
        if (maxCallDepth <= 0) throw new IllegalArgumentException("maxCallDepth must be positive: " + maxCallDepth);
        this.maxLineEvents = maxLineEvents;
        this.maxCallDepth = maxCallDepth;
        this.outputFormat = outputFormat;
        this.prettyJson = prettyJson;
    }

    public static AnalyzerConfig defaults() {
        return new AnalyzerConfig(1_000_000, 200, OutputFormat.CSV, true);
    }

    /**
     * 读取 classpath 配置并叠加系统属性
     */
    public static AnalyzerConfig load() {
        Properties props = new Properties();
        try (InputStream in = AnalyzerConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null) {
                props.load(in);
            } else {
                LOGGER.debug("classpath 上没有 {}，使用默认配置", RESOURCE);
            }
        } catch (IOException e) {
            LOGGER.warn("读取 {} 失败，使用默认配置: {}", RESOURCE, e.getMessage());
        }
        return from(props, System.getProperties());
    }

    /**
     * @param file      配置文件中的键（不带前缀）
     * @param overrides 带 {@code dynflow.} 前缀的覆盖项，通常是系统属性
     */
    public static AnalyzerConfig from(Properties file, Properties overrides) {
        AnalyzerConfig d = defaults();
        int maxLineEvents = intValue("maxLineEvents", file, overrides, d.maxLineEvents);
        int maxCallDepth = intValue("maxCallDepth", file, overrides, d.maxCallDepth);
        String format = value("outputFormat", file, overrides, d.outputFormat.name());
        boolean pretty = Boolean.parseBoolean(value("prettyJson", file, overrides, String.valueOf(d.prettyJson)));

        OutputFormat outputFormat;
        try {
            outputFormat = OutputFormat.valueOf(format.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown outputFormat '" + format + "', expected csv or json", e);
        }
        return new AnalyzerConfig(maxLineEvents, maxCallDepth, outputFormat, pretty);
    }

    public AnalyzerConfig withOutputFormat(OutputFormat format) {
        return new AnalyzerConfig(maxLineEvents, maxCallDepth, format, prettyJson);
    }

    private static String value(String key, Properties file, Properties overrides, String fallback) {
        String v = overrides.getProperty(PREFIX + key);
        if (v == null) v = file.getProperty(key);
        return v == null ? fallback : v;
    }

    private static int intValue(String key, Properties file, Properties overrides, int fallback) {
        String v = value(key, file, overrides, null);
        if (v == null) return fallback;
        try {
            return Integer.parseInt(v.trim().replace("_", ""));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be an integer, got '" + v + "'", e);
        }
    }

    @Override
    public String toString() {
        return "AnalyzerConfig{maxLineEvents=" + maxLineEvents + ", maxCallDepth=" + maxCallDepth
                + ", outputFormat=" + outputFormat + ", prettyJson=" + prettyJson + "}";
    }
}
