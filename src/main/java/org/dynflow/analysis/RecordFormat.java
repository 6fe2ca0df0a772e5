package org.dynflow.analysis;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.List;

/**
 * 依赖记录的两种输出格式：
 * - 文本，每行一条 {@code line,execution,variable,dependency}
 * - JSON 数组，元素为 {@code {"line":..,"execution":..,"variable":..,"dependency":..}}
 */
public final class RecordFormat {

    private static final Type RECORD_LIST = new TypeToken<List<DependencyRecord>>() {
    }.getType();

    private RecordFormat() {
    }

    public static String toLine(DependencyRecord r) {
        return r.line() + "," + r.execution() + "," + r.variable() + "," + r.dependency();
    }

    public static DependencyRecord parseLine(String text) {
        String[] parts = text.trim().split(",", -1);
        if (parts.length != 4) {
            throw new IllegalArgumentException("expected line,execution,variable,dependency but got '" + text + "'");
        }
        try {
            return new DependencyRecord(Integer.parseInt(parts[0]), Integer.parseInt(parts[1]), parts[2], parts[3]);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("bad line or execution number in '" + text + "'", e);
        }
    }

    public static void writeLines(List<DependencyRecord> records, Writer out) throws IOException {
        for (DependencyRecord r : records) {
            out.write(toLine(r));
            out.write('\n');
        }
        out.flush();
    }

    /**
     * 空行被忽略
     */
    public static List<DependencyRecord> readLines(Reader in) throws IOException {
        List<DependencyRecord> out = new ArrayList<>();
        BufferedReader reader = in instanceof BufferedReader b ? b : new BufferedReader(in);
        String line;
        while ((line = reader.readLine()) != null) {
            if (!line.isBlank()) out.add(parseLine(line));
        }
        return out;
    }

    public static Gson gson(boolean pretty) {
        GsonBuilder builder = new GsonBuilder().disableHtmlEscaping();
        if (pretty) builder.setPrettyPrinting();
        return builder.create();
    }

    public static String toJson(List<DependencyRecord> records, boolean pretty) {
        return gson(pretty).toJson(records, RECORD_LIST);
    }

    public static List<DependencyRecord> fromJson(String json) {
        List<DependencyRecord> records = gson(false).fromJson(json, RECORD_LIST);
        if (records == null) {
            throw new JsonParseException("empty JSON document");
        }
        return records;
    }
}
