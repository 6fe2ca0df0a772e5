package org.dynflow.analysis;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TestRecordFormat {

    private static final List<DependencyRecord> RECORDS = List.of(
            new DependencyRecord(3, 1, "b", "a"),
            new DependencyRecord(5, 2, "s", "x"));

    @Test
    public void testLineFormat() {
        assertEquals("3,1,b,a", RecordFormat.toLine(RECORDS.get(0)));
        assertEquals(new DependencyRecord(12, 4, "total", "x"), RecordFormat.parseLine("12,4,total,x"));
    }

    @Test
    public void testMalformedLines() {
        assertThrows(IllegalArgumentException.class, () -> RecordFormat.parseLine("1,2,a"));
        assertThrows(IllegalArgumentException.class, () -> RecordFormat.parseLine("x,2,a,b"));
        assertThrows(IllegalArgumentException.class, () -> RecordFormat.parseLine("1,2,a,b,c"));
    }

    @Test
    public void testWriteAndReadLines() throws IOException {
        StringWriter out = new StringWriter();
        RecordFormat.writeLines(RECORDS, out);
        assertEquals("3,1,b,a\n5,2,s,x\n", out.toString());
        assertEquals(RECORDS, RecordFormat.readLines(new StringReader(out + "\n\n")));
    }

    @Test
    public void testJsonShape() {
        JsonArray array = JsonParser.parseString(RecordFormat.toJson(RECORDS, false)).getAsJsonArray();
        assertEquals(2, array.size());
        JsonObject first = array.get(0).getAsJsonObject();
        assertEquals(3, first.get("line").getAsInt());
        assertEquals(1, first.get("execution").getAsInt());
        assertEquals("b", first.get("variable").getAsString());
        assertEquals("a", first.get("dependency").getAsString());
    }

    @Test
    public void testJsonRead() {
        String json = RecordFormat.toJson(RECORDS, true);
        assertTrue(json.contains("\n"));
        assertEquals(RECORDS, RecordFormat.fromJson(json));
        assertEquals(List.of(), RecordFormat.fromJson("[]"));
    }
}
