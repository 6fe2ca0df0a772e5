package org.dynflow.analysis;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TestLineRecords {

    @Test
    public void testGroupByLine() {
        DependencyRecord a = new DependencyRecord(5, 1, "x", "a");
        DependencyRecord b = new DependencyRecord(3, 1, "b", "a");
        DependencyRecord c = new DependencyRecord(5, 2, "x", "a");
        List<LineRecords> groups = LineRecords.groupByLine(List.of(a, b, c));

        assertEquals(2, groups.size());
        assertEquals(3, groups.get(0).line());
        assertEquals(List.of(b), groups.get(0).records());
        assertEquals(5, groups.get(1).line());
        assertEquals(List.of(a, c), groups.get(1).records());
        assertEquals(2, groups.get(1).executions());
    }

    @Test
    public void testEmpty() {
        assertTrue(LineRecords.groupByLine(List.of()).isEmpty());
    }

    @Test
    public void testGroupsAsJson() {
        List<LineRecords> groups = LineRecords.groupByLine(List.of(new DependencyRecord(3, 1, "b", "a")));
        String json = RecordFormat.gson(false).toJson(groups);
        assertTrue(json.contains("\"line\":3"), json);
        assertTrue(json.contains("\"variable\":\"b\""), json);
        assertTrue(json.contains("\"dependency\":\"a\""), json);
    }
}
