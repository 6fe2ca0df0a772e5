package org.dynflow.analysis;

import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class TestScopeStore {

    @Test
    public void testModuleScopeUsesGlobals() {
        ScopeStore store = new ScopeStore();
        store.set(Scope.MODULE, "a", Set.of("b"));
        assertEquals(Set.of("b"), store.get(Scope.MODULE, "a"));
        assertEquals(Set.of("b"), store.get(Scope.call(1), "a"));
        assertEquals(Set.of(), store.get(Scope.MODULE, "missing"));
    }

    @Test
    public void testCallScopeWritesLocally() {
        ScopeStore store = new ScopeStore();
        store.set(Scope.MODULE, "a", Set.of("g"));
        store.set(Scope.call(1), "a", Set.of("l"));

        assertEquals(Set.of("l"), store.get(Scope.call(1), "a"));
        assertEquals(Set.of("g"), store.get(Scope.MODULE, "a"));
        assertEquals(Set.of("g"), store.get(Scope.call(2), "a"));
    }

    @Test
    public void testEmptyLocalEntryShadowsGlobal() {
        ScopeStore store = new ScopeStore();
        store.set(Scope.MODULE, "p", Set.of("x"));
        store.set(Scope.call(3), "p", Set.of());
        assertEquals(Set.of(), store.get(Scope.call(3), "p"));
        assertTrue(store.hasEntry(Scope.call(3), "p"));
    }

    @Test
    public void testDiscard() {
        ScopeStore store = new ScopeStore();
        store.set(Scope.call(1), "a", Set.of("x"));
        store.set(Scope.call(2), "a", Set.of("y"));
        store.discard(Scope.call(1));

        assertEquals(Set.of(), store.get(Scope.call(1), "a"));
        assertFalse(store.hasEntry(Scope.call(1), "a"));
        assertEquals(Set.of("y"), store.get(Scope.call(2), "a"));
        assertEquals(1, store.activeCalls());

        store.discard(Scope.MODULE);
        assertEquals(1, store.activeCalls());
    }

    @Test
    public void testStoredSetsAreCopies() {
        ScopeStore store = new ScopeStore();
        Set<String> deps = new java.util.HashSet<>(Set.of("x"));
        store.set(Scope.MODULE, "a", deps);
        deps.add("y");
        assertEquals(Set.of("x"), store.get(Scope.MODULE, "a"));
    }
}
