package org.dynflow.analysis;

import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class TestDependencyPropagator {

    private final ScopeStore store = new ScopeStore();
    private final DependencyPropagator propagator =
            new DependencyPropagator(store, (scope, name) -> name.equals("len") && !store.hasEntry(scope, name));

    @Test
    public void testTransitiveUnion() {
        store.set(Scope.MODULE, "b", Set.of("a"));
        propagator.propagate(Scope.MODULE, Set.of("c"), Set.of("b", "d"));
        assertEquals(Set.of("a", "b", "d"), store.get(Scope.MODULE, "c"));
    }

    @Test
    public void testSelfInclusion() {
        store.set(Scope.MODULE, "s", Set.of());
        propagator.propagate(Scope.MODULE, Set.of("s"), Set.of("s", "x"));
        assertEquals(Set.of("s", "x"), store.get(Scope.MODULE, "s"));
    }

    @Test
    public void testAllTargetsGetTheSameSet() {
        propagator.propagate(Scope.MODULE, Set.of("p", "q"), Set.of("a", "b"));
        assertEquals(Set.of("a", "b"), store.get(Scope.MODULE, "p"));
        assertEquals(Set.of("a", "b"), store.get(Scope.MODULE, "q"));
    }

    @Test
    public void testConstantAssignmentClearsDependencies() {
        store.set(Scope.MODULE, "x", Set.of("y"));
        propagator.propagate(Scope.MODULE, Set.of("x"), Set.of());
        assertEquals(Set.of(), store.get(Scope.MODULE, "x"));
        assertTrue(store.hasEntry(Scope.MODULE, "x"));
    }

    @Test
    public void testBuiltinsAreSkipped() {
        store.set(Scope.MODULE, "a", Set.of("z"));
        propagator.propagate(Scope.MODULE, Set.of("n"), Set.of("len", "a"));
        assertEquals(Set.of("a", "z"), store.get(Scope.MODULE, "n"));

        // 程序自己绑定过之后就不再是内置名字
        store.set(Scope.MODULE, "len", Set.of());
        propagator.propagate(Scope.MODULE, Set.of("m"), Set.of("len"));
        assertEquals(Set.of("len"), store.get(Scope.MODULE, "m"));
    }

    @Test
    public void testCallScopeReadsGlobalsWritesLocals() {
        store.set(Scope.MODULE, "g", Set.of("h"));
        propagator.propagate(Scope.call(1), Set.of("l"), Set.of("g"));
        assertEquals(Set.of("g", "h"), store.get(Scope.call(1), "l"));
        assertFalse(store.hasEntry(Scope.MODULE, "l"));
    }
}
