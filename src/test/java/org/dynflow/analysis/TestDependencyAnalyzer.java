package org.dynflow.analysis;

import org.dynflow.ast.Module;
import org.dynflow.config.AnalyzerConfig;
import org.dynflow.parse.ParseError;
import org.dynflow.parse.Parser;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class TestDependencyAnalyzer {

    private final ByteArrayOutputStream programOutput = new ByteArrayOutputStream();

    private AnalysisResult analyze(String src) {
        return DependencyAnalyzer.analyze(src, AnalyzerConfig.defaults(),
                new PrintStream(programOutput, true, StandardCharsets.UTF_8));
    }

    private static List<String> lines(AnalysisResult result) {
        return result.records().stream().map(RecordFormat::toLine).collect(Collectors.toList());
    }

    private static String resource(String name) throws IOException {
        try (InputStream in = TestDependencyAnalyzer.class.getResourceAsStream("/programs/" + name)) {
            return new String(Objects.requireNonNull(in, name).readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    @Test
    public void testStraightLineChain() {
        AnalysisResult result = analyze("""
                a = 1
                b = a
                c = b + a
                """);
        assertEquals(List.of(new DependencyRecord(3, 1, "b", "a")), result.records());
        assertTrue(result.completed());
    }

    @Test
    public void testLoopVariable() {
        AnalysisResult result = analyze("""
                a = [1, 2]
                for x in a:
                    y = x
                """);
        assertEquals(List.of("3,1,x,a", "3,2,x,a"), lines(result));
    }

    @Test
    public void testNoDependenciesNoRecords() {
        assertTrue(analyze("x = 1\ny = 2\nprint(x, y)\n").records().isEmpty());
        assertEquals("1 2\n", programOutput.toString(StandardCharsets.UTF_8));
    }

    @Test
    public void testSelfReferentialAccumulation() {
        AnalysisResult result = analyze("""
                s = 0
                for x in [1, 2]:
                    s = s + x
                print(s)
                """);
        assertEquals(List.of("3,2,s,s", "3,2,s,x", "4,1,s,s", "4,1,s,x"), lines(result));
    }

    @Test
    public void testAugmentedAssignmentReportsTarget() {
        AnalysisResult result = analyze("""
                a = 1
                t = a
                t += 2
                u = t
                """);
        assertEquals(List.of("3,1,t,a", "4,1,t,a", "4,1,t,t"), lines(result));
    }

    @Test
    public void testReportsStateBeforeTheLineRuns() {
        AnalysisResult result = analyze("""
                a = 1
                b = a
                b = b + 1
                """);
        // 第 3 行报告的是执行前 b 的依赖，不包含 b 自身
        assertEquals(List.of("3,1,b,a"), lines(result));
    }

    @Test
    public void testIndependentLineCounters() {
        AnalysisResult result = analyze("""
                a = 1
                c = a
                i = 0
                while i < 3:
                    b = c
                    i += 1
                """);
        List<String> line5 = result.records().stream()
                .filter(r -> r.line() == 5).map(RecordFormat::toLine).collect(Collectors.toList());
        assertEquals(List.of("5,1,c,a", "5,2,c,a", "5,3,c,a"), line5);

        List<Integer> headerExecutions = result.records().stream()
                .filter(r -> r.line() == 4).map(DependencyRecord::execution).collect(Collectors.toList());
        assertEquals(List.of(2, 3, 4), headerExecutions);

        List<Integer> incrementExecutions = result.records().stream()
                .filter(r -> r.line() == 6).map(DependencyRecord::execution).collect(Collectors.toList());
        assertEquals(List.of(2, 3), incrementExecutions);
    }

    @Test
    public void testLocalsAreSeparateFromGlobals() {
        AnalysisResult result = analyze("""
                x = 1
                y = x
                def f(y):
                    z = y
                    return z
                w = f(5)
                v = y
                """);
        // 形参 y 不继承同名全局变量的依赖；调用结束后全局 y 不受影响
        assertEquals(List.of("5,1,z,y", "7,1,y,x"), lines(result));
    }

    @Test
    public void testEachCallCountsTheSameLines() {
        AnalysisResult result = analyze("""
                g = 1
                def f():
                    k = g
                    return k
                f()
                f()
                """);
        assertEquals(List.of("4,1,k,g", "4,2,k,g"), lines(result));
    }

    @Test
    public void testBuiltinsAreIgnored() {
        AnalysisResult result = analyze("""
                a = [3, 1]
                b = sorted(a)
                c = len(b)
                print(c)
                """);
        assertEquals(List.of("3,1,b,a", "4,1,c,a", "4,1,c,b"), lines(result));
        assertTrue(result.records().stream().noneMatch(r ->
                r.variable().equals("len") || r.dependency().equals("len")
                        || r.variable().equals("print") || r.dependency().equals("sorted")));
    }

    @Test
    public void testReboundBuiltinNameIsAVariable() {
        AnalysisResult result = analyze("""
                len = 4
                n = len
                m = n
                """);
        assertEquals(List.of("3,1,n,len"), lines(result));
    }

    @Test
    public void testPartialOutputOnProgramError() throws IOException {
        AnalysisResult result = analyze(resource("failing.py"));
        assertEquals(List.of("3,1,b,a", "4,1,c,a", "4,1,c,b"), lines(result));
        assertFalse(result.completed());
        assertEquals("ZeroDivisionError: division by zero (line 4)", result.error().orElseThrow());
    }

    @Test
    public void testParseErrorBeforeExecution() throws IOException {
        String src = resource("broken.py");
        assertThrows(ParseError.class, () -> analyze(src));
        assertThrows(ParseError.class, () -> analyze("print('never')\nx = = 1\n"));
        assertEquals("", programOutput.toString(StandardCharsets.UTF_8));
    }

    @Test
    public void testAverageProgram() throws IOException {
        AnalysisResult result = analyze(resource("average.py"));
        List<DependencyRecord> expected = RecordFormat.readLines(new StringReader(resource("average.expected")));
        assertEquals(expected, result.records());
        assertEquals("2.75\n", programOutput.toString(StandardCharsets.UTF_8));
    }

    @Test
    public void testReanalysisIsIdentical() throws IOException {
        String src = resource("average.py");
        assertEquals(analyze(src).records(), analyze(src).records());
    }

    @Test
    public void testExecutionLimitKeepsRecords() {
        AnalysisResult result = DependencyAnalyzer.analyze("""
                a = 1
                b = a
                c = b
                while True:
                    pass
                """, new AnalyzerConfig(50, 10, AnalyzerConfig.OutputFormat.CSV, false), new PrintStream(programOutput));
        assertEquals(List.of("3,1,b,a"), lines(result));
        assertTrue(result.error().orElseThrow().startsWith("ExecutionLimitError"));
    }

    @Test
    public void testAnalyzerIsSingleUse() {
        DependencyAnalyzer analyzer = new DependencyAnalyzer(Parser.parse("a = 1\n"),
                AnalyzerConfig.defaults(), new PrintStream(programOutput));
        analyzer.run();
        assertThrows(IllegalStateException.class, analyzer::run);
    }

    @Test
    public void testRecordsAreImmutable() {
        AnalysisResult result = analyze("a = 1\nb = a\nc = b\n");
        assertThrows(UnsupportedOperationException.class,
                () -> result.records().add(new DependencyRecord(1, 1, "x", "y")));
    }

    @Test
    public void testReadsOnContinuationLines() {
        AnalysisResult result = analyze("""
                a = 1
                b = a
                c = (1 +
                     b)
                d = max(1,
                        c)
                """);
        assertEquals(List.of("4,1,b,a", "6,1,c,a", "6,1,c,b"), lines(result));
    }

    @Test
    public void testBareAnnotationClearsDependencies() {
        AnalysisResult result = analyze("""
                a = 1
                x = a
                x: int
                y = x
                """);
        assertTrue(result.records().isEmpty(), () -> lines(result).toString());
    }

    @Test
    public void testStoreFailureSkipsOnlyThatLine() {
        ScopeStore failing = new ScopeStore() {
            @Override
            public void set(Scope scope, String name, Set<String> deps) {
                if ("broken".equals(name)) {
                    throw new IllegalStateException("cannot store " + name);
                }
                super.set(scope, name, deps);
            }
        };
        Module program = Parser.parse("""
                x = 1
                a = x
                broken = a
                c = a
                print(c)
                """);
        AnalysisResult result = new DependencyAnalyzer(program, AnalyzerConfig.defaults(),
                new PrintStream(programOutput, true, StandardCharsets.UTF_8), failing).run();

        assertTrue(result.completed());
        assertEquals(List.of("4,1,a,x", "5,1,c,a", "5,1,c,x"), lines(result));
        assertEquals("1\n", programOutput.toString(StandardCharsets.UTF_8));
    }
}
