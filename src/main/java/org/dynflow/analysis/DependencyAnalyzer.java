package org.dynflow.analysis;

import org.dynflow.ast.Module;
import org.dynflow.config.AnalyzerConfig;
import org.dynflow.interp.Frame;
import org.dynflow.interp.Interpreter;
import org.dynflow.interp.LineHook;
import org.dynflow.interp.ProgramError;
import org.dynflow.parse.Parser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * 对一个程序做一次动态数据流分析：
 * - 静态分类每一行的名字
 * - 在解释器的逐行回调中传播依赖集合
 * - 每执行一行，为该行读取的变量输出它们在这一行执行前的依赖
 * <p>
 * 一个实例只对应一次运行，所有状态（依赖存储、行计数、记录）都属于这个实例。不是线程安全的。
 */
public class DependencyAnalyzer implements LineHook {

    private static final Logger LOGGER = LoggerFactory.getLogger(DependencyAnalyzer.class);

    private final Module program;
    private final Map<Integer, LineClassification> lines;
    private final AnalyzerConfig config;
    private final PrintStream programOut;

    private final ScopeStore store;
    private final DependencyPropagator propagator;
    private final Map<Integer, Integer> executions = new HashMap<>();
    private final List<DependencyRecord> records = new ArrayList<>();

    private Set<String> builtinNames = Set.of();
    private boolean started = false;

    /**
     * @param programOut 被分析程序 print 的输出目标
     */
    public DependencyAnalyzer(Module program, AnalyzerConfig config, PrintStream programOut) {
        this(program, config, programOut, new ScopeStore());
    }

    DependencyAnalyzer(Module program, AnalyzerConfig config, PrintStream programOut, ScopeStore store) {
        this.program = program;
        this.lines = LineClassifier.classify(program);
        this.config = config;
        this.programOut = programOut;
        this.store = store;
        this.propagator = new DependencyPropagator(store, this::isBuiltin);
    }

    /**
     * 使用 classpath 配置分析一段源码，程序输出写到标准输出。
     *
     * @throws org.dynflow.parse.ParseError 源码无法解析，此时程序不会执行
     */
    public static AnalysisResult analyze(String source) {
        return analyze(source, AnalyzerConfig.load(), System.out);
    }

    public static AnalysisResult analyze(String source, AnalyzerConfig config, PrintStream programOut) {
        Module program = Parser.parse(source);
        return new DependencyAnalyzer(program, config, programOut).run();
    }

    /**
     * 执行程序并收集记录。程序自身出错时返回出错前的全部记录以及错误描述。
     */
    public AnalysisResult run() {
        if (started) {
            throw new IllegalStateException("DependencyAnalyzer instances are single-use");
        }
        started = true;

        Interpreter interpreter = new Interpreter(this, programOut, config.maxLineEvents, config.maxCallDepth);
        builtinNames = Set.copyOf(interpreter.builtinNames());

        String error = null;
        try {
            interpreter.run(program);
        } catch (ProgramError e) {
            error = e.describe();
            LOGGER.info("被分析程序异常结束: {}", error);
        } catch (RuntimeException e) {
            error = "InternalError: " + e;
            LOGGER.error("解释器内部错误，保留已收集的 {} 条记录", records.size(), e);
        } finally {
            programOut.flush();
        }
        LOGGER.debug("{} 分析完成，{} 条记录", program.sourceName, records.size());
        return new AnalysisResult(records, error);
    }

    private boolean isOwnCode(Frame frame) {
        return program.sourceName.equals(frame.sourceName());
    }

    private static Scope scopeOf(Frame frame) {
        return frame.isModuleLevel() ? Scope.MODULE : Scope.call(frame.invocationId());
    }

    /**
     * 内置名字：在运行开始时的内置表中，并且程序还没有从当前作用域可见的位置绑定过它
     */
    boolean isBuiltin(Scope scope, String name) {
        return builtinNames.contains(name) && !store.hasEntry(scope, name);
    }

    @Override
    public void onCall(Frame frame) {
        if (frame.isModuleLevel() || !isOwnCode(frame)) return;
        try {
            // 形参相当于从无名字赋值，避免回落到同名全局变量的依赖
            Scope scope = scopeOf(frame);
            for (String param : frame.locals().keySet()) {
                store.set(scope, param, Set.of());
            }
        } catch (RuntimeException e) {
            LOGGER.warn("登记 {} 的形参失败", frame, e);
        }
    }

    @Override
    public void onReturn(Frame frame) {
        if (!frame.isModuleLevel()) {
            store.discard(scopeOf(frame));
        }
    }

    @Override
    public void onLine(Frame frame, int line) {
        if (!isOwnCode(frame)) return;
        try {
            record(scopeOf(frame), line);
        } catch (RuntimeException e) {
            LOGGER.warn("处理第 {} 行时出错，本次执行不产生记录", line, e);
        }
    }

    private void record(Scope scope, int line) {
        LineClassification c = lines.get(line);
        if (c == null) return;

        Map<String, Set<String>> before = new LinkedHashMap<>();
        for (String name : c.emitCandidates()) {
            if (!isBuiltin(scope, name)) {
                before.put(name, new TreeSet<>(store.get(scope, name)));
            }
        }

        if (!c.assigned().isEmpty()) {
            propagator.propagate(scope, c.assigned(), c.rhs());
        }

        int execution = executions.merge(line, 1, Integer::sum);
        for (Map.Entry<String, Set<String>> e : before.entrySet()) {
            for (String dep : e.getValue()) {
                records.add(new DependencyRecord(line, execution, e.getKey(), dep));
            }
        }
    }
}
