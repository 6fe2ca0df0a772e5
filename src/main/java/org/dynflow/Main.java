package org.dynflow;

import org.dynflow.analysis.AnalysisResult;
import org.dynflow.analysis.DependencyAnalyzer;
import org.dynflow.analysis.RecordFormat;
import org.dynflow.ast.Module;
import org.dynflow.config.AnalyzerConfig;
import org.dynflow.parse.ParseError;
import org.dynflow.parse.Parser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * 读取一个脚本文件：
 * - 解析并执行，逐行收集依赖
 * - 把记录写入输出文件（文本或 JSON）
 * <p>
 * 退出码：0 正常；1 参数错误或 IO 错误；2 语法错误；3 被分析程序运行出错（输出文件照常写出）
 */
public class Main {

    private static final Logger LOGGER = LoggerFactory.getLogger(Main.class);

    static final String USAGE = "Usage: dynflow <source_file> <output_file> [--json]";

    public static void main(String[] args) {
        int code = run(args, System.out, System.err);
        if (code != 0) {
            System.exit(code);
        }
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        boolean json = false;
        int positional = 0;
        String[] files = new String[2];
        for (String a : args) {
            if ("--json".equals(a)) {
                json = true;
            } else if (positional < 2) {
                files[positional++] = a;
            } else {
                positional++;
            }
        }
        if (positional != 2) {
            err.println(USAGE);
            return 1;
        }

        AnalyzerConfig config;
        try {
            config = AnalyzerConfig.load();
        } catch (IllegalArgumentException e) {
            err.println("invalid configuration: " + e.getMessage());
            return 1;
        }
        if (json) {
            config = config.withOutputFormat(AnalyzerConfig.OutputFormat.JSON);
        }

        Path source = Paths.get(files[0]);
        Path output = Paths.get(files[1]);

        String text;
        try {
            text = Files.readString(source, StandardCharsets.UTF_8);
        } catch (IOException e) {
            err.println("cannot read " + source + ": " + e.getMessage());
            return 1;
        }

        Module program;
        try {
            program = Parser.parse(text, source.toAbsolutePath().toString());
        } catch (ParseError e) {
            err.println("SyntaxError: " + e.getProblem() + " (line " + e.getLine() + ", column " + e.getColumn() + ")");
            return 2;
        }

        LOGGER.info("分析 {}，配置 {}", source, config);
        AnalysisResult result = new DependencyAnalyzer(program, config, out).run();

        // 无论程序是否出错都写出已收集的记录
        try (Writer w = Files.newBufferedWriter(output, StandardCharsets.UTF_8)) {
            if (config.outputFormat == AnalyzerConfig.OutputFormat.JSON) {
                w.write(RecordFormat.toJson(result.records(), config.prettyJson));
                w.write('\n');
            } else {
                RecordFormat.writeLines(result.records(), w);
            }
        } catch (IOException e) {
            err.println("cannot write " + output + ": " + e.getMessage());
            return 1;
        }
        LOGGER.info("写出 {} 条记录到 {}", result.records().size(), output);

        if (result.error().isPresent()) {
            err.println(result.error().get());
            return 3;
        }
        return 0;
    }
}
