package org.dynflow.parse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

public class SyntaxValidator {

    private static final Logger LOGGER = LoggerFactory.getLogger(SyntaxValidator.class);

    /**
     * 检查源码能否被解析
     *
     * @return true = 语法正确; false = 语法错误
     */
    public static boolean validateSyntax(String source) {
        Optional<ParseError> problem = findProblem(source);
        problem.ifPresent(e -> LOGGER.warn("语法验证失败 -> Line {}: {}", e.getLine(), e.getProblem()));
        return problem.isEmpty();
    }

    /**
     * 返回第一个语法错误；空源码是合法的空程序
     */
    public static Optional<ParseError> findProblem(String source) {
        if (source == null) {
            return Optional.of(new ParseError(1, 1, "no source"));
        }
        try {
            Parser.parse(source);
            return Optional.empty();
        } catch (ParseError e) {
            return Optional.of(e);
        }
    }
}
