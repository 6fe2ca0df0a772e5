package org.dynflow.parse;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;

/**
 * 把源码切分为词法单元。
 * <p>
 * 行首的缩进被翻译成 INDENT / DEDENT；括号内部以及反斜杠续行时不产生 NEWLINE；
 * 空行和只有注释的行直接跳过。
 */
public class Lexer {

    static final Set<String> KEYWORDS = Set.of(
            "False", "None", "True", "and", "as", "assert", "break", "continue", "def", "del",
            "elif", "else", "for", "global", "if", "in", "is", "not", "or", "pass", "raise",
            "return", "while", "with",
            // 保留字，解析器会直接报不支持
            "class", "import", "from", "try", "except", "finally", "lambda", "yield",
            "nonlocal", "async", "await");

    private static final String[] OPERATORS = {
            "**=", "//=",
            "**", "//", "==", "!=", "<=", ">=", "+=", "-=", "*=", "/=", "%=", "->",
            "+", "-", "*", "/", "%", "<", ">", "=", "(", ")", "[", "]", "{", "}", ",", ":", ".", ";"
    };

    private final String src;
    private final List<Token> tokens = new ArrayList<>();
    private final Deque<Integer> indents = new ArrayDeque<>();
    private int pos = 0;
    private int line = 1;
    private int lineStart = 0;
    private int parenDepth = 0;
    private boolean atLineStart = true;

    public Lexer(String src) {
        // 统一换行符，行号只按 '\n' 计算
        this.src = src.replace("\r\n", "\n").replace('\r', '\n');
        indents.push(0);
    }

    public static List<Token> tokenize(String src) {
        return new Lexer(src).run();
    }

    public List<Token> run() {
        while (pos < src.length()) {
            if (atLineStart && parenDepth == 0) {
                if (readIndentation()) continue;
            }
            char c = src.charAt(pos);
            if (c == ' ' || c == '\t' || c == '\f') {
                pos++;
            } else if (c == '\\' && peekChar(1) == '\n') {
                pos += 2;
                newLine();
            } else if (c == '#') {
                skipComment();
            } else if (c == '\n') {
                if (parenDepth == 0) {
                    add(TokenType.NEWLINE, "\n", null, line, col());
                    atLineStart = true;
                }
                pos++;
                newLine();
            } else if (Character.isLetter(c) || c == '_') {
                readNameOrString();
            } else if (Character.isDigit(c) || (c == '.' && Character.isDigit(peekChar(1)))) {
                readNumber();
            } else if (c == '"' || c == '\'') {
                readString(pos, false);
            } else {
                readOperator();
            }
        }
        if (parenDepth > 0) {
            throw new ParseError(line, col(), "unexpected end of input inside brackets");
        }
        if (!tokens.isEmpty() && tokens.get(tokens.size() - 1).type() != TokenType.NEWLINE) {
            add(TokenType.NEWLINE, "\n", null, line, col());
        }
        while (indents.peek() > 0) {
            indents.pop();
            add(TokenType.DEDENT, "", null, line, col());
        }
        add(TokenType.END, "", null, line, col());
        return tokens;
    }

    /**
     * 处理行首缩进。返回 true 表示这一行是空行（或只有注释），已经整体跳过。
     */
    private boolean readIndentation() {
        int width = 0;
        while (pos < src.length()) {
            char c = src.charAt(pos);
            if (c == ' ') {
                width++;
            } else if (c == '\t') {
                width = (width / 8 + 1) * 8;
            } else if (c != '\f') {
                break;
            }
            pos++;
        }
        if (pos >= src.length()) {
            return true;
        }
        char c = src.charAt(pos);
        if (c == '#') {
            skipComment();
            return true;
        }
        if (c == '\n') {
            pos++;
            newLine();
            return true;
        }
        if (c == '\\' && peekChar(1) == '\n') {
            // 续行不影响缩进
            atLineStart = false;
            return false;
        }
        atLineStart = false;
        int current = indents.peek();
        if (width > current) {
            indents.push(width);
            add(TokenType.INDENT, "", null, line, col());
        } else if (width < current) {
            while (indents.peek() > width) {
                indents.pop();
                add(TokenType.DEDENT, "", null, line, col());
            }
            if (indents.peek() != width) {
                throw new ParseError(line, col(), "unindent does not match any outer indentation level");
            }
        }
        return false;
    }

    private void skipComment() {
        while (pos < src.length() && src.charAt(pos) != '\n') pos++;
    }

    private void readNameOrString() {
        int startCol = col();
        int start = pos;
        // r'...' 形式的原始字符串
        char c = src.charAt(pos);
        if ((c == 'r' || c == 'R') && (peekChar(1) == '\'' || peekChar(1) == '"')) {
            readString(pos + 1, true);
            return;
        }
        while (pos < src.length() && (Character.isLetterOrDigit(src.charAt(pos)) || src.charAt(pos) == '_')) {
            pos++;
        }
        String word = src.substring(start, pos);
        add(KEYWORDS.contains(word) ? TokenType.KEYWORD : TokenType.NAME, word, null, line, startCol);
    }

    private void readNumber() {
        int startCol = col();
        int start = pos;
        char c = src.charAt(pos);
        if (c == '0' && pos + 1 < src.length() && "xXoObB".indexOf(src.charAt(pos + 1)) >= 0) {
            char kind = Character.toLowerCase(src.charAt(pos + 1));
            pos += 2;
            int digitsStart = pos;
            while (pos < src.length() && (Character.isLetterOrDigit(src.charAt(pos)) || src.charAt(pos) == '_')) pos++;
            String digits = src.substring(digitsStart, pos).replace("_", "");
            int radix = kind == 'x' ? 16 : kind == 'o' ? 8 : 2;
            add(TokenType.INT, src.substring(start, pos), parseLong(digits, radix, startCol), line, startCol);
            return;
        }
        boolean isFloat = false;
        while (pos < src.length() && (Character.isDigit(src.charAt(pos)) || src.charAt(pos) == '_')) pos++;
        if (pos < src.length() && src.charAt(pos) == '.') {
            isFloat = true;
            pos++;
            while (pos < src.length() && (Character.isDigit(src.charAt(pos)) || src.charAt(pos) == '_')) pos++;
        }
        if (pos < src.length() && (src.charAt(pos) == 'e' || src.charAt(pos) == 'E')) {
            int save = pos;
            pos++;
            if (pos < src.length() && (src.charAt(pos) == '+' || src.charAt(pos) == '-')) pos++;
            if (pos < src.length() && Character.isDigit(src.charAt(pos))) {
                isFloat = true;
                while (pos < src.length() && Character.isDigit(src.charAt(pos))) pos++;
            } else {
                pos = save;
            }
        }
        if (pos < src.length() && (Character.isLetter(src.charAt(pos)) || src.charAt(pos) == '_')) {
            throw new ParseError(line, col(), "invalid decimal literal");
        }
        String text = src.substring(start, pos);
        String clean = text.replace("_", "");
        if (isFloat) {
            add(TokenType.FLOAT, text, Double.parseDouble(clean), line, startCol);
        } else {
            add(TokenType.INT, text, parseLong(clean, 10, startCol), line, startCol);
        }
    }

    private long parseLong(String digits, int radix, int startCol) {
        try {
            return Long.parseLong(digits, radix);
        } catch (NumberFormatException e) {
            throw new ParseError(line, startCol, "invalid or too large integer literal");
        }
    }

    /**
     * @param quotePos 引号所在位置（原始字符串时跳过了前缀 r）
     */
    private void readString(int quotePos, boolean raw) {
        int startLine = line;
        int startCol = col();
        char quote = src.charAt(quotePos);
        boolean triple = quotePos + 2 < src.length()
                && src.charAt(quotePos + 1) == quote && src.charAt(quotePos + 2) == quote;
        pos = quotePos + (triple ? 3 : 1);
        StringBuilder sb = new StringBuilder();
        while (true) {
            if (pos >= src.length()) {
                throw new ParseError(startLine, startCol, "unterminated string literal");
            }
            char c = src.charAt(pos);
            if (c == quote) {
                if (!triple) {
                    pos++;
                    break;
                }
                if (peekChar(1) == quote && peekChar(2) == quote) {
                    pos += 3;
                    break;
                }
            }
            if (c == '\n') {
                if (!triple) {
                    throw new ParseError(startLine, startCol, "unterminated string literal");
                }
                sb.append(c);
                pos++;
                newLine();
                continue;
            }
            if (c == '\\' && pos + 1 < src.length()) {
                char e = src.charAt(pos + 1);
                if (raw) {
                    sb.append(c).append(e);
                    pos += 2;
                    if (e == '\n') newLine();
                    continue;
                }
                pos += 2;
                switch (e) {
                    case 'n' -> sb.append('\n');
                    case 't' -> sb.append('\t');
                    case 'r' -> sb.append('\r');
                    case '0' -> sb.append('\0');
                    case '\\' -> sb.append('\\');
                    case '\'' -> sb.append('\'');
                    case '"' -> sb.append('"');
                    case '\n' -> newLine();
                    case 'x' -> sb.append((char) hex(2, startLine, startCol));
                    case 'u' -> sb.append((char) hex(4, startLine, startCol));
                    default -> sb.append('\\').append(e);
                }
                continue;
            }
            sb.append(c);
            pos++;
        }
        add(TokenType.STRING, src.substring(quotePos, pos), sb.toString(), startLine, startCol);
    }

    private int hex(int n, int startLine, int startCol) {
        if (pos + n > src.length()) {
            throw new ParseError(startLine, startCol, "truncated escape sequence");
        }
        try {
            int v = Integer.parseInt(src.substring(pos, pos + n), 16);
            pos += n;
            return v;
        } catch (NumberFormatException e) {
            throw new ParseError(startLine, startCol, "invalid escape sequence");
        }
    }

    private void readOperator() {
        int startCol = col();
        for (String op : OPERATORS) {
            if (src.startsWith(op, pos)) {
                pos += op.length();
                switch (op) {
                    case "(", "[", "{" -> parenDepth++;
                    case ")", "]", "}" -> {
                        if (parenDepth == 0) {
                            throw new ParseError(line, startCol, "unmatched '" + op + "'");
                        }
                        parenDepth--;
                    }
                    default -> {
                    }
                }
                add(TokenType.OP, op, null, line, startCol);
                return;
            }
        }
        throw new ParseError(line, startCol, "invalid character '" + src.charAt(pos) + "'");
    }

    private char peekChar(int ahead) {
        int p = pos + ahead;
        return p < src.length() ? src.charAt(p) : '\0';
    }

    private void newLine() {
        line++;
        lineStart = pos;
    }

    private int col() {
        return pos - lineStart + 1;
    }

    private void add(TokenType type, String text, Object value, int l, int c) {
        tokens.add(new Token(type, text, value, l, c));
    }
}
