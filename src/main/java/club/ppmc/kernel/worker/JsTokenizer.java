/**
 * JsTokenizer.java
 *
 * 轻量的 JavaScript/TypeScript 词法分析器，供单元格改写与 TypeScript 类型擦除使用。
 * 它不做语法分析，只保证字符串、模板字符串、注释与正则字面量被整体识别，
 * 从而在其中出现的关键字或括号不会干扰改写。空白与注释也作为记号保留，拼接全部记号即得到原文。
 */
package club.ppmc.kernel.worker;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

final class JsTokenizer {

    enum Type {
        IDENTIFIER,
        NUMBER,
        STRING,
        TEMPLATE,
        REGEX,
        PUNCTUATOR,
        WHITESPACE,
        COMMENT
    }

    /**
     * @param newlineBefore 与前一个有效记号之间是否隔着换行。
     */
    record Token(Type type, String text, int start, boolean newlineBefore) {

        boolean is(String value) {
            return (type == Type.PUNCTUATOR || type == Type.IDENTIFIER) && text.equals(value);
        }

        boolean isSignificant() {
            return type != Type.WHITESPACE && type != Type.COMMENT;
        }
    }

    // 按长度降序排列，保证最长匹配
    private static final String[] PUNCTUATORS = {
        ">>>=", "...", "===", "!==", "**=", "<<=", ">>=", ">>>", "&&=", "||=", "??=",
        "=>", "==", "!=", "<=", ">=", "&&", "||", "??", "?.", "++", "--", "+=", "-=", "*=", "/=",
        "%=", "&=", "|=", "^=", "<<", ">>", "**"
    };

    /** 这些关键字之后出现的 "/" 是正则字面量的开始。 */
    private static final Set<String> REGEX_PREFIX_KEYWORDS =
            Set.of("return", "typeof", "instanceof", "in", "of", "new", "delete", "void", "throw",
                    "case", "do", "else", "yield", "await");

    private final String source;
    private final List<Token> tokens = new ArrayList<>();
    private int pos;
    private boolean newlineSeen;
    private Token lastSignificant;

    private JsTokenizer(String source) {
        this.source = source;
    }

    static List<Token> tokenize(String source) {
        var tokenizer = new JsTokenizer(source);
        tokenizer.run();
        return tokenizer.tokens;
    }

    private void run() {
        while (pos < source.length()) {
            int start = pos;
            char c = source.charAt(pos);
            if (Character.isWhitespace(c)) {
                while (pos < source.length() && Character.isWhitespace(source.charAt(pos))) {
                    if (source.charAt(pos) == '\n') {
                        newlineSeen = true;
                    }
                    pos++;
                }
                add(Type.WHITESPACE, start);
            } else if (c == '/' && peek(1) == '/') {
                pos = indexOrEnd(source.indexOf('\n', pos));
                add(Type.COMMENT, start);
            } else if (c == '/' && peek(1) == '*') {
                int end = source.indexOf("*/", pos + 2);
                pos = end < 0 ? source.length() : end + 2;
                if (source.substring(start, pos).indexOf('\n') >= 0) {
                    newlineSeen = true;
                }
                add(Type.COMMENT, start);
            } else if (c == '"' || c == '\'') {
                skipString(c);
                add(Type.STRING, start);
            } else if (c == '`') {
                skipTemplate();
                add(Type.TEMPLATE, start);
            } else if (Character.isDigit(c) || (c == '.' && Character.isDigit(peek(1)))) {
                skipNumber();
                add(Type.NUMBER, start);
            } else if (isIdentifierStart(c) || (c == '#' && isIdentifierStart(peek(1)))) {
                pos++;
                while (pos < source.length() && isIdentifierPart(source.charAt(pos))) {
                    pos++;
                }
                add(Type.IDENTIFIER, start);
            } else if (c == '/' && regexAllowed()) {
                skipRegex();
                add(Type.REGEX, start);
            } else {
                pos += punctuatorLength();
                add(Type.PUNCTUATOR, start);
            }
        }
    }

    private void add(Type type, int start) {
        boolean significant = type != Type.WHITESPACE && type != Type.COMMENT;
        var token = new Token(type, source.substring(start, pos), start, significant && newlineSeen);
        tokens.add(token);
        if (significant) {
            lastSignificant = token;
            newlineSeen = false;
        }
    }

    private char peek(int offset) {
        int index = pos + offset;
        return index < source.length() ? source.charAt(index) : '\0';
    }

    private int indexOrEnd(int index) {
        return index < 0 ? source.length() : index;
    }

    private static boolean isIdentifierStart(char c) {
        return Character.isLetter(c) || c == '_' || c == '$' || c == '\\';
    }

    private static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '$' || c == '\\' || c == '\u200C' || c == '\u200D';
    }

    private void skipString(char quote) {
        pos++;
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (c == '\\') {
                pos += 2;
            } else if (c == quote || c == '\n') {
                pos++;
                return;
            } else {
                pos++;
            }
        }
        pos = Math.min(pos, source.length());
    }

    /** 跳过模板字符串，包括其中可能嵌套字符串与模板的 ${...} 表达式。 */
    private void skipTemplate() {
        pos++;
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (c == '\\') {
                pos += 2;
            } else if (c == '`') {
                pos++;
                return;
            } else if (c == '$' && peek(1) == '{') {
                pos += 2;
                skipTemplateExpression();
            } else {
                pos++;
            }
        }
        pos = Math.min(pos, source.length());
    }

    private void skipTemplateExpression() {
        int depth = 1;
        while (pos < source.length() && depth > 0) {
            char c = source.charAt(pos);
            if (c == '"' || c == '\'') {
                skipString(c);
            } else if (c == '`') {
                skipTemplate();
            } else if (c == '/' && peek(1) == '/') {
                pos = indexOrEnd(source.indexOf('\n', pos));
            } else if (c == '/' && peek(1) == '*') {
                int end = source.indexOf("*/", pos + 2);
                pos = end < 0 ? source.length() : end + 2;
            } else {
                if (c == '{') {
                    depth++;
                } else if (c == '}') {
                    depth--;
                }
                pos++;
            }
        }
    }

    private void skipNumber() {
        if (source.charAt(pos) == '0' && "xXoObB".indexOf(peek(1)) >= 0) {
            pos += 2;
            while (pos < source.length() && (Character.isLetterOrDigit(source.charAt(pos)) || source.charAt(pos) == '_')) {
                pos++;
            }
            return;
        }
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (Character.isDigit(c) || c == '_' || c == '.' || c == 'n') {
                pos++;
            } else if (c == 'e' || c == 'E') {
                pos++;
                if (peek(0) == '+' || peek(0) == '-') {
                    pos++;
                }
            } else {
                return;
            }
        }
    }

    private boolean regexAllowed() {
        Token prev = lastSignificant;
        if (prev == null) {
            return true;
        }
        switch (prev.type()) {
            case NUMBER:
            case STRING:
            case TEMPLATE:
            case REGEX:
                return false;
            case IDENTIFIER:
                return REGEX_PREFIX_KEYWORDS.contains(prev.text());
            default:
                return !(prev.text().equals(")") || prev.text().equals("]") || prev.text().equals("}")
                        || prev.text().equals("++") || prev.text().equals("--"));
        }
    }

    private void skipRegex() {
        pos++;
        boolean inClass = false;
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (c == '\\') {
                pos += 2;
                continue;
            }
            if (c == '\n') {
                return;
            }
            pos++;
            if (c == '[') {
                inClass = true;
            } else if (c == ']') {
                inClass = false;
            } else if (c == '/' && !inClass) {
                break;
            }
        }
        while (pos < source.length() && Character.isLetter(source.charAt(pos))) {
            pos++;
        }
        pos = Math.min(pos, source.length());
    }

    private int punctuatorLength() {
        for (String punctuator : PUNCTUATORS) {
            if (source.startsWith(punctuator, pos)) {
                // "a?.5:b" 中的 "?." 不是可选链
                if (punctuator.equals("?.") && Character.isDigit(peek(2))) {
                    return 1;
                }
                return punctuator.length();
            }
        }
        return 1;
    }
}
