/**
 * TypeScriptTranspiler.java
 *
 * 基于记号的 TypeScript 类型擦除。只删除类型层面的语法，不做类型检查，也不降级语言特性。
 *
 * <p><b>处理范围</b>:
 *
 * <ul>
 *   <li>删除 interface、type 别名、declare 声明、import type / export type 以及函数重载签名。
 *   <li>删除变量、参数、返回值与类字段上的类型注解，可选标记 "?"，确定赋值标记 "!"，非空断言 "!"。
 *   <li>删除 as / satisfies 断言、泛型参数与泛型实参、implements 子句，以及访问修饰符、readonly、abstract、override。
 *   <li>构造函数的参数属性转换为字段赋值；enum 转换为带反向映射的对象。
 * </ul>
 *
 * 被删除的代码中的换行保留，错误堆栈中的行号与源码一致。
 */
package club.ppmc.kernel.worker;

import club.ppmc.kernel.worker.JsTokenizer.Token;
import club.ppmc.kernel.worker.JsTokenizer.Type;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

public final class TypeScriptTranspiler implements Transpiler {

    private static final Set<String> PARAM_MODIFIERS =
            Set.of("public", "private", "protected", "readonly", "override");

    private static final Set<String> CLASS_MODIFIERS =
            Set.of("public", "private", "protected", "readonly", "override", "abstract", "declare", "static",
                    "async", "get", "set", "accessor");

    private static final Set<String> TS_ONLY_MODIFIERS =
            Set.of("public", "private", "protected", "readonly", "override", "abstract", "declare");

    /** 类型中出现的前缀关键字，其后仍然期待一个类型。 */
    private static final Set<String> TYPE_PREFIXES =
            Set.of("keyof", "typeof", "readonly", "infer", "unique", "asserts", "new", "abstract");

    /** 泛型尖括号内允许出现的标点。 */
    private static final Set<String> TYPE_PUNCTUATORS =
            Set.of(",", ".", "|", "&", "?", ":", "=>", "[", "]", "=", "...", "<", ">", ">>", ">>>");

    /** 这些记号之后的 "<" 开始一个泛型箭头函数或类型断言。 */
    private static final Set<String> EXPRESSION_PREFIXES =
            Set.of("=", "(", ",", "return", "=>", ":", "?", "[", "&&", "||", "??", "{");

    /** 不能作为 as 断言左侧操作数的关键字。 */
    private static final Set<String> NON_OPERAND_KEYWORDS =
            Set.of("return", "typeof", "instanceof", "in", "of", "new", "delete", "void", "throw", "case", "do",
                    "else", "yield", "await", "import", "export", "let", "const", "var");

    @Override
    public String transpile(String source) {
        return new Eraser(source).run();
    }

    @Override
    public String fileExtension() {
        return "ts";
    }

    private static final class Eraser {

        private final String source;
        private final List<Token> all;
        private final List<Integer> sig = new ArrayList<>();
        private final boolean[] removed;
        private final Map<Integer, String> replaced = new HashMap<>();
        private final Map<Integer, String> appended = new HashMap<>();
        private final Set<Integer> handledParens = new HashSet<>();
        private int moduleClauseEnd = -1;

        Eraser(String source) {
            this.source = source;
            this.all = JsTokenizer.tokenize(source);
            for (int i = 0; i < all.size(); i++) {
                if (all.get(i).isSignificant()) {
                    sig.add(i);
                }
            }
            this.removed = new boolean[all.size()];
        }

        // ------------------------------------------------------------ 基础工具

        private int size() {
            return sig.size();
        }

        private Token t(int i) {
            return i >= 0 && i < sig.size() ? all.get(sig.get(i)) : null;
        }

        private boolean is(int i, String text) {
            Token token = t(i);
            return token != null && token.is(text);
        }

        private boolean isIdentifier(int i) {
            Token token = t(i);
            return token != null && token.type() == Type.IDENTIFIER;
        }

        private boolean isRemoved(int i) {
            return removed[sig.get(i)];
        }

        /** 删除有效记号 from..to（含）及其间的空白与注释。 */
        private void remove(int from, int to) {
            if (from < 0 || to < from || from >= sig.size()) {
                return;
            }
            int end = sig.get(Math.min(to, sig.size() - 1));
            for (int k = sig.get(from); k <= end; k++) {
                removed[k] = true;
            }
        }

        /** 前一个未被删除的有效记号。 */
        private int prevLive(int i) {
            int j = i - 1;
            while (j >= 0 && isRemoved(j)) {
                j--;
            }
            return j;
        }

        /** 与 "(" "[" "{" 匹配的闭括号位置；不匹配时返回最后一个记号。 */
        private int matching(int open) {
            int depth = 0;
            for (int j = open; j < size(); j++) {
                Token token = t(j);
                if (token.type() != Type.PUNCTUATOR) {
                    continue;
                }
                switch (token.text()) {
                    case "(", "[", "{" -> depth++;
                    case ")", "]", "}" -> {
                        depth--;
                        if (depth == 0) {
                            return j;
                        }
                    }
                    default -> {
                        // 其他标点
                    }
                }
            }
            return size() - 1;
        }

        /**
         * 与 "<" 匹配的 ">" 位置。尖括号内出现非类型语法时返回 -1，说明这是比较运算符。
         */
        private int matchAngle(int open) {
            int depth = 0;
            for (int j = open; j < size(); j++) {
                Token token = t(j);
                String text = token.text();
                switch (token.type()) {
                    case IDENTIFIER, STRING, TEMPLATE -> {
                        // 类型名或字面量类型
                    }
                    case PUNCTUATOR -> {
                        if (text.equals("<")) {
                            depth++;
                        } else if (text.equals(">") || text.equals(">>") || text.equals(">>>")) {
                            depth -= text.length();
                            if (depth <= 0) {
                                return j;
                            }
                        } else if (text.equals("(") || text.equals("{")) {
                            j = matching(j);
                        } else if (!TYPE_PUNCTUATORS.contains(text)) {
                            return -1;
                        }
                    }
                    default -> {
                        return -1;
                    }
                }
            }
            return -1;
        }

        private boolean isStatementStart(int i) {
            int prev = prevLive(i);
            if (prev < 0) {
                return true;
            }
            Token before = t(prev);
            return t(i).newlineBefore() || before.is(";") || before.is("{") || before.is("}")
                    || before.is("export") || before.is("default");
        }

        private boolean isOperand(Token token) {
            return switch (token.type()) {
                case IDENTIFIER -> !NON_OPERAND_KEYWORDS.contains(token.text());
                case NUMBER, STRING, TEMPLATE, REGEX -> true;
                case PUNCTUATOR -> token.is(")") || token.is("]") || token.is("}");
                default -> false;
            };
        }

        /**
         * 跳过一个类型。
         *
         * @return 类型之后第一个记号的位置。
         */
        private int skipType(int i) {
            boolean expectOperand = true;
            boolean parenGroup = false;
            boolean conditional = false;
            while (i < size()) {
                Token token = t(i);
                if (expectOperand) {
                    if (token.is("(") || token.is("{") || token.is("[")) {
                        parenGroup = token.is("(");
                        i = matching(i) + 1;
                        expectOperand = false;
                    } else if (token.is("<")) {
                        int close = matchAngle(i);
                        if (close < 0) {
                            return i;
                        }
                        i = close + 1;
                    } else if (token.is("|") || token.is("&") || token.is("-")) {
                        i++;
                    } else if (token.type() == Type.IDENTIFIER && TYPE_PREFIXES.contains(token.text())
                            && i + 1 < size() && !isTypeTerminator(t(i + 1))) {
                        i++;
                    } else if (token.type() == Type.IDENTIFIER || token.type() == Type.STRING
                            || token.type() == Type.NUMBER || token.type() == Type.TEMPLATE) {
                        parenGroup = false;
                        expectOperand = false;
                        i++;
                    } else {
                        return i;
                    }
                    continue;
                }
                if (token.newlineBefore() && !(token.is("|") || token.is("&") || token.is("."))) {
                    return i;
                }
                if (token.is(".") || token.is("|") || token.is("&") || token.is("is")) {
                    expectOperand = true;
                    i++;
                } else if (token.is("[")) {
                    i = matching(i) + 1;
                } else if (token.is("<")) {
                    int close = matchAngle(i);
                    if (close < 0) {
                        return i;
                    }
                    i = close + 1;
                } else if (token.is("=>") && parenGroup) {
                    parenGroup = false;
                    expectOperand = true;
                    i++;
                } else if (token.is("extends")) {
                    conditional = true;
                    expectOperand = true;
                    i++;
                } else if (conditional && (token.is("?") || token.is(":"))) {
                    conditional = token.is("?");
                    expectOperand = true;
                    i++;
                } else {
                    return i;
                }
            }
            return i;
        }

        private static boolean isTypeTerminator(Token token) {
            return token.is(",") || token.is(")") || token.is(";") || token.is("=") || token.is(">")
                    || token.is("]") || token.is("}");
        }

        /** 跳过一个表达式，停在同层的 "," ";" 或闭括号处，或按自动分号插入规则结束的行尾。 */
        private int skipExpression(int i) {
            int depth = 0;
            int start = i;
            while (i < size()) {
                Token token = t(i);
                if (depth == 0) {
                    if (token.is(",") || token.is(";") || token.is(")") || token.is("]") || token.is("}")) {
                        return i;
                    }
                    if (i > start && token.newlineBefore() && !continuesLine(i)) {
                        return i;
                    }
                }
                if (token.is("(") || token.is("[") || token.is("{")) {
                    depth++;
                } else if (token.is(")") || token.is("]") || token.is("}")) {
                    depth--;
                }
                i++;
            }
            return i;
        }

        private boolean continuesLine(int i) {
            Token prev = t(i - 1);
            Token token = t(i);
            if (prev != null && prev.type() == Type.PUNCTUATOR
                    && !(prev.is(")") || prev.is("]") || prev.is("}") || prev.is("++") || prev.is("--"))) {
                return true;
            }
            return token.type() == Type.PUNCTUATOR
                    && !(token.is("{") || token.is("!") || token.is("~") || token.is("++") || token.is("--"));
        }

        /** 语句结束位置（含）。blockEnds 为真时同层 "}" 也结束语句。 */
        private int statementEnd(int i, boolean blockEnds) {
            int depth = 0;
            int start = i;
            for (int j = i; j < size(); j++) {
                Token token = t(j);
                if (depth == 0 && j > start && token.newlineBefore() && !continuesLine(j)) {
                    return j - 1;
                }
                if (token.is("(") || token.is("[") || token.is("{")) {
                    depth++;
                } else if (token.is(")") || token.is("]") || token.is("}")) {
                    depth--;
                    if (depth == 0 && blockEnds && token.is("}")) {
                        return is(j + 1, ";") ? j + 1 : j;
                    }
                    if (depth < 0) {
                        return j - 1;
                    }
                } else if (depth == 0 && token.is(";")) {
                    return j;
                }
            }
            return size() - 1;
        }

        private String text(int from, int to) {
            Token first = t(from);
            Token last = t(to);
            return source.substring(first.start(), last.start() + last.text().length());
        }

        // ------------------------------------------------------------ 主流程

        String run() {
            for (int i = 0; i < size(); i++) {
                if (isRemoved(i)) {
                    continue;
                }
                Token token = t(i);
                if (token.type() == Type.IDENTIFIER) {
                    onIdentifier(i, token.text());
                } else if (token.type() == Type.PUNCTUATOR) {
                    onPunctuator(i, token.text());
                }
            }
            return render();
        }

        private void onIdentifier(int i, String text) {
            switch (text) {
                case "interface" -> {
                    if (isStatementStart(i) && isIdentifier(i + 1)) {
                        int open = i + 1;
                        while (open < size() && !is(open, "{")) {
                            open++;
                        }
                        removeWithExport(i, matching(open));
                    }
                }
                case "type" -> {
                    if (isStatementStart(i) && isIdentifier(i + 1) && (is(i + 2, "=") || is(i + 2, "<"))) {
                        removeTypeAlias(i);
                    }
                }
                case "declare" -> {
                    if (isStatementStart(i) && isIdentifier(i + 1)) {
                        Token next = t(i + 1);
                        boolean block = Set.of("module", "namespace", "global", "class", "enum", "interface")
                                .contains(next.text());
                        removeWithExport(i, statementEnd(i, block));
                    }
                }
                case "import" -> onImport(i);
                case "export" -> onExport(i);
                case "enum" -> {
                    if (isIdentifier(i + 1) && is(i + 2, "{")) {
                        int prev = prevLive(i);
                        boolean constEnum = prev >= 0 && t(prev).is("const");
                        int start = constEnum ? prev : i;
                        if (isStatementStart(start)) {
                            convertEnum(start, i);
                        }
                    }
                }
                case "abstract" -> {
                    if (is(i + 1, "class")) {
                        remove(i, i);
                    }
                }
                case "let", "const", "var" -> onDeclaration(i);
                case "function" -> onFunction(i);
                case "class" -> onClass(i);
                case "as", "satisfies" -> onCast(i);
                default -> {
                    // 普通标识符
                }
            }
        }

        private void onPunctuator(int i, String text) {
            switch (text) {
                case "!" -> {
                    int prev = i - 1;
                    if (prev >= 0 && sig.get(prev) == sig.get(i) - 1 && !isRemoved(prev) && isOperand(t(prev))
                            && t(prev).type() != Type.NUMBER && t(prev).type() != Type.STRING) {
                        remove(i, i);
                    }
                }
                case "(" -> onParen(i);
                case "<" -> onAngle(i);
                default -> {
                    // 其他标点
                }
            }
        }

        private void removeWithExport(int start, int end) {
            int prev = prevLive(start);
            if (prev >= 0 && t(prev).is("export")) {
                start = prev;
            }
            remove(start, end);
        }

        private void removeTypeAlias(int i) {
            int j = i + 2;
            if (is(j, "<")) {
                int close = matchAngle(j);
                j = close < 0 ? j + 1 : close + 1;
            }
            if (!is(j, "=")) {
                return;
            }
            int end = skipType(j + 1);
            removeWithExport(i, is(end, ";") ? end : end - 1);
        }

        private void onImport(int i) {
            if (is(i + 1, "type") && !is(i + 2, "from") && !is(i + 2, ",")) {
                int j = i + 2;
                while (j < size() && t(j).type() != Type.STRING) {
                    j++;
                }
                remove(i, is(j + 1, ";") ? j + 1 : j);
                return;
            }
            if (is(i + 1, "{")) {
                int close = matching(i + 1);
                moduleClauseEnd = Math.max(moduleClauseEnd, close);
                removeInlineTypeSpecifiers(i + 1, close);
            } else if (is(i + 1, "*")) {
                moduleClauseEnd = Math.max(moduleClauseEnd, i + 3);
            } else {
                moduleClauseEnd = Math.max(moduleClauseEnd, statementEnd(i, false));
            }
        }

        private void onExport(int i) {
            if (is(i + 1, "type") && is(i + 2, "{")) {
                int j = matching(i + 2);
                if (is(j + 1, "from")) {
                    j += 2;
                }
                remove(i, is(j + 1, ";") ? j + 1 : j);
            } else if (is(i + 1, "{")) {
                int close = matching(i + 1);
                moduleClauseEnd = Math.max(moduleClauseEnd, close);
                removeInlineTypeSpecifiers(i + 1, close);
            } else if (is(i + 1, "*")) {
                moduleClauseEnd = Math.max(moduleClauseEnd, i + 3);
            }
        }

        /** {@code import { type A, B }} 中删除 "type A,"。 */
        private void removeInlineTypeSpecifiers(int open, int close) {
            int j = open + 1;
            while (j < close) {
                int end = j;
                while (end < close && !is(end, ",")) {
                    end++;
                }
                if (is(j, "type") && isIdentifier(j + 1)) {
                    remove(j, end < close ? end : end - 1);
                }
                j = end + 1;
            }
        }

        private void onCast(int i) {
            if (i <= moduleClauseEnd || t(i).newlineBefore()) {
                return;
            }
            int prev = prevLive(i);
            if (prev < 0 || !isOperand(t(prev))) {
                return;
            }
            if (is(i + 1, "const")) {
                remove(i, i + 1);
                return;
            }
            int end = skipType(i + 1);
            if (end > i + 1) {
                remove(i, end - 1);
            }
        }

        private void onDeclaration(int i) {
            if (!(isIdentifier(i + 1) || is(i + 1, "{") || is(i + 1, "["))) {
                return;
            }
            int j = i + 1;
            while (j < size()) {
                if (isIdentifier(j)) {
                    j++;
                } else if (is(j, "{") || is(j, "[")) {
                    j = matching(j) + 1;
                } else {
                    return;
                }
                if (is(j, "!") && is(j + 1, ":")) {
                    remove(j, j);
                    j++;
                }
                if (is(j, ":")) {
                    int end = skipType(j + 1);
                    remove(j, end - 1);
                    j = end;
                }
                if (is(j, "=")) {
                    j = skipExpression(j + 1);
                }
                if (!is(j, ",")) {
                    return;
                }
                j++;
            }
        }

        private void onFunction(int i) {
            int j = i + 1;
            if (is(j, "*")) {
                j++;
            }
            if (isIdentifier(j)) {
                j++;
            }
            if (is(j, "<")) {
                int close = matchAngle(j);
                if (close >= 0) {
                    remove(j, close);
                    j = close + 1;
                }
            }
            if (!is(j, "(")) {
                return;
            }
            j = processParams(j, null) + 1;
            if (is(j, ":")) {
                int end = skipType(j + 1);
                remove(j, end - 1);
                j = end;
            }
            if (!is(j, "{")) {
                // 重载签名，没有函数体
                int start = i;
                int prev = prevLive(start);
                if (prev >= 0 && t(prev).is("async")) {
                    start = prev;
                }
                removeWithExport(start, is(j, ";") ? j : j - 1);
            }
        }

        private void onParen(int i) {
            if (handledParens.contains(i)) {
                return;
            }
            int prev = prevLive(i);
            Token before = prev >= 0 ? t(prev) : null;
            if (before != null && before.is("catch")) {
                processParams(i, null);
                return;
            }
            int close = matching(i);
            if (is(close + 1, "=>")) {
                processParams(i, null);
            } else if (is(close + 1, ":")) {
                int end = skipType(close + 2);
                boolean arrow = is(end, "=>");
                boolean method = is(end, "{") && isMethodShorthand(prev);
                if (arrow || method) {
                    processParams(i, null);
                    remove(close + 1, end - 1);
                }
            } else if (is(close + 1, "{") && isMethodShorthand(prev)) {
                processParams(i, null);
            }
        }

        /** 对象字面量中的方法简写：{ name(...) { } }。 */
        private boolean isMethodShorthand(int nameIndex) {
            if (nameIndex < 0 || !isIdentifier(nameIndex)) {
                return false;
            }
            int before = prevLive(nameIndex);
            return before >= 0 && (t(before).is("{") || t(before).is(","));
        }

        private void onAngle(int i) {
            int prev = prevLive(i);
            Token before = prev >= 0 ? t(prev) : null;
            if (before == null || EXPRESSION_PREFIXES.contains(before.text())) {
                // 泛型箭头函数 <T>(x: T) => x 或类型断言 <T>value
                int close = matchAngle(i);
                if (close >= 0 && close + 1 < size()) {
                    remove(i, close);
                }
                return;
            }
            if (before.type() == Type.IDENTIFIER && !NON_OPERAND_KEYWORDS.contains(before.text())) {
                // 泛型实参 fn<T>(...) / new Foo<T>()
                int close = matchAngle(i);
                if (close >= 0 && (is(close + 1, "(") || (t(close + 1) != null
                        && t(close + 1).type() == Type.TEMPLATE))) {
                    remove(i, close);
                }
            }
        }

        /**
         * 擦除参数列表中的类型。
         *
         * @param properties 收集构造函数参数属性的名字，可以为 null。
         * @return 参数列表 ")" 的位置。
         */
        private int processParams(int open, List<String> properties) {
            handledParens.add(open);
            int close = matching(open);
            int j = open + 1;
            while (j < close) {
                int start = j;
                boolean property = false;
                while (isIdentifier(j) && PARAM_MODIFIERS.contains(t(j).text())
                        && (isIdentifier(j + 1) || is(j + 1, "{") || is(j + 1, "[") || is(j + 1, "..."))) {
                    remove(j, j);
                    property = true;
                    j++;
                }
                if (is(j, "this") && is(j + 1, ":")) {
                    int end = skipType(j + 2);
                    remove(j, is(end, ",") ? end : end - 1);
                    j = is(end, ",") ? end + 1 : end;
                    continue;
                }
                if (is(j, "...")) {
                    j++;
                }
                String name = null;
                if (isIdentifier(j)) {
                    name = t(j).text();
                    j++;
                } else if (is(j, "{") || is(j, "[")) {
                    j = matching(j) + 1;
                }
                if (is(j, "?")) {
                    remove(j, j);
                    j++;
                }
                if (is(j, ":")) {
                    int end = skipType(j + 1);
                    remove(j, end - 1);
                    j = end;
                }
                if (property && name != null && properties != null) {
                    properties.add(name);
                }
                j = skipToParamEnd(j, close);
                if (is(j, ",")) {
                    j++;
                }
                if (j == start) {
                    j++;
                }
            }
            return close;
        }

        private int skipToParamEnd(int j, int close) {
            while (j < close && !is(j, ",")) {
                if (is(j, "(") || is(j, "[") || is(j, "{")) {
                    j = matching(j);
                }
                j++;
            }
            return Math.min(j, close);
        }

        private void onClass(int i) {
            int j = i + 1;
            if (isIdentifier(j) && !is(j, "extends") && !is(j, "implements")) {
                j++;
            }
            if (is(j, "<")) {
                int close = matchAngle(j);
                if (close >= 0) {
                    remove(j, close);
                    j = close + 1;
                }
            }
            boolean hasSuper = false;
            while (j < size() && !is(j, "{")) {
                if (is(j, "extends")) {
                    hasSuper = true;
                } else if (is(j, "<")) {
                    int close = matchAngle(j);
                    if (close >= 0) {
                        remove(j, close);
                        j = close + 1;
                        continue;
                    }
                } else if (is(j, "implements")) {
                    int k = j;
                    while (k < size() && !is(k, "{")) {
                        k++;
                    }
                    remove(j, k - 1);
                    j = k;
                    break;
                } else if (is(j, "(")) {
                    j = matching(j);
                }
                j++;
            }
            if (j < size()) {
                processClassBody(j, hasSuper);
            }
        }

        private void processClassBody(int open, boolean hasSuper) {
            int close = matching(open);
            int j = open + 1;
            while (j < close) {
                if (is(j, ";")) {
                    j++;
                    continue;
                }
                int memberStart = j;
                boolean erased = false;
                while (isIdentifier(j) && CLASS_MODIFIERS.contains(t(j).text()) && startsMemberName(j + 1)) {
                    String modifier = t(j).text();
                    if (TS_ONLY_MODIFIERS.contains(modifier)) {
                        remove(j, j);
                        erased |= modifier.equals("abstract") || modifier.equals("declare");
                    }
                    j++;
                }
                if (is(j, "[") && isIdentifier(j + 1) && is(j + 2, ":")) {
                    // 索引签名
                    int end = memberEnd(j, close);
                    remove(memberStart, end);
                    j = end + 1;
                    continue;
                }
                if (is(j, "*")) {
                    j++;
                }
                String name = t(j).text();
                j = is(j, "[") ? matching(j) + 1 : j + 1;
                if (is(j, "?") || is(j, "!")) {
                    remove(j, j);
                    j++;
                }
                if (is(j, "<")) {
                    int angleClose = matchAngle(j);
                    if (angleClose >= 0) {
                        remove(j, angleClose);
                        j = angleClose + 1;
                    }
                }
                if (is(j, "(")) {
                    j = processMethod(memberStart, j, name.equals("constructor"), hasSuper, erased);
                    continue;
                }
                if (is(j, ":")) {
                    int end = skipType(j + 1);
                    remove(j, end - 1);
                    j = end;
                }
                int end = memberEnd(j, close);
                if (erased) {
                    remove(memberStart, end);
                }
                j = end + 1;
            }
        }

        /** @return 方法之后的位置。 */
        private int processMethod(int memberStart, int open, boolean constructor, boolean hasSuper, boolean erased) {
            List<String> properties = new ArrayList<>();
            int j = processParams(open, properties) + 1;
            if (is(j, ":")) {
                int end = skipType(j + 1);
                remove(j, end - 1);
                j = end;
            }
            if (!is(j, "{")) {
                // 重载签名或抽象方法
                int end = is(j, ";") ? j : j - 1;
                remove(memberStart, end);
                return end + 1;
            }
            int bodyClose = matching(j);
            if (erased) {
                remove(memberStart, bodyClose);
            } else if (constructor && !properties.isEmpty()) {
                insertPropertyAssignments(j, bodyClose, hasSuper, properties);
            }
            return bodyClose + 1;
        }

        private void insertPropertyAssignments(int bodyOpen, int bodyClose, boolean hasSuper, List<String> names) {
            var assignments = new StringBuilder();
            for (String name : names) {
                assignments.append(" this.").append(name).append(" = ").append(name).append(";");
            }
            int anchor = bodyOpen;
            String prefix = "";
            if (hasSuper) {
                for (int k = bodyOpen + 1; k < bodyClose; k++) {
                    if (is(k, "super") && is(k + 1, "(")) {
                        anchor = matching(k + 1);
                        if (is(anchor + 1, ";")) {
                            anchor++;
                        } else {
                            prefix = ";";
                        }
                        break;
                    }
                }
            }
            appended.merge(sig.get(anchor), prefix + assignments, String::concat);
        }

        private boolean startsMemberName(int i) {
            Token token = t(i);
            if (token == null) {
                return false;
            }
            return token.type() == Type.IDENTIFIER || token.type() == Type.STRING || token.type() == Type.NUMBER
                    || token.is("[") || token.is("*");
        }

        /** 类成员的最后一个记号位置。 */
        private int memberEnd(int j, int close) {
            if (is(j, ";")) {
                return j;
            }
            int depth = 0;
            int start = j;
            for (int k = j; k < close; k++) {
                Token token = t(k);
                if (depth == 0 && k > start && token.newlineBefore() && !continuesLine(k)) {
                    return k - 1;
                }
                if (token.is("(") || token.is("[") || token.is("{")) {
                    depth++;
                } else if (token.is(")") || token.is("]") || token.is("}")) {
                    depth--;
                } else if (depth == 0 && token.is(";")) {
                    return k;
                }
            }
            return close - 1;
        }

        /**
         * enum 转换为：var E; (function (E) { ... })(E || (E = {}));
         */
        private void convertEnum(int start, int enumIndex) {
            String name = t(enumIndex + 1).text();
            int open = enumIndex + 2;
            int close = matching(open);
            var out = new StringBuilder();
            out.append("var ").append(name).append("; (function (").append(name).append(") { var __next = -1;");
            int j = open + 1;
            while (j < close) {
                Token member = t(j);
                String key = member.type() == Type.STRING ? member.text() : "\"" + member.text() + "\"";
                j++;
                if (is(j, "=")) {
                    int end = skipExpression(j + 1);
                    String init = text(j + 1, end - 1);
                    if (end - 1 == j + 1 && t(j + 1).type() == Type.STRING) {
                        out.append(' ').append(name).append('[').append(key).append("] = ").append(init).append(';');
                    } else {
                        out.append(' ').append(name).append('[').append(name).append('[').append(key)
                                .append("] = __next = (").append(init).append(")] = ").append(key).append(';');
                    }
                    j = end;
                } else {
                    out.append(' ').append(name).append('[').append(name).append('[').append(key)
                            .append("] = ++__next] = ").append(key).append(';');
                }
                if (is(j, ",")) {
                    j++;
                }
            }
            out.append(" })(").append(name).append(" || (").append(name).append(" = {}));");
            int end = is(close + 1, ";") ? close + 1 : close;
            remove(start, end);
            int first = sig.get(start);
            removed[first] = false;
            replaced.put(first, out.toString());
        }

        // ------------------------------------------------------------ 输出

        private String render() {
            var out = new StringBuilder();
            boolean gap = false;
            for (int k = 0; k < all.size(); k++) {
                Token token = all.get(k);
                if (removed[k]) {
                    token.text().chars().filter(c -> c == '\n').forEach(c -> out.append('\n'));
                    gap |= token.isSignificant();
                    continue;
                }
                String text = replaced.getOrDefault(k, token.text());
                if (gap && !text.isEmpty() && out.length() > 0
                        && isWordChar(out.charAt(out.length() - 1)) && isWordChar(text.charAt(0))) {
                    out.append(' ');
                }
                gap = false;
                out.append(text);
                String extra = appended.get(k);
                if (extra != null) {
                    out.append(extra);
                }
            }
            return out.toString();
        }

        private static boolean isWordChar(char c) {
            return Character.isLetterOrDigit(c) || c == '_' || c == '$';
        }
    }
}
