/**
 * CellSourceRewriter.java
 *
 * 在单元格源码交给 GraalJS 之前改写其顶层声明，使单元格可以反复执行，且定义在单元格之间保留。
 *
 * <p><b>设计思路</b>:
 *
 * <ul>
 *   <li>顶层 {@code let}/{@code const} 改为 {@code var}，顶层 {@code class C} 改为 {@code var C = class C}，
 *       避免重复执行时出现重复声明错误。
 *   <li>使用了顶层 {@code await} 的单元格包装进一个 async 箭头函数。函数开头从 globalThis 读入顶层声明的名字，
 *       结尾把它们写回 globalThis，最后一个表达式语句的值作为函数返回值。
 *   <li>只做词法层面的识别，语句边界依照自动分号插入的规则近似判断。
 * </ul>
 */
package club.ppmc.kernel.worker;

import club.ppmc.kernel.worker.JsTokenizer.Token;
import club.ppmc.kernel.worker.JsTokenizer.Type;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

public final class CellSourceRewriter {

    static final String PERSIST_FUNCTION = "__nbPersist$";
    private static final String PERSIST_VALUE = "__nbValue$";

    /** 其后的 "(...)" 不是函数参数列表。 */
    private static final Set<String> CONTROL_KEYWORDS = Set.of("if", "for", "while", "switch", "catch", "with");

    /** 以这些记号开头的语句不是表达式语句。 */
    private static final Set<String> STATEMENT_KEYWORDS =
            Set.of("var", "let", "const", "class", "function", "if", "for", "while", "do", "switch", "try",
                    "return", "throw", "break", "continue", "import", "export", "else", "catch", "finally",
                    "debugger", "{", ";");

    /** 以这些记号开头的语句以块结束。 */
    private static final Set<String> BLOCK_STATEMENTS =
            Set.of("if", "for", "while", "switch", "try", "function", "class", "with", "{");

    /** 出现在行尾时，下一行仍属于同一语句。 */
    private static final Set<String> CONTINUING_KEYWORDS =
            Set.of("new", "typeof", "instanceof", "in", "of", "void", "delete", "await", "yield", "else", "do",
                    "extends", "throw", "case", "var", "let", "const", "async");

    /** 出现在行首时，它延续上一行的语句。 */
    private static final Set<String> CONTINUING_PREFIX_KEYWORDS =
            Set.of("instanceof", "in", "of", "else", "catch", "finally");

    private CellSourceRewriter() {}

    /** 一条顶层语句在有效记号列表中的范围。 */
    private record Statement(int first, int last) {}

    /**
     * 改写单元格源码。
     */
    public static String rewrite(String source) {
        Analysis analysis = analyze(source);
        return analysis.topLevelAwait ? wrapAsync(analysis) : analysis.render(Map.of(), Map.of());
    }

    /** 源码是否在任何函数之外使用了 await。 */
    static boolean hasTopLevelAwait(String source) {
        return analyze(source).topLevelAwait;
    }

    private static Analysis analyze(String source) {
        List<Token> all = JsTokenizer.tokenize(source);
        List<Integer> sig = new ArrayList<>();
        for (int i = 0; i < all.size(); i++) {
            if (all.get(i).isSignificant()) {
                sig.add(i);
            }
        }
        var analysis = new Analysis(all, sig);
        analysis.run();
        return analysis;
    }

    private static String wrapAsync(Analysis analysis) {
        Map<Integer, String> before = new HashMap<>();
        Map<Integer, String> after = new HashMap<>();
        Statement last = analysis.statements.isEmpty() ? null : analysis.statements.get(analysis.statements.size() - 1);
        boolean returnsLast = last != null && analysis.isExpressionStatement(last);
        if (returnsLast) {
            int lastToken = last.last();
            boolean hasSemicolon = analysis.tok(lastToken).is(";") && lastToken > last.first();
            int exprEnd = hasSemicolon ? lastToken - 1 : lastToken;
            before.put(analysis.sig.get(last.first()), "return " + PERSIST_FUNCTION + "(\n");
            after.put(analysis.sig.get(exprEnd), hasSemicolon ? "\n)" : "\n);");
        }

        var out = new StringBuilder("(async () => {\n");
        List<String> restored = new ArrayList<>(analysis.declaredNames);
        if (!restored.isEmpty()) {
            out.append("var ");
            for (int i = 0; i < restored.size(); i++) {
                out.append(i == 0 ? "" : ", ").append(restored.get(i)).append(" = globalThis.").append(restored.get(i));
            }
            out.append(";\n");
        }
        out.append("const ").append(PERSIST_FUNCTION).append(" = (").append(PERSIST_VALUE).append(") => { ");
        for (String name : analysis.declaredNames) {
            out.append("globalThis.").append(name).append(" = ").append(name).append("; ");
        }
        for (String name : analysis.functionNames) {
            out.append("globalThis.").append(name).append(" = ").append(name).append("; ");
        }
        out.append("return ").append(PERSIST_VALUE).append("; };\n");
        out.append(analysis.render(before, after));
        if (!returnsLast) {
            out.append("\n").append(PERSIST_FUNCTION).append("(undefined);");
        }
        out.append("\n})()");
        return out.toString();
    }

    private static final class Analysis {

        private final List<Token> all;
        private final List<Integer> sig;
        private final Map<Integer, String> replacements = new HashMap<>();
        private final Map<Integer, String> insertions = new HashMap<>();
        private final List<Statement> statements = new ArrayList<>();
        private final Set<String> declaredNames = new LinkedHashSet<>();
        private final Set<String> functionNames = new LinkedHashSet<>();
        private boolean topLevelAwait;

        /** 每个未闭合括号：是否为函数体的 "{"。 */
        private final Deque<Boolean> brackets = new ArrayDeque<>();
        /** 每个未闭合 "(" 之前的记号。 */
        private final Deque<String> parenOwners = new ArrayDeque<>();
        /** 无花括号箭头函数体开始时的括号深度。 */
        private final Deque<Integer> arrowBodies = new ArrayDeque<>();
        private int functionBraces;
        private String lastParenOwner;

        Analysis(List<Token> all, List<Integer> sig) {
            this.all = all;
            this.sig = sig;
        }

        Token tok(int sigIndex) {
            return all.get(sig.get(sigIndex));
        }

        private Token tokOrNull(int sigIndex) {
            return sigIndex >= 0 && sigIndex < sig.size() ? tok(sigIndex) : null;
        }

        void run() {
            int statementStart = -1;
            for (int i = 0; i < sig.size(); i++) {
                Token token = tok(i);
                Token prev = tokOrNull(i - 1);

                if (brackets.isEmpty() && statementStart >= 0 && token.newlineBefore()
                        && !continuesStatement(prev, token)) {
                    closeStatement(statementStart, i - 1);
                    statementStart = -1;
                }
                if (brackets.isEmpty() && statementStart < 0) {
                    statementStart = i;
                    onStatementStart(i);
                }

                trackScopes(i, token, prev);

                if (brackets.isEmpty()) {
                    if (token.is(";")) {
                        closeStatement(statementStart, i);
                        statementStart = -1;
                    } else if (token.is("}") && endsBlockStatement(statementStart, i)) {
                        closeStatement(statementStart, i);
                        statementStart = -1;
                    }
                }
            }
            if (statementStart >= 0) {
                closeStatement(statementStart, sig.size() - 1);
            }
        }

        private void trackScopes(int i, Token token, Token prev) {
            if (token.type() == Type.IDENTIFIER && token.text().equals("await")
                    && functionBraces == 0 && arrowBodies.isEmpty()
                    && (prev == null || !(prev.is(".") || prev.is("?.")))) {
                topLevelAwait = true;
            }
            if (token.type() != Type.PUNCTUATOR) {
                return;
            }
            switch (token.text()) {
                case "(" -> {
                    String owner = prev == null ? "" : prev.text();
                    Token beforePrev = tokOrNull(i - 2);
                    if (owner.equals("await") && beforePrev != null && beforePrev.is("for")) {
                        owner = "for";
                    }
                    parenOwners.push(owner);
                    brackets.push(false);
                }
                case "[" -> brackets.push(false);
                case "{" -> {
                    boolean function = prev != null
                            && (prev.is("=>") || (prev.is(")") && lastParenOwner != null
                                    && !CONTROL_KEYWORDS.contains(lastParenOwner)));
                    if (function) {
                        functionBraces++;
                    }
                    brackets.push(function);
                }
                case ")", "]", "}" -> {
                    if (token.is(")") && !parenOwners.isEmpty()) {
                        lastParenOwner = parenOwners.pop();
                    }
                    if (!brackets.isEmpty() && brackets.pop()) {
                        functionBraces--;
                    }
                    while (!arrowBodies.isEmpty() && arrowBodies.peek() > brackets.size()) {
                        arrowBodies.pop();
                    }
                }
                case ",", ";" -> {
                    while (!arrowBodies.isEmpty() && arrowBodies.peek() == brackets.size()) {
                        arrowBodies.pop();
                    }
                }
                case "=>" -> {
                    Token next = tokOrNull(i + 1);
                    if (next != null && !next.is("{")) {
                        arrowBodies.push(brackets.size());
                    }
                }
                default -> {
                    // 其他运算符不影响作用域
                }
            }
        }

        private boolean continuesStatement(Token prev, Token token) {
            if (prev == null) {
                return false;
            }
            if (prev.type() == Type.PUNCTUATOR) {
                if (prev.is(")")) {
                    if (lastParenOwner != null && CONTROL_KEYWORDS.contains(lastParenOwner)
                            && !lastParenOwner.equals("catch")) {
                        return true;
                    }
                } else if (!(prev.is("]") || prev.is("}") || prev.is("++") || prev.is("--"))) {
                    return true;
                }
            } else if (prev.type() == Type.IDENTIFIER && CONTINUING_KEYWORDS.contains(prev.text())) {
                return true;
            }
            if (token.type() == Type.TEMPLATE) {
                return true;
            }
            if (token.type() == Type.PUNCTUATOR) {
                return !(token.is("++") || token.is("--") || token.is("!") || token.is("~") || token.is("{")
                        || token.is(";"));
            }
            return token.type() == Type.IDENTIFIER && CONTINUING_PREFIX_KEYWORDS.contains(token.text());
        }

        private boolean endsBlockStatement(int statementStart, int closeIndex) {
            if (statementStart < 0) {
                return false;
            }
            String first = leadingKeyword(statementStart);
            if (!BLOCK_STATEMENTS.contains(first)) {
                return false;
            }
            Token next = tokOrNull(closeIndex + 1);
            return next == null || !(next.is("else") || next.is("catch") || next.is("finally"));
        }

        /** 语句的首个关键字，"async function" 视为 "function"。 */
        private String leadingKeyword(int statementStart) {
            Token first = tok(statementStart);
            Token second = tokOrNull(statementStart + 1);
            if (first.is("async") && second != null && second.is("function")) {
                return "function";
            }
            return first.text();
        }

        private void closeStatement(int first, int last) {
            if (first >= 0 && last >= first) {
                statements.add(new Statement(first, last));
            }
        }

        boolean isExpressionStatement(Statement statement) {
            Token first = tok(statement.first());
            Token second = tokOrNull(statement.first() + 1);
            if (first.type() != Type.STRING && STATEMENT_KEYWORDS.contains(first.text())) {
                return false;
            }
            if (first.is("async") && second != null && second.is("function")) {
                return false;
            }
            // 标签语句
            return !(first.type() == Type.IDENTIFIER && second != null && second.is(":"));
        }

        private void onStatementStart(int i) {
            Token token = tok(i);
            Token next = tokOrNull(i + 1);
            if (token.type() != Type.IDENTIFIER) {
                return;
            }
            switch (token.text()) {
                case "let", "const" -> {
                    if (next != null && (next.type() == Type.IDENTIFIER || next.is("[") || next.is("{"))) {
                        replacements.put(sig.get(i), "var");
                        collectBindings(i + 1);
                    }
                }
                case "var" -> collectBindings(i + 1);
                case "class" -> {
                    if (next != null && next.type() == Type.IDENTIFIER && !next.is("extends")) {
                        replacements.put(sig.get(i), "var " + next.text() + " = class");
                        declaredNames.add(next.text());
                        markClassEnd(i + 1);
                    }
                }
                case "function" -> addFunctionName(i + 1);
                case "async" -> {
                    if (next != null && next.is("function")) {
                        addFunctionName(i + 2);
                    }
                }
                default -> {
                    // 表达式语句
                }
            }
        }

        private void addFunctionName(int i) {
            Token name = tokOrNull(i);
            if (name != null && name.is("*")) {
                name = tokOrNull(i + 1);
            }
            if (name != null && name.type() == Type.IDENTIFIER) {
                functionNames.add(name.text());
            }
        }

        /** 在类体结束的 "}" 之后补一个分号，类声明变成了赋值表达式。 */
        private void markClassEnd(int from) {
            int depth = 0;
            for (int i = from; i < sig.size(); i++) {
                Token token = tok(i);
                if (token.is("{") || token.is("(") || token.is("[")) {
                    depth++;
                } else if (token.is("}") || token.is(")") || token.is("]")) {
                    depth--;
                    if (depth == 0 && token.is("}")) {
                        insertions.put(sig.get(i), ";");
                        return;
                    }
                }
            }
        }

        /** 收集声明语句中绑定的名字，包括解构模式中的名字。 */
        private void collectBindings(int from) {
            int i = from;
            while (i < sig.size()) {
                Token token = tok(i);
                if (token.type() == Type.IDENTIFIER) {
                    declaredNames.add(token.text());
                    i++;
                } else if (token.is("{") || token.is("[")) {
                    i = collectPattern(i);
                } else {
                    return;
                }
                // 跳过初始化表达式，直到同层的 "," 或语句结束
                int depth = 0;
                while (i < sig.size()) {
                    Token t = tok(i);
                    if (depth == 0 && (t.is(";") || (t.newlineBefore() && i > from && !continuesAfter(i)))) {
                        return;
                    }
                    if (depth == 0 && t.is(",")) {
                        i++;
                        break;
                    }
                    if (t.is("(") || t.is("[") || t.is("{")) {
                        depth++;
                    } else if (t.is(")") || t.is("]") || t.is("}")) {
                        if (depth == 0) {
                            return;
                        }
                        depth--;
                    }
                    i++;
                }
            }
        }

        private boolean continuesAfter(int i) {
            Token prev = tokOrNull(i - 1);
            Token token = tok(i);
            return prev != null && (prev.type() == Type.PUNCTUATOR && !(prev.is(")") || prev.is("]") || prev.is("}"))
                    || token.type() == Type.PUNCTUATOR && !token.is("{") && !token.is("!"));
        }

        /** @return 模式结束之后的位置。 */
        private int collectPattern(int open) {
            int depth = 0;
            int i = open;
            while (i < sig.size()) {
                Token token = tok(i);
                if (token.is("{") || token.is("[")) {
                    depth++;
                } else if (token.is("}") || token.is("]")) {
                    depth--;
                    if (depth == 0) {
                        return i + 1;
                    }
                } else if (token.is("(")) {
                    i = skipBalanced(i);
                    continue;
                } else if (token.type() == Type.IDENTIFIER) {
                    Token prev = tokOrNull(i - 1);
                    Token next = tokOrNull(i + 1);
                    boolean isKey = next != null && next.is(":");
                    boolean isDefault = prev != null && prev.is("=");
                    if (!isKey && !isDefault) {
                        declaredNames.add(token.text());
                    }
                }
                i++;
            }
            return i;
        }

        private int skipBalanced(int open) {
            int depth = 0;
            for (int i = open; i < sig.size(); i++) {
                Token token = tok(i);
                if (token.is("(")) {
                    depth++;
                } else if (token.is(")")) {
                    depth--;
                    if (depth == 0) {
                        return i + 1;
                    }
                }
            }
            return sig.size();
        }

        String render(Map<Integer, String> before, Map<Integer, String> after) {
            var out = new StringBuilder();
            for (int i = 0; i < all.size(); i++) {
                String prefix = before.get(i);
                if (prefix != null) {
                    out.append(prefix);
                }
                String replacement = replacements.get(i);
                out.append(replacement != null ? replacement : all.get(i).text());
                String inserted = insertions.get(i);
                if (inserted != null) {
                    out.append(inserted);
                }
                String suffix = after.get(i);
                if (suffix != null) {
                    out.append(suffix);
                }
            }
            return out.toString();
        }
    }
}
