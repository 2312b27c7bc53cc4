package club.ppmc.kernel.worker;

import java.util.Locale;
import java.util.Optional;

/**
 * 把单元格源码转换为 GraalJS 可以直接执行的 JavaScript。
 */
public interface Transpiler {

    String transpile(String source);

    /** 生成脚本源名称时使用的扩展名。 */
    String fileExtension();

    /**
     * @param language 单元格语言，"js"/"javascript" 或 "ts"/"typescript"。
     * @return 对应的转译器；不支持的语言返回空。
     */
    static Optional<Transpiler> forLanguage(String language) {
        String normalized = language == null ? "" : language.trim().toLowerCase(Locale.ROOT);
        switch (normalized) {
            case "js", "javascript" -> {
                return Optional.of(JavaScriptTranspiler.INSTANCE);
            }
            case "ts", "typescript" -> {
                return Optional.of(new TypeScriptTranspiler());
            }
            default -> {
                return Optional.empty();
            }
        }
    }
}
