/**
 * NotebookEnv.java
 *
 * 笔记本的运行环境描述：运行时名称与版本、声明的依赖包以及暴露给用户代码的环境变量。
 * 工作进程以它为依据准备每个笔记本独立的沙箱目录。
 */
package club.ppmc.kernel.model;

import java.util.Map;

/**
 * @param runtime 运行时名称，例如 "graaljs"。
 * @param version 运行时版本（可选）。
 * @param packages 依赖包名到版本范围的映射。
 * @param variables 通过 process.env 暴露给用户代码的变量。
 */
public record NotebookEnv(
        String runtime, String version, Map<String, String> packages, Map<String, String> variables) {

    public NotebookEnv {
        runtime = runtime == null || runtime.isBlank() ? "graaljs" : runtime;
        packages = packages == null ? Map.of() : Map.copyOf(packages);
        variables = variables == null ? Map.of() : Map.copyOf(variables);
    }

    public static NotebookEnv empty() {
        return new NotebookEnv(null, null, null, null);
    }
}
