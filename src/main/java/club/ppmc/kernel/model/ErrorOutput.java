/**
 * ErrorOutput.java
 *
 * 用户代码抛出的异常，转换为可展示的错误输出。
 */
package club.ppmc.kernel.model;

import java.util.List;

public record ErrorOutput(String type, String ename, String evalue, List<String> traceback)
        implements NotebookOutput {

    public ErrorOutput {
        type = "error";
        traceback = traceback == null ? List.of() : List.copyOf(traceback);
    }

    public static ErrorOutput from(ExecutionError error) {
        List<String> traceback =
                error.stack() == null || error.stack().isBlank()
                        ? List.of()
                        : List.of(error.stack().split("\n"));
        return new ErrorOutput("error", error.name(), error.message(), traceback);
    }
}
