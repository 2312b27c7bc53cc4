/**
 * ExecutionResult.java
 *
 * 一个作业的最终结果：非流式输出列表（最终展示值、错误对象等）加上执行记录。
 * 流式输出（stdout/stderr/display）在执行过程中已通过回调送达，不在此列表中重复。
 */
package club.ppmc.kernel.model;

import java.util.List;

public record ExecutionResult(List<NotebookOutput> outputs, ExecutionRecord execution) {

    public ExecutionResult {
        outputs = outputs == null ? List.of() : List.copyOf(outputs);
    }

    public ExecutionStatus status() {
        return execution.status();
    }
}
