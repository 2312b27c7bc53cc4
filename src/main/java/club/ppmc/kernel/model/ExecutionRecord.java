/**
 * ExecutionRecord.java
 *
 * 一次执行的时间与状态记录，是 ExecutionResult 的组成部分。
 */
package club.ppmc.kernel.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import jakarta.validation.constraints.NotNull;

/**
 * @param started 开始时间（epoch 毫秒）。
 * @param ended 结束时间（epoch 毫秒）。
 * @param status 终态。
 * @param error 仅在 status 为 error/aborted 时存在。
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExecutionRecord(long started, long ended, @NotNull ExecutionStatus status, ExecutionError error) {

    public static ExecutionRecord ok(long started, long ended) {
        return new ExecutionRecord(started, ended, ExecutionStatus.OK, null);
    }
}
