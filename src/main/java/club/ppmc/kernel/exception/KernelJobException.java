/**
 * KernelJobException.java
 *
 * 作业在编排器层面失败时用于拒绝其 Future 的运行时异常。
 * 用户代码自身的错误不会走这里，而是以 status=error 的结果正常返回。
 * 它携带失败原因，Controller 与 STOMP 层据此把错误转换为对前端友好的结构。
 */
package club.ppmc.kernel.exception;

import java.util.Map;
import lombok.Getter;

@Getter
public class KernelJobException extends RuntimeException {

    public enum Reason {
        /** 取消请求在宽限期内未得到响应，工作进程被强制终止。 */
        CANCELLED,
        /** 超过作业时间预算加看门狗余量仍无结果。 */
        TIMEOUT,
        /** 流式输出超过上限。 */
        OUTPUT_LIMIT,
        /** 工作进程在作业执行期间退出。 */
        WORKER_CRASHED,
        /** 工作进程报告了自身的内部错误。 */
        WORKER_ERROR,
        /** 工作池已关闭。 */
        POOL_CLOSED
    }

    private final Reason reason;

    /** 被拒绝的作业ID，排队阶段就失败时可能为 null。 */
    private final String jobId;

    public KernelJobException(Reason reason, String jobId, String message) {
        super(message);
        this.reason = reason;
        this.jobId = jobId;
    }

    public KernelJobException(Reason reason, String jobId, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
        this.jobId = jobId;
    }

    public static KernelJobException cancelled(String jobId) {
        return new KernelJobException(Reason.CANCELLED, jobId, "Job cancelled");
    }

    public static KernelJobException outputLimit(String jobId) {
        return new KernelJobException(Reason.OUTPUT_LIMIT, jobId, "Output limit exceeded");
    }

    /**
     * 将异常信息转换为一个Map，便于序列化为JSON。
     */
    public Map<String, Object> toErrorData() {
        return Map.of(
                "type", "KERNEL_" + reason.name(),
                "message", getMessage(),
                "jobId", jobId != null ? jobId : "");
    }
}
