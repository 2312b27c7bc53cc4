/**
 * ExecutionStatus.java
 *
 * 一次执行的终态。序列化为小写字符串，与前端和IPC消息中的取值保持一致。
 */
package club.ppmc.kernel.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ExecutionStatus {
    OK("ok"),
    ERROR("error"),
    ABORTED("aborted");

    private final String value;

    ExecutionStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static ExecutionStatus fromValue(String value) {
        for (ExecutionStatus status : values()) {
            if (status.value.equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("未知的执行状态: " + value);
    }
}
