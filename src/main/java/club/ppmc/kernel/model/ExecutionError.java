/**
 * ExecutionError.java
 *
 * 执行失败时的结构化错误信息。
 */
package club.ppmc.kernel.model;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExecutionError(String name, String message, String stack) {

    public static ExecutionError of(String name, String message) {
        return new ExecutionError(name, message, null);
    }
}
