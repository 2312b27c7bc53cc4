/**
 * KernelEvent.java
 *
 * 推送到 /topic/kernel/{sessionId} 的事件。
 * type 取值: status / stream / display / execute_reply / error / session_reset。
 */
package club.ppmc.kernel.model;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record KernelEvent(String type, String cellId, Object payload) {

    public static KernelEvent status(String cellId, String state) {
        return new KernelEvent("status", cellId, state);
    }

    public static KernelEvent output(String cellId, NotebookOutput output) {
        return new KernelEvent(output instanceof StreamOutput ? "stream" : "display", cellId, output);
    }

    public static KernelEvent reply(String cellId, ExecutionResult result) {
        return new KernelEvent("execute_reply", cellId, result);
    }

    public static KernelEvent error(String cellId, Object errorData) {
        return new KernelEvent("error", cellId, errorData);
    }

    public static KernelEvent sessionReset() {
        return new KernelEvent("session_reset", null, null);
    }
}
