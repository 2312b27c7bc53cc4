/**
 * StreamOutput.java
 *
 * 标准输出或标准错误上的一段文本。
 */
package club.ppmc.kernel.model;

public record StreamOutput(String type, String name, String text) implements NotebookOutput {

    public static final String STDOUT = "stdout";
    public static final String STDERR = "stderr";

    public StreamOutput {
        type = "stream";
    }

    public static StreamOutput stdout(String text) {
        return new StreamOutput("stream", STDOUT, text);
    }

    public static StreamOutput stderr(String text) {
        return new StreamOutput("stream", STDERR, text);
    }
}
