/**
 * FrameKind.java
 *
 * 帧类型。前三种携带用户代码产生的输出，CONTROL 承载结构化的 IPC 消息，
 * 与输出帧复用同一条有序字节流，因此结果消息永远不会越过它之前的输出。
 */
package club.ppmc.kernel.protocol;

public enum FrameKind {
    STDOUT(1),
    STDERR(2),
    DISPLAY(3),
    CONTROL(16);

    private final int code;

    FrameKind(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    /** 流式输出帧（计入作业的输出上限）。 */
    public boolean isStream() {
        return this == STDOUT || this == STDERR;
    }

    /**
     * @return 对应的帧类型；未知的编码返回 null。
     */
    public static FrameKind fromCode(int code) {
        for (FrameKind kind : values()) {
            if (kind.code == code) {
                return kind;
            }
        }
        return null;
    }
}
