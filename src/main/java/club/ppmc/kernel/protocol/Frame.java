/**
 * Frame.java
 *
 * 一个已解码的帧：类型加上原始负载字节。
 */
package club.ppmc.kernel.protocol;

import java.nio.charset.StandardCharsets;

public record Frame(FrameKind kind, byte[] payload) {

    public static Frame text(FrameKind kind, String text) {
        return new Frame(kind, text.getBytes(StandardCharsets.UTF_8));
    }

    /** 以 UTF-8 解释负载。 */
    public String text() {
        return new String(payload, StandardCharsets.UTF_8);
    }

    /** 编码后的总字节数（类型字节 + 长度前缀 + 负载）。 */
    public int encodedSize() {
        return 1 + FrameCodec.varintSize(payload.length) + payload.length;
    }
}
