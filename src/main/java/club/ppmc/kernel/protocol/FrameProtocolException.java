/**
 * FrameProtocolException.java
 *
 * 字节流违反帧格式时抛出，例如长度前缀过长或负载超过允许的最大值。
 * 读取方收到此异常后，该流上的后续数据均不可信。
 */
package club.ppmc.kernel.protocol;

import java.io.IOException;
import lombok.Getter;

@Getter
public class FrameProtocolException extends IOException {

    /** 超限帧声明的负载长度；与长度无关的格式错误为 -1。 */
    private final long declaredLength;

    public FrameProtocolException(String message) {
        this(message, -1);
    }

    public FrameProtocolException(String message, long declaredLength) {
        super(message);
        this.declaredLength = declaredLength;
    }

    public boolean isOversized() {
        return declaredLength >= 0;
    }
}
