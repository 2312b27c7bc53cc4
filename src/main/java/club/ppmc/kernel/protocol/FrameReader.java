/**
 * FrameReader.java
 *
 * 从输入流中逐帧读取。未知类型的帧会被跳过；声明长度超过上限的帧视为协议错误。
 * 非线程安全，每条流只应有一个读取线程。
 */
package club.ppmc.kernel.protocol;

import java.io.BufferedInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class FrameReader {

    private final InputStream in;
    private final int maxPayloadBytes;

    public FrameReader(InputStream in, int maxPayloadBytes) {
        this.in = in instanceof BufferedInputStream ? in : new BufferedInputStream(in);
        this.maxPayloadBytes = maxPayloadBytes;
    }

    /**
     * 读取下一个已知类型的帧。
     *
     * @return 下一帧；流在帧边界处正常结束时返回 null。
     * @throws EOFException 流在帧中间结束。
     * @throws FrameProtocolException 长度前缀畸形或负载超过上限。
     */
    public Frame next() throws IOException {
        while (true) {
            int kindCode = in.read();
            if (kindCode < 0) {
                return null;
            }
            long length = FrameCodec.readVarint(in, false);
            if (length > maxPayloadBytes) {
                throw new FrameProtocolException(
                        "帧负载长度 " + length + " 超过上限 " + maxPayloadBytes, length);
            }
            byte[] payload = in.readNBytes((int) length);
            if (payload.length < length) {
                throw new EOFException("帧负载被截断");
            }
            FrameKind kind = FrameKind.fromCode(kindCode);
            if (kind == null) {
                log.debug("丢弃未知类型的帧: kind={}, length={}", kindCode, length);
                continue;
            }
            return new Frame(kind, payload);
        }
    }
}
