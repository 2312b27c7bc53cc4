/**
 * ConsoleBuffer.java
 *
 * 单个作业的控制台输出缓冲。stdout 与 stderr 共用一个缓冲区，切换流时先刷新前一个流的内容，
 * 从而保持两者之间的先后顺序。定期刷新时不会把一个 UTF-8 字符拆到两个帧里，
 * 过大的输出被切分为多个帧，缓冲超过一个帧的大小时立即刷新。取消之后的输出全部丢弃。
 */
package club.ppmc.kernel.worker;

import club.ppmc.kernel.protocol.FrameKind;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

final class ConsoleBuffer {

    static final int MAX_CHUNK_BYTES = 64 * 1024;

    private final OutputSink sink;
    private final ByteArrayOutputStream pending = new ByteArrayOutputStream();
    private FrameKind pendingKind;
    private boolean discarding;

    ConsoleBuffer(OutputSink sink) {
        this.sink = sink;
    }

    synchronized void write(FrameKind kind, byte[] bytes, int offset, int length) {
        if (discarding || length == 0) {
            return;
        }
        if (pendingKind != null && pendingKind != kind) {
            flushLocked(true);
        }
        pendingKind = kind;
        pending.write(bytes, offset, length);
        if (pending.size() > MAX_CHUNK_BYTES) {
            // 不等定时刷新，避免紧密循环的输出在两次刷新之间撑满堆
            flushLocked(false);
        }
    }

    void write(FrameKind kind, String text) {
        byte[] bytes = text.getBytes(StandardCharsets.UTF_8);
        write(kind, bytes, 0, bytes.length);
    }

    /** 刷新完整的字符，末尾不完整的 UTF-8 序列留到下次。 */
    synchronized void flush() {
        flushLocked(false);
    }

    synchronized void flushAll() {
        flushLocked(true);
    }

    /** 先刷新已缓冲的文本，再立即发送展示帧。 */
    synchronized void display(byte[] json) {
        if (discarding) {
            return;
        }
        flushLocked(true);
        sink.send(FrameKind.DISPLAY, json);
    }

    /** 刷新已有内容，此后的输出全部丢弃。 */
    synchronized void discardFurther() {
        flushLocked(true);
        discarding = true;
    }

    synchronized boolean isDiscarding() {
        return discarding;
    }

    private void flushLocked(boolean complete) {
        if (pending.size() == 0) {
            return;
        }
        byte[] bytes = pending.toByteArray();
        int end = complete ? bytes.length : completeUtf8Length(bytes);
        int start = 0;
        while (start < end) {
            int chunkEnd = Math.min(end, start + MAX_CHUNK_BYTES);
            if (chunkEnd < end) {
                chunkEnd = start + completeUtf8Length(Arrays.copyOfRange(bytes, start, chunkEnd));
            }
            sink.send(pendingKind, Arrays.copyOfRange(bytes, start, chunkEnd));
            start = chunkEnd;
        }
        pending.reset();
        pending.write(bytes, end, bytes.length - end);
    }

    /**
     * @return 不含末尾不完整 UTF-8 序列的前缀长度。
     */
    static int completeUtf8Length(byte[] bytes) {
        int length = bytes.length;
        // 向前最多查看 3 个字节，找到最后一个字符的首字节
        for (int i = length - 1; i >= Math.max(0, length - 4); i--) {
            int b = bytes[i] & 0xFF;
            if ((b & 0xC0) == 0x80) {
                continue;
            }
            int expected;
            if (b < 0x80) {
                expected = 1;
            } else if ((b & 0xE0) == 0xC0) {
                expected = 2;
            } else if ((b & 0xF0) == 0xE0) {
                expected = 3;
            } else if ((b & 0xF8) == 0xF0) {
                expected = 4;
            } else {
                return length;
            }
            return length - i >= expected ? length : i;
        }
        return length;
    }
}
