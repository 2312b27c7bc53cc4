package club.ppmc.kernel.worker;

import club.ppmc.kernel.protocol.FrameKind;

/**
 * 工作进程输出帧的去向。生产环境写入真实的 stdout，测试中可以直接收集。
 */
@FunctionalInterface
public interface OutputSink {

    void send(FrameKind kind, byte[] payload);
}
