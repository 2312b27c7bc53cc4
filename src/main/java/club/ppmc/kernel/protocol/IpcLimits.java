/**
 * IpcLimits.java
 *
 * 协议层面的取值范围。
 */
package club.ppmc.kernel.protocol;

public final class IpcLimits {

    /** 单个作业允许的最长超时（10分钟）。 */
    public static final long MAX_TIMEOUT_MS = 600_000L;

    private IpcLimits() {}
}
