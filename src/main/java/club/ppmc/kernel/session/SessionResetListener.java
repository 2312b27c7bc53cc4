package club.ppmc.kernel.session;

/**
 * 会话的独占工作进程被替换时回调。此时该会话之前定义的全局变量已全部丢失。
 */
@FunctionalInterface
public interface SessionResetListener {

    void onSessionReset(String sessionId);
}
