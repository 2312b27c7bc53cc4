package club.ppmc.kernel.worker;

/**
 * 笔记本依赖安装失败（npm 无法启动或以非零退出码结束）。
 */
public class DependencyInstallException extends Exception {

    public DependencyInstallException(String message) {
        super(message);
    }

    public DependencyInstallException(String message, Throwable cause) {
        super(message, cause);
    }
}
