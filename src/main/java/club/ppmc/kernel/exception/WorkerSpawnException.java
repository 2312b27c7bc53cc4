/**
 * WorkerSpawnException.java
 *
 * 无法启动工作进程时抛出，例如找不到 java 可执行文件。
 */
package club.ppmc.kernel.exception;

public class WorkerSpawnException extends RuntimeException {

    public WorkerSpawnException(String message, Throwable cause) {
        super(message, cause);
    }
}
