package club.ppmc.kernel.worker;

/**
 * 作业因取消或超时而停止时，由执行线程在等待或检查点处抛出。
 */
class JobStoppedException extends RuntimeException {

    JobStoppedException() {
        super("job stopped", null, false, false);
    }
}
