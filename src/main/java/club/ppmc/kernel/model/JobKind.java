package club.ppmc.kernel.model;

/** 作业种类：执行单元格，或调用已注册的交互处理函数。 */
public enum JobKind {
    EXECUTE,
    INVOKE_HANDLER
}
