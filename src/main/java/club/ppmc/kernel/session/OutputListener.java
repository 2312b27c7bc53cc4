package club.ppmc.kernel.session;

import club.ppmc.kernel.model.NotebookOutput;

/**
 * 接收一个作业执行期间的流式输出（StreamOutput 或 DisplayDataOutput），按产生顺序回调。
 */
@FunctionalInterface
public interface OutputListener {

    void onOutput(NotebookOutput output);
}
