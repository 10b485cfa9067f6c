package org.stepreduce.step;

/**
 * 引擎内部不变量被破坏（例如同一个 id 出现在两个等价类中、改写后出现悬空引用）。
 * <p>
 * 这类错误表示引擎缺陷而不是输入问题，调用方应与 {@link StepReduceException} 区分处理。
 */
public class ReductionDefectException extends IllegalStateException {

    public ReductionDefectException(String message) {
        super(message);
    }
}
