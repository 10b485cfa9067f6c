package org.stepreduce.step;

import java.util.List;

/**
 * STEP 参数值（递归结构）。
 * <p>
 * 支持的形式：
 * <ul>
 *   <li>数字：{@code 1} / {@code -1.2} / {@code 1.0E-3}（保留原始写法 raw）</li>
 *   <li>字符串：{@code 'text'}（raw 为引号之间的原文，{@code ''} 转义与 {@code \X2\...\X0\} 均不解码）</li>
 *   <li>枚举：{@code .NAME.}（name 不含两侧的点）</li>
 *   <li>引用：{@code #123}</li>
 *   <li>列表：{@code (a,b,c)} 以及嵌套列表</li>
 *   <li>类型化参数：{@code LENGTH_MEASURE(10.5)}</li>
 *   <li>未设置 {@code $} 与派生 {@code *}</li>
 * </ul>
 * 所有实现均为不可变 record，列表在构造时做不可变拷贝。
 */
public interface StepValue {

    record StepNumber(String raw) implements StepValue {
    }

    record StepString(String raw) implements StepValue {
    }

    record StepEnum(String name) implements StepValue {
    }

    record StepRef(int id) implements StepValue {
    }

    record StepList(List<StepValue> items) implements StepValue {
        public StepList {
            items = List.copyOf(items);
        }
    }

    /**
     * 类型化参数，也用于复杂实体的各个分部（{@code #1=(A(..)B(..))} 中的 {@code A(..)}）以及 HEADER 记录。
     */
    record StepTyped(String type, List<StepValue> args) implements StepValue {
        public StepTyped {
            args = List.copyOf(args);
        }
    }

    record StepOmitted() implements StepValue {
    }

    record StepDerived() implements StepValue {
    }

    StepOmitted OMITTED = new StepOmitted();

    StepDerived DERIVED = new StepDerived();
}
