package org.stepreduce.step;

import java.util.List;

/**
 * DATA 段中的一条实体实例。
 * <p>
 * 简单实体 {@code #id=TYPE(params)} 只有一个分部；复杂实体 {@code #id=(A(..)B(..))} 按源文件顺序保存多个分部。
 * 实体解析后不可变，压缩过程中的任何改写都会构造新实例。
 *
 * @param id      原始实体 id（'#' 后面的数字）
 * @param parts   类型化分部列表（至少一个）
 * @param complex 是否为复杂实体语法
 */
public record StepEntity(int id, List<StepValue.StepTyped> parts, boolean complex) {

    public StepEntity {
        parts = List.copyOf(parts);
        if (parts.isEmpty()) {
            throw new IllegalArgumentException("实体 #" + id + " 至少需要一个类型分部");
        }
    }

    /**
     * 分组用的类型名：简单实体为类型本身，复杂实体为 {@code (A,B,...)}。
     */
    public String typeName() {
        if (!complex) {
            return parts.get(0).type();
        }
        StringBuilder sb = new StringBuilder("(");
        for (int i = 0; i < parts.size(); i++) {
            if (i > 0) {
                sb.append(',');
            }
            sb.append(parts.get(i).type());
        }
        return sb.append(')').toString();
    }

    /**
     * 简单实体的参数列表；复杂实体返回空列表（参数分布在各分部中）。
     */
    public List<StepValue> params() {
        return complex ? List.of() : parts.get(0).args();
    }

    public StepEntity withParts(List<StepValue.StepTyped> newParts) {
        return new StepEntity(id, newParts, complex);
    }

    public StepEntity withId(int newId) {
        return new StepEntity(newId, parts, complex);
    }
}
