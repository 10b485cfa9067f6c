package org.stepreduce.step;

import java.util.Arrays;

/**
 * 一次迭代产生的不可变划分。
 * <p>
 * 实体按源文件顺序编号为 0..n-1；{@code representativeOf[k]} 是实体 k 所在类的代表实体的编号
 * （代表 = 类中原始 id 最小的成员）。代表由类唯一确定，因此两个划分相等当且仅当数组逐项相等。
 */
final class Partition {

    private final int[] representativeOf;
    private final int classCount;

    Partition(int[] representativeOf) {
        this.representativeOf = representativeOf;
        int count = 0;
        for (int k = 0; k < representativeOf.length; k++) {
            if (representativeOf[k] == k) {
                count++;
            }
        }
        this.classCount = count;
    }

    /**
     * 每个实体自成一类。
     */
    static Partition discrete(int size) {
        int[] reps = new int[size];
        for (int k = 0; k < size; k++) {
            reps[k] = k;
        }
        return new Partition(reps);
    }

    int representative(int index) {
        return representativeOf[index];
    }

    int size() {
        return representativeOf.length;
    }

    int classCount() {
        return classCount;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Partition other)) {
            return false;
        }
        return Arrays.equals(representativeOf, other.representativeOf);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(representativeOf);
    }
}
