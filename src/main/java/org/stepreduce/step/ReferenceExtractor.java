package org.stepreduce.step;

import java.util.Arrays;
import java.util.List;
import java.util.function.IntConsumer;

/**
 * 实体引用提取（热点路径）。
 * <p>
 * 两种入口：
 * <ul>
 *   <li>{@link #references(StepEntity)}：对已解析实体取一层引用（不递归进入被引用实体），
 *       扁平参数列表走线性扫描，只有遇到嵌套列表/类型化参数才递归。</li>
 *   <li>{@link #forEachReference(CharSequence, IntConsumer)}：直接在原文上识别 {@code #数字}，
 *       跳过字符串字面量，不做通用解析，也不产生中间对象。</li>
 * </ul>
 * 实例内部复用一个 int 缓冲区，因此不是线程安全的；并行场景下每个线程各用一个实例。
 */
public final class ReferenceExtractor {

    private static final int[] NONE = new int[0];

    private int[] buffer = new int[16];
    private int size;

    /**
     * 返回实体直接引用的 id（去重，按首次出现顺序）。
     */
    public int[] references(StepEntity entity) {
        size = 0;
        for (StepValue.StepTyped part : entity.parts()) {
            collect(part.args());
        }
        if (size == 0) {
            return NONE;
        }
        return distinct();
    }

    public static int[] referencesOf(StepEntity entity) {
        return new ReferenceExtractor().references(entity);
    }

    private void collect(List<StepValue> values) {
        for (int i = 0, n = values.size(); i < n; i++) {
            StepValue v = values.get(i);
            if (v instanceof StepValue.StepRef ref) {
                add(ref.id());
            } else if (v instanceof StepValue.StepList list) {
                collect(list.items());
            } else if (v instanceof StepValue.StepTyped typed) {
                collect(typed.args());
            }
        }
    }

    private void add(int id) {
        if (size == buffer.length) {
            buffer = Arrays.copyOf(buffer, size * 2);
        }
        buffer[size++] = id;
    }

    private int[] distinct() {
        // 实体引用数通常很少（几个到几十个），平方去重比哈希集合更省分配
        int[] out = new int[size];
        int count = 0;
        outer:
        for (int i = 0; i < size; i++) {
            int id = buffer[i];
            for (int j = 0; j < count; j++) {
                if (out[j] == id) {
                    continue outer;
                }
            }
            out[count++] = id;
        }
        return count == out.length ? out : Arrays.copyOf(out, count);
    }

    /**
     * 在原始语句文本上扫描 {@code #数字} 形式的引用（字符串字面量与注释内部的 '#' 不算）。
     * <p>
     * 对 {@code #12=FOO(#3)} 这样的完整语句，左侧的实例 id 也会被报告；调用方按需跳过。
     *
     * @return 报告的引用个数
     */
    public static int forEachReference(CharSequence text, IntConsumer consumer) {
        int count = 0;
        int n = text.length();
        int i = 0;
        while (i < n) {
            char c = text.charAt(i);
            if (c == '\'') {
                i++;
                while (i < n) {
                    if (text.charAt(i) == '\'') {
                        if (i + 1 < n && text.charAt(i + 1) == '\'') {
                            i += 2;
                            continue;
                        }
                        break;
                    }
                    i++;
                }
                i++;
                continue;
            }
            if (c == '/' && i + 1 < n && text.charAt(i + 1) == '*') {
                int end = indexOf(text, "*/", i + 2);
                i = end < 0 ? n : end + 2;
                continue;
            }
            if (c != '#') {
                i++;
                continue;
            }
            int j = i + 1;
            long value = 0;
            while (j < n) {
                char d = text.charAt(j);
                if (d < '0' || d > '9') {
                    break;
                }
                value = value * 10 + (d - '0');
                if (value > Integer.MAX_VALUE) {
                    break;
                }
                j++;
            }
            if (j > i + 1 && value <= Integer.MAX_VALUE) {
                consumer.accept((int) value);
                count++;
            }
            i = Math.max(j, i + 1);
        }
        return count;
    }

    private static int indexOf(CharSequence text, String needle, int from) {
        int limit = text.length() - needle.length();
        outer:
        for (int i = from; i <= limit; i++) {
            for (int j = 0; j < needle.length(); j++) {
                if (text.charAt(i + j) != needle.charAt(j)) {
                    continue outer;
                }
            }
            return i;
        }
        return -1;
    }
}
