package org.stepreduce.step;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * 数字字面量的无损规范化：只统一写法，不做舍入。
 * <p>
 * Part 21 中 INTEGER 与 REAL 是不同的记号类型：含 '.' 或指数的是 REAL，否则是 INTEGER。
 * 规范化结果带类型前缀（{@code I}/{@code R}），因此 {@code 1} 与 {@code 1.} 永远不相等。
 * <ul>
 *   <li>REAL：{@code 1.0}、{@code 1.}、{@code 1.0E0}、{@code +1.000} 相同；{@code -0.0} 与 {@code 0.} 相同。</li>
 *   <li>INTEGER：只统一符号与前导零，例如 {@code +7}、{@code 007} 与 {@code 7} 相同。</li>
 * </ul>
 * 规范化结果只用于等价比较，输出时仍保留代表实体的原始写法。
 */
public final class NumberNormalizer {

    private NumberNormalizer() {
    }

    public static boolean isReal(String raw) {
        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            if (c == '.' || c == 'E' || c == 'e') {
                return true;
            }
        }
        return false;
    }

    public static String normalize(String raw) {
        try {
            if (!isReal(raw)) {
                return "I" + new BigInteger(raw);
            }
            BigDecimal value = new BigDecimal(raw);
            if (value.signum() == 0) {
                return "R0";
            }
            BigDecimal stripped = value.stripTrailingZeros();
            return "R" + stripped.unscaledValue() + "E" + (-stripped.scale());
        } catch (NumberFormatException e) {
            // 解析阶段已经校验过语法，这里兜底按原文比较
            return raw;
        }
    }
}
