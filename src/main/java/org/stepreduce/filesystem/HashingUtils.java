package org.stepreduce.filesystem;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * sha256 指纹（十六进制），用于在工具结果中标识输入与输出内容。
 */
public final class HashingUtils {

    private static final HexFormat HEX = HexFormat.of();

    private HashingUtils() {
    }

    public static String sha256Hex(byte[] bytes) {
        try {
            return HEX.formatHex(MessageDigest.getInstance("SHA-256").digest(bytes));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("当前运行环境不支持 SHA-256 摘要算法（MessageDigest）", e);
        }
    }
}
