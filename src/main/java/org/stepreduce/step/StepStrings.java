package org.stepreduce.step;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * STEP 字符串字面量的展示用解码。
 * <p>
 * 压缩引擎内部始终使用字符串原文（不解码）做比较和输出；本类只在需要把 HEADER 元信息返回给调用方时使用。
 * <ul>
 *   <li>{@code ''} -> {@code '}</li>
 *   <li>{@code \X2\...\X0\}：UCS-2（每 4 位十六进制一个 16-bit code unit）</li>
 *   <li>{@code \X4\...\X0\}：UCS-4（每 8 位十六进制一个 code point）</li>
 *   <li>{@code \X\hh}：单字节十六进制</li>
 *   <li>未转义的非 ASCII 字节：若整体是合法 UTF-8 则按 UTF-8 解释，否则按 ISO-8859-1 原样保留</li>
 * </ul>
 * 示例：{@code \X2\4E2D6587\X0\} -> "中文"
 */
public final class StepStrings {

    private StepStrings() {
    }

    public static String decode(String raw) {
        if (raw == null || raw.isEmpty()) {
            return raw;
        }
        String text = reinterpretUtf8(raw.replace("''", "'"));
        if (text.indexOf('\\') < 0) {
            return text;
        }

        StringBuilder out = new StringBuilder(text.length());
        int len = text.length();
        for (int i = 0; i < len; i++) {
            char c = text.charAt(i);
            if (c != '\\' || i + 2 >= len || (text.charAt(i + 1) != 'X' && text.charAt(i + 1) != 'x')) {
                out.append(c);
                continue;
            }

            char mode = text.charAt(i + 2);
            if ((mode == '2' || mode == '4') && i + 3 < len && text.charAt(i + 3) == '\\') {
                int seqStart = i + 4;
                int endMarker = indexOfEndMarker(text, seqStart);
                if (endMarker > 0) {
                    String decoded = decodeHexSequence(text.substring(seqStart, endMarker), mode == '4' ? 8 : 4);
                    if (decoded != null) {
                        out.append(decoded);
                        // 循环末尾 i++，落在 "\X0\" 之后
                        i = endMarker + 3;
                        continue;
                    }
                }
            }

            if (mode == '\\' && i + 4 < len) {
                int hi = Character.digit(text.charAt(i + 3), 16);
                int lo = Character.digit(text.charAt(i + 4), 16);
                if (hi >= 0 && lo >= 0) {
                    out.append((char) (hi * 16 + lo));
                    i += 4;
                    continue;
                }
            }

            out.append(c);
        }
        return out.toString();
    }

    private static String reinterpretUtf8(String latin1) {
        boolean ascii = true;
        for (int i = 0; i < latin1.length(); i++) {
            if (latin1.charAt(i) > 0x7F) {
                ascii = false;
                break;
            }
        }
        if (ascii) {
            return latin1;
        }
        byte[] bytes = latin1.getBytes(StandardCharsets.ISO_8859_1);
        var decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            return decoder.decode(ByteBuffer.wrap(bytes)).toString();
        } catch (CharacterCodingException e) {
            return latin1;
        }
    }

    private static int indexOfEndMarker(String text, int fromIndex) {
        for (int i = fromIndex; i + 3 < text.length(); i++) {
            if (text.charAt(i) == '\\'
                    && (text.charAt(i + 1) == 'X' || text.charAt(i + 1) == 'x')
                    && text.charAt(i + 2) == '0'
                    && text.charAt(i + 3) == '\\') {
                return i;
            }
        }
        return -1;
    }

    private static String decodeHexSequence(String hexText, int group) {
        if (hexText.isEmpty()) {
            return "";
        }
        if (hexText.length() % group != 0) {
            return null;
        }
        StringBuilder out = new StringBuilder(hexText.length() / group);
        for (int i = 0; i < hexText.length(); i += group) {
            int codePoint;
            try {
                codePoint = Integer.parseInt(hexText.substring(i, i + group), 16);
            } catch (NumberFormatException e) {
                return null;
            }
            if (group == 8) {
                if (!Character.isValidCodePoint(codePoint)) {
                    return null;
                }
                out.appendCodePoint(codePoint);
            } else {
                out.append((char) codePoint);
            }
        }
        return out.toString();
    }
}
