package org.stepreduce.step;

import java.util.List;

/**
 * 词法器输出的一条记录（以 ';' 结束的一条语句）。
 *
 * @param kind     记录类别（段标记 / HEADER 记录 / DATA 实体）
 * @param text     注释替换为空格并 trim 之后的语句文本（不含结尾的 ';'），供解析使用
 * @param source   trim 之后的语句原文（保留语句内注释），输出 HEADER 注释时原样写回
 * @param offset   语句第一个非空白字符的字节偏移
 * @param comments 语句之前出现的 {@code /* ... *}{@code /} 注释（原文，按出现顺序）
 */
public record StepRecord(Kind kind, String text, String source, int offset, List<String> comments) {

    public StepRecord {
        comments = List.copyOf(comments);
    }

    public enum Kind {
        FILE_START,
        HEADER_START,
        HEADER_ENTRY,
        DATA_START,
        DATA_ENTRY,
        END_SECTION,
        FILE_END
    }
}
