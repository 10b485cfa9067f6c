package org.stepreduce.step;

import java.util.ArrayList;
import java.util.List;

/**
 * HEADER 段：按原顺序保存记录原文（输出时原样写回），同时保留解析后的结构，便于读取
 * {@code FILE_DESCRIPTION}/{@code FILE_NAME}/{@code FILE_SCHEMA} 等元信息。
 */
public final class StepHeader {

    /**
     * HEADER 段中常见的记录类型；严格模式下出现其他类型会被拒绝。
     */
    public static final List<String> KNOWN_RECORD_TYPES = List.of(
            "FILE_DESCRIPTION",
            "FILE_NAME",
            "FILE_SCHEMA",
            "FILE_POPULATION",
            "SECTION_LANGUAGE",
            "SECTION_CONTEXT"
    );

    private final List<StepRecord> records;
    private final List<StepValue.StepTyped> entries;

    public StepHeader(List<StepRecord> records, List<StepValue.StepTyped> entries) {
        this.records = List.copyOf(records);
        this.entries = List.copyOf(entries);
    }

    public List<StepRecord> records() {
        return records;
    }

    public StepValue.StepTyped find(String type) {
        for (StepValue.StepTyped entry : entries) {
            if (entry.type().equalsIgnoreCase(type)) {
                return entry;
            }
        }
        return null;
    }

    /**
     * {@code FILE_NAME} 的第一个参数（name），已解码 {@code \X2\...\X0\} 转义；没有时为 null。
     */
    public String fileName() {
        StepValue.StepTyped fileName = find("FILE_NAME");
        if (fileName == null || fileName.args().isEmpty()) {
            return null;
        }
        return stringValue(fileName.args().get(0));
    }

    /**
     * {@code FILE_SCHEMA} 中的 schema 名称列表（例如 AP214/AP242）；没有时为空列表。
     */
    public List<String> schemas() {
        StepValue.StepTyped schema = find("FILE_SCHEMA");
        if (schema == null || schema.args().isEmpty()) {
            return List.of();
        }
        List<String> out = new ArrayList<>();
        collectStrings(schema.args().get(0), out);
        return out;
    }

    /**
     * {@code FILE_DESCRIPTION} 的描述列表；没有时为空列表。
     */
    public List<String> descriptions() {
        StepValue.StepTyped description = find("FILE_DESCRIPTION");
        if (description == null || description.args().isEmpty()) {
            return List.of();
        }
        List<String> out = new ArrayList<>();
        collectStrings(description.args().get(0), out);
        return out;
    }

    private static String stringValue(StepValue value) {
        if (value instanceof StepValue.StepString s) {
            return StepStrings.decode(s.raw());
        }
        return null;
    }

    private static void collectStrings(StepValue value, List<String> out) {
        if (value instanceof StepValue.StepString s) {
            out.add(StepStrings.decode(s.raw()));
        } else if (value instanceof StepValue.StepList list) {
            for (StepValue item : list.items()) {
                collectStrings(item, out);
            }
        }
    }
}
