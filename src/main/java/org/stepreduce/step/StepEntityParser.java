package org.stepreduce.step;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * STEP 实体解析器：把词法器切出的记录转换为结构化的 {@link StepEntity}/{@link StepHeader}/{@link StepFile}。
 * <p>
 * 支持的实体语句：
 * <ul>
 *   <li>简单实体：{@code #123=ENTITY_NAME(arg1,arg2,...)}</li>
 *   <li>复杂实体：{@code #123=(TYPE_A(...)TYPE_B(...))}</li>
 * </ul>
 * 参数按递归下降解析，见 {@link StepValue}。与“尽力而为”的摘要扫描不同，这里任何语法错误都会立即抛出
 * {@link StepReduceException}（带字节偏移），不做任何恢复：部分解析的数据可能悄悄丢失引用。
 */
public final class StepEntityParser {

    private static final Logger log = LoggerFactory.getLogger(StepEntityParser.class);

    private StepEntityParser() {
    }

    /**
     * 解析整个文件：词法切分 -> HEADER/DATA 解析 -> 悬空引用校验。
     *
     * @param text         按 ISO-8859-1 解码的全文
     * @param strictHeader 为 true 时，HEADER 中出现 {@link StepHeader#KNOWN_RECORD_TYPES} 之外的记录会被拒绝
     */
    public static StepFile parseFile(String text, boolean strictHeader) {
        List<StepRecord> headerRecords = new ArrayList<>();
        List<StepValue.StepTyped> headerEntries = new ArrayList<>();
        Map<Integer, StepEntity> entities = new LinkedHashMap<>();
        Map<Integer, Integer> offsets = new LinkedHashMap<>();
        String dataStatement = null;
        boolean started = false;
        boolean inSection = false;
        boolean ended = false;

        StepLexer lexer = new StepLexer(text);
        while (lexer.hasNext()) {
            StepRecord record = lexer.next();
            switch (record.kind()) {
                case FILE_START -> started = true;
                case HEADER_START, DATA_START -> {
                    if (!started) {
                        throw StepReduceException.malformed("缺少文件起始标记 ISO-10303-21;", record.offset());
                    }
                    inSection = true;
                    if (record.kind() == StepRecord.Kind.DATA_START) {
                        dataStatement = record.text();
                    }
                }
                case HEADER_ENTRY -> {
                    StepValue.StepTyped entry = parseHeaderRecord(record.text(), record.offset());
                    if (strictHeader && !StepHeader.KNOWN_RECORD_TYPES.contains(entry.type())) {
                        throw StepReduceException.unsupported("不支持的 HEADER 记录类型：" + entry.type(), record.offset());
                    }
                    headerRecords.add(record);
                    headerEntries.add(entry);
                }
                case DATA_ENTRY -> {
                    StepEntity entity = parseEntity(record.text(), record.offset());
                    if (entities.putIfAbsent(entity.id(), entity) != null) {
                        throw StepReduceException.malformed("实体 id 重复：#" + entity.id(), record.offset());
                    }
                    offsets.put(entity.id(), record.offset());
                }
                case END_SECTION -> inSection = false;
                case FILE_END -> ended = true;
                default -> throw new IllegalStateException("未知记录类别：" + record.kind());
            }
        }
        if (!started) {
            throw StepReduceException.malformed("缺少文件起始标记 ISO-10303-21;", 0);
        }
        if (inSection) {
            throw StepReduceException.malformed("段未以 ENDSEC; 结束", text.length());
        }
        if (!ended) {
            throw StepReduceException.malformed("缺少文件结束标记 END-ISO-10303-21;", text.length());
        }

        validateReferences(entities, offsets);
        log.debug("解析完成：header={} 条，entities={} 个", headerRecords.size(), entities.size());
        return new StepFile(
                new StepHeader(headerRecords, headerEntries),
                dataStatement == null ? "DATA" : dataStatement,
                entities,
                offsets
        );
    }

    private static void validateReferences(Map<Integer, StepEntity> entities, Map<Integer, Integer> offsets) {
        ReferenceExtractor extractor = new ReferenceExtractor();
        for (StepEntity entity : entities.values()) {
            for (int target : extractor.references(entity)) {
                if (!entities.containsKey(target)) {
                    throw StepReduceException.dangling(entity.id(), target, offsets.get(entity.id()));
                }
            }
        }
    }

    /**
     * 解析一条 DATA 实体语句（不含结尾的 ';'）。
     *
     * @param recordText 语句文本
     * @param baseOffset 语句在全文中的字节偏移（用于报错）
     */
    public static StepEntity parseEntity(String recordText, int baseOffset) {
        Parser p = new Parser(recordText, baseOffset);
        StepEntity entity = p.parseEntity();
        p.expectEnd();
        return entity;
    }

    /**
     * 解析一条 HEADER 记录，例如 {@code FILE_SCHEMA(('AP214'))}。
     */
    public static StepValue.StepTyped parseHeaderRecord(String recordText, int baseOffset) {
        Parser p = new Parser(recordText, baseOffset);
        p.skipWs();
        StepValue.StepTyped typed = p.parseTyped();
        p.expectEnd();
        return typed;
    }

    private static final class Parser {
        final String text;
        final int baseOffset;
        int i = 0;

        Parser(String text, int baseOffset) {
            this.text = text;
            this.baseOffset = baseOffset;
        }

        StepEntity parseEntity() {
            skipWs();
            expect('#', "实体 id（#数字）");
            int id = parseId();
            skipWs();
            expect('=', "'='");
            skipWs();
            if (peek() != '(') {
                return new StepEntity(id, List.of(parseTyped()), false);
            }

            // 复杂实体：#id=(A(...)B(...)...)
            i++;
            List<StepValue.StepTyped> parts = new ArrayList<>();
            skipWs();
            while (!eof() && peek() != ')') {
                parts.add(parseTyped());
                skipWs();
            }
            if (parts.isEmpty()) {
                throw unexpected("复杂实体的类型分部");
            }
            expect(')', "')'");
            return new StepEntity(id, parts, true);
        }

        StepValue.StepTyped parseTyped() {
            if (peek() == '!') {
                throw StepReduceException.unsupported("不支持用户自定义实体（!NAME）", offset());
            }
            if (eof() || !isIdentStart(peek())) {
                throw unexpected("实体类型名");
            }
            String type = parseIdent();
            skipWs();
            expect('(', "'('");
            return new StepValue.StepTyped(type, parseArgsUntilClose());
        }

        /**
         * 解析参数表直到匹配的 ')'（调用前已消费 '('）。
         */
        List<StepValue> parseArgsUntilClose() {
            List<StepValue> out = new ArrayList<>();
            skipWs();
            if (peek() == ')') {
                i++;
                return out;
            }
            while (true) {
                out.add(parseValue());
                skipWs();
                if (peek() == ',') {
                    i++;
                    continue;
                }
                if (peek() == ')') {
                    i++;
                    return out;
                }
                throw unexpected("',' 或 ')'");
            }
        }

        StepValue parseValue() {
            skipWs();
            if (eof()) {
                throw unexpected("参数值");
            }
            char c = peek();
            if (c == '$') {
                i++;
                return StepValue.OMITTED;
            }
            if (c == '*') {
                i++;
                return StepValue.DERIVED;
            }
            if (c == '#') {
                i++;
                return new StepValue.StepRef(parseId());
            }
            if (c == '\'') {
                return new StepValue.StepString(parseString());
            }
            if (c == '(') {
                i++;
                return new StepValue.StepList(parseArgsUntilClose());
            }
            if (c == '.') {
                if (i + 1 < text.length() && Character.isDigit(text.charAt(i + 1))) {
                    return parseNumber();
                }
                return new StepValue.StepEnum(parseEnum());
            }
            if (c == '"') {
                throw StepReduceException.unsupported("不支持二进制字面量", offset());
            }
            if (isIdentStart(c)) {
                return parseTyped();
            }
            if (c == '+' || c == '-' || Character.isDigit(c)) {
                return parseNumber();
            }
            throw unexpected("参数值");
        }

        int parseId() {
            int start = i;
            long v = 0;
            while (!eof() && isDigit(peek())) {
                v = v * 10 + (peek() - '0');
                if (v > Integer.MAX_VALUE) {
                    i = start;
                    throw unexpected("不超过 " + Integer.MAX_VALUE + " 的实体 id");
                }
                i++;
            }
            if (i == start) {
                throw unexpected("实体 id 数字");
            }
            if (v == 0) {
                i = start;
                throw unexpected("正整数实体 id");
            }
            return (int) v;
        }

        StepValue.StepNumber parseNumber() {
            int start = i;
            if (peek() == '+' || peek() == '-') {
                i++;
            }
            int digitsStart = i;
            while (!eof() && isDigit(peek())) {
                i++;
            }
            int mantissaDigits = i - digitsStart;
            if (!eof() && peek() == '.') {
                i++;
                int fracStart = i;
                while (!eof() && isDigit(peek())) {
                    i++;
                }
                mantissaDigits += i - fracStart;
            }
            if (mantissaDigits == 0) {
                i = start;
                throw unexpected("数字");
            }
            if (!eof() && (peek() == 'E' || peek() == 'e')) {
                int expStart = i;
                i++;
                if (!eof() && (peek() == '+' || peek() == '-')) {
                    i++;
                }
                int expDigits = i;
                while (!eof() && isDigit(peek())) {
                    i++;
                }
                if (i == expDigits) {
                    i = expStart;
                    throw unexpected("指数数字");
                }
            }
            return new StepValue.StepNumber(text.substring(start, i));
        }

        String parseEnum() {
            int start = i;
            i++;
            if (eof() || !isIdentStart(peek())) {
                i = start;
                throw unexpected("枚举值（.NAME.）");
            }
            int nameStart = i;
            while (!eof() && isIdentPart(peek())) {
                i++;
            }
            String name = text.substring(nameStart, i);
            expect('.', "枚举结束符 '.'");
            return name;
        }

        String parseIdent() {
            int start = i;
            i++;
            while (!eof() && isIdentPart(peek())) {
                i++;
            }
            return text.substring(start, i);
        }

        String parseString() {
            int start = i;
            i++;
            while (!eof()) {
                if (peek() == '\'') {
                    if (i + 1 < text.length() && text.charAt(i + 1) == '\'') {
                        i += 2;
                        continue;
                    }
                    String raw = text.substring(start + 1, i);
                    i++;
                    return raw;
                }
                i++;
            }
            throw StepReduceException.malformed("字符串引号未闭合", baseOffset + start);
        }

        void expect(char c, String description) {
            if (eof() || peek() != c) {
                throw unexpected(description);
            }
            i++;
        }

        void expectEnd() {
            skipWs();
            if (!eof()) {
                // 多出来的内容说明上一条语句缺少 ';'，两条语句被连在了一起
                throw StepReduceException.malformed(
                        "语句缺少结束符 ';'，之后出现：" + StepLexer.abbreviate(text.substring(i)),
                        offset()
                );
            }
        }

        StepReduceException unexpected(String expected) {
            String found = eof() ? "语句结尾" : "'" + StepLexer.abbreviate(text.substring(i, Math.min(text.length(), i + 12))) + "'";
            return StepReduceException.unexpected(expected, found, offset());
        }

        int offset() {
            return baseOffset + i;
        }

        void skipWs() {
            while (!eof() && Character.isWhitespace(peek())) {
                i++;
            }
        }

        boolean eof() {
            return i >= text.length();
        }

        char peek() {
            return eof() ? '\0' : text.charAt(i);
        }

        static boolean isDigit(char c) {
            return c >= '0' && c <= '9';
        }

        static boolean isIdentStart(char c) {
            return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || c == '_';
        }

        static boolean isIdentPart(char c) {
            return isIdentStart(c) || isDigit(c);
        }
    }
}
