package org.stepreduce.step;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.NoSuchElementException;

/**
 * STEP 物理文件词法器：把全文切分为以 ';' 结束的记录，并按所在段分类。
 * <p>
 * STEP 物理文件结构：
 * <pre>
 *   ISO-10303-21;
 *   HEADER; ... ENDSEC;
 *   DATA;   ... ENDSEC;
 *   END-ISO-10303-21;
 * </pre>
 * 扫描规则：
 * <ul>
 *   <li>字符串字面量 {@code 'text'} 内的 ';'、括号、注释标记都不参与切分；{@code ''} 表示转义单引号。</li>
 *   <li>语句内的 {@code /* ... *}{@code /} 注释在语句文本中替换为一个空格（注释是记号分隔符，
 *       {@code #1/*c*}{@code /0} 不能变成 {@code #10}）；语句之前的注释随记录一起返回。</li>
 *   <li>语句缺少 ';'、引号或注释在文件末尾仍未闭合时抛出 {@link ErrorKind#MALFORMED_RECORD}。</li>
 *   <li>{@code END-ISO-10303-21;} 之后的内容忽略。</li>
 * </ul>
 * 词法器是惰性的：每次 {@link #next()} 只扫描一条语句，不做任何修改。
 */
public final class StepLexer implements Iterator<StepRecord> {

    private enum Section {
        NONE,
        HEADER,
        DATA,
        DONE
    }

    private final String text;
    private int pos;
    private Section section = Section.NONE;
    private boolean headerSeen;
    private boolean dataSeen;
    private StepRecord pending;

    public StepLexer(String text) {
        this.text = text;
    }

    public static List<StepRecord> tokenize(String text) {
        List<StepRecord> records = new ArrayList<>();
        StepLexer lexer = new StepLexer(text);
        while (lexer.hasNext()) {
            records.add(lexer.next());
        }
        return records;
    }

    @Override
    public boolean hasNext() {
        if (pending == null && section != Section.DONE) {
            pending = scanRecord();
        }
        return pending != null;
    }

    @Override
    public StepRecord next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        StepRecord record = pending;
        pending = null;
        return record;
    }

    private StepRecord scanRecord() {
        List<String> comments = new ArrayList<>();
        skipWhitespaceAndComments(comments);
        if (pos >= text.length()) {
            return null;
        }

        int start = pos;
        // 只有语句内部出现注释时才需要拼接，否则直接 substring
        StringBuilder withoutComments = null;
        int segmentStart = start;
        while (pos < text.length()) {
            char c = text.charAt(pos);
            if (c == '\'') {
                pos = skipString(pos);
                continue;
            }
            if (c == '/' && pos + 1 < text.length() && text.charAt(pos + 1) == '*') {
                if (withoutComments == null) {
                    withoutComments = new StringBuilder();
                }
                withoutComments.append(text, segmentStart, pos).append(' ');
                pos = skipComment(pos);
                segmentStart = pos;
                continue;
            }
            if (c == ';') {
                String source = text.substring(start, pos).trim();
                String statement;
                if (withoutComments == null) {
                    statement = source;
                } else {
                    withoutComments.append(text, segmentStart, pos);
                    statement = withoutComments.toString().trim();
                }
                pos++;
                return classify(statement, source, start, comments);
            }
            pos++;
        }
        throw StepReduceException.malformed("语句缺少结束符 ';'", start);
    }

    private StepRecord classify(String statement, String source, int offset, List<String> comments) {
        String keyword = statement.toUpperCase(Locale.ROOT);
        if (section == Section.NONE) {
            if ("ISO-10303-21".equals(keyword)) {
                return new StepRecord(StepRecord.Kind.FILE_START, statement, source, offset, comments);
            }
            if ("HEADER".equals(keyword)) {
                if (headerSeen) {
                    throw StepReduceException.malformed("HEADER 段重复出现", offset);
                }
                headerSeen = true;
                section = Section.HEADER;
                return new StepRecord(StepRecord.Kind.HEADER_START, statement, source, offset, comments);
            }
            if (isDataKeyword(keyword)) {
                if (dataSeen) {
                    throw StepReduceException.unsupported("不支持包含多个 DATA 段的文件", offset);
                }
                dataSeen = true;
                section = Section.DATA;
                return new StepRecord(StepRecord.Kind.DATA_START, statement, source, offset, comments);
            }
            if ("END-ISO-10303-21".equals(keyword)) {
                section = Section.DONE;
                return new StepRecord(StepRecord.Kind.FILE_END, statement, source, offset, comments);
            }
            if ("ANCHOR".equals(keyword) || "REFERENCE".equals(keyword) || "SIGNATURE".equals(keyword)) {
                throw StepReduceException.unsupported("不支持 " + keyword + " 段", offset);
            }
            throw StepReduceException.malformed("记录不在任何段内：" + abbreviate(statement), offset);
        }

        if ("ENDSEC".equals(keyword)) {
            section = Section.NONE;
            return new StepRecord(StepRecord.Kind.END_SECTION, statement, source, offset, comments);
        }
        StepRecord.Kind kind = (section == Section.HEADER) ? StepRecord.Kind.HEADER_ENTRY : StepRecord.Kind.DATA_ENTRY;
        return new StepRecord(kind, statement, source, offset, comments);
    }

    private static boolean isDataKeyword(String keyword) {
        if (!keyword.startsWith("DATA")) {
            return false;
        }
        String rest = keyword.substring(4).trim();
        // DATA; 或 DATA(('name'),('schema'));
        return rest.isEmpty() || rest.charAt(0) == '(';
    }

    private void skipWhitespaceAndComments(List<String> comments) {
        while (pos < text.length()) {
            char c = text.charAt(pos);
            if (Character.isWhitespace(c)) {
                pos++;
                continue;
            }
            if (c == '/' && pos + 1 < text.length() && text.charAt(pos + 1) == '*') {
                int commentStart = pos;
                pos = skipComment(pos);
                comments.add(text.substring(commentStart, pos));
                continue;
            }
            return;
        }
    }

    private int skipString(int quoteIndex) {
        int i = quoteIndex + 1;
        while (i < text.length()) {
            if (text.charAt(i) == '\'') {
                if (i + 1 < text.length() && text.charAt(i + 1) == '\'') {
                    i += 2;
                    continue;
                }
                return i + 1;
            }
            i++;
        }
        throw StepReduceException.malformed("字符串引号未闭合", quoteIndex);
    }

    private int skipComment(int commentStart) {
        int end = text.indexOf("*/", commentStart + 2);
        if (end < 0) {
            throw StepReduceException.malformed("注释未闭合", commentStart);
        }
        return end + 2;
    }

    static String abbreviate(String text) {
        return text.length() <= 40 ? text : text.substring(0, 40) + "…";
    }
}
