package org.stepreduce.step;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * 测试用 STEP 文本构造。
 */
final class StepFixtures {

    static final String HEADER = """
            ISO-10303-21;
            HEADER;
            FILE_DESCRIPTION(('test'),'2;1');
            FILE_NAME('a.stp','2026-01-01T00:00:00',('a'),('o'),'p','s','');
            FILE_SCHEMA(('AUTOMOTIVE_DESIGN'));
            ENDSEC;
            """;

    private StepFixtures() {
    }

    static String wrap(String data) {
        return HEADER + "DATA;\n" + data + "\nENDSEC;\nEND-ISO-10303-21;\n";
    }

    static byte[] bytes(String data) {
        return wrap(data).getBytes(StandardCharsets.ISO_8859_1);
    }

    static StepFile parse(String data) {
        return StepEntityParser.parseFile(wrap(data), false);
    }

    static String text(byte[] output) {
        return new String(output, StandardCharsets.ISO_8859_1);
    }

    /**
     * 输出 DATA 段中的实体行（不含结尾的 ';'）。
     */
    static List<String> dataLines(byte[] output) {
        List<String> lines = new ArrayList<>();
        boolean inData = false;
        for (String line : text(output).split("\n")) {
            if (line.startsWith("DATA")) {
                inData = true;
                continue;
            }
            if (inData && line.equals("ENDSEC;")) {
                break;
            }
            if (inData) {
                lines.add(line.substring(0, line.length() - 1));
            }
        }
        return lines;
    }
}
