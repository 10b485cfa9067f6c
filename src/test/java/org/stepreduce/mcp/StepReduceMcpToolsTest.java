package org.stepreduce.mcp;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.util.unit.DataSize;
import org.stepreduce.filesystem.HashingUtils;
import org.stepreduce.filesystem.SecurePathResolver;
import org.stepreduce.filesystem.StepReduceProperties;
import org.stepreduce.filesystem.dto.step.StepEntityTypeCount;
import org.stepreduce.filesystem.dto.step.StepReduceResult;
import org.stepreduce.step.ErrorKind;
import org.stepreduce.step.StepReduceException;
import org.stepreduce.step.StepReducer;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StepReduceMcpToolsTest {

    private static final String MODEL = """
            ISO-10303-21;
            HEADER;
            FILE_DESCRIPTION(('\\X2\\4E2D65876A21578B\\X0\\'),'2;1');
            FILE_NAME('part.stp','2026-01-01T00:00:00',('a'),('o'),'p','s','');
            FILE_SCHEMA(('AP214'));
            ENDSEC;
            DATA;
            #1=POINT(1.0,2.0,3.0);
            #2=POINT(1.0,2.0,3.0);
            #3=LINE(#1,#2);
            ENDSEC;
            END-ISO-10303-21;
            """;

    @TempDir
    Path root;

    private StepReduceProperties properties;

    @BeforeEach
    void setUp() throws IOException {
        properties = new StepReduceProperties();
        properties.setRoots(List.of(root.toString()));
        Files.writeString(root.resolve("part.stp"), MODEL, StandardCharsets.ISO_8859_1);
    }

    private StepReduceMcpTools tools() {
        return new StepReduceMcpTools(properties, new SecurePathResolver(properties), new StepReducer(properties.toReduceOptions()));
    }

    @Test
    void listRoots_returnsConfiguredRoot() {
        assertThat(tools().listRoots().roots()).extracting(r -> r.id()).containsExactly("root0");
    }

    @Test
    void previewReduce_reportsStatisticsWithoutWriting() throws IOException {
        StepReduceResult result = tools().previewReduce(null, "part.stp", null, null, null, null);

        assertThat(result.written()).isFalse();
        assertThat(result.outputPath()).isNull();
        assertThat(result.inputEntities()).isEqualTo(3);
        assertThat(result.outputEntities()).isEqualTo(2);
        assertThat(result.mergedEntities()).isEqualTo(1);
        assertThat(result.mergedByType()).containsExactly(new StepEntityTypeCount("POINT", 1));
        assertThat(result.header().descriptions()).containsExactly("中文模型");
        assertThat(result.header().fileName()).isEqualTo("part.stp");
        assertThat(result.header().schemas()).containsExactly("AP214");
        try (var files = Files.list(root)) {
            assertThat(files).containsExactly(root.resolve("part.stp"));
        }
    }

    @Test
    void reduceFile_writesNextToInputByDefault() throws IOException {
        StepReduceResult result = tools().reduceFile(null, "part.stp", null, null, null, null, null, null);

        Path written = root.resolve("part.reduced.stp");
        assertThat(result.written()).isTrue();
        assertThat(result.outputPath()).isEqualTo("part.reduced.stp");
        assertThat(written).exists();
        byte[] output = Files.readAllBytes(written);
        assertThat(new String(output, StandardCharsets.ISO_8859_1))
                .contains("#1=POINT(1.0,2.0,3.0);\n#2=LINE(#1,#1);\n");
        assertThat(result.outputSha256()).isEqualTo(HashingUtils.sha256Hex(output));
        assertThat(Files.readString(root.resolve("part.stp"), StandardCharsets.ISO_8859_1)).isEqualTo(MODEL);
    }

    @Test
    void reduceFile_refusesToOverwriteUnlessAsked() throws IOException {
        Path target = Files.writeString(root.resolve("out.stp"), "keep me");

        assertThatThrownBy(() -> tools().reduceFile(null, "part.stp", "out.stp", null, null, null, null, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("overwrite=true");
        assertThat(Files.readString(target)).isEqualTo("keep me");

        tools().reduceFile(null, "part.stp", "out.stp", true, null, null, null, null);
        assertThat(Files.readString(target)).startsWith("ISO-10303-21;");
    }

    @Test
    void reduceFile_writesNothingForMalformedInput() throws IOException {
        Files.writeString(root.resolve("broken.stp"), MODEL.replace("#1=POINT(1.0,2.0,3.0);", "#1=POINT(1.0,2.0,3.0)"));

        assertThatThrownBy(() -> tools().reduceFile(null, "broken.stp", "fixed.stp", null, null, null, null, null))
                .isInstanceOfSatisfying(StepReduceException.class,
                        e -> assertThat(e.getKind()).isEqualTo(ErrorKind.MALFORMED_RECORD));
        assertThat(root.resolve("fixed.stp")).doesNotExist();
        try (var files = Files.list(root)) {
            assertThat(files).noneMatch(p -> p.getFileName().toString().endsWith(".tmp"));
        }
    }

    @Test
    void reduceFile_isRejectedWhenWritingDisabled() {
        properties.setAllowWrite(false);

        assertThatThrownBy(() -> tools().reduceFile(null, "part.stp", null, null, null, null, null, null))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("allow-write");
    }

    @Test
    void previewReduce_warnsWhenOrphanRemovalFindsNoRoot() {
        StepReduceResult result = tools().previewReduce(null, "part.stp", null, null, true, null);

        assertThat(result.orphanRoots()).isZero();
        assertThat(result.orphansRemoved()).isZero();
        assertThat(result.warnings()).anyMatch(w -> w.contains("GC 根"));
    }

    @Test
    void reduceFile_refusesToReplaceInputUnlessAsked() {
        assertThatThrownBy(() -> tools().reduceFile(null, "part.stp", "part.stp", null, null, null, null, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("overwrite=true");
    }

    @Test
    void previewReduce_rejectsNonStepFile() throws IOException {
        Files.writeString(root.resolve("notes.txt"), "hello");

        assertThatThrownBy(() -> tools().previewReduce(null, "notes.txt", null, null, null, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("STEP");
    }

    @Test
    void previewReduce_rejectsOversizedInput() {
        properties.setMaxInputBytes(DataSize.ofBytes(16));

        assertThatThrownBy(() -> tools().previewReduce(null, "part.stp", null, null, null, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("max-input-bytes");
    }

    @Test
    void previewReduce_rejectsPathOutsideRoot() {
        assertThatThrownBy(() -> tools().previewReduce(null, "../part.stp", null, null, null, null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
