package org.stepreduce.step;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StepEntityParserTest {

    @Test
    void parseEntity_parsesAllValueKinds() {
        StepEntity entity = StepEntityParser.parseEntity(
                "#7=THING('it''s',-1.5E-3,.T.,#3,(#4,(1,2)),$,*,LENGTH_MEASURE(10.5),.5)", 0);

        assertThat(entity.id()).isEqualTo(7);
        assertThat(entity.complex()).isFalse();
        assertThat(entity.typeName()).isEqualTo("THING");
        assertThat(entity.params()).containsExactly(
                new StepValue.StepString("it''s"),
                new StepValue.StepNumber("-1.5E-3"),
                new StepValue.StepEnum("T"),
                new StepValue.StepRef(3),
                new StepValue.StepList(List.of(
                        new StepValue.StepRef(4),
                        new StepValue.StepList(List.of(new StepValue.StepNumber("1"), new StepValue.StepNumber("2")))
                )),
                StepValue.OMITTED,
                StepValue.DERIVED,
                new StepValue.StepTyped("LENGTH_MEASURE", List.of(new StepValue.StepNumber("10.5"))),
                new StepValue.StepNumber(".5")
        );
    }

    @Test
    void parseEntity_toleratesWhitespaceBetweenTokens() {
        StepEntity entity = StepEntityParser.parseEntity("#10 = POINT ( 1.0 ,\n 2.0 , ( #1 , #2 ) )", 0);

        assertThat(entity.id()).isEqualTo(10);
        assertThat(StepSerializer.formatEntity(entity)).isEqualTo("#10=POINT(1.0,2.0,(#1,#2))");
    }

    @Test
    void parseEntity_parsesComplexEntityParts() {
        StepEntity entity = StepEntityParser.parseEntity("#5=(LENGTH_UNIT()NAMED_UNIT(*)SI_UNIT(.MILLI.,.METRE.))", 0);

        assertThat(entity.complex()).isTrue();
        assertThat(entity.parts()).extracting(StepValue.StepTyped::type)
                .containsExactly("LENGTH_UNIT", "NAMED_UNIT", "SI_UNIT");
        assertThat(entity.typeName()).isEqualTo("(LENGTH_UNIT,NAMED_UNIT,SI_UNIT)");
        assertThat(entity.params()).isEmpty();
    }

    @Test
    void parseEntity_keepsTypeNameCase() {
        StepEntity entity = StepEntityParser.parseEntity("#1=Point(0.)", 0);

        assertThat(entity.typeName()).isEqualTo("Point");
    }

    @Test
    void parseEntity_reportsUnexpectedTokenWithAbsoluteOffset() {
        assertThatThrownBy(() -> StepEntityParser.parseEntity("#1=A(1,,2)", 100))
                .isInstanceOfSatisfying(StepReduceException.class, e -> {
                    assertThat(e.getKind()).isEqualTo(ErrorKind.UNEXPECTED_TOKEN);
                    assertThat(e.getOffset()).isEqualTo(107);
                });
    }

    @Test
    void parseEntity_reportsUnclosedParameterList() {
        assertThatThrownBy(() -> StepEntityParser.parseEntity("#1=A(1", 0))
                .isInstanceOfSatisfying(StepReduceException.class,
                        e -> assertThat(e.getKind()).isEqualTo(ErrorKind.UNEXPECTED_TOKEN));
    }

    @Test
    void parseEntity_rejectsZeroId() {
        assertThatThrownBy(() -> StepEntityParser.parseEntity("#0=A(1)", 0))
                .isInstanceOfSatisfying(StepReduceException.class,
                        e -> assertThat(e.getKind()).isEqualTo(ErrorKind.UNEXPECTED_TOKEN));
    }

    @Test
    void parseEntity_rejectsUserDefinedEntity() {
        assertThatThrownBy(() -> StepEntityParser.parseEntity("#1=!MY_TYPE(1)", 0))
                .isInstanceOfSatisfying(StepReduceException.class,
                        e -> assertThat(e.getKind()).isEqualTo(ErrorKind.UNSUPPORTED_CONSTRUCT));
    }

    @Test
    void parseEntity_rejectsBinaryLiteral() {
        assertThatThrownBy(() -> StepEntityParser.parseEntity("#1=A(\"0FF\")", 0))
                .isInstanceOfSatisfying(StepReduceException.class,
                        e -> assertThat(e.getKind()).isEqualTo(ErrorKind.UNSUPPORTED_CONSTRUCT));
    }

    @Test
    void parseEntity_rejectsTwoStatementsJoinedWithoutTerminator() {
        String record = "#1=A(1)\n#2=A(1)";

        assertThatThrownBy(() -> StepEntityParser.parseEntity(record, 40))
                .isInstanceOfSatisfying(StepReduceException.class, e -> {
                    assertThat(e.getKind()).isEqualTo(ErrorKind.MALFORMED_RECORD);
                    assertThat(e.getOffset()).isEqualTo(40 + record.indexOf("#2"));
                });
    }

    @Test
    void parseFile_keepsFileOrderAndHeader() {
        StepFile file = StepFixtures.parse("#20=A(1);\n#3=B(#20);\n#11=C(#3);");

        assertThat(file.entities().keySet()).containsExactly(20, 3, 11);
        assertThat(file.dataStatement()).isEqualTo("DATA");
        assertThat(file.header().fileName()).isEqualTo("a.stp");
        assertThat(file.header().schemas()).containsExactly("AUTOMOTIVE_DESIGN");
        assertThat(file.header().descriptions()).containsExactly("test");
    }

    @Test
    void parseFile_rejectsDuplicateId() {
        String text = StepFixtures.wrap("#1=A(1);\n#1=A(2);");

        assertThatThrownBy(() -> StepEntityParser.parseFile(text, false))
                .isInstanceOfSatisfying(StepReduceException.class, e -> {
                    assertThat(e.getKind()).isEqualTo(ErrorKind.MALFORMED_RECORD);
                    assertThat(e.getOffset()).isEqualTo(text.indexOf("#1=A(2)"));
                });
    }

    @Test
    void parseFile_rejectsDanglingReference() {
        String text = StepFixtures.wrap("#1=POINT(0.);\n#2=POINT(1.);\n#3=LINE(#1,#99);");

        assertThatThrownBy(() -> StepEntityParser.parseFile(text, false))
                .isInstanceOfSatisfying(StepReduceException.class, e -> {
                    assertThat(e.getKind()).isEqualTo(ErrorKind.DANGLING_REFERENCE);
                    assertThat(e.getEntityId()).isEqualTo(99);
                    assertThat(e.getOffset()).isEqualTo(text.indexOf("#3=LINE"));
                });
    }

    @Test
    void parseFile_strictHeaderRejectsUnknownRecordType() {
        String text = StepFixtures.HEADER.replace("ENDSEC;", "CUSTOM_HEADER('x');\nENDSEC;")
                + "DATA;\n#1=A(1);\nENDSEC;\nEND-ISO-10303-21;\n";

        assertThat(StepEntityParser.parseFile(text, false).header().records()).hasSize(4);
        assertThatThrownBy(() -> StepEntityParser.parseFile(text, true))
                .isInstanceOfSatisfying(StepReduceException.class,
                        e -> assertThat(e.getKind()).isEqualTo(ErrorKind.UNSUPPORTED_CONSTRUCT));
    }

    @Test
    void parseFile_requiresEndMarker() {
        String text = StepFixtures.HEADER + "DATA;\n#1=A(1);\nENDSEC;\n";

        assertThatThrownBy(() -> StepEntityParser.parseFile(text, false))
                .isInstanceOfSatisfying(StepReduceException.class,
                        e -> assertThat(e.getKind()).isEqualTo(ErrorKind.MALFORMED_RECORD));
    }
}
