package org.stepreduce.step;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class EquivalenceEngineTest {

    private static EquivalenceEngine engine() {
        return new EquivalenceEngine(true, Set.of(), false, 1);
    }

    @Test
    void resolve_mergesStructurallyIdenticalLeaves() {
        StepFile file = StepFixtures.parse("#1=POINT(1.0,2.0,3.0);\n#2=POINT(1.0,2.0,3.0);\n#3=LINE(#1,#2);");

        EquivalenceEngine.Resolution resolution = engine().resolve(file);

        assertThat(resolution.classes()).containsExactly(
                new EquivalenceClass(1, List.of(1, 2)),
                new EquivalenceClass(3, List.of(3))
        );
        assertThat(resolution.mergedEntities()).isEqualTo(1);
        assertThat(resolution.converged()).isTrue();
    }

    @Test
    void resolve_propagatesMergesThroughReferences() {
        StepFile file = StepFixtures.parse("#1=A(1);\n#2=A(1);\n#3=B(#1);\n#4=B(#2);");

        EquivalenceEngine.Resolution resolution = engine().resolve(file);

        assertThat(resolution.representativeOf()).isEqualTo(Map.of(1, 1, 2, 1, 3, 3, 4, 3));
        assertThat(resolution.classes()).hasSize(2);
        assertThat(resolution.iterations()).isEqualTo(2);
        assertThat(resolution.converged()).isTrue();
    }

    @Test
    void resolve_propagatesAcrossSeveralLevels() {
        StepFile file = StepFixtures.parse("""
                #1=P(0.);
                #2=P(0.);
                #3=E(#1);
                #4=E(#2);
                #5=F(#3,'x');
                #6=F(#4,'x');
                #7=G((#5,#6));
                """);

        EquivalenceEngine.Resolution resolution = engine().resolve(file);

        assertThat(resolution.classes()).extracting(EquivalenceClass::members).containsExactly(
                List.of(1, 2),
                List.of(3, 4),
                List.of(5, 6),
                List.of(7)
        );
        assertThat(resolution.converged()).isTrue();
    }

    @Test
    void resolve_terminatesOnCyclicPair() {
        StepFile file = StepFixtures.parse("#1=A(#2);\n#2=A(#1);");

        EquivalenceEngine.Resolution resolution = engine().resolve(file);

        assertThat(resolution.converged()).isTrue();
        assertThat(resolution.iterations()).isLessThanOrEqualTo(file.entityCount());
        assertThat(resolution.classes()).containsExactly(
                new EquivalenceClass(1, List.of(1)),
                new EquivalenceClass(2, List.of(2))
        );
        assertThat(resolution.forcedFinal()).isZero();
    }

    @Test
    void resolve_forcesTentativeClassesFinalAtIterationCap() {
        StepFile file = StepFixtures.parse("""
                #1=P(1.);
                #2=P(1.);
                #3=L(#1);
                #4=L(#2);
                #5=W(#3);
                #6=W(#4);
                """);

        EquivalenceEngine.Resolution capped = engine().resolve(file, 1);

        assertThat(capped.converged()).isFalse();
        assertThat(capped.iterations()).isEqualTo(1);
        assertThat(capped.forcedFinal()).isEqualTo(2);
        assertThat(capped.classes()).extracting(EquivalenceClass::members).containsExactly(
                List.of(1, 2),
                List.of(3, 4),
                List.of(5),
                List.of(6)
        );

        EquivalenceEngine.Resolution full = engine().resolve(file);
        assertThat(full.converged()).isTrue();
        assertThat(full.forcedFinal()).isZero();
        assertThat(full.classes()).hasSize(3);
    }

    @Test
    void resolve_choosesSmallestIdAsRepresentativeRegardlessOfFileOrder() {
        StepFile file = StepFixtures.parse("#9=A(1);\n#4=A(1);\n#7=A(1);");

        EquivalenceEngine.Resolution resolution = engine().resolve(file);

        assertThat(resolution.classes()).containsExactly(new EquivalenceClass(4, List.of(4, 7, 9)));
        assertThat(resolution.representativeOf()).containsEntry(9, 4).containsEntry(7, 4);
    }

    @Test
    void resolve_keepsDifferentTypesApart() {
        StepFile file = StepFixtures.parse("#1=A(1);\n#2=B(1);\n#3=(A(1)B(1));\n#4=(B(1)A(1));");

        EquivalenceEngine.Resolution resolution = engine().resolve(file);

        assertThat(resolution.classes()).hasSize(4);
    }

    @Test
    void resolve_comparesNumbersByValueOnlyWhenNormalizing() {
        StepFile file = StepFixtures.parse("#1=A(1.0);\n#2=A(1.);\n#3=A(1.000E0);");

        assertThat(engine().resolve(file).classes()).hasSize(1);
        assertThat(new EquivalenceEngine(false, Set.of(), false, 1).resolve(file).classes()).hasSize(3);
    }

    @Test
    void resolve_neverMergesIdentityTypes() {
        StepFile file = StepFixtures.parse("""
                #1=PRODUCT('p','p','',());
                #2=PRODUCT('p','p','',());
                #3=PRODUCT_DEFINITION_FORMATION('','',#1);
                #4=PRODUCT_DEFINITION_FORMATION('','',#2);
                """);

        EquivalenceEngine protecting = new EquivalenceEngine(true, Set.of("PRODUCT"), false, 1);

        assertThat(protecting.resolve(file).classes()).hasSize(4);
        assertThat(engine().resolve(file).classes()).hasSize(2);
    }

    @Test
    void resolve_parallelSignaturesGiveSameResult() {
        StringBuilder data = new StringBuilder();
        int id = 1;
        for (int i = 0; i < 200; i++) {
            int point = id++;
            data.append('#').append(point).append("=CARTESIAN_POINT('',(").append(i % 7).append(".,0.,0.));\n");
            data.append('#').append(id++).append("=VERTEX_POINT('',#").append(point).append(");\n");
        }
        StepFile file = StepFixtures.parse(data.toString());

        EquivalenceEngine.Resolution sequential = engine().resolve(file);
        EquivalenceEngine.Resolution parallel = new EquivalenceEngine(true, Set.of(), true, 1).resolve(file);

        assertThat(parallel.classes()).isEqualTo(sequential.classes());
        assertThat(sequential.classes()).hasSize(14);
    }

    @Test
    void resolve_coversEveryEntityExactlyOnce() {
        StepFile file = StepFixtures.parse("#1=A(1);\n#2=A(1);\n#3=B(#1,#2);\n#4=B(#2,#1);\n#5=A(2);");

        EquivalenceEngine.Resolution resolution = engine().resolve(file);

        assertThat(resolution.classes()).flatExtracting(EquivalenceClass::members)
                .containsExactlyInAnyOrder(1, 2, 3, 4, 5);
        assertThat(resolution.representativeOf()).hasSize(5);
    }

    @Test
    void partition_equalityIsStructural() {
        assertThat(new Partition(new int[]{0, 0, 2})).isEqualTo(new Partition(new int[]{0, 0, 2}));
        assertThat(new Partition(new int[]{0, 0, 2}).classCount()).isEqualTo(2);
        assertThat(Partition.discrete(3)).isNotEqualTo(new Partition(new int[]{0, 0, 2}));
    }
}
