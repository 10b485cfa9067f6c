package org.stepreduce.step;

import java.util.List;
import java.util.Set;

/**
 * 一次精简的选项。
 *
 * @param preserveHeaderComments 是否在输出中保留 HEADER 段的注释（记录之前的注释与记录内部的注释）；DATA 段注释总是丢弃
 * @param strictHeader           是否拒绝未知的 HEADER 记录类型
 * @param normalizeNumbers       比较时是否按数值（而非书写形式）比较数字，例如 {@code 1.0} 与 {@code 1.}；INTEGER 与 REAL 始终不相等
 * @param preserveIdentityTypes  是否保护带身份语义的实体类型不被合并
 * @param identityTypes          带身份语义的实体类型
 * @param removeOrphans          是否删除从 GC 根不可达的实体
 * @param gcRootTypes            GC 根实体类型
 * @param parallel               是否并行计算签名
 * @param parallelThreshold      实体数达到该值时才启用并行
 */
public record ReduceOptions(
        boolean preserveHeaderComments,
        boolean strictHeader,
        boolean normalizeNumbers,
        boolean preserveIdentityTypes,
        Set<String> identityTypes,
        boolean removeOrphans,
        Set<String> gcRootTypes,
        boolean parallel,
        int parallelThreshold
) {

    public static final List<String> DEFAULT_IDENTITY_TYPES = List.of(
            "PRODUCT",
            "PRODUCT_DEFINITION",
            "PRODUCT_DEFINITION_FORMATION",
            "PRODUCT_DEFINITION_FORMATION_WITH_SPECIFIED_SOURCE",
            "PRODUCT_DEFINITION_SHAPE",
            "PRODUCT_DEFINITION_CONTEXT",
            "PRODUCT_DEFINITION_WITH_ASSOCIATED_DOCUMENTS",
            "PRODUCT_RELATED_PRODUCT_CATEGORY",
            "SHAPE_DEFINITION_REPRESENTATION",
            "SHAPE_REPRESENTATION",
            "SHAPE_REPRESENTATION_RELATIONSHIP",
            "ADVANCED_BREP_SHAPE_REPRESENTATION",
            "MANIFOLD_SOLID_BREP",
            "MANIFOLD_SURFACE_SHAPE_REPRESENTATION",
            "GEOMETRICALLY_BOUNDED_SURFACE_SHAPE_REPRESENTATION",
            "GEOMETRICALLY_BOUNDED_WIREFRAME_SHAPE_REPRESENTATION",
            "STYLED_ITEM",
            "OVER_RIDING_STYLED_ITEM",
            "PRESENTATION_LAYER_ASSIGNMENT",
            "APPLICATION_CONTEXT",
            "APPLICATION_PROTOCOL_DEFINITION",
            "PRODUCT_CONTEXT",
            "DESIGN_CONTEXT"
    );

    public static final List<String> DEFAULT_GC_ROOT_TYPES = List.of(
            "APPLICATION_CONTEXT",
            "APPLICATION_PROTOCOL_DEFINITION",
            "CONTEXT_DEPENDENT_SHAPE_REPRESENTATION",
            "DRAUGHTING_MODEL",
            "MECHANICAL_DESIGN_GEOMETRIC_PRESENTATION_REPRESENTATION",
            "PRESENTATION_LAYER_ASSIGNMENT",
            "PRODUCT_DEFINITION",
            "SHAPE_DEFINITION_REPRESENTATION",
            "SHAPE_REPRESENTATION_RELATIONSHIP"
    );

    public static final int DEFAULT_PARALLEL_THRESHOLD = 50_000;

    public ReduceOptions {
        identityTypes = (identityTypes == null) ? Set.of() : Set.copyOf(identityTypes);
        gcRootTypes = (gcRootTypes == null) ? Set.of() : Set.copyOf(gcRootTypes);
        if (parallelThreshold < 1) {
            throw new IllegalArgumentException("parallelThreshold 必须 >= 1，当前：" + parallelThreshold);
        }
    }

    public static ReduceOptions defaults() {
        return new ReduceOptions(
                false,
                false,
                true,
                true,
                Set.copyOf(DEFAULT_IDENTITY_TYPES),
                false,
                Set.copyOf(DEFAULT_GC_ROOT_TYPES),
                false,
                DEFAULT_PARALLEL_THRESHOLD
        );
    }

    public ReduceOptions withPreserveHeaderComments(boolean value) {
        return new ReduceOptions(value, strictHeader, normalizeNumbers, preserveIdentityTypes, identityTypes,
                removeOrphans, gcRootTypes, parallel, parallelThreshold);
    }

    public ReduceOptions withStrictHeader(boolean value) {
        return new ReduceOptions(preserveHeaderComments, value, normalizeNumbers, preserveIdentityTypes, identityTypes,
                removeOrphans, gcRootTypes, parallel, parallelThreshold);
    }

    public ReduceOptions withNormalizeNumbers(boolean value) {
        return new ReduceOptions(preserveHeaderComments, strictHeader, value, preserveIdentityTypes, identityTypes,
                removeOrphans, gcRootTypes, parallel, parallelThreshold);
    }

    public ReduceOptions withPreserveIdentityTypes(boolean value) {
        return new ReduceOptions(preserveHeaderComments, strictHeader, normalizeNumbers, value, identityTypes,
                removeOrphans, gcRootTypes, parallel, parallelThreshold);
    }

    public ReduceOptions withRemoveOrphans(boolean value) {
        return new ReduceOptions(preserveHeaderComments, strictHeader, normalizeNumbers, preserveIdentityTypes,
                identityTypes, value, gcRootTypes, parallel, parallelThreshold);
    }

    public ReduceOptions withParallel(boolean value, int threshold) {
        return new ReduceOptions(preserveHeaderComments, strictHeader, normalizeNumbers, preserveIdentityTypes,
                identityTypes, removeOrphans, gcRootTypes, value, threshold);
    }
}
