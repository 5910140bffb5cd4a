package com.layoutmapper.engine;

import com.layoutmapper.codegen.CodegenOptions;
import com.layoutmapper.mapping.ImportPathResolver;
import com.layoutmapper.mapping.Mapper;
import lombok.Builder;
import lombok.Data;

/**
 * Per-call configuration of the mapping engine. Nothing is read from global state.
 */
@Data
@Builder(toBuilder = true)
public class EngineConfig {

    @Builder.Default
    private double minConfidence = 60.0;

    @Builder.Default
    private boolean includeImports = true;

    @Builder.Default
    private boolean includeTypeInterfaces = true;

    @Builder.Default
    private int suggestionLimit = Mapper.DEFAULT_SUGGESTION_LIMIT;

    /**
     * Suggestions must score strictly above this.
     */
    @Builder.Default
    private double suggestionFloor = Mapper.DEFAULT_SUGGESTION_FLOOR;

    /**
     * Number of mappable elements from which scoring runs in parallel; 0 keeps it sequential.
     */
    @Builder.Default
    private int parallelThreshold = 0;

    /**
     * Module root used for components that declare no import path.
     */
    @Builder.Default
    private String libraryRoot = ImportPathResolver.DEFAULT_LIBRARY_ROOT;

    public static EngineConfig defaults() {
        return EngineConfig.builder().build();
    }

    /**
     * @throws IllegalArgumentException on the first invalid setting
     */
    public void validate() {
        if (Double.isNaN(minConfidence) || minConfidence < 0 || minConfidence > 100) {
            throw new IllegalArgumentException("minConfidence must be between 0 and 100, got " + minConfidence);
        }
        if (suggestionLimit < 0) {
            throw new IllegalArgumentException("suggestionLimit must not be negative, got " + suggestionLimit);
        }
        if (parallelThreshold < 0) {
            throw new IllegalArgumentException("parallelThreshold must not be negative, got " + parallelThreshold);
        }
    }

    public CodegenOptions toCodegenOptions() {
        return CodegenOptions.builder()
                .includeImports(includeImports)
                .includeTypeInterfaces(includeTypeInterfaces)
                .build();
    }
}
