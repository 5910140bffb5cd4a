package com.layoutmapper.codegen;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class CodegenOptions {

    @Builder.Default
    boolean includeImports = true;

    @Builder.Default
    boolean includeTypeInterfaces = true;

    public static CodegenOptions defaults() {
        return CodegenOptions.builder().build();
    }
}
