package com.layoutmapper.codegen;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class GeneratedCode {

    /**
     * Sorted import statements; empty when imports are disabled.
     */
    @Singular("importStatement")
    List<String> imports;

    /**
     * Usage lines grouped by component, groups in first-appearance order.
     */
    @Singular("usage")
    List<ComponentUsage> usages;

    /**
     * One {@code interface <Name>Props} per component; empty when interfaces are disabled.
     */
    @Singular("typeInterface")
    List<String> typeInterfaces;

    /**
     * Composed {@code GeneratedComponent} source, or an empty string when nothing was mapped.
     */
    String scaffold;

    /**
     * Mapping notes prefixed with the element they concern.
     */
    @Singular("warning")
    List<String> warnings;

    int totalComponents;

    public int getTotalUsages() {
        return usages.size();
    }

    public boolean hasScaffold() {
        return scaffold != null && !scaffold.isEmpty();
    }
}
