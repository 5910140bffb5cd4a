package com.layoutmapper.analysis;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class LayoutAnalysis {

    @Singular("spacingPattern")
    List<ContainerPattern> spacingPatterns;

    @Singular("alignmentPattern")
    List<ContainerPattern> alignmentPatterns;

    @Singular("responsivePattern")
    List<ContainerPattern> responsivePatterns;

    @Singular("grid")
    List<GridUsage> grids;

    LayoutMetrics metrics;
}
