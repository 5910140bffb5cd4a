package com.layoutmapper.engine;

import com.layoutmapper.codegen.GeneratedCode;
import com.layoutmapper.mapping.MappingReport;
import lombok.Value;

@Value
public class MappingResult {
    MappingReport report;
    GeneratedCode code;
}
