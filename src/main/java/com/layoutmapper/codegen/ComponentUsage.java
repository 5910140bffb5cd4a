package com.layoutmapper.codegen;

import lombok.Value;

import java.util.Map;

/**
 * One JSX usage line and the element it was generated for.
 */
@Value
public class ComponentUsage {
    String elementId;
    String elementName;
    String componentName;
    String code;
    Map<String, Object> props;
}
