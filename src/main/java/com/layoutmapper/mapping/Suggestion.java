package com.layoutmapper.mapping;

import lombok.Value;

/**
 * A catalog component proposed for an element that did not reach the confidence floor.
 */
@Value
public class Suggestion {
    String componentName;
    double score;
    String reason;
    String example;
}
