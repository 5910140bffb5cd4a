package com.layoutmapper.model;

import lombok.Builder;
import lombok.Value;

/**
 * Column, row or pixel grid attached to a frame.
 */
@Value
@Builder(toBuilder = true)
public class LayoutGrid {
    String pattern;
    double sectionSize;
    double gutterSize;
    String alignment;
    int count;
    double offset;
}
