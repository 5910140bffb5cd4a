package com.layoutmapper.analysis;

import lombok.Value;

/**
 * A layout pattern detected on one container, e.g. {@code left_aligned}.
 */
@Value
public class ContainerPattern {
    String nodeId;
    String nodeName;
    String pattern;
    int childCount;
}
