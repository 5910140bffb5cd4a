package com.layoutmapper.analysis;

import com.layoutmapper.model.LayoutGrid;
import lombok.Value;

@Value
public class GridUsage {
    String nodeId;
    String nodeName;
    LayoutGrid grid;
}
