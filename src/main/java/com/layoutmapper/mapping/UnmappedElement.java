package com.layoutmapper.mapping;

import com.layoutmapper.analysis.FlatElement;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class UnmappedElement {

    public static final String BELOW_MINIMUM = "No component meets minimum confidence";
    public static final String NO_CANDIDATE = "No suitable component found";

    @NonNull
    FlatElement element;

    /**
     * Highest score any catalog component reached, 0 when the catalog is empty.
     */
    double bestScore;

    @NonNull
    String reason;

    @Singular("suggestion")
    List<Suggestion> suggestions;
}
