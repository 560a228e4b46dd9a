package com.goldprice.common.model;

import java.util.List;

/**
 * Output of a field extractor: the candidate rows plus the timestamp the page
 * asserts for the whole batch ({@code null} when the page shows none).
 */
public record ExtractionResult(List<RawField> fields, String assertedTimestamp) {

    public ExtractionResult {
        fields = fields == null ? List.of() : List.copyOf(fields);
    }

    public static ExtractionResult empty() {
        return new ExtractionResult(List.of(), null);
    }
}
