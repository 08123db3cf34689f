package it.aw.documentsearch.model;

import javax.validation.constraints.Max;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotNull;
import javax.validation.constraints.Size;

/**
 * Body di POST /api/v1/search.
 */
public record SearchRequest(
        @NotNull @Size(min = 1)  String  query,
        @Min(1) @Max(20)         Integer k       // null = DEFAULT_K
) {

    public static final int DEFAULT_K = 5;

    public int effectiveK() {
        return k != null ? k : DEFAULT_K;
    }
}
