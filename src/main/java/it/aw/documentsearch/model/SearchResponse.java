package it.aw.documentsearch.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record SearchResponse(
        String             query,
        List<SearchResult> results,
        @JsonProperty("total_results") int totalResults
) {}
