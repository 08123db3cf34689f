package it.aw.documentsearch.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record FileListResponse(
        List<FileInfo> files,
        @JsonProperty("total_files") int totalFiles
) {}
