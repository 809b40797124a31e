package com.policyqa.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

public record SourceCitation(
    @JsonProperty("document_id")
    Long documentId,

    @JsonProperty("chunk_id")
    Long chunkId,

    @JsonProperty("quoted_text")
    String quotedText,

    @JsonInclude(JsonInclude.Include.NON_NULL)
    Integer page
) {}
