package com.webharvest.core.service.export;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;

/** index.json 배열 원소 */
@JsonPropertyOrder({"url", "title", "timestamp", "status_code", "file_path", "depth",
        "content_length", "outbound_links", "excerpt"})
public record IndexEntry(
        @JsonProperty("url") String url,
        @JsonProperty("title") String title,
        @JsonProperty("timestamp") Instant timestamp,
        @JsonProperty("status_code") int statusCode,
        @JsonProperty("file_path") String filePath,
        @JsonProperty("depth") int depth,
        @JsonProperty("content_length") int contentLength,
        @JsonProperty("outbound_links") int outboundLinks,
        @JsonProperty("excerpt") String excerpt) {}
