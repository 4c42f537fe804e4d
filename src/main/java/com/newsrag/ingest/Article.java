package com.newsrag.ingest;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record Article(
        String url,
        String title,
        String text,
        String category,
        @JsonProperty("scraped_at") String scrapedAt) {
}
