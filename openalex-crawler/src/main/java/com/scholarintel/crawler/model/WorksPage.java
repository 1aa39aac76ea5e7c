package com.scholarintel.crawler.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Data;

import java.util.List;

/**
 * Raw envelope of a /works list response.
 * Items stay as JSON trees; the extractor tolerates whatever shape they have.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class WorksPage {

    private List<JsonNode> results;

    private Meta meta;

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Meta {
        private Long count;

        @JsonProperty("per_page")
        private Integer perPage;

        /** Null once the sequence is exhausted */
        @JsonProperty("next_cursor")
        private String nextCursor;
    }
}
