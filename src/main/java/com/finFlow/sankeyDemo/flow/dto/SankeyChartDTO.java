package com.finFlow.sankeyDemo.flow.dto;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.finFlow.sankeyDemo.flow.model.ColorClass;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Positioned, colored flow graph handed to the external renderer.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SankeyChartDTO {

    @JsonProperty("title")
    private String title;

    @JsonProperty("footnote")
    private String footnote;

    @JsonProperty("colorScheme")
    private String colorScheme;

    @JsonProperty("nodes")
    private List<Node> nodes;

    @JsonProperty("edges")
    private List<Edge> edges;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    @JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY,
            getterVisibility = JsonAutoDetect.Visibility.NONE,
            isGetterVisibility = JsonAutoDetect.Visibility.NONE,
            setterVisibility = JsonAutoDetect.Visibility.NONE)
    public static class Node {
        @JsonProperty("label")
        private String label;

        @JsonProperty("stage")
        private double stage;

        @JsonProperty("yPosition")
        private double yPosition;

        @JsonProperty("colorClass")
        private ColorClass colorClass;

        @JsonProperty("color")
        private String color;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    public static class Edge {
        @JsonProperty("sourceIndex")
        private int sourceIndex;

        @JsonProperty("targetIndex")
        private int targetIndex;

        @JsonProperty("magnitude")
        private double magnitude;

        @JsonProperty("colorClass")
        private ColorClass colorClass;

        @JsonProperty("color")
        private String color;
    }
}
