package com.finFlow.sankeyDemo.pipeline.util;

import com.finFlow.sankeyDemo.flow.service.FlowGraphBuilder;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class OutputPathsTest {

    @Test
    void defaultFilesSitNextToTheirSource() {
        Path summary = Path.of("reports", "acme_2024.txt");

        assertThat(OutputPaths.bucketFileFor(summary)).isEqualTo(Path.of("reports", "acme_2024_buckets.json"));
        assertThat(OutputPaths.chartFileFor(summary)).isEqualTo(Path.of("reports", "acme_2024_sankey.json"));
        assertThat(OutputPaths.chartFileFor(Path.of("acme_2024_buckets.json")))
                .isEqualTo(Path.of("acme_2024_buckets_sankey.json"));
    }

    @Test
    void titleUsesCapitalizedPrefixBeforeFirstUnderscore() {
        assertThat(OutputPaths.titleFor(Path.of("data", "ACME_2024_buckets.json")))
                .isEqualTo("Acme - Financial Flow Analysis");
        assertThat(OutputPaths.titleFor(Path.of("globex.json")))
                .isEqualTo("Globex - Financial Flow Analysis");
    }

    @Test
    void titleFallsBackWithoutAUsableName() {
        assertThat(OutputPaths.titleFor(null)).isEqualTo(FlowGraphBuilder.DEFAULT_TITLE);
        assertThat(OutputPaths.titleFor(Path.of("_buckets.json"))).isEqualTo(FlowGraphBuilder.DEFAULT_TITLE);
    }
}
