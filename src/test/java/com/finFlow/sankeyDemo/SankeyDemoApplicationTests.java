package com.finFlow.sankeyDemo;

import com.finFlow.sankeyDemo.extraction.model.FallbackPatternTable;
import com.finFlow.sankeyDemo.extraction.model.TaxonomyKey;
import com.finFlow.sankeyDemo.pipeline.cli.PipelineCommandRunner;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Smoke test verifying the Spring context boots with its configured beans.
 */
@SpringBootTest
class SankeyDemoApplicationTests {

    @Autowired
    private PipelineCommandRunner pipelineCommandRunner;

    @Autowired
    private FallbackPatternTable fallbackPatternTable;

    /**
     * With no command the runner only logs usage and reports success.
     */
    @Test
    void contextLoads() {
        assertThat(pipelineCommandRunner.getExitCode()).isZero();
        assertThat(fallbackPatternTable.patternsFor(TaxonomyKey.REVENUE)).isNotEmpty();
    }

}
