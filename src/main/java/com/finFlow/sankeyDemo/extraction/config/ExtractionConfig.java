package com.finFlow.sankeyDemo.extraction.config;

import com.finFlow.sankeyDemo.extraction.model.FallbackPatternTable;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ExtractionConfig {

    @Bean
    public FallbackPatternTable fallbackPatternTable(
            @Value("${sankey.extraction.fallback-patterns:" + FallbackPatternTable.DEFAULT_RESOURCE + "}") String resourcePath) {
        return FallbackPatternTable.load(resourcePath);
    }
}
