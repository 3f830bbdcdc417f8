package com.finFlow.sankeyDemo.pipeline.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.finFlow.sankeyDemo.flow.dto.SankeyChartDTO;
import com.finFlow.sankeyDemo.flow.model.ColorScheme;
import com.finFlow.sankeyDemo.flow.model.FlowGraph;
import com.finFlow.sankeyDemo.flow.service.SankeyChartAssembler;
import com.finFlow.sankeyDemo.pipeline.exception.OutputWriteException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes a positioned flow graph as a pretty-printed chart file for the external renderer.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SankeyChartWriter {

    private final SankeyChartAssembler sankeyChartAssembler;
    private final ObjectMapper objectMapper;

    public SankeyChartDTO write(FlowGraph graph, ColorScheme colorScheme, Path file) {
        SankeyChartDTO chart = sankeyChartAssembler.assemble(graph, colorScheme);
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), chart);
        } catch (IOException e) {
            log.error("Failed to write chart file - path: {}", file, e);
            throw new OutputWriteException(file, e);
        }
        log.info("Chart file written - path: {}, scheme: {}", file, colorScheme.getSchemeName());
        return chart;
    }
}
