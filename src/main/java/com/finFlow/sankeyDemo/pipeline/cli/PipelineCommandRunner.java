package com.finFlow.sankeyDemo.pipeline.cli;

import com.finFlow.sankeyDemo.llm.exception.TextGenerationException;
import com.finFlow.sankeyDemo.pipeline.exception.PipelineException;
import com.finFlow.sankeyDemo.pipeline.model.PipelineState;
import com.finFlow.sankeyDemo.pipeline.service.FinancialFlowPipeline;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;

/**
 * Command-line entry point.
 *
 * <pre>
 * extract   --input=&lt;summary.txt&gt; [--output=&lt;buckets.json&gt;] [--model=&lt;model&gt;]
 * visualize --buckets=&lt;buckets.json&gt; [--output=&lt;chart.json&gt;] [--color-scheme=&lt;name&gt;]
 * run       --input=&lt;summary.txt&gt; [--model=&lt;model&gt;] [--color-scheme=&lt;name&gt;]
 * </pre>
 *
 * Exit codes: 0 on success or when no command is given, 1 when a run fails, 2 on bad usage.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PipelineCommandRunner implements ApplicationRunner, ExitCodeGenerator {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_USAGE = 2;

    static final String USAGE = """
            Usage: <command> [options]
              extract   --input=<summary.txt> [--output=<buckets.json>] [--model=<model>]
              visualize --buckets=<buckets.json> [--output=<chart.json>] [--color-scheme=standard|professional|high_contrast]
              run       --input=<summary.txt> [--model=<model>] [--color-scheme=<name>]""";

    private final FinancialFlowPipeline financialFlowPipeline;

    private int exitCode = EXIT_OK;

    @Override
    public void run(ApplicationArguments args) {
        List<String> commands = args.getNonOptionArgs();
        if (commands.isEmpty()) {
            log.info("No command given\n{}", USAGE);
            return;
        }

        String command = commands.get(0);
        try {
            switch (command) {
                case "extract" -> {
                    PipelineState state = financialFlowPipeline.extract(
                            requiredPath(args, "input"), optionalPath(args, "output"), option(args, "model"));
                    log.info("Buckets written to {} (extraction path: {})", state.getBucketFile(), state.getExtractionPath());
                }
                case "visualize" -> {
                    PipelineState state = financialFlowPipeline.visualize(
                            requiredPath(args, "buckets"), optionalPath(args, "output"), option(args, "color-scheme"));
                    log.info("Chart written to {}", state.getChartFile());
                }
                case "run" -> {
                    PipelineState state = financialFlowPipeline.run(
                            requiredPath(args, "input"), option(args, "model"), option(args, "color-scheme"));
                    log.info("Buckets written to {}, chart written to {}", state.getBucketFile(), state.getChartFile());
                }
                default -> {
                    log.error("Unknown command: {}\n{}", command, USAGE);
                    exitCode = EXIT_USAGE;
                }
            }
        } catch (MissingOptionException e) {
            log.error("{}\n{}", e.getMessage(), USAGE);
            exitCode = EXIT_USAGE;
        } catch (PipelineException | TextGenerationException e) {
            log.error("Command '{}' failed: {}", command, e.getMessage());
            exitCode = EXIT_FAILED;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    private static Path requiredPath(ApplicationArguments args, String name) {
        String value = option(args, name);
        if (value == null) {
            throw new MissingOptionException(name);
        }
        return Path.of(value);
    }

    private static Path optionalPath(ApplicationArguments args, String name) {
        String value = option(args, name);
        return value == null ? null : Path.of(value);
    }

    private static String option(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty() || values.get(0).isBlank()) {
            return null;
        }
        return values.get(0);
    }

    private static class MissingOptionException extends RuntimeException {
        MissingOptionException(String option) {
            super("Missing required option --" + option);
        }
    }
}
