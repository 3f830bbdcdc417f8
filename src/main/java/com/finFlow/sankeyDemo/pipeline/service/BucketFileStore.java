package com.finFlow.sankeyDemo.pipeline.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.finFlow.sankeyDemo.extraction.model.Bucket;
import com.finFlow.sankeyDemo.extraction.model.BucketSet;
import com.finFlow.sankeyDemo.extraction.model.TaxonomyKey;
import com.finFlow.sankeyDemo.pipeline.exception.InputFileNotFoundException;
import com.finFlow.sankeyDemo.pipeline.exception.InvalidBucketFileException;
import com.finFlow.sankeyDemo.pipeline.exception.OutputWriteException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Reads and writes bucket files.
 *
 * A bucket file is a JSON array of {@code {"bucket": <label>, "value": <millions>}} records
 * in taxonomy order. Every extractable key is written; EBIT and EBT only when they hold a value.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BucketFileStore {

    private static final String BUCKET_FIELD = "bucket";
    private static final String VALUE_FIELD = "value";

    private final ObjectMapper objectMapper;

    public void write(BucketSet buckets, Path file) {
        ArrayNode array = objectMapper.createArrayNode();
        for (Bucket bucket : buckets.buckets()) {
            if (bucket.name().isDerivable() && bucket.value() == 0.0) {
                continue;
            }
            array.addObject()
                    .put(BUCKET_FIELD, bucket.name().getLabel())
                    .put(VALUE_FIELD, bucket.value());
        }

        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), array);
        } catch (IOException e) {
            log.error("Failed to write bucket file - path: {}", file, e);
            throw new OutputWriteException(file, e);
        }
        log.info("Bucket file written - path: {}, records: {}", file, array.size());
    }

    /**
     * Reads a bucket file.
     *
     * Records with an unknown label or a non-numeric value are dropped; a repeated label keeps
     * its first value; labels not in the file default to 0.0.
     *
     * @param file Bucket file
     * @return Reported buckets
     * @throws InputFileNotFoundException if the file is missing or unreadable
     * @throws InvalidBucketFileException if the file is not a JSON array
     */
    public BucketSet read(Path file) {
        if (!Files.isRegularFile(file)) {
            throw new InputFileNotFoundException(file);
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(file.toFile());
        } catch (JsonProcessingException e) {
            throw new InvalidBucketFileException("Bucket file is not valid JSON: " + file, e);
        } catch (IOException e) {
            throw new InputFileNotFoundException(file, e);
        }

        if (root == null || !root.isArray()) {
            throw new InvalidBucketFileException("Bucket file must contain a JSON array of records: " + file);
        }

        Map<TaxonomyKey, Double> values = new EnumMap<>(TaxonomyKey.class);
        for (JsonNode record : root) {
            String label = record.path(BUCKET_FIELD).asText(null);
            Optional<TaxonomyKey> key = TaxonomyKey.fromLabel(label);
            if (key.isEmpty()) {
                log.warn("Skipping unknown bucket in {}: {}", file.getFileName(), record);
                continue;
            }
            JsonNode value = record.get(VALUE_FIELD);
            if (value == null || !value.isNumber() || !Double.isFinite(value.asDouble())) {
                log.warn("Skipping non-numeric value in {} - bucket: {}", file.getFileName(), label);
                continue;
            }
            if (values.putIfAbsent(key.get(), value.asDouble()) != null) {
                log.warn("Skipping repeated bucket in {}: {}", file.getFileName(), label);
            }
        }

        log.info("Bucket file read - path: {}, buckets: {}", file, values.size());
        return BucketSet.of(values);
    }
}
