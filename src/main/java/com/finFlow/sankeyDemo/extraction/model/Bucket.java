package com.finFlow.sankeyDemo.extraction.model;

import java.util.Objects;

/**
 * One taxonomy entry's resolved value in millions.
 *
 * @param name    taxonomy key
 * @param value   value in millions, 0.0 when not reported
 * @param derived true when computed from other buckets rather than extracted
 */
public record Bucket(TaxonomyKey name, double value, boolean derived) {

    public Bucket {
        Objects.requireNonNull(name, "name");
    }

    public static Bucket reported(TaxonomyKey name, double value) {
        return new Bucket(name, value, false);
    }

    public static Bucket derived(TaxonomyKey name, double value) {
        return new Bucket(name, value, true);
    }

    /**
     * A bucket is present when it carries a non-zero value or was derived.
     */
    public boolean isPresent() {
        return derived || value != 0.0;
    }
}
