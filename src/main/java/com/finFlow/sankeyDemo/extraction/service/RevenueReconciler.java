package com.finFlow.sankeyDemo.extraction.service;

import com.finFlow.sankeyDemo.extraction.model.BucketSet;
import com.finFlow.sankeyDemo.extraction.model.ExtractionResult;
import com.finFlow.sankeyDemo.extraction.model.TaxonomyKey;
import com.finFlow.sankeyDemo.llm.exception.TextGenerationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import static com.finFlow.sankeyDemo.extraction.model.TaxonomyKey.PRODUCTS;
import static com.finFlow.sankeyDemo.extraction.model.TaxonomyKey.REVENUE;
import static com.finFlow.sankeyDemo.extraction.model.TaxonomyKey.SERVICES;

/**
 * Enforces Revenue = Products + Services.
 *
 * Steps:
 * 1. If Revenue is positive and a component is zero, ask the model for the breakdown and
 *    fill only the zero component(s) with positive answers. A failed request keeps the zeros.
 * 2. If both components are positive and their sum is off by more than the tolerance
 *    (fraction of Revenue), scale both so they sum to Revenue exactly.
 *
 * No other bucket is touched. Running it on a consistent set changes nothing.
 */
@Slf4j
@Service
public class RevenueReconciler {

    private final PrimaryBucketExtractor primaryBucketExtractor;
    private final double tolerance;

    public RevenueReconciler(PrimaryBucketExtractor primaryBucketExtractor,
                             @Value("${sankey.reconciliation.tolerance:0.01}") double tolerance) {
        this.primaryBucketExtractor = primaryBucketExtractor;
        this.tolerance = tolerance;
    }

    /**
     * Reconciles a bucket set.
     *
     * @param buckets Extracted buckets
     * @param summaryText Source text for the breakdown request, or null to skip it
     * @param model Model override, or null
     * @return Reconciled copy (the same instance when nothing changed)
     */
    public BucketSet reconcile(BucketSet buckets, String summaryText, String model) {
        BucketSet result = fillMissingComponents(buckets, summaryText, model);
        return rescaleComponents(result);
    }

    /**
     * Whether Products + Services is within tolerance of Revenue, or the check does not apply.
     */
    public boolean isConsistent(BucketSet buckets) {
        double products = buckets.value(PRODUCTS);
        double services = buckets.value(SERVICES);
        double revenue = buckets.value(REVENUE);
        if (products <= 0 || services <= 0 || revenue <= 0) {
            return true;
        }
        return Math.abs(products + services - revenue) <= tolerance * revenue;
    }

    private BucketSet fillMissingComponents(BucketSet buckets, String summaryText, String model) {
        double revenue = buckets.value(REVENUE);
        boolean productsMissing = buckets.value(PRODUCTS) == 0.0;
        boolean servicesMissing = buckets.value(SERVICES) == 0.0;

        if (revenue <= 0 || (!productsMissing && !servicesMissing)) {
            return buckets;
        }
        if (summaryText == null || summaryText.isBlank()) {
            log.debug("No source text for revenue breakdown request - leaving components as reported");
            return buckets;
        }

        ExtractionResult breakdown;
        try {
            breakdown = primaryBucketExtractor.extractRevenueBreakdown(summaryText, model);
        } catch (TextGenerationException e) {
            log.warn("Revenue breakdown request failed, keeping reported components: {}", e.getMessage());
            return buckets;
        }

        if (!breakdown.isUsable()) {
            log.info("Revenue breakdown unusable ({}), keeping reported components", breakdown.getUnusableReason());
            return buckets;
        }

        BucketSet result = buckets;
        result = fillIfMissing(result, breakdown.getBuckets(), PRODUCTS, productsMissing);
        result = fillIfMissing(result, breakdown.getBuckets(), SERVICES, servicesMissing);
        return result;
    }

    private BucketSet fillIfMissing(BucketSet target, BucketSet breakdown, TaxonomyKey key, boolean missing) {
        double proposed = breakdown.value(key);
        if (!missing || proposed <= 0) {
            return target;
        }
        log.info("Filled {} from revenue breakdown: {} million", key.getLabel(), proposed);
        return target.withValue(key, proposed);
    }

    private BucketSet rescaleComponents(BucketSet buckets) {
        if (isConsistent(buckets)) {
            return buckets;
        }

        double products = buckets.value(PRODUCTS);
        double services = buckets.value(SERVICES);
        double revenue = buckets.value(REVENUE);
        double scale = revenue / (products + services);

        log.info("Adjusted Products/Services to match Revenue - ratio: {}, products: {} -> {}, services: {} -> {}",
                String.format("%.4f", scale), products, products * scale, services, services * scale);

        return buckets
                .withValue(PRODUCTS, products * scale)
                .withValue(SERVICES, services * scale);
    }
}
