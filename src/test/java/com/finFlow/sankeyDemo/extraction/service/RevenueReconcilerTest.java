package com.finFlow.sankeyDemo.extraction.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.finFlow.sankeyDemo.extraction.model.BucketSet;
import com.finFlow.sankeyDemo.llm.TextGenerationClient;
import com.finFlow.sankeyDemo.llm.exception.TextGenerationException;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static com.finFlow.sankeyDemo.extraction.model.TaxonomyKey.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for the Revenue = Products + Services reconciliation.
 */
class RevenueReconcilerTest {

    private static final String SUMMARY = "Total revenue was $1,000 million.";

    private static final TextGenerationClient UNAVAILABLE = (prompt, model) -> {
        throw new TextGenerationException("service unavailable");
    };

    private static final TextGenerationClient NOT_EXPECTED = (prompt, model) -> {
        throw new AssertionError("breakdown request not expected");
    };

    private RevenueReconciler reconcilerWith(TextGenerationClient client) {
        return new RevenueReconciler(new PrimaryBucketExtractor(client, new ObjectMapper()), 0.01);
    }

    /**
     * Zero components cannot be rescaled, and a failed breakdown request leaves them as they are.
     */
    @Test
    void zeroComponentsStayZeroWhenBreakdownFails() {
        BucketSet buckets = BucketSet.of(Map.of(REVENUE, 1000.0, PRODUCTS, 0.0, SERVICES, 0.0));

        BucketSet reconciled = reconcilerWith(UNAVAILABLE).reconcile(buckets, SUMMARY, null);

        assertThat(reconciled.value(PRODUCTS)).isZero();
        assertThat(reconciled.value(SERVICES)).isZero();
        assertThat(reconciled).isEqualTo(buckets);
    }

    @Test
    void inconsistentComponentsAreRescaledToRevenue() {
        BucketSet buckets = BucketSet.of(Map.of(PRODUCTS, 600.0, SERVICES, 500.0, REVENUE, 1000.0, NET_INCOME, 90.0));

        BucketSet reconciled = reconcilerWith(NOT_EXPECTED).reconcile(buckets, SUMMARY, null);

        assertThat(reconciled.value(PRODUCTS)).isCloseTo(545.4545, within(1e-3));
        assertThat(reconciled.value(SERVICES)).isCloseTo(454.5454, within(1e-3));
        assertThat(reconciled.value(PRODUCTS) + reconciled.value(SERVICES)).isCloseTo(1000.0, within(1e-9));
        assertThat(reconciled.value(REVENUE)).isEqualTo(1000.0);
        assertThat(reconciled.value(NET_INCOME)).isEqualTo(90.0);
    }

    @Test
    void componentsWithinToleranceAreUntouched() {
        BucketSet buckets = BucketSet.of(Map.of(PRODUCTS, 600.0, SERVICES, 405.0, REVENUE, 1000.0));

        RevenueReconciler reconciler = reconcilerWith(NOT_EXPECTED);

        assertThat(reconciler.isConsistent(buckets)).isTrue();
        assertThat(reconciler.reconcile(buckets, SUMMARY, null)).isSameAs(buckets);
    }

    @Test
    void reconcilingTwiceChangesNothingMore() {
        BucketSet buckets = BucketSet.of(Map.of(PRODUCTS, 600.0, SERVICES, 500.0, REVENUE, 1000.0));
        RevenueReconciler reconciler = reconcilerWith(NOT_EXPECTED);

        BucketSet once = reconciler.reconcile(buckets, SUMMARY, null);
        BucketSet twice = reconciler.reconcile(once, SUMMARY, null);

        assertThat(twice).isEqualTo(once);
    }

    @Test
    void breakdownFillsMissingComponents() {
        RevenueReconciler reconciler = reconcilerWith((prompt, model) ->
                "[{\"bucket\": \"Products\", \"value\": 700}, {\"bucket\": \"Services\", \"value\": 300}]");
        BucketSet buckets = BucketSet.of(Map.of(REVENUE, 1000.0));

        BucketSet reconciled = reconciler.reconcile(buckets, SUMMARY, null);

        assertThat(reconciled.value(PRODUCTS)).isEqualTo(700.0);
        assertThat(reconciled.value(SERVICES)).isEqualTo(300.0);
    }

    @Test
    void breakdownNeverOverwritesReportedComponent() {
        RevenueReconciler reconciler = reconcilerWith((prompt, model) ->
                "[{\"bucket\": \"Products\", \"value\": 999}, {\"bucket\": \"Services\", \"value\": 600}]");
        BucketSet buckets = BucketSet.of(Map.of(REVENUE, 1000.0, PRODUCTS, 400.0));

        BucketSet reconciled = reconciler.reconcile(buckets, SUMMARY, null);

        assertThat(reconciled.value(PRODUCTS)).isEqualTo(400.0);
        assertThat(reconciled.value(SERVICES)).isEqualTo(600.0);
    }

    @Test
    void unusableBreakdownKeepsReportedValues() {
        BucketSet buckets = BucketSet.of(Map.of(REVENUE, 1000.0, PRODUCTS, 400.0));

        BucketSet reconciled = reconcilerWith((prompt, model) -> "No breakdown is given.").reconcile(buckets, SUMMARY, null);

        assertThat(reconciled).isEqualTo(buckets);
    }

    @Test
    void noBreakdownRequestWithoutRevenueOrText() {
        AtomicInteger calls = new AtomicInteger();
        RevenueReconciler reconciler = reconcilerWith((prompt, model) -> {
            calls.incrementAndGet();
            return "[]";
        });

        reconciler.reconcile(BucketSet.of(Map.of(NET_INCOME, 10.0)), SUMMARY, null);
        reconciler.reconcile(BucketSet.of(Map.of(REVENUE, 1000.0)), null, null);

        assertThat(calls).hasValue(0);
    }
}
