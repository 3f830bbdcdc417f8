package com.finFlow.sankeyDemo.extraction.model;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class BucketSetTest {

    @Test
    void unsetKeysHoldReportedZero() {
        BucketSet buckets = BucketSet.of(Map.of(TaxonomyKey.REVENUE, 1000.0));

        assertThat(buckets.buckets()).hasSize(TaxonomyKey.values().length);
        assertThat(buckets.value(TaxonomyKey.NET_INCOME)).isZero();
        assertThat(buckets.isPresent(TaxonomyKey.NET_INCOME)).isFalse();
        assertThat(buckets.isPresent(TaxonomyKey.REVENUE)).isTrue();
    }

    @Test
    void updatesReturnANewSet() {
        BucketSet original = BucketSet.of(Map.of(TaxonomyKey.REVENUE, 1000.0));

        BucketSet updated = original.withValue(TaxonomyKey.PRODUCTS, 600.0);

        assertThat(original.value(TaxonomyKey.PRODUCTS)).isZero();
        assertThat(updated.value(TaxonomyKey.PRODUCTS)).isEqualTo(600.0);
        assertThat(updated).isNotEqualTo(original);
    }

    /**
     * A derived bucket counts as present even when its computed value is zero.
     */
    @Test
    void derivedZeroIsPresent() {
        BucketSet buckets = BucketSet.empty().withDerivedValue(TaxonomyKey.EBIT, 0.0);

        assertThat(buckets.isPresent(TaxonomyKey.EBIT)).isTrue();
        assertThat(buckets.isDerived(TaxonomyKey.EBIT)).isTrue();
        assertThat(buckets.hasDerivedBuckets()).isTrue();
        assertThat(BucketSet.empty().hasDerivedBuckets()).isFalse();
    }

    @Test
    void bucketsAreInTaxonomyOrder() {
        BucketSet buckets = BucketSet.of(Map.of(TaxonomyKey.NET_INCOME, 1.0, TaxonomyKey.PRODUCTS, 2.0));

        assertThat(buckets.buckets()).extracting(Bucket::name).containsExactly(TaxonomyKey.values());
    }
}
