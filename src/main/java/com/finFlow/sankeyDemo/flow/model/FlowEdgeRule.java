package com.finFlow.sankeyDemo.flow.model;

import com.finFlow.sankeyDemo.extraction.model.TaxonomyKey;

import java.util.Set;
import java.util.function.Predicate;

/**
 * One row of the edge table: add {@code source -> target} when the condition holds over
 * the present node set and both endpoints are present.
 *
 * @param source    edge source
 * @param target    edge target
 * @param condition presence condition evaluated once per build
 */
public record FlowEdgeRule(TaxonomyKey source, TaxonomyKey target, Predicate<Set<TaxonomyKey>> condition) {

    public static FlowEdgeRule always(TaxonomyKey source, TaxonomyKey target) {
        return new FlowEdgeRule(source, target, present -> true);
    }

    public static FlowEdgeRule when(Predicate<Set<TaxonomyKey>> condition, TaxonomyKey source, TaxonomyKey target) {
        return new FlowEdgeRule(source, target, condition);
    }

    public boolean appliesTo(Set<TaxonomyKey> present) {
        return present.contains(source) && present.contains(target) && condition.test(present);
    }
}
