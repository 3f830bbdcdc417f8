package com.finFlow.sankeyDemo.flow.service;

import com.finFlow.sankeyDemo.extraction.model.Bucket;
import com.finFlow.sankeyDemo.extraction.model.BucketSet;
import com.finFlow.sankeyDemo.extraction.model.TaxonomyKey;
import com.finFlow.sankeyDemo.flow.model.FlowEdge;
import com.finFlow.sankeyDemo.flow.model.FlowEdgeRule;
import com.finFlow.sankeyDemo.flow.model.FlowGraph;
import com.finFlow.sankeyDemo.flow.model.FlowNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.Predicate;

import static com.finFlow.sankeyDemo.extraction.model.TaxonomyKey.*;
import static com.finFlow.sankeyDemo.flow.model.FlowEdgeRule.always;
import static com.finFlow.sankeyDemo.flow.model.FlowEdgeRule.when;

/**
 * Builds the flow graph from a reconciled bucket set.
 *
 * Derives EBIT and EBT when they are not reported, then evaluates the edge table in order.
 * Every rule's target comes after its source in one fixed topological order
 * (components, revenue, gross profit, operating income, other income, EBIT, interest, EBT,
 * taxes, net income), so the graph is acyclic. Cost of Revenue and Operating Expenses end
 * their branches; every other branch ends at Net Income.
 */
@Slf4j
@Service
public class FlowGraphBuilder {

    public static final String DEFAULT_TITLE = "Financial Flow Analysis";
    public static final String DERIVED_FOOTNOTE = "* Calculated values based on reported financials";

    private static final Predicate<Set<TaxonomyKey>> HAS_EBIT = present -> present.contains(EBIT);
    private static final Predicate<Set<TaxonomyKey>> HAS_EBT = present -> present.contains(EBT);

    private static final List<FlowEdgeRule> EDGE_RULES = List.of(
            // revenue aggregation
            always(PRODUCTS, REVENUE),
            always(SERVICES, REVENUE),
            // revenue split
            always(REVENUE, COST_OF_REVENUE),
            always(REVENUE, GROSS_PROFIT),
            // profit split
            always(GROSS_PROFIT, OPERATING_EXPENSES),
            always(GROSS_PROFIT, OPERATING_INCOME),
            // operating income to EBIT, or flattened when there is no EBIT
            when(HAS_EBIT, OPERATING_INCOME, EBIT),
            when(HAS_EBIT, OTHER_INCOME_EXPENSE, EBIT),
            when(HAS_EBIT.negate(), OPERATING_INCOME, INTEREST_INCOME),
            when(HAS_EBIT.negate(), OPERATING_INCOME, INTEREST_EXPENSE),
            when(HAS_EBIT.negate(), OPERATING_INCOME, OTHER_INCOME_EXPENSE),
            // EBIT to EBT with interest components
            when(HAS_EBIT.and(HAS_EBT), EBIT, EBT),
            when(HAS_EBIT.and(HAS_EBT), INTEREST_INCOME, EBT),
            when(HAS_EBIT.and(HAS_EBT), INTEREST_EXPENSE, EBT),
            // EBT reported without EBIT: the below-the-line items feed EBT directly
            when(HAS_EBIT.negate().and(HAS_EBT), OTHER_INCOME_EXPENSE, EBT),
            when(HAS_EBIT.negate().and(HAS_EBT), INTEREST_INCOME, EBT),
            when(HAS_EBIT.negate().and(HAS_EBT), INTEREST_EXPENSE, EBT),
            // EBT to net income, or operating income directly
            when(HAS_EBT, EBT, NET_INCOME),
            when(HAS_EBT, TAXES, NET_INCOME),
            when(HAS_EBT.negate(), OPERATING_INCOME, NET_INCOME),
            when(HAS_EBT.negate(), TAXES, NET_INCOME),
            // no intermediates at all: keep interest and other income in the flow
            when(HAS_EBIT.negate().and(HAS_EBT.negate()), INTEREST_INCOME, NET_INCOME),
            when(HAS_EBIT.negate().and(HAS_EBT.negate()), INTEREST_EXPENSE, NET_INCOME),
            when(HAS_EBIT.negate().and(HAS_EBT.negate()), OTHER_INCOME_EXPENSE, NET_INCOME)
    );

    /**
     * Builds an unpositioned graph.
     *
     * @param buckets Reconciled buckets
     * @param title Chart title, or null for the default
     * @return Graph with nodes in taxonomy order and edges in rule order
     */
    public FlowGraph build(BucketSet buckets, String title) {
        BucketSet complete = deriveIntermediates(buckets);

        Set<TaxonomyKey> present = EnumSet.noneOf(TaxonomyKey.class);
        List<FlowNode> nodes = new ArrayList<>();
        for (Bucket bucket : complete.buckets()) {
            if (!bucket.isPresent()) {
                continue;
            }
            present.add(bucket.name());
            nodes.add(FlowNode.builder()
                    .id(bucket.name())
                    .label(formatLabel(bucket))
                    .value(bucket.value())
                    .derived(bucket.derived())
                    .build());
        }

        List<FlowEdge> edges = new ArrayList<>();
        for (FlowEdgeRule rule : EDGE_RULES) {
            if (rule.appliesTo(present)) {
                edges.add(FlowEdge.builder()
                        .source(rule.source())
                        .target(rule.target())
                        .magnitude(Math.abs(complete.value(rule.target())))
                        .build());
            }
        }

        log.info("Flow graph built - nodes: {}, edges: {}, derived: {}",
                nodes.size(), edges.size(), nodes.stream().filter(FlowNode::isDerived).map(FlowNode::getId).toList());

        return FlowGraph.builder()
                .title(title == null || title.isBlank() ? DEFAULT_TITLE : title)
                .footnote(complete.hasDerivedBuckets() ? DERIVED_FOOTNOTE : null)
                .nodes(nodes)
                .edges(edges)
                .build();
    }

    /**
     * Derives EBIT and EBT where they are not reported.
     *
     * EBIT = Operating Income + Other Income/Expense, when Operating Income is present.
     * EBT = EBIT + Interest Income - Interest Expense, when EBIT is present.
     */
    public BucketSet deriveIntermediates(BucketSet buckets) {
        BucketSet result = buckets;

        if (result.isPresent(OPERATING_INCOME) && !result.isPresent(EBIT)) {
            double ebit = result.value(OPERATING_INCOME) + result.value(OTHER_INCOME_EXPENSE);
            log.debug("Derived EBIT: {}", ebit);
            result = result.withDerivedValue(EBIT, ebit);
        }

        if (result.isPresent(EBIT) && !result.isPresent(EBT)) {
            double ebt = result.value(EBIT) + result.value(INTEREST_INCOME) - result.value(INTEREST_EXPENSE);
            log.debug("Derived EBT: {}", ebt);
            result = result.withDerivedValue(EBT, ebt);
        }

        return result;
    }

    /**
     * Label as {@code Name[*]\n$+12.3M}; derived nodes carry an asterisk.
     */
    static String formatLabel(Bucket bucket) {
        String sign = bucket.value() < 0 ? "" : "+";
        return String.format(Locale.ROOT, "%s%s\n$%s%.1fM",
                bucket.name().getLabel(), bucket.derived() ? "*" : "", sign, bucket.value());
    }
}
