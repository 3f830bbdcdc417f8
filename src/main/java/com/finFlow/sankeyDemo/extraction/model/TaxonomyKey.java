package com.finFlow.sankeyDemo.extraction.model;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Closed taxonomy of financial line items, in canonical order.
 * 
 * The first twelve entries are extracted from text; EBIT and EBT are derived
 * by the flow graph builder unless a bucket file reports them.
 */
public enum TaxonomyKey {

    PRODUCTS("Products", false),
    SERVICES("Services", false),
    REVENUE("Revenue", false),
    COST_OF_REVENUE("Cost of Revenue", false),
    GROSS_PROFIT("Gross Profit", false),
    OPERATING_EXPENSES("Operating Expenses", false),
    OPERATING_INCOME("Operating Income", false),
    INTEREST_EXPENSE("Interest Expense", false),
    INTEREST_INCOME("Interest Income", false),
    OTHER_INCOME_EXPENSE("Other Income/Expense", false),
    TAXES("Taxes", false),
    NET_INCOME("Net Income", false),
    EBIT("EBIT", true),
    EBT("EBT", true);

    private static final List<TaxonomyKey> EXTRACTABLE = Arrays.stream(values())
            .filter(key -> !key.derivable)
            .toList();

    private final String label;
    private final boolean derivable;

    TaxonomyKey(String label, boolean derivable) {
        this.label = label;
        this.derivable = derivable;
    }

    /**
     * Display label, also the exact {@code bucket} string used in bucket files and model output.
     */
    public String getLabel() {
        return label;
    }

    public boolean isDerivable() {
        return derivable;
    }

    /**
     * Looks up a key by its exact label.
     *
     * @param label Label as written in a bucket file or model response
     * @return Matching key, or empty for unknown labels
     */
    public static Optional<TaxonomyKey> fromLabel(String label) {
        if (label == null) {
            return Optional.empty();
        }
        for (TaxonomyKey key : values()) {
            if (key.label.equals(label)) {
                return Optional.of(key);
            }
        }
        return Optional.empty();
    }

    /**
     * Keys requested from the text, in taxonomy order (everything except EBIT and EBT).
     */
    public static List<TaxonomyKey> extractable() {
        return EXTRACTABLE;
    }
}
