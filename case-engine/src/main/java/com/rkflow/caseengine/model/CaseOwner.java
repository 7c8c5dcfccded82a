package com.rkflow.caseengine.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * The two records a case can be listed under, keyed by their table name.
 * Batch operations check that every case id belongs to the given owner.
 */
public enum CaseOwner {
    SUPPLY("rk_supply"),    // candidate record
    DEMAND("rk_demand");    // job requisition

    private final String table;

    CaseOwner(String table) {
        this.table = table;
    }

    public String table() { return table; }

    public static Optional<CaseOwner> fromTable(String table) {
        return Arrays.stream(values())
                .filter(o -> o.table.equals(table))
                .findFirst();
    }
}
