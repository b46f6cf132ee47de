package com.bugbounty.core.domain;

/**
 * Lengths for free-text columns. The migrations declare these columns as
 * {@code TEXT}; the mapped length only sizes generated schemas.
 */
final class ColumnLengths {

    static final int TEXT = 65_535;

    private ColumnLengths() {}
}
