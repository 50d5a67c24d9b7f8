package se.artisan_be.repository.filter;

public enum FilterKind {
    /** Exact match on one value or membership in a comma-separated list. */
    CATEGORICAL,
    /** Like {@link #CATEGORICAL}, over a whole-number id column. Non-numeric values are ignored. */
    IDENTIFIER,
    /** Like {@link #CATEGORICAL}, over a boolean column: true/false, yes/no or 1/0. */
    FLAG,
    /** Range ({@code min-max}), comparison ({@code >n}, {@code <n}) or exact number. */
    NUMERICAL
}
