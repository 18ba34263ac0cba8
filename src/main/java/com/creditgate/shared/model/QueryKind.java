package com.creditgate.shared.model;

/**
 * Lookup mode of a billable search operation.
 */
public enum QueryKind {
    SMART,
    EXACT
}
