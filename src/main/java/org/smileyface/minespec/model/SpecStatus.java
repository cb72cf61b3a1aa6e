package org.smileyface.minespec.model;

/**
 * Reconciliation outcome of a {@link ValidatedSpec}.
 */
public enum SpecStatus {
    VALIDATED,
    FLAGGED,
    REJECTED
}
