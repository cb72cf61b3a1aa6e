package org.smileyface.minespec.model;

/**
 * Trust level of the source a document was fetched from, most trusted first.
 */
public enum SourceTier {
    OEM_PRIMARY,
    OEM_SECONDARY,
    DEALER,
    THIRD_PARTY,
    UNKNOWN
}
