package org.smileyface.minespec.model;

/**
 * How a candidate value was located inside its document.
 */
public enum ExtractionMethod {
    REGEX,
    TABLE_CELL,
    RIMPULL_TABLE
}
