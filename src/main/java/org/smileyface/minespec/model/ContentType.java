package org.smileyface.minespec.model;

/**
 * Kind of fetched source document.
 */
public enum ContentType {
    HTML,
    PDF
}
