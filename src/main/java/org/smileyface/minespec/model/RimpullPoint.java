package org.smileyface.minespec.model;

/**
 * One row of a rimpull table in canonical units.
 */
public record RimpullPoint(int gear, double speedKph, double forceKn) {
}
