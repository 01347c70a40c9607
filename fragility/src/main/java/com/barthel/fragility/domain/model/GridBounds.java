package com.barthel.fragility.domain.model;

/**
 * Spatial extent of one climate grid cell in decimal degrees.
 */
public record GridBounds(double minLat, double maxLat, double minLon, double maxLon) {
}
