package com.barthel.fragility.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Fragility curve of one component for one variable in one grid cell.
 *
 * @param xValues  climate intensities, null entries are missing values
 * @param fcValues probabilities of failure, same length as {@code xValues}
 * @param finalPof the last probability, the snapshot figure for the cell
 */
public record GridCurve(List<Double> xValues, List<Double> fcValues, double finalPof) {

    private static final GridCurve NO_DATA = new GridCurve(List.of(0.0), List.of(0.0), 0.0);

    public GridCurve {
        if (xValues.size() != fcValues.size()) {
            throw new IllegalArgumentException("Intensity and probability series must have equal length");
        }
        if (!(finalPof >= 0.0 && finalPof <= 1.0)) {
            throw new IllegalArgumentException("Final PoF must be within [0,1]");
        }
        xValues = Collections.unmodifiableList(new ArrayList<>(xValues));
        fcValues = List.copyOf(fcValues);
    }

    /**
     * Single point zero curve used when a cell has no data for a variable.
     */
    public static GridCurve noData() {
        return NO_DATA;
    }

    public static GridCurve of(List<Double> xValues, double[] probabilities) {
        if (probabilities.length == 0) {
            return NO_DATA;
        }
        List<Double> fc = new ArrayList<>(probabilities.length);
        for (double p : probabilities) {
            fc.add(p);
        }
        return new GridCurve(xValues, fc, probabilities[probabilities.length - 1]);
    }

    /**
     * Probability at a time index, 0.0 beyond the end of the curve.
     */
    public double pofAt(int timeIndex) {
        return timeIndex < fcValues.size() ? fcValues.get(timeIndex) : 0.0;
    }
}
