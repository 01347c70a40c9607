package com.barthel.fragility.application.service.computation;

import com.barthel.fragility.domain.model.GridCurve;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Collapses the per cell curves of one component and variable. The worst
 * cell dominates, both for the snapshot and per time step.
 */
@Component
public class GridReducer {

    /**
     * @param curves one curve per grid cell
     * @return the largest final probability, 0.0 without cells
     */
    public double reduce(Collection<GridCurve> curves) {
        return curves.stream()
                .mapToDouble(GridCurve::finalPof)
                .max()
                .orElse(0.0);
    }

    /**
     * Maximum probability across cells at every time index. Cells shorter
     * than the time axis contribute 0.0 past their end.
     *
     * @param curves    one curve per grid cell
     * @param timeSteps length of the dataset time axis
     * @return one value per time step
     */
    public List<Double> reducePerTimestep(Collection<GridCurve> curves, int timeSteps) {
        List<Double> series = new ArrayList<>(timeSteps);
        for (int t = 0; t < timeSteps; t++) {
            double max = 0.0;
            for (GridCurve curve : curves) {
                max = Math.max(max, curve.pofAt(t));
            }
            series.add(max);
        }
        return series;
    }
}
