package com.barthel.fragility.application.service.computation;

import com.barthel.fragility.application.service.distribution.DistributionEvaluator;
import com.barthel.fragility.config.FragilityProperties;
import com.barthel.fragility.domain.exception.HbomStructureException;
import com.barthel.fragility.domain.model.AssessedComponent;
import com.barthel.fragility.domain.model.AssessedTree;
import com.barthel.fragility.domain.model.ComponentNode;
import com.barthel.fragility.domain.model.FragilityTimeSeries;
import com.barthel.fragility.domain.model.GridCell;
import com.barthel.fragility.domain.model.GridCurve;
import com.barthel.fragility.domain.model.HazardBinding;
import com.barthel.fragility.domain.model.HbomTree;
import com.barthel.fragility.domain.model.PreparedClimateData;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Computes fragility curves for a component forest against a prepared
 * climate dataset.
 *
 * <p>The computation is a post-order fold: every component evaluates its own
 * curve per variable and grid cell, reduces the cells to one probability per
 * variable, then combines it with the already assessed subcomponents. The
 * input tree is never modified; a new {@link AssessedTree} is returned.</p>
 */
@Service
@Slf4j
public class FragilityComputer {

    private final DistributionEvaluator evaluator;
    private final GridReducer gridReducer;
    private final ReliabilityCombiner combiner;
    private final int maxTreeDepth;

    public FragilityComputer(DistributionEvaluator evaluator,
                             GridReducer gridReducer,
                             ReliabilityCombiner combiner,
                             FragilityProperties properties) {
        this.evaluator = evaluator;
        this.gridReducer = gridReducer;
        this.combiner = combiner;
        this.maxTreeDepth = properties.getMaxTreeDepth();
    }

    /**
     * Assesses every root of the tree for one hazard.
     *
     * @param tree    the component forest, typically filtered to the hazard
     * @param hazard  the hazard whose bindings are evaluated
     * @param climate the prepared climate dataset
     * @return the curve annotated forest
     */
    public AssessedTree computeForTree(HbomTree tree, String hazard, PreparedClimateData climate) {
        log.info("Computing fragility for hazard={}, {} vars, {} grids",
                hazard, climate.variables().size(), climate.data().size());

        List<AssessedComponent> roots = tree.components().stream()
                .map(root -> assess(root, hazard, climate, 0))
                .toList();
        return new AssessedTree(tree.sector(), hazard, roots);
    }

    /**
     * Assesses the tree, then extracts the worst cell probability per time
     * step for every component that has an own curve for the hazard.
     *
     * @param tree    the component forest
     * @param hazard  the hazard whose bindings are evaluated
     * @param climate the prepared climate dataset
     * @return series keyed by component uuid and variable, aligned to the dataset times
     */
    public FragilityTimeSeries computeTimeseries(HbomTree tree, String hazard, PreparedClimateData climate) {
        AssessedTree assessed = computeForTree(tree, hazard, climate);

        int timeSteps = climate.times().size();
        Map<String, Map<String, List<Double>>> series = new LinkedHashMap<>();
        assessed.components().forEach(root -> collectSeries(root, timeSteps, series));

        log.info("Extracted time series for {} components", series.size());
        return new FragilityTimeSeries(hazard, climate.times(), series);
    }

    private AssessedComponent assess(ComponentNode node, String hazard, PreparedClimateData climate, int depth) {
        if (depth > maxTreeDepth) {
            throw new HbomStructureException(
                    "Component hierarchy exceeds max depth " + maxTreeDepth + " at " + node.uuid());
        }

        Map<String, Map<Integer, GridCurve>> curves = ownCurves(node, hazard, climate);
        Map<String, Double> ownPofByVar = new LinkedHashMap<>();
        curves.forEach((variable, byGrid) -> ownPofByVar.put(variable, gridReducer.reduce(byGrid.values())));

        List<AssessedComponent> children = node.subcomponents().stream()
                .map(child -> assess(child, hazard, climate, depth + 1))
                .toList();

        CombinedPof combined = combiner.combine(ownPofByVar,
                children.stream().map(AssessedComponent::pofByVar).toList());
        return new AssessedComponent(node, curves, combined.pofByVar(), combined.pof(), children);
    }

    private Map<String, Map<Integer, GridCurve>> ownCurves(ComponentNode node, String hazard,
                                                           PreparedClimateData climate) {
        Optional<HazardBinding> binding = node.binding(hazard)
                .filter(b -> b.fragilityModel() != null && !b.fragilityModel().isBlank())
                .filter(b -> !b.isInherit());
        if (binding.isEmpty()) {
            return Map.of();
        }

        HazardBinding hazardBinding = binding.get();
        Map<String, Map<Integer, GridCurve>> curves = new LinkedHashMap<>();
        for (String variable : climate.variables()) {
            if (!hazardBinding.appliesTo(variable)) {
                continue;
            }
            Map<Integer, GridCurve> byGrid = new LinkedHashMap<>();
            for (GridCell cell : climate.data()) {
                byGrid.put(cell.gridIndex(), curveFor(node, hazardBinding, variable, cell));
            }
            curves.put(variable, byGrid);
        }
        return curves;
    }

    private GridCurve curveFor(ComponentNode node, HazardBinding binding, String variable, GridCell cell) {
        List<Double> series = cell.series(variable);
        if (series.isEmpty()) {
            return GridCurve.noData();
        }

        double[] intensities = new double[series.size()];
        for (int i = 0; i < intensities.length; i++) {
            Double value = series.get(i);
            intensities[i] = value == null ? Double.NaN : value;
        }

        double[] probabilities = evaluator.evaluate(binding.fragilityModel(), binding.fragilityParams(), intensities);
        int coerced = 0;
        for (int i = 0; i < probabilities.length; i++) {
            if (!Double.isFinite(probabilities[i])) {
                probabilities[i] = 0.0;
                coerced++;
            }
        }
        if (coerced > 0) {
            log.warn("Coerced {} non-finite PoF values to 0.0 for component={}, variable={}, grid={}",
                    coerced, node.uuid(), variable, cell.gridIndex());
        }
        return GridCurve.of(series, probabilities);
    }

    private void collectSeries(AssessedComponent component, int timeSteps,
                               Map<String, Map<String, List<Double>>> series) {
        if (component.hasCurves()) {
            Map<String, List<Double>> byVariable = new LinkedHashMap<>();
            component.fragilityCurves().forEach((variable, byGrid) ->
                    byVariable.put(variable, gridReducer.reducePerTimestep(byGrid.values(), timeSteps)));
            series.put(component.uuid(), byVariable);
        }
        component.subcomponents().forEach(child -> collectSeries(child, timeSteps, series));
    }
}
