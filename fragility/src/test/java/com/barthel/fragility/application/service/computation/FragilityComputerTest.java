package com.barthel.fragility.application.service.computation;

import com.barthel.fragility.application.service.distribution.DistributionEvaluator;
import com.barthel.fragility.application.service.distribution.impl.LogisticFragilityDistribution;
import com.barthel.fragility.application.service.distribution.impl.LognormalFragilityDistribution;
import com.barthel.fragility.application.service.distribution.impl.WeibullFragilityDistribution;
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
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class FragilityComputerTest {

    private static final String HAZARD = "Heat Stress";

    private final FragilityProperties properties = new FragilityProperties();

    private final FragilityComputer computer = new FragilityComputer(
            new DistributionEvaluator(List.of(
                    new LognormalFragilityDistribution(),
                    new WeibullFragilityDistribution(),
                    new LogisticFragilityDistribution())),
            new GridReducer(),
            new ReliabilityCombiner(),
            properties);

    private final PreparedClimateData climate = new PreparedClimateData(
            List.of("tas", "hurs"),
            List.of("2030-01-01T00:00:00", "2030-01-02T00:00:00"),
            List.of(
                    new GridCell(0, null, Map.of("tas", List.of(30.0, 40.0), "hurs", List.of(50.0, 60.0))),
                    new GridCell(1, null, Map.of("tas", List.of(35.0, 20.0), "hurs", List.of(55.0, 65.0)))));

    @Test
    void restrictsCurvesToBoundVariable() {
        ComponentNode node = node("A", binding("logistic", Map.of("mid_point", 35.0, "slope", 1.0), "tas"));

        AssessedComponent assessed = computeSingle(node);

        assertThat(assessed.fragilityCurves()).containsOnlyKeys("tas");
        assertThat(assessed.fragilityCurves().get("tas")).containsOnlyKeys(0, 1);
        assertThat(assessed.pofByVar()).containsOnlyKeys("tas");
    }

    @Test
    void snapshotIsWorstFinalProbabilityAcrossCells() {
        ComponentNode node = node("A", binding("logistic", Map.of("mid_point", 35.0, "slope", 1.0), "tas"));

        AssessedComponent assessed = computeSingle(node);

        GridCurve cell0 = assessed.fragilityCurves().get("tas").get(0);
        GridCurve cell1 = assessed.fragilityCurves().get("tas").get(1);
        assertThat(cell0.xValues()).containsExactly(30.0, 40.0);
        assertThat(cell0.finalPof()).isEqualTo(cell0.fcValues().get(1));
        assertThat(assessed.pofByVar().get("tas")).isEqualTo(Math.max(cell0.finalPof(), cell1.finalPof()));
        assertThat(assessed.pof()).isEqualTo(assessed.pofByVar().get("tas"));
    }

    @Test
    void unrestrictedBindingAppliesToEveryVariable() {
        ComponentNode node = node("A", binding("weibull", Map.of("shape", 2.0, "scale", 100.0), null));

        AssessedComponent assessed = computeSingle(node);

        assertThat(assessed.fragilityCurves()).containsOnlyKeys("tas", "hurs");
    }

    @Test
    void parentCombinesOwnCurveWithChildren() {
        ComponentNode child = node("B", binding("logistic", Map.of("mid_point", 10.0, "slope", 1.0), "hurs"));
        ComponentNode parent = node("A", binding("logistic", Map.of("mid_point", 35.0, "slope", 1.0), "tas"))
                .withSubcomponents(List.of(child));

        AssessedComponent assessed = computeSingle(parent);

        assertThat(assessed.fragilityCurves()).containsOnlyKeys("tas");
        assertThat(assessed.pofByVar()).containsOnlyKeys("tas", "hurs");
        assertThat(assessed.pofByVar().get("hurs"))
                .isCloseTo(assessed.subcomponents().get(0).pofByVar().get("hurs"), within(1e-12));
    }

    @Test
    void inheritComponentOnlyAggregatesChildren() {
        ComponentNode child = node("B", binding("logistic", Map.of("mid_point", 35.0, "slope", 1.0), "tas"));
        ComponentNode parent = node("A", binding("inherit", Map.of(), null)).withSubcomponents(List.of(child));

        AssessedComponent assessed = computeSingle(parent);

        assertThat(assessed.hasCurves()).isFalse();
        assertThat(assessed.pofByVar().get("tas"))
                .isCloseTo(assessed.subcomponents().get(0).pof(), within(1e-12));
    }

    @Test
    void componentWithoutBindingAndChildrenHasZeroPof() {
        AssessedComponent assessed = computeSingle(node("A", null));

        assertThat(assessed.hasCurves()).isFalse();
        assertThat(assessed.pofByVar()).isEmpty();
        assertThat(assessed.pof()).isEqualTo(0.0);
    }

    @Test
    void missingSeriesYieldsSinglePointZeroCurve() {
        PreparedClimateData sparse = new PreparedClimateData(
                List.of("tas"), List.of("2030-01-01T00:00:00"),
                List.of(new GridCell(7, null, Map.of())));
        ComponentNode node = node("A", binding("lognormal", Map.of("median", 30.0, "dispersion", 0.3), "tas"));

        AssessedTree tree = computer.computeForTree(new HbomTree("energy", List.of(node)), HAZARD, sparse);

        GridCurve curve = tree.components().get(0).fragilityCurves().get("tas").get(7);
        assertThat(curve.xValues()).containsExactly(0.0);
        assertThat(curve.fcValues()).containsExactly(0.0);
        assertThat(curve.finalPof()).isEqualTo(0.0);
    }

    @Test
    void missingClimateValuesAreCoercedToZero() {
        PreparedClimateData withGaps = new PreparedClimateData(
                List.of("tas"), List.of("t0", "t1"),
                List.of(new GridCell(0, null, Map.of("tas", Arrays.asList(40.0, null)))));
        ComponentNode node = node("A", binding("logistic", Map.of("mid_point", 35.0, "slope", 1.0), "tas"));

        AssessedTree tree = computer.computeForTree(new HbomTree("energy", List.of(node)), HAZARD, withGaps);

        GridCurve curve = tree.components().get(0).fragilityCurves().get("tas").get(0);
        assertThat(curve.fcValues().get(0)).isGreaterThan(0.5);
        assertThat(curve.fcValues().get(1)).isEqualTo(0.0);
        assertThat(curve.finalPof()).isEqualTo(0.0);
    }

    @Test
    void unknownModelGivesZeroCurves() {
        ComponentNode node = node("A", binding("gumbel", Map.of(), "tas"));

        AssessedComponent assessed = computeSingle(node);

        assertThat(assessed.fragilityCurves().get("tas").get(0).fcValues()).containsExactly(0.0, 0.0);
        assertThat(assessed.pof()).isEqualTo(0.0);
    }

    @Test
    void timeseriesCoversOnlyComponentsWithOwnCurves() {
        ComponentNode child = node("B", binding("logistic", Map.of("mid_point", 35.0, "slope", 1.0), "tas"));
        ComponentNode parent = node("A", null).withSubcomponents(List.of(child));

        FragilityTimeSeries series = computer.computeTimeseries(
                new HbomTree("energy", List.of(parent)), HAZARD, climate);

        assertThat(series.series()).containsOnlyKeys("B");
        List<Double> tas = series.series().get("B").get("tas");
        assertThat(tas).hasSize(2);
        // t0: max(sigmoid(-5), sigmoid(0)); t1: max(sigmoid(5), sigmoid(-15))
        assertThat(tas.get(0)).isCloseTo(0.5, within(1e-12));
        assertThat(tas.get(1)).isCloseTo(1.0 / (1.0 + Math.exp(-5.0)), within(1e-12));
    }

    @Test
    void inputTreeIsLeftUntouched() {
        ComponentNode node = node("A", binding("logistic", Map.of("mid_point", 35.0, "slope", 1.0), "tas"));
        HbomTree tree = new HbomTree("energy", List.of(node));

        computer.computeForTree(tree, HAZARD, climate);

        assertThat(tree.components().get(0)).isEqualTo(node);
    }

    @Test
    void rejectsHierarchiesDeeperThanConfigured() {
        properties.setMaxTreeDepth(2);
        FragilityComputer shallow = new FragilityComputer(
                new DistributionEvaluator(List.of(new LogisticFragilityDistribution())),
                new GridReducer(), new ReliabilityCombiner(), properties);

        ComponentNode deep = node("D", null);
        for (String uuid : List.of("C", "B", "A")) {
            deep = node(uuid, null).withSubcomponents(List.of(deep));
        }
        HbomTree tree = new HbomTree("energy", List.of(deep));

        assertThatThrownBy(() -> shallow.computeForTree(tree, HAZARD, climate))
                .isInstanceOf(HbomStructureException.class);
    }

    private AssessedComponent computeSingle(ComponentNode node) {
        AssessedTree tree = computer.computeForTree(new HbomTree("energy", List.of(node)), HAZARD, climate);
        assertThat(tree.components()).hasSize(1);
        return tree.components().get(0);
    }

    private static ComponentNode node(String uuid, HazardBinding binding) {
        return new ComponentNode(uuid, "Component " + uuid, "transformer", null, null, null, null,
                binding == null ? Map.of() : Map.of(HAZARD, binding), List.of());
    }

    private static HazardBinding binding(String model, Map<String, Double> params, String variable) {
        return new HazardBinding(model, params, variable, Map.of(), 0, "test");
    }
}
