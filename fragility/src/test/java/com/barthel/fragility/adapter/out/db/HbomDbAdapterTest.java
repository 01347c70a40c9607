package com.barthel.fragility.adapter.out.db;

import com.barthel.fragility.domain.model.FlatComponentRecord;
import com.barthel.fragility.domain.model.FragilityCurveDocument;
import com.barthel.fragility.domain.model.HbomStats;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@Import(HbomDbAdapter.class)
class HbomDbAdapterTest {

    @Autowired
    private HbomDbAdapter adapter;

    @BeforeEach
    void setUp() {
        adapter.saveComponents("energy", List.of(
                record("A", null, List.of("B", "C"), "substation"),
                record("B", "A", List.of("D"), "breaker"),
                record("C", "A", List.of(), "breaker"),
                record("D", "B", List.of(), "relay")));
        adapter.saveComponents("water", List.of(record("W", null, List.of(), "pump")));
        adapter.replaceCurves(List.of("B", "D"), List.of(
                curve("B", "Wind", "weibull", 1),
                curve("B", "Heat Stress", "lognormal", null),
                curve("D", "Wind", "logistic", 2)));
    }

    @Test
    void readsRecordsBackWithOrderedChildren() {
        List<FlatComponentRecord> records = adapter.findComponentsBySector("energy");

        assertThat(records).hasSize(4);
        FlatComponentRecord root = adapter.findComponentByUuid("A").orElseThrow();
        assertThat(root.isRoot()).isTrue();
        assertThat(root.childrenUuids()).containsExactly("B", "C");
        assertThat(root.metadata()).containsEntry("voltage", "110kV");
    }

    @Test
    void findsDescendantsThroughParentLinks() {
        assertThat(adapter.findDescendants("A")).extracting(FlatComponentRecord::uuid)
                .containsExactlyInAnyOrder("B", "C", "D");
        assertThat(adapter.findDescendants("D")).isEmpty();
    }

    @Test
    void filtersCurvesByHazardAndComponents() {
        List<FragilityCurveDocument> wind = adapter.findCurvesByHazard("Wind", List.of("A", "B", "C", "D"));

        assertThat(wind).extracting(FragilityCurveDocument::model).containsExactly("weibull", "logistic");
        assertThat(wind.get(0).parameters()).containsEntry("shape", 2.0);
        assertThat(adapter.findCurvesByHazard("Wind", List.of())).isEmpty();
        assertThat(adapter.findCurvesForComponents(List.of("B"))).hasSize(2);
    }

    @Test
    void replacingCurvesDropsPreviousOnes() {
        adapter.replaceCurves(List.of("B"), List.of(curve("B", "Drought", "weibull", null)));

        assertThat(adapter.findCurvesForComponents(List.of("B")))
                .extracting(FragilityCurveDocument::hazard).containsExactly("Drought");
        assertThat(adapter.findCurvesForComponents(List.of("D"))).hasSize(1);
    }

    @Test
    void statsCountPerSectorAndOverall() {
        HbomStats energy = adapter.stats("energy");
        HbomStats all = adapter.stats(null);

        assertThat(energy.totalComponents()).isEqualTo(4);
        assertThat(energy.rootComponents()).isEqualTo(1);
        assertThat(energy.assetTypes()).containsEntry("breaker", 2L);
        assertThat(all.totalComponents()).isEqualTo(5);
        assertThat(all.rootComponents()).isEqualTo(2);
        assertThat(all.fragilityCurves().total()).isEqualTo(3);
        assertThat(all.fragilityCurves().unmatched()).isZero();
    }

    private static FlatComponentRecord record(String uuid, String parent, List<String> children, String type) {
        return new FlatComponentRecord(uuid, "Component " + uuid, type, null, parent == null ? 0 : 1,
                "Component " + uuid, parent, children, Map.of("voltage", "110kV"));
    }

    private static FragilityCurveDocument curve(String uuid, String hazard, String model, Integer priority) {
        return new FragilityCurveDocument(uuid, hazard, model, Map.of("shape", 2.0), null,
                Map.of("terrain", "coastal"), priority, "survey");
    }
}
