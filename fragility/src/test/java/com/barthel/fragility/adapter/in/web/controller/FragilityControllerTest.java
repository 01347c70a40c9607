package com.barthel.fragility.adapter.in.web.controller;

import com.barthel.fragility.application.port.in.ComputeFragilityUseCase;
import com.barthel.fragility.domain.exception.ClimateDataUnavailableException;
import com.barthel.fragility.domain.exception.HbomNotFoundException;
import com.barthel.fragility.domain.exception.HbomStructureException;
import com.barthel.fragility.domain.model.AssessedComponent;
import com.barthel.fragility.domain.model.AssessedTree;
import com.barthel.fragility.domain.model.ComponentNode;
import com.barthel.fragility.domain.model.FragilityTimeSeries;
import com.barthel.fragility.domain.model.GridCurve;
import com.barthel.fragility.domain.model.HazardBinding;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(controllers = FragilityController.class)
class FragilityControllerTest {

    private static final String HEAT = "Heat Stress";

    @Autowired MockMvc mvc;
    @MockBean ComputeFragilityUseCase computeFragilityUseCase;

    @Test
    void computeReturnsAnnotatedTree() throws Exception {
        HazardBinding binding = new HazardBinding("logistic", Map.of("mid_point", 35.0), "tas", Map.of(), 0, "survey");
        ComponentNode node = new ComponentNode("A", "Substation", "substation", null, 0, "Substation",
                Map.of(), Map.of(HEAT, binding), List.of());
        GridCurve curve = GridCurve.of(List.of(30.0, 40.0), new double[]{0.1, 0.6});
        AssessedComponent assessed = new AssessedComponent(node, Map.of("tas", Map.of(0, curve)),
                Map.of("tas", 0.6), 0.6, List.of());
        when(computeFragilityUseCase.computeFragility("energy", HEAT))
                .thenReturn(new AssessedTree("energy", HEAT, List.of(assessed)));

        mvc.perform(get("/api/fragility/compute/{sector}/{hazard}", "energy", HEAT))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.sector").value("energy"))
                .andExpect(jsonPath("$.components[0].uuid").value("A"))
                .andExpect(jsonPath("$.components[0].pof").value(0.6))
                .andExpect(jsonPath("$.components[0].pof_by_var.tas").value(0.6))
                .andExpect(jsonPath("$.components[0].hazards['Heat Stress'].fragility_model").value("logistic"))
                .andExpect(jsonPath("$.components[0].hazards['Heat Stress'].fragility_curves.tas['0'].final_pof")
                        .value(0.6));
    }

    @Test
    void timeseriesReplacesNonFiniteValuesWithNull() throws Exception {
        when(computeFragilityUseCase.computeTimeseries("energy", HEAT)).thenReturn(new FragilityTimeSeries(
                HEAT, List.of("t0", "t1"),
                Map.of("A", Map.of("tas", Arrays.asList(0.2, Double.NaN)))));

        mvc.perform(get("/api/fragility/timeseries/{sector}/{hazard}", "energy", HEAT))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.A.tas[0]").value(0.2))
                .andExpect(jsonPath("$.A.tas[1]").doesNotExist());
    }

    @Test
    void missingClimateIsBadRequestWithTraceId() throws Exception {
        when(computeFragilityUseCase.computeFragility("energy", HEAT))
                .thenThrow(new ClimateDataUnavailableException(HEAT));

        mvc.perform(get("/api/fragility/compute/{sector}/{hazard}", "energy", HEAT).header("X-Request-Id", "req-42"))
                .andExpect(status().isBadRequest())
                .andExpect(header().string("X-Request-Id", "req-42"))
                .andExpect(jsonPath("$.code").value("CLIMATE_DATA_UNAVAILABLE"))
                .andExpect(jsonPath("$.trace_id").value("req-42"))
                .andExpect(jsonPath("$.status").value(400))
                .andExpect(jsonPath("$.sector").value("energy"))
                .andExpect(jsonPath("$.hazard").value(HEAT))
                .andExpect(jsonPath("$.timestamp").exists());
    }

    @Test
    void emptySectorIsNotFound() throws Exception {
        when(computeFragilityUseCase.computeFragility("water", HEAT))
                .thenThrow(new HbomNotFoundException("No HBOM components found for sector: water"));

        mvc.perform(get("/api/fragility/compute/{sector}/{hazard}", "water", HEAT))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("NOT_FOUND"));
    }

    @Test
    void cyclicHierarchyIsUnprocessable() throws Exception {
        when(computeFragilityUseCase.computeFragility("energy", HEAT))
                .thenThrow(new HbomStructureException("Cyclic component reference: A -> B"));

        mvc.perform(get("/api/fragility/compute/{sector}/{hazard}", "energy", HEAT))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("INVALID_HIERARCHY"));
    }
}
