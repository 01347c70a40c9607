package com.barthel.fragility.adapter.in.web.controller;

import com.barthel.fragility.application.port.in.FetchHbomUseCase;
import com.barthel.fragility.application.port.in.ImportHbomUseCase;
import com.barthel.fragility.domain.model.ComponentNode;
import com.barthel.fragility.domain.model.FlatComponentRecord;
import com.barthel.fragility.domain.model.HbomStats;
import com.barthel.fragility.domain.model.HbomTree;
import com.barthel.fragility.domain.model.ImportSummary;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(controllers = HbomController.class)
class HbomControllerTest {

    @Autowired MockMvc mvc;
    @MockBean FetchHbomUseCase fetchHbomUseCase;
    @MockBean ImportHbomUseCase importHbomUseCase;
    @Captor ArgumentCaptor<List<ComponentNode>> roots;

    @Test
    void treeIsReturnedWithoutPof() throws Exception {
        ComponentNode node = new ComponentNode("A", "Substation", "substation", null, 0, "Substation",
                Map.of(), Map.of(), List.of());
        when(fetchHbomUseCase.fetchTree("energy", "Wind")).thenReturn(new HbomTree("energy", List.of(node)));

        mvc.perform(get("/api/hbom/tree/energy/Wind"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.components[0].component_type").value("substation"))
                .andExpect(jsonPath("$.components[0].pof").doesNotExist());
    }

    @Test
    void unknownComponentIsNotFound() throws Exception {
        when(fetchHbomUseCase.fetchComponent("nope", true)).thenReturn(Optional.empty());

        mvc.perform(get("/api/hbom/component/nope"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("Component not found: nope"))
                .andExpect(jsonPath("$.path").value("/api/hbom/component/nope"))
                .andExpect(jsonPath("$.hazard").doesNotExist());
    }

    @Test
    void componentFragilitiesCanBeSkipped() throws Exception {
        ComponentNode node = new ComponentNode("B", "Breaker", "breaker", null, 1, "Substation > Breaker",
                Map.of(), Map.of(), List.of());
        when(fetchHbomUseCase.fetchComponent("B", false)).thenReturn(Optional.of(node));

        mvc.perform(get("/api/hbom/component/B").param("include_fragilities", "false"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.uuid").value("B"))
                .andExpect(jsonPath("$.node_path").value("Substation > Breaker"));
    }

    @Test
    void rootsAreCounted() throws Exception {
        when(fetchHbomUseCase.fetchRoots("energy")).thenReturn(List.of(
                new FlatComponentRecord("A", "Substation", null, "substation", 0, "Substation", null,
                        List.of(), Map.of())));

        mvc.perform(get("/api/hbom/roots/energy"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(1))
                .andExpect(jsonPath("$.roots[0].component_type").value("unknown"))
                .andExpect(jsonPath("$.roots[0].canonical_component_type").value("substation"));
    }

    @Test
    void statsAcceptOptionalSector() throws Exception {
        when(fetchHbomUseCase.stats(null)).thenReturn(new HbomStats("Relational HBOM baseline", 3, 1,
                Map.of("substation", 3L), new HbomStats.CurveCounts(2, 2, 0)));

        mvc.perform(get("/api/hbom/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total_components").value(3))
                .andExpect(jsonPath("$.fragility_curves.matched").value(2));
    }

    @Test
    void commitImportsNestedComponents() throws Exception {
        when(importHbomUseCase.importTree(eq("energy"), any()))
                .thenReturn(new ImportSummary("energy", List.of("A"), 2, 1));

        mvc.perform(post("/api/hbom/commit").contentType("application/json")
                        .content("""
                                {"sector": "energy", "components": [{
                                  "uuid": "A", "label": "Substation", "component_type": "substation",
                                  "subcomponents": [{
                                    "uuid": "B", "label": "Breaker",
                                    "hazards": {"Wind": {"fragility_model": "weibull",
                                                         "fragility_params": {"shape": 2.0, "scale": 40.0},
                                                         "priority": 3}}
                                  }]
                                }]}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.root_uuids[0]").value("A"))
                .andExpect(jsonPath("$.components").value(2));

        verify(importHbomUseCase).importTree(eq("energy"), roots.capture());
        ComponentNode breaker = roots.getValue().get(0).subcomponents().get(0);
        assertThat(breaker.componentType()).isEqualTo("unknown");
        assertThat(breaker.hazards().get("Wind").fragilityParams()).containsEntry("scale", 40.0);
        assertThat(breaker.hazards().get("Wind").priority()).isEqualTo(3);
    }

    @Test
    void commitWithoutLabelIsRejected() throws Exception {
        mvc.perform(post("/api/hbom/commit").contentType("application/json")
                        .content("{\"sector\":\"energy\",\"components\":[{\"uuid\":\"A\"}]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_FAILED"));

        verifyNoInteractions(importHbomUseCase);
    }
}
