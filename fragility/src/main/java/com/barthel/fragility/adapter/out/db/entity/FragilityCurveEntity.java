package com.barthel.fragility.adapter.out.db.entity;

import jakarta.persistence.*;
import lombok.*;

import java.util.HashMap;
import java.util.Map;

@Entity
@Table(name = "fragility_curves", indexes = {
        @Index(name = "idx_fragility_curves_component", columnList = "component_uuid"),
        @Index(name = "idx_fragility_curves_hazard", columnList = "hazard")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class FragilityCurveEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "component_uuid", length = 64)
    private String componentUuid;

    private String hazard;

    @Column(name = "fragility_model")
    private String model;

    private String climateVariable;
    private Integer priority;
    private String source;

    @ElementCollection
    @CollectionTable(name = "fragility_curve_parameters", joinColumns = @JoinColumn(name = "curve_id"))
    @MapKeyColumn(name = "param_name")
    @Column(name = "param_value")
    @Builder.Default
    private Map<String, Double> parameters = new HashMap<>();

    @ElementCollection
    @CollectionTable(name = "fragility_curve_conditions", joinColumns = @JoinColumn(name = "curve_id"))
    @MapKeyColumn(name = "condition_key")
    @Column(name = "condition_value")
    @Builder.Default
    private Map<String, String> conditions = new HashMap<>();
}
