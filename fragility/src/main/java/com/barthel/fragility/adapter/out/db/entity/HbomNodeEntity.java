package com.barthel.fragility.adapter.out.db.entity;

import jakarta.persistence.*;
import lombok.*;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Entity
@Table(name = "hbom_nodes", indexes = {
        @Index(name = "idx_hbom_nodes_sector", columnList = "sector"),
        @Index(name = "idx_hbom_nodes_parent", columnList = "parent_uuid")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class HbomNodeEntity {

    @Id
    @Column(length = 64)
    private String uuid;

    private String sector;

    @Column(nullable = false)
    private String label;

    private String assetType;
    private String canonicalComponentType;

    @Column(name = "node_level")
    private Integer level;

    @Column(length = 2000)
    private String nodePath;

    @Column(name = "parent_uuid", length = 64)
    private String parentUuid;

    @ElementCollection
    @CollectionTable(name = "hbom_node_children", joinColumns = @JoinColumn(name = "node_uuid"))
    @OrderColumn(name = "child_order")
    @Column(name = "child_uuid", length = 64)
    @Builder.Default
    private List<String> childrenUuids = new ArrayList<>();

    @ElementCollection
    @CollectionTable(name = "hbom_node_metadata", joinColumns = @JoinColumn(name = "node_uuid"))
    @MapKeyColumn(name = "meta_key")
    @Column(name = "meta_value", length = 2000)
    @Builder.Default
    private Map<String, String> metadata = new HashMap<>();
}
