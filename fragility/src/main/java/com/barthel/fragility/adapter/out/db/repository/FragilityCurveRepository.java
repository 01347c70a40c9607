package com.barthel.fragility.adapter.out.db.repository;

import com.barthel.fragility.adapter.out.db.entity.FragilityCurveEntity;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Collection;
import java.util.List;

public interface FragilityCurveRepository extends JpaRepository<FragilityCurveEntity, Long> {

    List<FragilityCurveEntity> findByHazardAndComponentUuidInOrderByIdAsc(String hazard, Collection<String> componentUuids);

    List<FragilityCurveEntity> findByComponentUuidInOrderByIdAsc(Collection<String> componentUuids);

    long countByComponentUuidIsNotNull();

    void deleteByComponentUuidIn(Collection<String> componentUuids);
}
