package com.barthel.fragility.adapter.out.db.repository;

import com.barthel.fragility.adapter.out.db.entity.HbomNodeEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface HbomNodeRepository extends JpaRepository<HbomNodeEntity, String> {

    List<HbomNodeEntity> findBySector(String sector);

    List<HbomNodeEntity> findByParentUuid(String parentUuid);

    @Query("select count(n) from HbomNodeEntity n where (:sector is null or n.sector = :sector)")
    long countComponents(@Param("sector") String sector);

    @Query("select count(n) from HbomNodeEntity n where n.parentUuid is null and (:sector is null or n.sector = :sector)")
    long countRoots(@Param("sector") String sector);

    @Query("select n.assetType as assetType, count(n) as total from HbomNodeEntity n "
            + "where (:sector is null or n.sector = :sector) group by n.assetType order by count(n) desc")
    List<AssetTypeCount> countByAssetType(@Param("sector") String sector);

    interface AssetTypeCount {
        String getAssetType();

        Long getTotal();
    }
}
