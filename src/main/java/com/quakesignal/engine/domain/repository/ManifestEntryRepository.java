package com.quakesignal.engine.domain.repository;

import com.quakesignal.engine.domain.model.ManifestEntry;
import com.quakesignal.engine.domain.model.UnitType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface ManifestEntryRepository extends JpaRepository<ManifestEntry, Long> {

    Optional<ManifestEntry> findByUnitTypeAndUnitKey(UnitType unitType, String unitKey);

    List<ManifestEntry> findByUnitTypeOrderByUnitKeyAsc(UnitType unitType);

    @Query("SELECT m.unitKey FROM ManifestEntry m WHERE m.unitType = :unitType AND m.paramsHash = :paramsHash")
    List<String> findCompletedKeys(@Param("unitType") UnitType unitType,
                                   @Param("paramsHash") String paramsHash);

    long countByUnitTypeAndParamsHash(UnitType unitType, String paramsHash);
}
