package com.quakesignal.engine.domain.service.run;

import com.quakesignal.engine.domain.model.ManifestEntry;
import com.quakesignal.engine.domain.model.UnitType;
import com.quakesignal.engine.domain.repository.ManifestEntryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.HashSet;
import java.util.Set;

@Slf4j
@Service
@RequiredArgsConstructor
public class RunManifestService {

    private final ManifestEntryRepository repository;

    @Transactional(readOnly = true)
    public boolean isComplete(UnitType unitType, String unitKey, String paramsHash) {
        return repository.findByUnitTypeAndUnitKey(unitType, unitKey)
                .map(entry -> entry.getParamsHash().equals(paramsHash))
                .orElse(false);
    }

    @Transactional(readOnly = true)
    public Set<String> completedKeys(UnitType unitType, String paramsHash) {
        return new HashSet<>(repository.findCompletedKeys(unitType, paramsHash));
    }

    @Transactional
    public void markComplete(UnitType unitType, String unitKey, String paramsHash, long rowCount) {
        ManifestEntry entry = repository.findByUnitTypeAndUnitKey(unitType, unitKey)
                .orElseGet(() -> ManifestEntry.builder()
                        .unitType(unitType)
                        .unitKey(unitKey)
                        .build());
        entry.setParamsHash(paramsHash);
        entry.setRowCount(rowCount);
        entry.setCompletedAtEpochMs(System.currentTimeMillis());
        repository.save(entry);
        log.debug("[Run] 매니페스트 기록: type={}, key={}, rows={}", unitType, unitKey, rowCount);
    }

    @Transactional
    public void invalidate(UnitType unitType, String unitKey) {
        repository.findByUnitTypeAndUnitKey(unitType, unitKey).ifPresent(repository::delete);
    }
}
