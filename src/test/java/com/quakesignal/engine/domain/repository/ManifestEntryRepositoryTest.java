package com.quakesignal.engine.domain.repository;

import com.quakesignal.engine.domain.model.ManifestEntry;
import com.quakesignal.engine.domain.model.UnitType;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.dao.DataIntegrityViolationException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
class ManifestEntryRepositoryTest {

    @Autowired
    private ManifestEntryRepository repository;

    @Test
    void completedKeysAreScopedToUnitTypeAndParamsHash() {
        repository.save(entry(UnitType.PARTITION, "geomag/KAK/2023-01-01", "h1"));
        repository.save(entry(UnitType.PARTITION, "geomag/KAK/2023-01-02", "h1"));
        repository.save(entry(UnitType.PARTITION, "aef/KAK/2023-01-01", "h2"));
        repository.save(entry(UnitType.EVENT, "E1", "h1"));

        assertThat(repository.findCompletedKeys(UnitType.PARTITION, "h1"))
                .containsExactlyInAnyOrder("geomag/KAK/2023-01-01", "geomag/KAK/2023-01-02");
        assertThat(repository.findCompletedKeys(UnitType.EVENT, "h1")).containsExactly("E1");
        assertThat(repository.countByUnitTypeAndParamsHash(UnitType.PARTITION, "h2")).isEqualTo(1);
        assertThat(repository.findByUnitTypeOrderByUnitKeyAsc(UnitType.PARTITION))
                .extracting(ManifestEntry::getUnitKey)
                .containsExactly("aef/KAK/2023-01-01", "geomag/KAK/2023-01-01", "geomag/KAK/2023-01-02");
    }

    @Test
    void unitKeyIsUniquePerUnitType() {
        repository.saveAndFlush(entry(UnitType.EVENT, "E1", "h1"));
        repository.saveAndFlush(entry(UnitType.PARTITION, "E1", "h1"));

        assertThatThrownBy(() -> repository.saveAndFlush(entry(UnitType.EVENT, "E1", "h2")))
                .isInstanceOf(DataIntegrityViolationException.class);
    }

    private static ManifestEntry entry(UnitType type, String key, String hash) {
        return ManifestEntry.builder()
                .unitType(type)
                .unitKey(key)
                .paramsHash(hash)
                .rowCount(10)
                .completedAtEpochMs(1_672_531_200_000L)
                .build();
    }
}
