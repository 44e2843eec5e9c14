package com.quakesignal.engine.domain.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Entity
@Table(name = "manifest_entry",
        uniqueConstraints = @UniqueConstraint(name = "uk_manifest_unit", columnNames = {"unitType", "unitKey"}),
        indexes = @Index(name = "idx_manifest_params_hash", columnList = "paramsHash"))
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ManifestEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private UnitType unitType;

    @Column(nullable = false)
    private String unitKey;

    @Column(nullable = false, length = 64)
    private String paramsHash;

    private long rowCount;
    private long completedAtEpochMs;
}
