package com.driftguardian.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;
import java.util.Map;

@Entity
@Table(
    name = "observation_records",
    indexes = {
        @Index(name = "idx_obs_model",   columnList = "model_id"),
        @Index(name = "idx_obs_created", columnList = "created_at"),
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ObservationRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(updatable = false, nullable = false)
    private Long id;

    @Column(name = "model_id", nullable = false, length = 64, updatable = false)
    private String modelId;

    @Convert(converter = JsonMapConverter.class)
    @Column(name = "features", nullable = false, columnDefinition = "TEXT", updatable = false)
    private Map<String, Object> features;

    @Column(nullable = false, updatable = false)
    private int prediction;

    @Column(name = "true_label", updatable = false)
    private Integer trueLabel;

    @Convert(converter = JsonMapConverter.class)
    @Column(name = "sensitive_features", columnDefinition = "TEXT", updatable = false)
    private Map<String, Object> sensitiveFeatures;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;

    @Column(name = "request_id", length = 64, updatable = false)
    private String requestId;
}
