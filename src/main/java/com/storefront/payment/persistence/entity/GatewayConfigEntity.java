package com.storefront.payment.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Instant;

/**
 * Gateway settings record maintained by the store's settings screen. Looked up by
 * {@code config_name}; edits take effect on the next credential resolution after the
 * cache is invalidated.
 */
@Entity
@Table(name = "gateway_config", uniqueConstraints = {
    @UniqueConstraint(name = "uk_gateway_config_name", columnNames = "config_name")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GatewayConfigEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "config_name", nullable = false, length = 64)
    private String configName;

    @Column(name = "client_id")
    private String clientId;

    @ToString.Exclude
    @Column(name = "client_secret")
    private String clientSecret;

    /** "sandbox" or "production"/"live". */
    @Column(name = "environment", length = 20)
    private String environment;

    @Column(name = "enabled", nullable = false)
    private boolean enabled;

    @Column(name = "active", nullable = false)
    private boolean active;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    @PreUpdate
    protected void touch() {
        updatedAt = Instant.now();
    }
}
