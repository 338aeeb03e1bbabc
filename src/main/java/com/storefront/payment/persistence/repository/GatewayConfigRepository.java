package com.storefront.payment.persistence.repository;

import com.storefront.payment.persistence.entity.GatewayConfigEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Repository for gateway settings records.
 */
@Repository
public interface GatewayConfigRepository extends JpaRepository<GatewayConfigEntity, Long> {

    Optional<GatewayConfigEntity> findByConfigNameAndActiveTrue(String configName);
}
