package com.github.salilvnair.convflow.repo;

import com.github.salilvnair.convflow.entity.CfSessionSnapshot;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface SessionSnapshotRepository
        extends JpaRepository<CfSessionSnapshot, String> {
    Optional<CfSessionSnapshot> findBySessionIdAndTenantIdAndUserIdAndActiveTrue(String sessionId, String tenantId, String userId);
}
