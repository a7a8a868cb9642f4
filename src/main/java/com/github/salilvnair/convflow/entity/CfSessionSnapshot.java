package com.github.salilvnair.convflow.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.OffsetDateTime;

@Entity
@Table(name = "cf_session_snapshot")
@Builder
@AllArgsConstructor
@NoArgsConstructor
@Getter
@Setter
public class CfSessionSnapshot {

    @Id
    @Column(name = "session_id")
    private String sessionId;

    @Column(name = "tenant_id", nullable = false)
    private String tenantId;

    @Column(name = "user_id", nullable = false)
    private String userId;

    @Column(name = "template_id")
    private String templateId;

    @Column(name = "current_node_id")
    private String currentNodeId;

    @Column(name = "active")
    private boolean active;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "snapshot_json")
    private String snapshotJson;

    @Column(name = "created_at")
    private OffsetDateTime createdAt;

    @Column(name = "updated_at")
    private OffsetDateTime updatedAt;

    @Column(name = "expires_at")
    private OffsetDateTime expiresAt;

    @PrePersist
    @PreUpdate
    private void ensureTimestamps() {
        OffsetDateTime now = OffsetDateTime.now();
        if (createdAt == null) {
            createdAt = now;
        }
        if (updatedAt == null) {
            updatedAt = now;
        }
    }
}
