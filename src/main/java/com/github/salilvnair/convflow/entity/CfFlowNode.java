package com.github.salilvnair.convflow.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

@Entity
@Table(name = "cf_flow_node")
@Builder
@AllArgsConstructor
@NoArgsConstructor
@Getter
@Setter
public class CfFlowNode {

    @Id
    @Column(name = "node_id")
    private String nodeId;

    @Column(name = "tenant_id", nullable = false)
    private String tenantId;

    @Column(name = "template_id", nullable = false)
    private String templateId;

    @Column(name = "node_type", nullable = false)
    private String nodeType;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "node_json", nullable = false)
    private String nodeJson;

    @Column(name = "priority")
    private Integer priority;

    @Column(name = "enabled")
    private boolean enabled;
}
