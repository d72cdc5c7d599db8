package com.wshg.catalog.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Append-only audit ledger. One chain per resource id, ordered by seq_no; the unique
 * (resource_id, seq_no) pair makes a second record claiming the same predecessor fail to insert.
 * No foreign key to resources: the trail outlives the physically deleted row.
 */
@Entity
@Table(name = "change_records",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_change_records_chain_pos", columnNames = {"resource_id", "seq_no"}),
                @UniqueConstraint(name = "uk_change_records_block_hash", columnNames = {"block_hash"})
        },
        indexes = {
                @Index(name = "idx_change_records_resource", columnList = "resource_id"),
                @Index(name = "idx_change_records_recorded", columnList = "recorded_at")
        })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ChangeRecordEntity {

    @Id
    @Column(length = 64)
    private String id;

    @Column(name = "resource_id", nullable = false, length = 255)
    private String resourceId;

    @Column(name = "seq_no", nullable = false)
    private long sequence;

    @Column(nullable = false, length = 16)
    private String operation;

    @Column(nullable = false, length = 255)
    private String actor;

    @Column(name = "changes_json", columnDefinition = "TEXT", nullable = false)
    private String changesJson;

    @Column(name = "recorded_at", nullable = false)
    private Instant timestamp;

    @Column(name = "previous_hash", nullable = false, length = 64)
    private String previousHash;

    @Column(name = "block_hash", nullable = false, length = 64)
    private String blockHash;
}
