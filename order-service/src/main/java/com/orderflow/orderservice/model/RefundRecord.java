package com.orderflow.orderservice.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Payment-ledger side of a refund, keyed by the gateway refund id.
 * The ticketing workflow that requests refunds lives elsewhere.
 */
@Entity
@Table(name = "refund_records")
@Getter
@Setter
@ToString(onlyExplicitlyIncluded = true)
public class RefundRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false, unique = true)
    @ToString.Include
    private String reference;

    private UUID orderId;

    private String paymentId;

    private BigDecimal amount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    @ToString.Include
    private RefundStatus status;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "refund_history", joinColumns = @JoinColumn(name = "refund_record_id"))
    @OrderBy("at ASC")
    private List<RefundHistoryEntry> history = new ArrayList<>();

    @CreationTimestamp
    @Column(updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    private Instant updatedAt;

    public boolean hasRecorded(String action, String note) {
        return history.stream()
                .anyMatch(entry -> action.equals(entry.getAction()) && Objects.equals(note, entry.getNote()));
    }
}
