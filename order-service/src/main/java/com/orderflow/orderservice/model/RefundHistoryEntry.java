package com.orderflow.orderservice.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Embeddable
@NoArgsConstructor
@AllArgsConstructor
public class RefundHistoryEntry {

    @Column(name = "at", nullable = false)
    private Instant at;

    // e.g. refund_processed
    @Column(name = "action", nullable = false)
    private String action;

    @Column(name = "note")
    private String note;
}
