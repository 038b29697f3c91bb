package com.orderflow.orderservice.repository;

import com.orderflow.orderservice.model.WebhookInboxEvent;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Repository
public interface WebhookInboxRepository extends JpaRepository<WebhookInboxEvent, UUID> {

    List<WebhookInboxEvent> findTop50ByProcessedFalseAndReceivedAtBeforeAndAttemptsLessThanOrderByReceivedAtAsc(
            Instant receivedBefore, int maxAttempts);

    List<WebhookInboxEvent> findTop1000ByProcessedTrueAndReceivedAtBefore(Instant cutoff);
}
