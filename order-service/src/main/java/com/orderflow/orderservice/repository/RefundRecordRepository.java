package com.orderflow.orderservice.repository;

import com.orderflow.orderservice.model.RefundRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface RefundRecordRepository extends JpaRepository<RefundRecord, UUID> {

    Optional<RefundRecord> findByReference(String reference);
}
