package com.orderflow.orderservice.repository;

import com.orderflow.orderservice.model.IdempotentEvent;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;

@Repository
public interface IdempotentEventRepository extends JpaRepository<IdempotentEvent, String> {

  @Modifying
  @Query("DELETE FROM IdempotentEvent e WHERE e.createdAt < :cutoff")
  int deleteOlderThan(@Param("cutoff") LocalDateTime cutoff);
}
