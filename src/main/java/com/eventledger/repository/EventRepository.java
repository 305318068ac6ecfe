package com.eventledger.repository;

import com.eventledger.model.Event;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface EventRepository extends JpaRepository<Event, UUID> {
  List<Event> findByDateBetweenOrderByDateDesc(Instant from, Instant to);

  boolean existsByCategoryId(String categoryId);
}
