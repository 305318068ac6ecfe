package com.eventledger.repository;

import com.eventledger.model.Hint;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

public interface HintRepository extends JpaRepository<Hint, UUID> {
  List<Hint> findAllByOrderByDisplayOrderAscIdAsc();

  List<Hint> findByActiveTrueOrderByDisplayOrderAscIdAsc();

  boolean existsByActiveTrueAndDisplayOrder(int displayOrder);

  Optional<Hint> findFirstByActiveTrueAndDisplayOrderAndIdNot(int displayOrder, UUID id);

  boolean existsByPrefillCategoryId(String categoryId);

  @Query("select coalesce(max(h.displayOrder), -1) from Hint h")
  int findMaxDisplayOrder();
}
