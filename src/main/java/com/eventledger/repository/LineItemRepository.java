package com.eventledger.repository;

import com.eventledger.model.LineItem;
import com.eventledger.model.ProviderType;
import java.util.Collection;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface LineItemRepository extends JpaRepository<LineItem, UUID> {
  List<LineItem> findByProviderAndExternalRefIn(ProviderType provider, Collection<String> externalRefs);

  @Query("select li from LineItem li where li.event is null order by li.date desc, li.id asc")
  List<LineItem> findReviewable();

  List<LineItem> findAllByOrderByDateDescIdAsc();

  List<LineItem> findByPaymentMethodOrderByDateDescIdAsc(String paymentMethod);

  List<LineItem> findByPaymentMethodAndEventIsNullOrderByDateDescIdAsc(String paymentMethod);

  @Query("select li from LineItem li where li.event.id = :eventId order by li.date asc, li.id asc")
  List<LineItem> findByEventId(@Param("eventId") UUID eventId);
}
