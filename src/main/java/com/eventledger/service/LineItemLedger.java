package com.eventledger.service;

import com.eventledger.exception.ConflictException;
import com.eventledger.exception.NotFoundException;
import com.eventledger.exception.NotManualException;
import com.eventledger.exception.PartialNotFoundException;
import com.eventledger.exception.ValidationException;
import com.eventledger.model.Event;
import com.eventledger.model.LineItem;
import com.eventledger.model.ProviderType;
import com.eventledger.provider.NormalizedItem;
import com.eventledger.repository.LineItemRepository;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * The authoritative set of line items.
 *
 * <p>Every mutation runs inside one database transaction while holding a single ledger
 * lock, and the lock is released only after the commit. Merges from different providers,
 * selection toggles and event attachment therefore never interleave, and readers see
 * either all or none of a mutation.
 *
 * <p>An item is reviewable while it is not attached to an event. Attaching removes it
 * from the reviewable set; detaching returns it with {@code selected} cleared.
 */
@Service
public class LineItemLedger {
  private static final Logger log = LoggerFactory.getLogger(LineItemLedger.class);
  static final String CASH_PAYMENT_METHOD = "Cash";

  private final LineItemRepository repository;
  private final TransactionTemplate transactionTemplate;
  private final ReentrantLock lock = new ReentrantLock();

  public LineItemLedger(LineItemRepository repository, PlatformTransactionManager transactionManager) {
    this.repository = repository;
    this.transactionTemplate = new TransactionTemplate(transactionManager);
  }

  public MergeReport merge(ProviderType provider, List<NormalizedItem> items) {
    Objects.requireNonNull(provider, "provider");
    if (items == null || items.isEmpty()) {
      return new MergeReport(0, 0, 0);
    }
    Map<String, NormalizedItem> incoming = new LinkedHashMap<>();
    for (NormalizedItem item : items) {
      if (item.externalRef() == null || item.externalRef().isBlank()) {
        log.warn("Skipping {} item without external reference", provider.getKey());
        continue;
      }
      incoming.put(item.externalRef(), item);
    }
    MergeReport report = locked(() -> {
      Map<String, LineItem> existing = new LinkedHashMap<>();
      for (LineItem item : repository.findByProviderAndExternalRefIn(provider, incoming.keySet())) {
        existing.put(item.getExternalRef(), item);
      }
      int inserted = 0;
      int updated = 0;
      int unchanged = 0;
      List<LineItem> toSave = new ArrayList<>();
      for (NormalizedItem source : incoming.values()) {
        LineItem item = existing.get(source.externalRef());
        if (item == null) {
          item = new LineItem();
          item.setProvider(provider);
          item.setExternalRef(source.externalRef());
          apply(item, source);
          toSave.add(item);
          inserted++;
        } else if (apply(item, source)) {
          toSave.add(item);
          updated++;
        } else {
          unchanged++;
        }
      }
      repository.saveAll(toSave);
      return new MergeReport(inserted, updated, unchanged);
    });
    log.info("Merged {} {} items: {} inserted, {} updated, {} unchanged",
        incoming.size(), provider.getKey(), report.inserted(), report.updated(), report.unchanged());
    return report;
  }

  public List<LineItem> listUnreviewed() {
    return repository.findReviewable();
  }

  public List<LineItem> listAll(String paymentMethod, boolean onlyToReview) {
    if (paymentMethod == null || paymentMethod.isBlank()) {
      return onlyToReview ? repository.findReviewable() : repository.findAllByOrderByDateDescIdAsc();
    }
    String filter = paymentMethod.trim();
    return onlyToReview
        ? repository.findByPaymentMethodAndEventIsNullOrderByDateDescIdAsc(filter)
        : repository.findByPaymentMethodOrderByDateDescIdAsc(filter);
  }

  public LineItem get(UUID id) {
    return repository.findById(id)
        .orElseThrow(() -> new NotFoundException("Line item not found: " + id));
  }

  /** Loads the given items in request order; all must exist. */
  public List<LineItem> getMany(Collection<UUID> ids) {
    Set<UUID> requested = new LinkedHashSet<>(ids);
    Map<UUID, LineItem> found = new LinkedHashMap<>();
    for (LineItem item : repository.findAllById(requested)) {
      found.put(item.getId(), item);
    }
    List<UUID> missing = requested.stream().filter(id -> !found.containsKey(id)).toList();
    if (!missing.isEmpty()) {
      throw new PartialNotFoundException(missing);
    }
    return requested.stream().map(found::get).toList();
  }

  /** Flips {@code selected}. Items already attached to an event are returned unchanged. */
  public LineItem toggleSelect(UUID id) {
    return locked(() -> {
      LineItem item = get(id);
      if (item.getEvent() != null) {
        return item;
      }
      item.setSelected(!item.isSelected());
      return repository.save(item);
    });
  }

  /**
   * Removes the given items from the reviewable set and attaches them to the event built by
   * {@code eventFactory}, all in one transaction. Nothing changes when any id is missing or
   * any item already belongs to an event.
   */
  public Event removeMany(Collection<UUID> ids, Function<List<LineItem>, Event> eventFactory) {
    if (ids == null || ids.isEmpty()) {
      throw new ValidationException("At least one line item is required");
    }
    return locked(() -> {
      List<LineItem> items = getMany(ids);
      List<UUID> conflicting = items.stream()
          .filter(item -> item.getEvent() != null)
          .map(LineItem::getId)
          .toList();
      if (!conflicting.isEmpty()) {
        throw new ConflictException(conflicting);
      }
      Event event = eventFactory.apply(items);
      for (LineItem item : items) {
        item.setEvent(event);
        item.setReviewed(true);
        item.setSelected(false);
      }
      repository.saveAll(items);
      log.info("Attached {} line items to event {}", items.size(), event.getId());
      return event;
    });
  }

  /**
   * Detaches every item of the event, returning them to the reviewable set unselected, then
   * runs {@code afterDetach} in the same transaction.
   */
  public List<LineItem> restore(UUID eventId, Runnable afterDetach) {
    return locked(() -> {
      List<LineItem> items = repository.findByEventId(eventId);
      for (LineItem item : items) {
        item.setEvent(null);
        item.setReviewed(false);
        item.setSelected(false);
      }
      List<LineItem> saved = repository.saveAll(items);
      repository.flush();
      afterDetach.run();
      log.info("Returned {} line items from event {} to review", saved.size(), eventId);
      return saved;
    });
  }

  public LineItem addManual(Instant date,
                            BigDecimal amount,
                            String description,
                            String counterparty,
                            String paymentMethod) {
    if (date == null) {
      throw new ValidationException("date is required");
    }
    if (amount == null) {
      throw new ValidationException("amount is required");
    }
    LineItem item = new LineItem();
    item.setDate(date);
    item.setAmount(amount);
    item.setDescription(description == null ? "" : description.trim());
    item.setCounterparty(counterparty == null ? "" : counterparty.trim());
    item.setPaymentMethod(paymentMethod == null || paymentMethod.isBlank()
        ? CASH_PAYMENT_METHOD
        : paymentMethod.trim());
    LineItem saved = locked(() -> repository.save(item));
    log.info("Added manual line item {}", saved.getId());
    return saved;
  }

  public void deleteManual(UUID id) {
    locked(() -> {
      LineItem item = get(id);
      if (!item.isManual()) {
        throw new NotManualException("Line item " + id + " comes from a provider and cannot be deleted");
      }
      if (item.getEvent() != null) {
        throw new ConflictException(List.of(id));
      }
      repository.delete(item);
      return null;
    });
    log.info("Deleted manual line item {}", id);
  }

  private <T> T locked(Supplier<T> work) {
    lock.lock();
    try {
      return transactionTemplate.execute(status -> work.get());
    } finally {
      lock.unlock();
    }
  }

  private static boolean apply(LineItem item, NormalizedItem source) {
    boolean changed = false;
    if (!Objects.equals(item.getDate(), source.date())) {
      item.setDate(source.date());
      changed = true;
    }
    if (item.getAmount() == null || source.amount() == null || item.getAmount().compareTo(source.amount()) != 0) {
      item.setAmount(source.amount());
      changed = true;
    }
    changed |= !Objects.equals(item.getDescription(), source.description());
    item.setDescription(source.description());
    changed |= !Objects.equals(item.getCounterparty(), source.counterparty());
    item.setCounterparty(source.counterparty());
    changed |= !Objects.equals(item.getPaymentMethod(), source.paymentMethod());
    item.setPaymentMethod(source.paymentMethod());
    return changed;
  }
}
