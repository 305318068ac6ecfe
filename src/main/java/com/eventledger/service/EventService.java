package com.eventledger.service;

import com.eventledger.dto.CreateEventRequest;
import com.eventledger.exception.NotFoundException;
import com.eventledger.exception.ValidationException;
import com.eventledger.model.Event;
import com.eventledger.model.LineItem;
import com.eventledger.model.Tag;
import com.eventledger.repository.EventRepository;
import com.eventledger.repository.LineItemRepository;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class EventService {
  private static final Logger log = LoggerFactory.getLogger(EventService.class);

  private final EventRepository eventRepository;
  private final LineItemRepository lineItemRepository;
  private final LineItemLedger ledger;
  private final CategoryService categoryService;
  private final TagService tagService;
  private final AggregateService aggregateService;

  public EventService(EventRepository eventRepository,
                      LineItemRepository lineItemRepository,
                      LineItemLedger ledger,
                      CategoryService categoryService,
                      TagService tagService,
                      AggregateService aggregateService) {
    this.eventRepository = eventRepository;
    this.lineItemRepository = lineItemRepository;
    this.ledger = ledger;
    this.categoryService = categoryService;
    this.tagService = tagService;
    this.aggregateService = aggregateService;
  }

  /**
   * Creates the event and removes its line items from review in one transaction. Fails
   * without side effects when an item is missing or already belongs to another event.
   */
  public Event create(CreateEventRequest request) {
    if (request.getName() == null || request.getName().isBlank()) {
      throw new ValidationException("name is required");
    }
    String categoryId = request.getCategory() == null ? null : request.getCategory().trim();
    if (!categoryService.exists(categoryId)) {
      throw new ValidationException("Unknown category: " + request.getCategory());
    }
    boolean duplicate = Boolean.TRUE.equals(request.getIsDuplicateTransaction());
    Instant dateOverride = request.getDate() == null
        ? null
        : request.getDate().atStartOfDay(ZoneOffset.UTC).toInstant();

    Event created = ledger.removeMany(request.getLineItems(), items -> {
      Event event = new Event();
      event.setName(request.getName().trim());
      event.setCategoryId(categoryId);
      event.setDuplicateTransaction(duplicate);
      event.setAmount(amountOf(items, duplicate));
      event.setDate(dateOverride != null ? dateOverride : earliest(items));
      event.setTags(tagService.resolve(request.getTags()));
      return eventRepository.save(event);
    });
    log.info("Created event {} '{}' with {} line items", created.getId(), created.getName(),
        request.getLineItems().size());
    aggregateService.recomputeQuietly();
    return created;
  }

  /** Deletes the event and returns its line items to review. */
  public List<LineItem> delete(UUID id) {
    Event event = get(id);
    List<LineItem> restored = ledger.restore(event.getId(), () -> eventRepository.deleteById(event.getId()));
    log.info("Deleted event {}", id);
    aggregateService.recomputeQuietly();
    return restored;
  }

  public Event get(UUID id) {
    return eventRepository.findById(id)
        .orElseThrow(() -> new NotFoundException("Event not found: " + id));
  }

  /** Events in the window, newest first; a non-empty tag filter keeps events carrying any of the tags. */
  public List<Event> list(Instant from, Instant to, Collection<String> tags) {
    Instant start = from == null ? Instant.EPOCH : from;
    Instant end = to == null ? Instant.now() : to;
    if (end.isBefore(start)) {
      throw new ValidationException("end_time must not be before start_time");
    }
    List<Event> events = eventRepository.findByDateBetweenOrderByDateDesc(start, end);
    Set<String> wanted = TagService.normalize(tags);
    if (wanted.isEmpty()) {
      return events;
    }
    return events.stream()
        .filter(event -> event.getTags().stream().map(Tag::getName).anyMatch(wanted::contains))
        .toList();
  }

  public List<LineItem> lineItems(UUID eventId) {
    get(eventId);
    return lineItemRepository.findByEventId(eventId);
  }

  /** The first item's amount for duplicate transactions, otherwise the sum. */
  static BigDecimal amountOf(List<LineItem> items, boolean duplicate) {
    if (duplicate) {
      return items.get(0).getAmount();
    }
    return items.stream().map(LineItem::getAmount).reduce(BigDecimal.ZERO, BigDecimal::add);
  }

  private static Instant earliest(List<LineItem> items) {
    return items.stream().map(LineItem::getDate).min(Comparator.naturalOrder()).orElseGet(Instant::now);
  }
}
