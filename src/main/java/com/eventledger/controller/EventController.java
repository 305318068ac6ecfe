package com.eventledger.controller;

import com.eventledger.dto.CreateEventRequest;
import com.eventledger.dto.EventListResponse;
import com.eventledger.dto.EventResponse;
import com.eventledger.dto.LineItemListResponse;
import com.eventledger.model.Event;
import com.eventledger.model.LineItem;
import com.eventledger.service.EventService;
import jakarta.validation.Valid;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/events")
public class EventController {
  private final EventService eventService;

  public EventController(EventService eventService) {
    this.eventService = eventService;
  }

  @PostMapping
  @ResponseStatus(HttpStatus.CREATED)
  public EventResponse create(@Valid @RequestBody CreateEventRequest request) {
    Event event = eventService.create(request);
    return ResponseMapper.event(event, List.copyOf(new LinkedHashSet<>(request.getLineItems())));
  }

  /** {@code start_time} and {@code end_time} are Unix seconds; {@code tags} matches any of the names. */
  @GetMapping
  public EventListResponse list(@RequestParam(name = "start_time", required = false) Long startTime,
                                @RequestParam(name = "end_time", required = false) Long endTime,
                                @RequestParam(name = "tags", required = false) List<String> tags) {
    List<Event> events = eventService.list(
        startTime == null ? null : Instant.ofEpochSecond(startTime),
        endTime == null ? null : Instant.ofEpochSecond(endTime),
        tags == null ? List.of() : tags);
    List<EventResponse> data = events.stream()
        .map(event -> ResponseMapper.event(event, itemIds(event.getId())))
        .toList();
    BigDecimal total = events.stream().map(Event::getAmount).reduce(BigDecimal.ZERO, BigDecimal::add);
    return new EventListResponse(data, total);
  }

  @GetMapping("/{eventId}")
  public EventResponse get(@PathVariable UUID eventId) {
    return ResponseMapper.event(eventService.get(eventId), itemIds(eventId));
  }

  @GetMapping("/{eventId}/line_items_for_event")
  public LineItemListResponse lineItems(@PathVariable UUID eventId) {
    List<LineItem> items = eventService.lineItems(eventId);
    return new LineItemListResponse(ResponseMapper.lineItems(items), ResponseMapper.total(items));
  }

  @DeleteMapping("/{eventId}")
  public LineItemListResponse delete(@PathVariable UUID eventId) {
    List<LineItem> restored = eventService.delete(eventId);
    return new LineItemListResponse(ResponseMapper.lineItems(restored), ResponseMapper.total(restored));
  }

  private List<UUID> itemIds(UUID eventId) {
    return eventService.lineItems(eventId).stream().map(LineItem::getId).toList();
  }
}
