package com.eventledger.controller;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.eventledger.config.AppProperties;
import com.eventledger.dto.CreateEventRequest;
import com.eventledger.exception.ConflictException;
import com.eventledger.exception.NotManualException;
import com.eventledger.model.Event;
import com.eventledger.model.LineItem;
import com.eventledger.model.Tag;
import com.eventledger.service.EventService;
import com.eventledger.service.LineItemLedger;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest({EventController.class, LineItemController.class})
@EnableConfigurationProperties(AppProperties.class)
class EventControllerTest {
  @Autowired
  MockMvc mockMvc;

  @MockBean
  EventService eventService;
  @MockBean
  LineItemLedger ledger;

  @Test
  void createEventReturnsItsLineItemIds() throws Exception {
    UUID itemId = UUID.randomUUID();
    Event event = new Event();
    event.setId(UUID.randomUUID());
    event.setName("Coffee Run");
    event.setCategoryId("dining");
    event.setDate(Instant.ofEpochSecond(1_700_000_000L));
    event.setAmount(new BigDecimal("-12.00"));
    when(eventService.create(any(CreateEventRequest.class))).thenReturn(event);

    mockMvc.perform(post("/api/events")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"name\": \"Coffee Run\", \"category\": \"dining\", \"line_items\": [\"" + itemId + "\"]}"))
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.category").value("dining"))
        .andExpect(jsonPath("$.is_duplicate_transaction").value(false))
        .andExpect(jsonPath("$.line_item_ids[0]").value(itemId.toString()));
  }

  @Test
  void createEventWithoutItemsIsRejectedBeforeTheService() throws Exception {
    mockMvc.perform(post("/api/events")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"name\": \"Coffee Run\", \"category\": \"dining\", \"line_items\": []}"))
        .andExpect(status().isBadRequest());

    verify(eventService, never()).create(any());
  }

  @Test
  void conflictingEventIsAConflict() throws Exception {
    UUID itemId = UUID.randomUUID();
    when(eventService.create(any(CreateEventRequest.class))).thenThrow(new ConflictException(List.of(itemId)));

    mockMvc.perform(post("/api/events")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"name\": \"Again\", \"category\": \"dining\", \"line_items\": [\"" + itemId + "\"]}"))
        .andExpect(status().isConflict());
  }

  @Test
  void listPassesTagFilterAndReturnsEventTags() throws Exception {
    Tag trip = new Tag();
    trip.setId(UUID.randomUUID());
    trip.setName("trip");
    Event event = new Event();
    event.setId(UUID.randomUUID());
    event.setName("Ferry");
    event.setCategoryId("travel");
    event.setDate(Instant.ofEpochSecond(1_700_000_000L));
    event.setAmount(new BigDecimal("-30"));
    event.setTags(Set.of(trip));
    when(eventService.list(isNull(), isNull(), eq(List.of("trip", "work")))).thenReturn(List.of(event));
    when(eventService.lineItems(event.getId())).thenReturn(List.of());

    mockMvc.perform(get("/api/events").param("tags", "trip", "work"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.data[0].tags[0]").value("trip"))
        .andExpect(jsonPath("$.total").value(-30));
  }

  @Test
  void lineItemsCanBeFilteredForReview() throws Exception {
    LineItem item = new LineItem();
    item.setId(UUID.randomUUID());
    item.setDate(Instant.ofEpochSecond(1_700_000_000L));
    item.setAmount(new BigDecimal("-20"));
    item.setPaymentMethod("Cash");
    when(ledger.listAll("Cash", true)).thenReturn(List.of(item));

    mockMvc.perform(get("/api/line_items")
            .param("only_line_items_to_review", "true")
            .param("payment_method", "Cash"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.data[0].payment_method").value("Cash"))
        .andExpect(jsonPath("$.data[0].manual").value(true))
        .andExpect(jsonPath("$.total").value(-20));
  }

  @Test
  void deletingAProviderItemIsAConflict() throws Exception {
    UUID id = UUID.randomUUID();
    doThrow(new NotManualException("not manual")).when(ledger).deleteManual(id);

    mockMvc.perform(delete("/api/line_items/" + id))
        .andExpect(status().isConflict());
  }

  @Test
  void cashTransactionNeedsAnAmount() throws Exception {
    mockMvc.perform(post("/api/cash_transaction")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"date\": \"2024-02-01\", \"description\": \"Market\"}"))
        .andExpect(status().isBadRequest());
  }
}
