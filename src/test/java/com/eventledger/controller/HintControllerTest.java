package com.eventledger.controller;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.eventledger.config.AppProperties;
import com.eventledger.dto.HintRequest;
import com.eventledger.exception.PartialNotFoundException;
import com.eventledger.exception.UnknownIdException;
import com.eventledger.exception.ValidationException;
import com.eventledger.expression.ValidationResult;
import com.eventledger.model.Hint;
import com.eventledger.model.LineItem;
import com.eventledger.service.HintMatcher;
import com.eventledger.service.HintStore;
import com.eventledger.service.LineItemLedger;
import com.eventledger.service.Suggestion;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(HintController.class)
@EnableConfigurationProperties(AppProperties.class)
class HintControllerTest {
  @Autowired
  MockMvc mockMvc;

  @MockBean
  HintStore hintStore;
  @MockBean
  HintMatcher hintMatcher;
  @MockBean
  LineItemLedger ledger;

  @Test
  void createReadsSnakeCaseFields() throws Exception {
    Hint hint = new Hint();
    hint.setId(UUID.randomUUID());
    hint.setName("Coffee");
    hint.setExpression("description.contains(\"cafe\")");
    hint.setPrefillName("Coffee Run");
    hint.setPrefillCategoryId("dining");
    hint.setDisplayOrder(0);
    hint.setCreatedAt(Instant.EPOCH);
    hint.setUpdatedAt(Instant.EPOCH);
    when(hintStore.create(any(HintRequest.class))).thenReturn(hint);

    mockMvc.perform(post("/api/event-hints")
            .contentType(MediaType.APPLICATION_JSON)
            .content("""
                {"name": "Coffee", "cel_expression": "description.contains(\\"cafe\\")",
                 "prefill_name": "Coffee Run", "prefill_category_id": "dining", "is_active": true}
                """))
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.cel_expression").value("description.contains(\"cafe\")"))
        .andExpect(jsonPath("$.prefill_category_id").value("dining"))
        .andExpect(jsonPath("$.is_active").value(true))
        .andExpect(jsonPath("$.display_order").value(0));
  }

  @Test
  void invalidExpressionIsABadRequest() throws Exception {
    when(hintStore.create(any(HintRequest.class))).thenThrow(new ValidationException("Invalid expression: boom"));

    mockMvc.perform(post("/api/event-hints")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"name\": \"x\", \"cel_expression\": \"amount <\", \"prefill_name\": \"x\"}"))
        .andExpect(status().isBadRequest());
  }

  @Test
  void validateReportsErrors() throws Exception {
    when(hintStore.validate("amount <")).thenReturn(ValidationResult.invalid("Unexpected end of expression at position 8"));

    mockMvc.perform(post("/api/event-hints/validate")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"cel_expression\": \"amount <\"}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.is_valid").value(false))
        .andExpect(jsonPath("$.error").value("Unexpected end of expression at position 8"));
  }

  @Test
  void evaluateReturnsSuggestionOrNull() throws Exception {
    UUID itemId = UUID.randomUUID();
    UUID hintId = UUID.randomUUID();
    LineItem item = new LineItem();
    item.setId(itemId);
    when(ledger.getMany(List.of(itemId))).thenReturn(List.of(item));
    when(hintMatcher.suggest(List.of(item)))
        .thenReturn(Optional.of(new Suggestion("Coffee Run", "dining", hintId, "Coffee")))
        .thenReturn(Optional.empty());
    String body = "{\"line_item_ids\": [\"" + itemId + "\"]}";

    mockMvc.perform(post("/api/event-hints/evaluate").contentType(MediaType.APPLICATION_JSON).content(body))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.suggestion.name").value("Coffee Run"))
        .andExpect(jsonPath("$.suggestion.category").value("dining"))
        .andExpect(jsonPath("$.suggestion.matched_hint_id").value(hintId.toString()))
        .andExpect(jsonPath("$.suggestion.matched_hint_name").value("Coffee"));

    mockMvc.perform(post("/api/event-hints/evaluate").contentType(MediaType.APPLICATION_JSON).content(body))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.suggestion").isEmpty());
  }

  @Test
  void evaluateWithStaleIdsIsNotFound() throws Exception {
    UUID missing = UUID.randomUUID();
    when(ledger.getMany(anyList())).thenThrow(new PartialNotFoundException(List.of(missing)));

    mockMvc.perform(post("/api/event-hints/evaluate")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"line_item_ids\": [\"" + missing + "\"]}"))
        .andExpect(status().isNotFound());
  }

  @Test
  void evaluateRequiresAtLeastOneId() throws Exception {
    mockMvc.perform(post("/api/event-hints/evaluate")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"line_item_ids\": []}"))
        .andExpect(status().isBadRequest());
  }

  @Test
  void reorderWithUnknownIdIsNotFound() throws Exception {
    UUID unknown = UUID.randomUUID();
    when(hintStore.reorder(eq(List.of(unknown)))).thenThrow(new UnknownIdException(List.of(unknown)));

    mockMvc.perform(put("/api/event-hints/reorder")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"hint_ids\": [\"" + unknown + "\"]}"))
        .andExpect(status().isNotFound());
  }
}
