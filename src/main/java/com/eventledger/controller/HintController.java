package com.eventledger.controller;

import com.eventledger.dto.EvaluateHintsRequest;
import com.eventledger.dto.EvaluateHintsResponse;
import com.eventledger.dto.HintRequest;
import com.eventledger.dto.HintResponse;
import com.eventledger.dto.ReorderHintsRequest;
import com.eventledger.dto.ValidateExpressionRequest;
import com.eventledger.dto.ValidateExpressionResponse;
import com.eventledger.expression.ValidationResult;
import com.eventledger.service.HintMatcher;
import com.eventledger.service.HintStore;
import com.eventledger.service.LineItemLedger;
import jakarta.validation.Valid;
import java.util.List;
import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/event-hints")
public class HintController {
  private final HintStore hintStore;
  private final HintMatcher hintMatcher;
  private final LineItemLedger ledger;

  public HintController(HintStore hintStore, HintMatcher hintMatcher, LineItemLedger ledger) {
    this.hintStore = hintStore;
    this.hintMatcher = hintMatcher;
    this.ledger = ledger;
  }

  @GetMapping
  public List<HintResponse> list(@RequestParam(name = "active_only", defaultValue = "false") boolean activeOnly) {
    return hintStore.list(activeOnly).stream().map(ResponseMapper::hint).toList();
  }

  @GetMapping("/{hintId}")
  public HintResponse get(@PathVariable UUID hintId) {
    return ResponseMapper.hint(hintStore.get(hintId));
  }

  @PostMapping
  @ResponseStatus(HttpStatus.CREATED)
  public HintResponse create(@RequestBody HintRequest request) {
    return ResponseMapper.hint(hintStore.create(request));
  }

  @PutMapping("/{hintId}")
  public HintResponse update(@PathVariable UUID hintId, @RequestBody HintRequest request) {
    return ResponseMapper.hint(hintStore.update(hintId, request));
  }

  @DeleteMapping("/{hintId}")
  @ResponseStatus(HttpStatus.NO_CONTENT)
  public void delete(@PathVariable UUID hintId) {
    hintStore.delete(hintId);
  }

  @PutMapping("/reorder")
  public List<HintResponse> reorder(@Valid @RequestBody ReorderHintsRequest request) {
    return hintStore.reorder(request.getHintIds()).stream().map(ResponseMapper::hint).toList();
  }

  @PostMapping("/validate")
  public ValidateExpressionResponse validate(@RequestBody ValidateExpressionRequest request) {
    ValidationResult result = hintStore.validate(request.getCelExpression());
    return new ValidateExpressionResponse(result.valid(), result.error());
  }

  @PostMapping("/evaluate")
  public EvaluateHintsResponse evaluate(@Valid @RequestBody EvaluateHintsRequest request) {
    return new EvaluateHintsResponse(hintMatcher.suggest(ledger.getMany(request.getLineItemIds()))
        .map(ResponseMapper::suggestion)
        .orElse(null));
  }
}
