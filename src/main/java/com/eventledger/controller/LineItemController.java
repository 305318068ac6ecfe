package com.eventledger.controller;

import com.eventledger.dto.CashTransactionRequest;
import com.eventledger.dto.LineItemListResponse;
import com.eventledger.dto.LineItemResponse;
import com.eventledger.model.LineItem;
import com.eventledger.service.LineItemLedger;
import jakarta.validation.Valid;
import java.time.ZoneOffset;
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
@RequestMapping("/api")
public class LineItemController {
  private final LineItemLedger ledger;

  public LineItemController(LineItemLedger ledger) {
    this.ledger = ledger;
  }

  @GetMapping("/line_items")
  public LineItemListResponse list(
      @RequestParam(name = "only_line_items_to_review", defaultValue = "false") boolean onlyToReview,
      @RequestParam(name = "payment_method", required = false) String paymentMethod) {
    List<LineItem> items = ledger.listAll(paymentMethod, onlyToReview);
    return new LineItemListResponse(ResponseMapper.lineItems(items), ResponseMapper.total(items));
  }

  @GetMapping("/line_items/{lineItemId}")
  public LineItemResponse get(@PathVariable UUID lineItemId) {
    return ResponseMapper.lineItem(ledger.get(lineItemId));
  }

  @PostMapping("/line_items/{lineItemId}/toggle_select")
  public LineItemResponse toggleSelect(@PathVariable UUID lineItemId) {
    return ResponseMapper.lineItem(ledger.toggleSelect(lineItemId));
  }

  @DeleteMapping("/line_items/{lineItemId}")
  @ResponseStatus(HttpStatus.NO_CONTENT)
  public void delete(@PathVariable UUID lineItemId) {
    ledger.deleteManual(lineItemId);
  }

  @PostMapping("/cash_transaction")
  @ResponseStatus(HttpStatus.CREATED)
  public LineItemResponse createCashTransaction(@Valid @RequestBody CashTransactionRequest request) {
    LineItem item = ledger.addManual(
        request.getDate().atStartOfDay(ZoneOffset.UTC).toInstant(),
        request.getAmount(),
        request.getDescription(),
        request.getResponsibleParty(),
        request.getPaymentMethod());
    return ResponseMapper.lineItem(item);
  }
}
