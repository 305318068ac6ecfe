package com.eventledger.controller;

import com.eventledger.dto.AccountResponse;
import com.eventledger.dto.EventResponse;
import com.eventledger.dto.HintResponse;
import com.eventledger.dto.LineItemResponse;
import com.eventledger.dto.SuggestionResponse;
import com.eventledger.dto.SyncResultResponse;
import com.eventledger.model.Account;
import com.eventledger.model.Event;
import com.eventledger.model.Hint;
import com.eventledger.model.LineItem;
import com.eventledger.model.Tag;
import com.eventledger.service.Suggestion;
import com.eventledger.service.SyncResult;
import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

final class ResponseMapper {
  private ResponseMapper() {
  }

  static LineItemResponse lineItem(LineItem item) {
    return new LineItemResponse(
        item.getId(),
        item.getProvider() == null ? null : item.getProvider().getKey(),
        item.getExternalRef(),
        item.getDate().getEpochSecond(),
        item.getAmount(),
        item.getDescription(),
        item.getCounterparty(),
        item.getPaymentMethod(),
        item.isReviewed(),
        item.isSelected(),
        item.isManual(),
        item.getEvent() == null ? null : item.getEvent().getId());
  }

  static List<LineItemResponse> lineItems(List<LineItem> items) {
    return items.stream().map(ResponseMapper::lineItem).toList();
  }

  static BigDecimal total(List<LineItem> items) {
    return items.stream().map(LineItem::getAmount).reduce(BigDecimal.ZERO, BigDecimal::add);
  }

  static HintResponse hint(Hint hint) {
    return new HintResponse(
        hint.getId(),
        hint.getName(),
        hint.getExpression(),
        hint.getPrefillName(),
        hint.getPrefillCategoryId(),
        hint.getDisplayOrder(),
        hint.isActive(),
        hint.getCreatedAt(),
        hint.getUpdatedAt());
  }

  static SuggestionResponse suggestion(Suggestion suggestion) {
    return new SuggestionResponse(
        suggestion.name(), suggestion.categoryId(), suggestion.matchedHintId(), suggestion.matchedHintName());
  }

  static EventResponse event(Event event, List<UUID> lineItemIds) {
    return new EventResponse(
        event.getId(),
        event.getName(),
        event.getCategoryId(),
        event.getDate().getEpochSecond(),
        event.getAmount(),
        event.isDuplicateTransaction(),
        lineItemIds,
        event.getTags().stream().map(Tag::getName).sorted().toList());
  }

  static AccountResponse account(Account account) {
    return new AccountResponse(
        account.getId(),
        account.getProvider().getKey(),
        account.getDisplayName(),
        account.getExternalId(),
        account.getStatus().name().toLowerCase(Locale.ROOT),
        account.getBalance(),
        account.getBalanceAsOf(),
        account.getSyncStatus() == null ? null : account.getSyncStatus().name().toLowerCase(Locale.ROOT),
        account.getLastSyncedAt(),
        account.getLastSyncError());
  }

  static SyncResultResponse syncResult(SyncResult result) {
    return new SyncResultResponse(
        result.accountId(),
        result.outcome().name().toLowerCase(Locale.ROOT),
        result.itemsMerged(),
        result.error());
  }
}
