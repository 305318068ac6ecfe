package com.eventledger.provider;

import java.math.BigDecimal;
import java.time.Instant;

/** A provider transaction in ledger terms: negative amounts are money out. */
public record NormalizedItem(String externalRef,
                             Instant date,
                             BigDecimal amount,
                             String description,
                             String counterparty,
                             String paymentMethod) {}
