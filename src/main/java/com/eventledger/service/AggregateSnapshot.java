package com.eventledger.service;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Cached aggregates. {@code monthlyBreakdown} maps category name to month ({@code MM-yyyy})
 * to amount, every category carrying every month in {@code months}.
 */
public record AggregateSnapshot(BigDecimal totalBalance,
                                List<String> months,
                                Map<String, Map<String, BigDecimal>> monthlyBreakdown,
                                Instant computedAt) {}
