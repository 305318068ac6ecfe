package com.eventledger.service;

import com.eventledger.model.Account;
import com.eventledger.model.AccountStatus;
import com.eventledger.model.Category;
import com.eventledger.model.Event;
import com.eventledger.repository.AccountRepository;
import com.eventledger.repository.CategoryRepository;
import com.eventledger.repository.EventRepository;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class AggregateService {
  private static final Logger log = LoggerFactory.getLogger(AggregateService.class);
  static final DateTimeFormatter MONTH_FORMAT = DateTimeFormatter.ofPattern("MM-yyyy");

  private final AccountRepository accountRepository;
  private final EventRepository eventRepository;
  private final CategoryRepository categoryRepository;
  private final AtomicReference<AggregateSnapshot> snapshot = new AtomicReference<>();

  public AggregateService(AccountRepository accountRepository,
                          EventRepository eventRepository,
                          CategoryRepository categoryRepository) {
    this.accountRepository = accountRepository;
    this.eventRepository = eventRepository;
    this.categoryRepository = categoryRepository;
  }

  public synchronized AggregateSnapshot recompute() {
    BigDecimal total = accountRepository.findByStatus(AccountStatus.ACTIVE).stream()
        .map(Account::getBalance)
        .filter(balance -> balance != null)
        .reduce(BigDecimal.ZERO, BigDecimal::add);

    Map<String, String> categoryNames = new HashMap<>();
    for (Category category : categoryRepository.findAll()) {
      categoryNames.put(category.getId(), category.getName());
    }
    List<Event> events = eventRepository.findAll();
    List<String> months = monthRange(events);
    Map<String, Map<String, BigDecimal>> breakdown = new TreeMap<>();
    for (Event event : events) {
      String category = categoryNames.getOrDefault(event.getCategoryId(), event.getCategoryId());
      Map<String, BigDecimal> perMonth = breakdown.computeIfAbsent(category, key -> zeroes(months));
      perMonth.merge(month(event.getDate()), event.getAmount(), BigDecimal::add);
    }
    AggregateSnapshot computed = new AggregateSnapshot(total, months, breakdown, Instant.now());
    snapshot.set(computed);
    log.debug("Recomputed aggregates over {} events and {} months", events.size(), months.size());
    return computed;
  }

  /** Latest snapshot, computing one when none exists yet. */
  public AggregateSnapshot current() {
    AggregateSnapshot current = snapshot.get();
    return current != null ? current : recompute();
  }

  /** Recomputes, logging instead of propagating a failure. */
  public void recomputeQuietly() {
    try {
      recompute();
    } catch (RuntimeException ex) {
      log.warn("Aggregate recomputation failed: {}", ex.getMessage(), ex);
    }
  }

  static String month(Instant instant) {
    return YearMonth.from(instant.atZone(ZoneOffset.UTC)).format(MONTH_FORMAT);
  }

  private static List<String> monthRange(List<Event> events) {
    if (events.isEmpty()) {
      return Collections.emptyList();
    }
    YearMonth first = null;
    YearMonth last = null;
    for (Event event : events) {
      YearMonth month = YearMonth.from(event.getDate().atZone(ZoneOffset.UTC));
      first = first == null || month.isBefore(first) ? month : first;
      last = last == null || month.isAfter(last) ? month : last;
    }
    List<String> months = new ArrayList<>();
    for (YearMonth cursor = first; !cursor.isAfter(last); cursor = cursor.plusMonths(1)) {
      months.add(cursor.format(MONTH_FORMAT));
    }
    return months;
  }

  private static Map<String, BigDecimal> zeroes(List<String> months) {
    Map<String, BigDecimal> values = new LinkedHashMap<>();
    months.forEach(month -> values.put(month, BigDecimal.ZERO));
    return values;
  }
}
