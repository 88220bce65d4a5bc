package com.example.bookkeeping.service;

import java.time.Clock;
import java.time.LocalDate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import com.example.bookkeeping.domain.UsageRecord;
import com.example.bookkeeping.repository.UsageRecordRepository;

/** Keeps one usage record per business per calendar month. */
@Service
@Transactional
public class UsageRecordService implements UsageTrackingSink {

  private static final Logger log = LoggerFactory.getLogger(UsageRecordService.class);

  private final UsageRecordRepository usageRecordRepository;
  private final Clock clock;

  public UsageRecordService(UsageRecordRepository usageRecordRepository, Clock clock) {
    this.usageRecordRepository = usageRecordRepository;
    this.clock = clock;
  }

  @Override
  @Transactional(propagation = Propagation.REQUIRES_NEW)
  public void incrementTransactionCount(Long businessId, int count) {
    if (count <= 0) {
      return;
    }
    LocalDate month = currentMonth();
    UsageRecord record =
        usageRecordRepository
            .findByBusinessIdAndMonth(businessId, month)
            .orElseGet(() -> new UsageRecord(businessId, month));
    record.addTransactions(count);
    usageRecordRepository.save(record);
    log.debug(
        "Usage for business {} in {} is now {} transactions",
        businessId,
        month,
        record.getTransactionCount());
  }

  /** Returns the number of transactions imported by the business this month. */
  @Transactional(readOnly = true)
  public long getMonthlyTransactionCount(Long businessId) {
    return usageRecordRepository
        .findByBusinessIdAndMonth(businessId, currentMonth())
        .map(UsageRecord::getTransactionCount)
        .orElse(0L);
  }

  private LocalDate currentMonth() {
    return LocalDate.now(clock).withDayOfMonth(1);
  }
}
