package com.example.bookkeeping.repository;

import java.time.LocalDate;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.example.bookkeeping.domain.UsageRecord;

@Repository
public interface UsageRecordRepository extends JpaRepository<UsageRecord, Long> {

  Optional<UsageRecord> findByBusinessIdAndMonth(Long businessId, LocalDate month);
}
