package com.example.bookkeeping.repository;

import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.example.bookkeeping.domain.LedgerAccount;

@Repository
public interface LedgerAccountRepository extends JpaRepository<LedgerAccount, Long> {

  List<LedgerAccount> findByBusinessIdAndActiveTrueOrderByCode(Long businessId);

  Optional<LedgerAccount> findByBusinessIdAndCode(Long businessId, String code);

  boolean existsByBusinessId(Long businessId);
}
