package com.ardua.ledger.importing;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface BankImportProfileRepository extends JpaRepository<BankImportProfile, Long> {

    Optional<BankImportProfile> findByBankAccountId(Long bankAccountId);
}
