package com.signaltrader.repository.jpa;

import com.signaltrader.domain.enums.LedgerEntryType;
import com.signaltrader.entity.LedgerEntryEntity;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the ledger_entries table. Reads are always in sequence order.
 */
@Repository
public interface LedgerEntryJpaRepository extends JpaRepository<LedgerEntryEntity, Long> {

    List<LedgerEntryEntity> findAllByOrderByIdAsc();

    List<LedgerEntryEntity> findByEntryTypeOrderByIdAsc(LedgerEntryType entryType);

    List<LedgerEntryEntity> findByEntryTypeAndSymbolOrderByIdAsc(LedgerEntryType entryType, String symbol);

    boolean existsByEntryTypeAndPositionId(LedgerEntryType entryType, String positionId);
}
