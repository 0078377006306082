package com.signaltrader.testsupport;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;

import com.signaltrader.config.TradingProperties;
import com.signaltrader.domain.enums.LedgerEntryType;
import com.signaltrader.entity.LedgerEntryEntity;
import com.signaltrader.ledger.TradeLedger;
import com.signaltrader.mapper.LedgerEntryMapper;
import com.signaltrader.repository.jpa.LedgerEntryJpaRepository;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import org.mapstruct.factory.Mappers;
import org.springframework.dao.DataAccessResourceFailureException;

/**
 * Ledger table kept in a list behind a mocked {@link LedgerEntryJpaRepository}, so ledger
 * backed services can be tested without a database. {@link #setFailWrites} simulates the
 * store being unavailable.
 */
public class InMemoryLedgerStore {

    private final List<LedgerEntryEntity> rows = new CopyOnWriteArrayList<>();
    private final AtomicLong ids = new AtomicLong(0);
    private volatile boolean failWrites;

    private final LedgerEntryJpaRepository repository = mock(LedgerEntryJpaRepository.class);

    public InMemoryLedgerStore() {
        lenient().when(repository.save(any(LedgerEntryEntity.class))).thenAnswer(invocation -> {
            if (failWrites) {
                throw new DataAccessResourceFailureException("ledger unavailable");
            }
            LedgerEntryEntity entity = invocation.getArgument(0);
            entity.setId(ids.incrementAndGet());
            rows.add(entity);
            return entity;
        });
        lenient().when(repository.findAllByOrderByIdAsc()).thenAnswer(invocation -> List.copyOf(rows));
        lenient()
                .when(repository.findByEntryTypeOrderByIdAsc(any(LedgerEntryType.class)))
                .thenAnswer(invocation -> rows.stream()
                        .filter(row -> row.getEntryType() == invocation.getArgument(0))
                        .toList());
        lenient()
                .when(repository.findByEntryTypeAndSymbolOrderByIdAsc(any(LedgerEntryType.class), anyString()))
                .thenAnswer(invocation -> rows.stream()
                        .filter(row -> row.getEntryType() == invocation.getArgument(0))
                        .filter(row -> invocation.getArgument(1).equals(row.getSymbol()))
                        .toList());
        lenient()
                .when(repository.existsByEntryTypeAndPositionId(any(LedgerEntryType.class), anyString()))
                .thenAnswer(invocation -> {
                    if (failWrites) {
                        throw new DataAccessResourceFailureException("ledger unavailable");
                    }
                    return rows.stream()
                            .anyMatch(row -> row.getEntryType() == invocation.getArgument(0)
                                    && invocation.getArgument(1).equals(row.getPositionId()));
                });
    }

    public TradeLedger newLedger(TradingProperties tradingProperties, Clock clock) {
        return new TradeLedger(repository, Mappers.getMapper(LedgerEntryMapper.class), tradingProperties, clock);
    }

    public void setFailWrites(boolean failWrites) {
        this.failWrites = failWrites;
    }

    public List<LedgerEntryEntity> rows() {
        return List.copyOf(rows);
    }

    public long count(LedgerEntryType type) {
        return rows.stream().filter(row -> row.getEntryType() == type).count();
    }
}
