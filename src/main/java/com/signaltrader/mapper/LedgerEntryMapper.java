package com.signaltrader.mapper;

import com.signaltrader.domain.model.LedgerEntry;
import com.signaltrader.entity.LedgerEntryEntity;
import java.util.List;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

/**
 * MapStruct mapper between the LedgerEntry domain record and LedgerEntryEntity.
 * The entity identity column carries the domain sequence id.
 */
@Mapper
public interface LedgerEntryMapper {

    @Mapping(source = "sequenceId", target = "id")
    LedgerEntryEntity toEntity(LedgerEntry entry);

    @Mapping(source = "id", target = "sequenceId")
    LedgerEntry toDomain(LedgerEntryEntity entity);

    List<LedgerEntry> toDomainList(List<LedgerEntryEntity> entities);
}
