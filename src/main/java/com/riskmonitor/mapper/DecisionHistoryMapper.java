package com.riskmonitor.mapper;

import com.riskmonitor.domain.model.BalanceRecord;
import com.riskmonitor.domain.model.TradeOutcome;
import com.riskmonitor.entity.DecisionRecordEntity;
import com.riskmonitor.entity.TradeOutcomeEntity;
import java.util.List;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

/**
 * MapStruct mapper from the decision history tables to the monitor's domain models.
 * The monitor never writes history, so only the entity-to-domain direction exists.
 */
@Mapper
public interface DecisionHistoryMapper {

    @Mapping(source = "totalUnrealizedProfit", target = "unrealizedPnl")
    BalanceRecord toBalanceRecord(DecisionRecordEntity entity);

    List<BalanceRecord> toBalanceRecords(List<DecisionRecordEntity> entities);

    TradeOutcome toTradeOutcome(TradeOutcomeEntity entity);

    List<TradeOutcome> toTradeOutcomes(List<TradeOutcomeEntity> entities);
}
