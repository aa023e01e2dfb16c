package com.riskmonitor.repository.jpa;

import com.riskmonitor.entity.TradeOutcomeEntity;
import java.util.List;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the trade_outcomes table.
 */
@Repository
public interface TradeOutcomeJpaRepository extends JpaRepository<TradeOutcomeEntity, Long> {

    List<TradeOutcomeEntity> findByTraderIdOrderByCloseTimeDesc(String traderId, Pageable pageable);
}
