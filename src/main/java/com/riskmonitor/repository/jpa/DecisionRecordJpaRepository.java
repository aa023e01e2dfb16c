package com.riskmonitor.repository.jpa;

import com.riskmonitor.entity.DecisionRecordEntity;
import java.util.List;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the decision_records table.
 */
@Repository
public interface DecisionRecordJpaRepository extends JpaRepository<DecisionRecordEntity, Long> {

    /** Newest first; page size bounds the lookback. */
    List<DecisionRecordEntity> findByTraderIdOrderByTimestampDesc(String traderId, Pageable pageable);
}
