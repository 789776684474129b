package com.nexus.backend.repository;

import com.nexus.backend.model.DailyStat;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@Repository
public interface DailyStatRepository extends JpaRepository<DailyStat, Long> {

    Optional<DailyStat> findByUserIdAndTradeDay(String userId, LocalDate tradeDay);

    List<DailyStat> findByUserIdAndTradeDayBetweenOrderByTradeDayAsc(String userId, LocalDate from, LocalDate to);
}
