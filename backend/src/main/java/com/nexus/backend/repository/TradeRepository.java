package com.nexus.backend.repository;

import com.nexus.backend.model.Trade;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Repository
public interface TradeRepository extends JpaRepository<Trade, String> {

    Optional<Trade> findByIdAndUserId(String id, String userId);

    boolean existsByUserIdAndSymbolAndStatus(String userId, String symbol, Trade.TradeStatus status);

    // Journal window, newest first
    List<Trade> findByUserIdAndOpenedAtGreaterThanEqualOrderByOpenedAtDesc(String userId, LocalDateTime since);
}
