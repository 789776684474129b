package com.nexus.backend.service;

import com.nexus.backend.model.TradingSession;
import org.springframework.stereotype.Service;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;

/**
 * Maps a UTC instant to the crypto trading session it falls in.
 */
@Service
public class TradingSessionService {

    public TradingSession detect(Instant nowUtc) {
        ZonedDateTime now = nowUtc.atZone(ZoneOffset.UTC);
        DayOfWeek day = now.getDayOfWeek();
        if (day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY) {
            return TradingSession.WEEKEND;
        }
        int hour = now.getHour();
        if (hour < 7) {
            return TradingSession.ASIA;
        }
        if (hour < 13) {
            return TradingSession.EU;
        }
        if (hour < 21) {
            return TradingSession.US;
        }
        return TradingSession.OFF_HOURS;
    }
}
