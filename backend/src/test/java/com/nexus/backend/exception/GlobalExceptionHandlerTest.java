package com.nexus.backend.exception;

import com.nexus.backend.dto.ApiError;
import com.nexus.backend.model.DailyStat;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.orm.ObjectOptimisticLockingFailureException;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    void lostUpdateIsConflict() {
        ResponseEntity<ApiError> response = handler.handleConflict(
                new ObjectOptimisticLockingFailureException(DailyStat.class, 1L), request());

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(response.getBody().getMessage()).isEqualTo("Concurrent update; retry the request.");
    }

    @Test
    void racingInsertIsConflict() {
        ResponseEntity<ApiError> response = handler.handleConflict(
                new DataIntegrityViolationException("uq_daily_stats_user_day"), request());

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(response.getBody().getPath()).isEqualTo("/api/trades/close");
    }

    private static MockHttpServletRequest request() {
        return new MockHttpServletRequest("POST", "/api/trades/close");
    }
}
