package com.campus.portal.error;

import org.junit.jupiter.api.Test;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.orm.ObjectOptimisticLockingFailureException;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ApiExceptionHandlerTest {

    private final ApiExceptionHandler handler = new ApiExceptionHandler();

    @Test
    void uniqueConstraintRaceIsAConflict() {
        ResponseEntity<Map<String, Object>> res = handler.integrity(
                new DataIntegrityViolationException("duplicate key value violates unique constraint"));

        assertThat(res.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(res.getBody()).containsEntry("status", "error")
                .containsEntry("reason", "constraint-conflict");
    }

    @Test
    void lockFailuresAreConflicts() {
        ResponseEntity<Map<String, Object>> timeout = handler.concurrent(new CannotAcquireLockException("lock timeout"));
        ResponseEntity<Map<String, Object>> stale = handler.concurrent(
                new ObjectOptimisticLockingFailureException("Event", 7L));

        assertThat(timeout.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(timeout.getBody()).containsEntry("reason", "concurrent-update");
        assertThat(stale.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(stale.getBody()).containsEntry("reason", "concurrent-update");
    }
}
