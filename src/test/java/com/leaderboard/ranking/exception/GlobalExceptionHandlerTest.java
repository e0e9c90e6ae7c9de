package com.leaderboard.ranking.exception;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import static org.junit.jupiter.api.Assertions.*;

class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    void testNotFoundMapsTo404() {
        ResponseEntity<GlobalExceptionHandler.ErrorResponse> response =
            handler.handleLeaderboardNotFound(new LeaderboardNotFoundException("Leaderboard API is disabled"));

        assertEquals(HttpStatus.NOT_FOUND, response.getStatusCode());
        assertEquals("LEADERBOARD_NOT_FOUND", response.getBody().getErrorCode());
        assertNotNull(response.getBody().getTimestamp());
    }

    @Test
    void testInvalidRequestMapsTo400WithMessage() {
        ResponseEntity<GlobalExceptionHandler.ErrorResponse> response =
            handler.handleInvalidRequest(new InvalidRequestException("season_id is required for scope=season"));

        assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
        assertEquals("INVALID_REQUEST", response.getBody().getErrorCode());
        assertEquals("season_id is required for scope=season", response.getBody().getMessage());
    }

    @Test
    void testRecordStoreFailureMapsTo500() {
        ResponseEntity<GlobalExceptionHandler.ErrorResponse> response =
            handler.handleRecordStoreFailure(new RecordStoreException("Record store did not answer", null));

        assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, response.getStatusCode());
        assertEquals("RECORD_STORE_ERROR", response.getBody().getErrorCode());
    }

    @Test
    void testUnexpectedErrorMapsTo500() {
        ResponseEntity<GlobalExceptionHandler.ErrorResponse> response =
            handler.handleGenericException(new IllegalStateException("boom"));

        assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, response.getStatusCode());
        assertEquals("INTERNAL_ERROR", response.getBody().getErrorCode());
    }
}
