package com.openforge.kairn.error;

import io.github.resilience4j.bulkhead.Bulkhead;
import io.github.resilience4j.bulkhead.BulkheadFullException;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import static org.junit.jupiter.api.Assertions.*;

class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    void statusOf_mapsEveryKind() {
        assertEquals(HttpStatus.NOT_FOUND, GlobalExceptionHandler.statusOf(ErrorKind.NOT_FOUND));
        assertEquals(HttpStatus.BAD_REQUEST, GlobalExceptionHandler.statusOf(ErrorKind.INVALID_ARGUMENT));
        assertEquals(HttpStatus.CONFLICT, GlobalExceptionHandler.statusOf(ErrorKind.CONFLICT));
        assertEquals(HttpStatus.SERVICE_UNAVAILABLE, GlobalExceptionHandler.statusOf(ErrorKind.STORE_FAILURE));
    }

    @Test
    void handleKairn_keepsKindAndMessage() {
        ResponseEntity<ApiError> response = handler.handleKairn(KairnException.notFound("Node not found: 7"));

        assertEquals(HttpStatus.NOT_FOUND, response.getStatusCode());
        assertNotNull(response.getBody());
        assertEquals(ErrorKind.NOT_FOUND, response.getBody().kind());
        assertEquals("Node not found: 7", response.getBody().message());
    }

    @Test
    void handleStore_reportsStoreFailure() {
        ResponseEntity<ApiError> dataAccess = handler.handleStore(new DataIntegrityViolationException("boom"));
        ResponseEntity<ApiError> busy = handler.handleStore(
                BulkheadFullException.createBulkheadFullException(Bulkhead.ofDefaults("test")));

        assertEquals(HttpStatus.SERVICE_UNAVAILABLE, dataAccess.getStatusCode());
        assertEquals(ErrorKind.STORE_FAILURE, dataAccess.getBody().kind());
        assertEquals(HttpStatus.SERVICE_UNAVAILABLE, busy.getStatusCode());
    }

    @Test
    void handleGeneric_hidesInternalMessage() {
        ResponseEntity<ApiError> response = handler.handleGeneric(new IllegalStateException("secret detail"));

        assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, response.getStatusCode());
        assertEquals(ErrorKind.STORE_FAILURE, response.getBody().kind());
        assertEquals("Internal server error", response.getBody().message());
    }

    @Test
    void errorKind_serializesAsCode() {
        assertEquals("NotFound", ErrorKind.NOT_FOUND.code());
        assertEquals("InvalidArgument", ErrorKind.INVALID_ARGUMENT.code());
        assertEquals("Conflict", ErrorKind.CONFLICT.code());
        assertEquals("StoreFailure", ErrorKind.STORE_FAILURE.code());
    }
}
