package com.phillippitts.retroauto.presentation.exception;

import com.phillippitts.retroauto.exception.ParseException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest {

    private GlobalExceptionHandler handler;

    @BeforeEach
    void setUp() {
        handler = new GlobalExceptionHandler();
    }

    @Test
    void parseErrorReturns400WithLocation() {
        ParseException ex = new ParseException("expected ':' after flow name", 3, 14);

        ResponseEntity<GlobalExceptionHandler.ApiError> response = handler.handleParse(ex);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().errorCode()).isEqualTo("ParseException");
        assertThat(response.getBody().details()).isEqualTo("expected ':' after flow name");
        assertThat(response.getBody().line()).isEqualTo(3);
        assertThat(response.getBody().column()).isEqualTo(14);
    }

    @Test
    void busyEngineReturns409() {
        ResponseEntity<GlobalExceptionHandler.ApiError> response =
                handler.handleConflict(new IllegalStateException("A script is already running"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(response.getBody().toString()).contains("EngineBusy", "A script is already running");
        assertThat(response.getBody().line()).isNull();
    }

    @Test
    void invalidArgumentReturns400() {
        ResponseEntity<GlobalExceptionHandler.ApiError> response =
                handler.handleBadRequest(new IllegalArgumentException("Invalid interrupt rule #0"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody().errorCode()).isEqualTo("IllegalArgumentException");
        assertThat(response.getBody().details()).contains("Invalid interrupt rule #0");
    }

    @Test
    void unexpectedErrorHidesInternals() {
        RuntimeException ex = new RuntimeException("/secret/internal/path exploded");

        ResponseEntity<GlobalExceptionHandler.ApiError> response = handler.handleUnexpected(ex);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().toString()).doesNotContain("/secret/internal/path");
        assertThat(response.getBody().toString()).matches(".*timestamp=\\d{4}-\\d{2}-\\d{2}T.*");
    }
}
