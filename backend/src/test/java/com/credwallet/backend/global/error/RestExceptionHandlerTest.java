package com.credwallet.backend.global.error;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

class RestExceptionHandlerTest {

    private final RestExceptionHandler handler = new RestExceptionHandler();

    @Test
    void permissionDeniedLooksExactlyLikeNotFound() {
        ResponseEntity<ProblemResponse> denied = handler.handleVaultException(VaultException.permissionDenied("NOT_CREDENTIAL_OWNER"));
        ResponseEntity<ProblemResponse> missing = handler.handleVaultException(VaultException.notFound("CREDENTIAL_NOT_FOUND"));

        assertThat(denied.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(denied.getStatusCode()).isEqualTo(missing.getStatusCode());
        assertThat(denied.getBody()).isEqualTo(missing.getBody());
        assertThat(denied.getBody().code()).isEqualTo(RestExceptionHandler.REDACTED_CODE);
    }

    @Test
    void invalidArgumentKeepsCodeAndDetail() {
        ResponseEntity<ProblemResponse> response = handler.handleVaultException(
                VaultException.invalidArgument("SELF_SHARE", "A credential cannot be shared with its owner"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
        assertThat(response.getBody().code()).isEqualTo("SELF_SHARE");
        assertThat(response.getBody().detail()).isEqualTo("A credential cannot be shared with its owner");
        assertThat(response.getBody().type()).endsWith("/self_share");
    }

    @Test
    void storageFailureIsServiceUnavailable() {
        ResponseEntity<ProblemResponse> response = handler.handleStorageFailure(new DataAccessResourceFailureException("connection refused"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(response.getBody().code()).isEqualTo("storage_failure");
        assertThat(response.getBody().detail()).doesNotContain("connection refused");
    }

    @Test
    void integrityViolationIsConflict() {
        ResponseEntity<ProblemResponse> response = handler.handleIntegrityViolation(new DataIntegrityViolationException("dup"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
    }
}
