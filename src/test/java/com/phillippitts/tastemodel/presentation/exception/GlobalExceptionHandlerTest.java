package com.phillippitts.tastemodel.presentation.exception;

import com.phillippitts.tastemodel.domain.HealthStatus;
import com.phillippitts.tastemodel.exception.ConcurrentTrainingException;
import com.phillippitts.tastemodel.exception.CorruptArtifactException;
import com.phillippitts.tastemodel.exception.DeploymentBlockedException;
import com.phillippitts.tastemodel.exception.HealthProbeTimeoutException;
import com.phillippitts.tastemodel.exception.InvalidInputException;
import com.phillippitts.tastemodel.exception.NotFoundException;
import com.phillippitts.tastemodel.exception.RegistryInvariantException;
import com.phillippitts.tastemodel.exception.RegistryStorageException;
import com.phillippitts.tastemodel.exception.TrainingException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest {

    private GlobalExceptionHandler handler;

    @BeforeEach
    void setUp() {
        handler = new GlobalExceptionHandler();
    }

    @Test
    void unknownTrackReturns404() {
        ResponseEntity<?> response = handler.handleNotFound(NotFoundException.track("t9"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(response.getBody().toString()).contains("NotFoundException").contains("Track not found");
    }

    @Test
    void invalidInputReturns400() {
        ResponseEntity<?> response = handler.handleInvalidInput(new InvalidInputException("rating", "out of range"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody().toString()).contains("rating: out of range");
    }

    @Test
    void malformedRequestReturns400() {
        ResponseEntity<?> response = handler.handleMalformedRequest(new IllegalArgumentException("bad json"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    }

    @Test
    void busyPipelineReturns409() {
        ResponseEntity<?> response = handler.handleConcurrentTraining(
                new ConcurrentTrainingException("preference", "preference"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(response.getBody().toString()).contains("Pipeline busy");
    }

    @Test
    void blockedDeploymentReturns409() {
        ResponseEntity<?> response = handler.handleDeploymentBlocked(
                new DeploymentBlockedException("preference", 3, HealthStatus.CRITICAL));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(response.getBody().toString()).contains("CRITICAL");
    }

    @Test
    void probeTimeoutReturns503() {
        ResponseEntity<?> response = handler.handleProbeTimeout(new HealthProbeTimeoutException(2000));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
    }

    @Test
    void corruptArtifactReturns500WithoutHashes() {
        ResponseEntity<?> response = handler.handleCorruptArtifact(
                new CorruptArtifactException("preference", 2, "aaaa", "bbbb"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().toString()).doesNotContain("aaaa").doesNotContain("bbbb");
    }

    @Test
    void registryFailuresDoNotExposePaths() {
        ResponseEntity<?> storage = handler.handleRegistryFailure(new RegistryStorageException("preference",
                "Cannot write /secret/models/preference/v2", new IOException("disk full")));
        ResponseEntity<?> invariant = handler.handleRegistryFailure(
                new RegistryInvariantException("latest points to missing v9"));

        assertThat(storage.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(storage.getBody().toString()).doesNotContain("/secret");
        assertThat(invariant.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
    }

    @Test
    void trainingFailureReturns500() {
        ResponseEntity<?> response = handler.handleTrainingFailure(new TrainingException("diverged", "preference"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
    }

    @Test
    void unexpectedErrorsAreGeneric() {
        ResponseEntity<?> response = handler.handleUnexpected(new IllegalStateException("internal detail"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().toString())
                .contains("InternalServerError")
                .doesNotContain("internal detail")
                .matches(".*timestamp=\\d{4}-\\d{2}-\\d{2}T.*");
    }
}
