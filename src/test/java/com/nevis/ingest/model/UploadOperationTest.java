package com.nevis.ingest.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class UploadOperationTest {

    @Test
    @DisplayName("A nested result error should count as a failure when the top level is clean")
    void shouldReportNestedError() {
        OperationError nested = new OperationError(3, "Unsupported file");
        UploadOperation operation = new UploadOperation("op", true, Optional.empty(),
            Optional.of(new OperationResult(null, Optional.of(nested))));

        assertThat(operation.failure()).contains(nested);
    }

    @Test
    @DisplayName("A top-level error should take precedence")
    void shouldPreferTopLevelError() {
        OperationError top = new OperationError(13, "Internal");
        UploadOperation operation = new UploadOperation("op", true, Optional.of(top),
            Optional.of(new OperationResult(null, Optional.of(new OperationError(3, "nested")))));

        assertThat(operation.failure()).contains(top);
    }

    @Test
    @DisplayName("An error without a message is still an error")
    void emptyErrorShouldStillFail() {
        UploadOperation operation = new UploadOperation("op", true, Optional.of(new OperationError(null, "")), null);

        assertThat(operation.failure()).isPresent();
        assertThat(operation.failure().get().describe()).isEqualTo("Remote operation failed");
    }

    @Test
    @DisplayName("A clean completed operation should have no failure")
    void shouldHaveNoFailure() {
        UploadOperation operation = new UploadOperation("op", true, Optional.empty(),
            Optional.of(new OperationResult("doc", Optional.empty())));

        assertThat(operation.failure()).isEmpty();
    }
}
