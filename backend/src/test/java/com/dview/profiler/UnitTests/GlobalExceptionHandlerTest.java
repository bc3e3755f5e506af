package com.dview.profiler.exception;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.MethodParameter;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.validation.BindingResult;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.context.request.WebRequest;

@ExtendWith(MockitoExtension.class)
@DisplayName("GlobalExceptionHandler Unit Tests")
class GlobalExceptionHandlerTest {

  @Mock private WebRequest webRequest;

  @Mock private BindingResult bindingResult;

  private GlobalExceptionHandler exceptionHandler;

  @BeforeEach
  void setUp() {
    exceptionHandler = new GlobalExceptionHandler();
    ReflectionTestUtils.setField(exceptionHandler, "environment", "test");
    ReflectionTestUtils.setField(exceptionHandler, "debugEnabled", false);
    when(webRequest.getDescription(false)).thenReturn("uri=/api/profile-data");
  }

  @Nested
  @DisplayName("Client errors")
  class ClientErrors {

    @Test
    void unknownSessionMapsToNotFound() {
      ResponseEntity<GlobalExceptionHandler.ErrorResponse> response =
          exceptionHandler.handleResourceNotFoundException(
              new ResourceNotFoundException("Session not found: s1"), webRequest);

      assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
      assertThat(response.getBody().getMessage()).isEqualTo("Session not found: s1");
      assertThat(response.getBody().getPath()).isEqualTo("/api/profile-data");
      assertThat(response.getBody().getError()).isEqualTo("Not Found");
    }

    @Test
    void dataSourceFailureMapsToBadRequest() {
      ResponseEntity<GlobalExceptionHandler.ErrorResponse> response =
          exceptionHandler.handleDataSourceException(
              new DataSourceException("Unsupported file type: .xml"), webRequest);

      assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
      assertThat(response.getBody().getStatus()).isEqualTo(400);
    }

    @Test
    void invalidSettingsMapToBadRequest() {
      ResponseEntity<GlobalExceptionHandler.ErrorResponse> response =
          exceptionHandler.handleConfigurationException(
              new ConfigurationException("maxThreads must be positive"), webRequest);

      assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
      assertThat(response.getBody().getMessage()).isEqualTo("maxThreads must be positive");
    }

    @Test
    void runningJobConflictMapsToConflict() {
      ResponseEntity<GlobalExceptionHandler.ErrorResponse> response =
          exceptionHandler.handleIllegalStateException(
              new IllegalStateException("Profiling already running"), webRequest);

      assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
    }

    @Test
    void validationErrorsAreListedPerField() throws Exception {
      MethodParameter parameter =
          new MethodParameter(Object.class.getMethod("equals", Object.class), 0);
      when(bindingResult.getAllErrors())
          .thenReturn(
              List.of(
                  new FieldError("request", "session_id", "must not be blank"),
                  new FieldError("request", "max_records", "must be greater than 0")));

      ResponseEntity<GlobalExceptionHandler.ErrorResponse> response =
          exceptionHandler.handleValidationExceptions(
              new MethodArgumentNotValidException(parameter, bindingResult), webRequest);

      assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
      assertThat(response.getBody().getError()).isEqualTo("Validation Failed");
      assertThat(response.getBody().getValidationErrors())
          .containsEntry("session_id", "must not be blank")
          .containsEntry("max_records", "must be greater than 0");
    }
  }

  @Nested
  @DisplayName("Unexpected errors")
  class UnexpectedErrors {

    @Test
    void hidesDetailsByDefault() {
      ResponseEntity<GlobalExceptionHandler.ErrorResponse> response =
          exceptionHandler.handleGlobalException(new RuntimeException("db exploded"), webRequest);

      assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
      assertThat(response.getBody().getMessage()).isEqualTo("An unexpected error occurred");
      assertThat(response.getBody().getDebugMessage()).isNull();
    }

    @Test
    void exposesDebugMessageOutsideProductionWhenEnabled() {
      ReflectionTestUtils.setField(exceptionHandler, "debugEnabled", true);

      ResponseEntity<GlobalExceptionHandler.ErrorResponse> response =
          exceptionHandler.handleGlobalException(new RuntimeException("db exploded"), webRequest);

      assertThat(response.getBody().getDebugMessage()).isEqualTo("db exploded");
    }

    @Test
    void neverExposesDebugMessageInProduction() {
      ReflectionTestUtils.setField(exceptionHandler, "environment", "production");
      ReflectionTestUtils.setField(exceptionHandler, "debugEnabled", true);

      ResponseEntity<GlobalExceptionHandler.ErrorResponse> response =
          exceptionHandler.handleGlobalException(new RuntimeException("db exploded"), webRequest);

      assertThat(response.getBody().getDebugMessage()).isNull();
    }
  }
}
