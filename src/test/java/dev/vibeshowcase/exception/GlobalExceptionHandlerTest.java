package dev.vibeshowcase.exception;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import jakarta.validation.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.MessageSource;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.http.HttpStatus;
import org.springframework.mock.http.server.reactive.MockServerHttpRequest;
import org.springframework.mock.web.server.MockServerWebExchange;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.web.server.ResponseStatusException;
import reactor.test.StepVerifier;

import java.util.Locale;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("GlobalExceptionHandler")
class GlobalExceptionHandlerTest {

    @Mock
    private MessageSource messageSource;

    @InjectMocks
    private GlobalExceptionHandler handler;

    private MockServerWebExchange exchange;

    @BeforeEach
    void setUp() {
        exchange = MockServerWebExchange.from(MockServerHttpRequest.get("/api/projects/7"));
        // keys come back unchanged
        lenient().when(messageSource.getMessage(anyString(), any(), anyString(), any(Locale.class)))
                .thenAnswer(inv -> inv.getArgument(0));
    }

    @Nested
    @DisplayName("domain errors")
    class DomainErrors {

        @Test
        @DisplayName("Should map a missing resource to 404 with its message key and path")
        void shouldHandleNotFound() {
            StepVerifier.create(handler.handleResourceNotFound(ResourceNotFoundException.project(), exchange))
                    .assertNext(response -> {
                        assertThat(response.getStatus()).isEqualTo(404);
                        assertThat(response.getError()).isEqualTo("error.not_found");
                        assertThat(response.getMessage()).isEqualTo("error.project_not_found");
                        assertThat(response.getPath()).isEqualTo("/api/projects/7");
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("Should map an untranslated constraint violation to 409")
        void shouldHandleDataIntegrityViolation() {
            StepVerifier.create(handler.handleDataIntegrityViolation(
                            new DuplicateKeyException("duplicate key value violates unique constraint"), exchange))
                    .assertNext(response -> {
                        assertThat(response.getStatus()).isEqualTo(409);
                        assertThat(response.getError()).isEqualTo("error.conflict");
                        assertThat(response.getMessage()).isEqualTo("error.concurrent_modification");
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("Should map a duplicate to 409")
        void shouldHandleDuplicate() {
            StepVerifier.create(handler.handleDuplicateResource(new DuplicateResourceException("error.username_taken"), exchange))
                    .assertNext(response -> {
                        assertThat(response.getStatus()).isEqualTo(409);
                        assertThat(response.getMessage()).isEqualTo("error.username_taken");
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("Should map an invalid argument to 400")
        void shouldHandleIllegalArgument() {
            StepVerifier.create(handler.handleIllegalArgument(new IllegalArgumentException("error.invalid_id"), exchange))
                    .assertNext(response -> {
                        assertThat(response.getStatus()).isEqualTo(400);
                        assertThat(response.getMessage()).isEqualTo("error.invalid_id");
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("Should fall back to a generic key for an invalid argument without message")
        void shouldHandleIllegalArgumentWithoutMessage() {
            StepVerifier.create(handler.handleIllegalArgument(new IllegalArgumentException(), exchange))
                    .assertNext(response -> assertThat(response.getMessage()).isEqualTo("error.invalid_request"))
                    .verifyComplete();
        }
    }

    @Nested
    @DisplayName("security errors")
    class SecurityErrors {

        @Test
        @DisplayName("Should hide the cause of failed logins")
        void shouldHandleBadCredentials() {
            StepVerifier.create(handler.handleAuthentication(new BadCredentialsException("user ada not found"), exchange))
                    .assertNext(response -> {
                        assertThat(response.getStatus()).isEqualTo(401);
                        assertThat(response.getMessage()).isEqualTo("error.invalid_credentials");
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("Should map access denied to 403")
        void shouldHandleAccessDenied() {
            StepVerifier.create(handler.handleAccessDenied(new AccessDeniedException("error.only_author_or_admin"), exchange))
                    .assertNext(response -> {
                        assertThat(response.getStatus()).isEqualTo(403);
                        assertThat(response.getMessage()).isEqualTo("error.only_author_or_admin");
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("Should keep the status of a ResponseStatusException")
        void shouldHandleResponseStatus() {
            ResponseStatusException ex = new ResponseStatusException(HttpStatus.UNAUTHORIZED, "error.authentication_required");

            StepVerifier.create(handler.handleResponseStatus(ex, exchange))
                    .assertNext(entity -> {
                        assertThat(entity.getStatusCode()).isEqualTo(HttpStatus.UNAUTHORIZED);
                        assertThat(entity.getBody()).isNotNull();
                        assertThat(entity.getBody().getError()).isEqualTo("error.unauthorized");
                        assertThat(entity.getBody().getMessage()).isEqualTo("error.authentication_required");
                    })
                    .verifyComplete();
        }
    }

    @Test
    @DisplayName("Should report constraint violations by field name")
    void shouldHandleConstraintViolation() {
        @SuppressWarnings("unchecked")
        ConstraintViolation<Object> violation = mock(ConstraintViolation.class);
        Path path = mock(Path.class);
        when(path.toString()).thenReturn("listProjects.limit");
        when(violation.getPropertyPath()).thenReturn(path);
        when(violation.getMessage()).thenReturn("must be positive");

        StepVerifier.create(handler.handleConstraintViolation(new ConstraintViolationException(Set.of(violation)), exchange))
                .assertNext(response -> {
                    assertThat(response.getStatus()).isEqualTo(400);
                    assertThat(response.getValidationErrors()).containsEntry("limit", "must be positive");
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("Should answer unexpected errors with a generic 500")
    void shouldHandleUnexpectedError() {
        StepVerifier.create(handler.handleGenericException(new IllegalStateException("db password is hunter2"), exchange))
                .assertNext(response -> {
                    assertThat(response.getStatus()).isEqualTo(500);
                    assertThat(response.getMessage()).isEqualTo("error.unexpected_error");
                })
                .verifyComplete();
    }
}
