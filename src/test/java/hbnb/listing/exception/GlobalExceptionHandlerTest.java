package hbnb.listing.exception;

import hbnb.listing.dto.ApiResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest {

    private GlobalExceptionHandler handler;

    @BeforeEach
    void setUp() {
        handler = new GlobalExceptionHandler();
    }

    @Test
    void shouldMapValidationToBadRequestWithField() {
        ResponseEntity<ApiResponse<Map<String, String>>> response =
                handler.handleValidation(new ValidationException("rating", "rating must be between 1 and 5"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().getKind()).isEqualTo("VALIDATION");
        assertThat(response.getBody().getData()).containsEntry("rating", "rating must be between 1 and 5");
    }

    @Test
    void shouldMapNotFoundTo404() {
        ResponseEntity<ApiResponse<Void>> response =
                handler.handleNotFound(new EntityNotFoundException("Place", "p-1"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(response.getBody().getKind()).isEqualTo("NOT_FOUND");
        assertThat(response.getBody().getMessage()).isEqualTo("Place not found: p-1");
    }

    @Test
    void shouldMapConflictTo409() {
        ResponseEntity<ApiResponse<Void>> response =
                handler.handleConflict(new ConflictException("Email already registered: a@b.io"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(response.getBody().getCode()).isEqualTo(409);
    }

    @Test
    void shouldMapAuthorizationFailures() {
        assertThat(handler.handleUnauthenticated(new UnauthenticatedException("Authentication required"))
                .getStatusCode()).isEqualTo(HttpStatus.UNAUTHORIZED);
        assertThat(handler.handleForbidden(new ForbiddenActionException("Unauthorized action"))
                .getStatusCode()).isEqualTo(HttpStatus.FORBIDDEN);
    }

    @Test
    void shouldHideInternalErrorDetails() {
        ResponseEntity<ApiResponse<Void>> response =
                handler.handleGenericException(new IllegalStateException("secret internals"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().getKind()).isEqualTo("INTERNAL");
        assertThat(response.getBody().getMessage()).doesNotContain("secret");
    }

    @Test
    void businessExceptionsCarryTheirKind() {
        assertThat(new ValidationException("f", "m").getKind()).isEqualTo(ErrorKind.VALIDATION);
        assertThat(new EntityNotFoundException("User", "u").getKind()).isEqualTo(ErrorKind.NOT_FOUND);
        assertThat(new ConflictException("c").getKind()).isEqualTo(ErrorKind.CONFLICT);
    }
}
