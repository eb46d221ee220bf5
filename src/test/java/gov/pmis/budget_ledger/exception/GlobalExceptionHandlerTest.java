package gov.pmis.budget_ledger.exception;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    @DisplayName("Every domain code maps to a fixed HTTP status")
    void statusMapping() {
        assertEquals(HttpStatus.BAD_REQUEST, GlobalExceptionHandler.statusFor(ValidationException.CODE));
        assertEquals(HttpStatus.NOT_FOUND, GlobalExceptionHandler.statusFor(NotFoundException.CODE));
        assertEquals(HttpStatus.CONFLICT, GlobalExceptionHandler.statusFor(ConflictException.CODE));
        assertEquals(HttpStatus.CONFLICT, GlobalExceptionHandler.statusFor(AlreadyProcessedException.CODE));
        assertEquals(HttpStatus.CONFLICT, GlobalExceptionHandler.statusFor(CannotCancelException.CODE));
        assertEquals(HttpStatus.UNPROCESSABLE_ENTITY, GlobalExceptionHandler.statusFor(InsufficientBudgetException.CODE));
        assertEquals(HttpStatus.FORBIDDEN, GlobalExceptionHandler.statusFor(UnauthorizedApproverException.CODE));
        assertEquals(HttpStatus.FORBIDDEN, GlobalExceptionHandler.statusFor(UnauthorizedCancelException.CODE));
        assertEquals(HttpStatus.SERVICE_UNAVAILABLE, GlobalExceptionHandler.statusFor(LedgerContentionException.CODE));
        assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, GlobalExceptionHandler.statusFor("SOMETHING_ELSE"));
    }

    @Test
    @DisplayName("Domain errors carry code, message and details")
    void domainErrorBody() {
        ResponseEntity<ApiError> response = handler.handleDomainException(
            new ValidationException("Invalid budget allocation", List.of("fiscalYear must be a four-digit year")));

        assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
        ApiError body = response.getBody();
        assertNotNull(body);
        assertEquals("VALIDATION_ERROR", body.getCode());
        assertEquals("Invalid budget allocation", body.getMessage());
        assertEquals(List.of("fiscalYear must be a four-digit year"), body.getDetails().get("violations"));
    }

    @Test
    @DisplayName("Errors without details omit the details field")
    void emptyDetailsOmitted() {
        ResponseEntity<ApiError> response = handler.handleDomainException(
            new ConflictException("Transaction is awaiting its approval request: " + UUID.randomUUID()));

        assertEquals(HttpStatus.CONFLICT, response.getStatusCode());
        assertNull(response.getBody().getDetails());
    }

    @Test
    @DisplayName("Insufficient budget reports both amounts")
    void insufficientBudgetBody() {
        ResponseEntity<ApiError> response = handler.handleDomainException(
            new InsufficientBudgetException(new BigDecimal("10000.00"), new BigDecimal("10001.00")));

        assertEquals(HttpStatus.UNPROCESSABLE_ENTITY, response.getStatusCode());
        assertEquals(new BigDecimal("10000.00"), response.getBody().getDetails().get("available"));
        assertEquals(new BigDecimal("10001.00"), response.getBody().getDetails().get("requested"));
    }

    @Test
    @DisplayName("Storage errors are not echoed to the client")
    void storageErrorsHidden() {
        ResponseEntity<ApiError> response = handler.handleGenericException(
            new DataAccessResourceFailureException("FATAL: password authentication failed for user \"budget\""));

        assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, response.getStatusCode());
        assertEquals("An unexpected error occurred", response.getBody().getMessage());
        assertFalse(response.getBody().getMessage().contains("password"));
    }
}
