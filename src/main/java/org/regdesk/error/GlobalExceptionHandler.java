package org.regdesk.error;

import org.regdesk.registration.exception.CompetitionNotFoundException;
import org.regdesk.registration.exception.RegistrationInvariantException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(CompetitionNotFoundException.class)
    protected ResponseEntity<ErrorResponse> handleCompetitionNotFound(CompetitionNotFoundException e) {
        log.warn("Competition not found: {}", e.getCompetitionId());
        return ErrorResponse.toResponseEntity(HttpStatus.NOT_FOUND, "COMPETITION_NOT_FOUND", e.getMessage());
    }

    /**
     * Broken ordering contract between loader and grouping. The details are
     * logged, the client only sees a generic server error.
     */
    @ExceptionHandler(RegistrationInvariantException.class)
    protected ResponseEntity<ErrorResponse> handleInvariantViolation(RegistrationInvariantException e) {
        log.error("Registration data violates grouping invariant", e);
        return ErrorResponse.toResponseEntity(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_SERVER_ERROR",
                "Internal server error");
    }

    @ExceptionHandler(DataAccessException.class)
    protected ResponseEntity<ErrorResponse> handleDataAccess(DataAccessException e) {
        log.error("Data access failure", e);
        return ErrorResponse.toResponseEntity(HttpStatus.INTERNAL_SERVER_ERROR, "DATA_ACCESS_FAILURE",
                "Internal server error");
    }
}
