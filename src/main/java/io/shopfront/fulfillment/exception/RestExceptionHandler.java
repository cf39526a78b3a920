package io.shopfront.fulfillment.exception;

import java.net.URI;
import java.time.Instant;
import java.util.stream.Collectors;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import lombok.extern.slf4j.Slf4j;

/**
 * Global exception handler for the REST controllers.
 * Maps the service exceptions to HTTP status codes and formats responses using
 * the Problem Details for HTTP APIs standard (RFC 7807).
 */
@RestControllerAdvice
@Slf4j
public class RestExceptionHandler {

    @ExceptionHandler(OrderNotFoundException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public ProblemDetail handleOrderNotFoundException(OrderNotFoundException ex, WebRequest request) {
        log.warn("Handling OrderNotFoundException: {}", ex.getMessage());

        return problem(HttpStatus.NOT_FOUND, "Order Not Found", ex.getMessage(), request);
    }

    @ExceptionHandler(OrderGroupNotFoundException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public ProblemDetail handleOrderGroupNotFoundException(OrderGroupNotFoundException ex, WebRequest request) {
        log.warn("Handling OrderGroupNotFoundException: {}", ex.getMessage());

        return problem(HttpStatus.NOT_FOUND, "Order Group Not Found", ex.getMessage(), request);
    }

    /**
     * Capture {@link StatusConflictException} and returns HTTP 409 Conflict. The
     * response carries the order's actual status so the client can refresh its
     * view.
     *
     * @param ex      The caught {@link StatusConflictException}.
     * @param request The current web request.
     * @return A {@link ProblemDetail} object representing the error.
     */
    @ExceptionHandler(StatusConflictException.class)
    @ResponseStatus(HttpStatus.CONFLICT)
    public ProblemDetail handleStatusConflictException(StatusConflictException ex, WebRequest request) {
        log.warn("Handling StatusConflictException: {}", ex.getMessage());

        ProblemDetail problemDetail = problem(HttpStatus.CONFLICT, "Order Status Changed", ex.getMessage(), request);
        problemDetail.setProperty("orderId", ex.getOrderId());
        problemDetail.setProperty("believedStatus", ex.getBelievedStatus());
        problemDetail.setProperty("currentStatus", ex.getCurrentStatus());
        problemDetail.setProperty("alreadyApplied", ex.isAlreadyApplied());

        return problemDetail;
    }

    @ExceptionHandler(InvalidStatusTransitionException.class)
    @ResponseStatus(HttpStatus.UNPROCESSABLE_ENTITY)
    public ProblemDetail handleInvalidStatusTransitionException(InvalidStatusTransitionException ex,
            WebRequest request) {
        log.warn("Handling InvalidStatusTransitionException: {}", ex.getMessage());

        ProblemDetail problemDetail = problem(HttpStatus.UNPROCESSABLE_ENTITY, "Invalid Status Transition",
                ex.getMessage(), request);
        problemDetail.setProperty("currentStatus", ex.getCurrentStatus());

        return problemDetail;
    }

    @ExceptionHandler(ActionNotPermittedException.class)
    @ResponseStatus(HttpStatus.FORBIDDEN)
    public ProblemDetail handleActionNotPermittedException(ActionNotPermittedException ex, WebRequest request) {
        log.warn("Handling ActionNotPermittedException: {}", ex.getMessage());

        return problem(HttpStatus.FORBIDDEN, "Action Not Permitted", ex.getMessage(), request);
    }

    @ExceptionHandler(OrderValidationException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public ProblemDetail handleOrderValidationException(OrderValidationException ex, WebRequest request) {
        log.warn("Handling OrderValidationException: {}", ex.getMessage());

        return problem(HttpStatus.BAD_REQUEST, "Validation Failed", ex.getMessage(), request);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public ProblemDetail handleMethodArgumentNotValidException(MethodArgumentNotValidException ex,
            WebRequest request) {
        String detail = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining("; "));
        log.warn("Handling MethodArgumentNotValidException: {}", detail);

        return problem(HttpStatus.BAD_REQUEST, "Validation Failed", detail, request);
    }

    /**
     * Unreadable bodies, including unknown status labels and enum values.
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public ProblemDetail handleHttpMessageNotReadableException(HttpMessageNotReadableException ex,
            WebRequest request) {
        log.warn("Handling HttpMessageNotReadableException: {}", ex.getMessage());

        return problem(HttpStatus.BAD_REQUEST, "Malformed Request Body", "The request body could not be read.",
                request);
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public ProblemDetail handleMissingRequestHeaderException(MissingRequestHeaderException ex, WebRequest request) {
        log.warn("Handling MissingRequestHeaderException: {}", ex.getMessage());

        return problem(HttpStatus.BAD_REQUEST, "Missing Header", ex.getMessage(), request);
    }

    /**
     * Capture {@link MethodArgumentTypeMismatchException} and returns HTTP 400 Bad
     * Request. Occurs when a path variable, parameter or header cannot be
     * converted, e.g. a malformed UUID or an unknown actor role.
     *
     * @param ex      The caught {@link MethodArgumentTypeMismatchException}.
     * @param request The current web request.
     * @return A {@link ProblemDetail} object representing the error.
     */
    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public ProblemDetail handleMethodArgumentTypeMismatchException(MethodArgumentTypeMismatchException ex,
            WebRequest request) {
        log.warn("Handling MethodArgumentTypeMismatchException: {}", ex.getMessage());

        return problem(HttpStatus.BAD_REQUEST, "Invalid Parameter", ex.getMessage(), request);
    }

    /**
     * Capture {@link PartialGroupFailureException} and returns HTTP 500. Lists
     * the orders that were and were not updated so the client can retry.
     *
     * @param ex      The caught {@link PartialGroupFailureException}.
     * @param request The current web request.
     * @return A {@link ProblemDetail} object representing the error.
     */
    @ExceptionHandler(PartialGroupFailureException.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public ProblemDetail handlePartialGroupFailureException(PartialGroupFailureException ex, WebRequest request) {
        log.error("Handling PartialGroupFailureException: {}", ex.getMessage());

        ProblemDetail problemDetail = problem(HttpStatus.INTERNAL_SERVER_ERROR, "Partial Group Failure",
                ex.getMessage(), request);
        problemDetail.setProperty("groupId", ex.getGroupId());
        problemDetail.setProperty("succeededOrderIds", ex.getSucceededOrderIds());
        problemDetail.setProperty("failedOrderIds", ex.getFailedOrderIds());

        return problemDetail;
    }

    /**
     * Catches any other unhandled exceptions that may occur during request
     * processing.
     * Returns HTTP 500 Internal Server Error with a generic message to avoid
     * exposing internal details.
     *
     * @param ex      The caught {@link Exception}.
     * @param request The current web request.
     * @return A {@link ProblemDetail} object representing the error.
     */
    @ExceptionHandler(Exception.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public ProblemDetail handleGenericException(Exception ex, WebRequest request) {
        log.error("Handling unexpected exception: {}", ex.getMessage(), ex);

        return problem(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
                "An unexpected internal error occurred.", request);
    }

    private static ProblemDetail problem(HttpStatus status, String title, String detail, WebRequest request) {
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(status, detail);
        problemDetail.setTitle(title);
        problemDetail.setProperty("timestamp", Instant.now());
        problemDetail.setInstance(URI.create(request.getDescription(false)));

        return problemDetail;
    }
}
