package quickpoll.websockets.controller;

import jakarta.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import quickpoll.websockets.service.InvalidPollException;
import quickpoll.websockets.service.InvalidVoteException;
import quickpoll.websockets.service.PollAccessDeniedException;
import quickpoll.websockets.service.PollNotFoundException;

import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps domain failures to HTTP statuses with a {@code {"detail": "..."}} body.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(PollNotFoundException.class)
    public ResponseEntity<Map<String, String>> handleNotFound(PollNotFoundException e) {
        return detail(HttpStatus.NOT_FOUND, "Poll not found");
    }

    @ExceptionHandler(PollAccessDeniedException.class)
    public ResponseEntity<Map<String, String>> handleAccessDenied(PollAccessDeniedException e) {
        return detail(HttpStatus.FORBIDDEN, e.getMessage());
    }

    @ExceptionHandler({InvalidPollException.class, InvalidVoteException.class})
    public ResponseEntity<Map<String, String>> handleBadRequest(RuntimeException e) {
        return detail(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, String>> handleInvalidBody(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining("; "));
        log.debug("Rejected request body: {}", message);
        return detail(HttpStatus.BAD_REQUEST, message);
    }

    @ExceptionHandler({
            ConstraintViolationException.class,
            HandlerMethodValidationException.class,
            MissingServletRequestParameterException.class
    })
    public ResponseEntity<Map<String, String>> handleInvalidParameters(Exception e) {
        log.debug("Rejected request parameters: {}", e.getMessage());
        return detail(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    private ResponseEntity<Map<String, String>> detail(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(Map.of("detail", message));
    }
}
