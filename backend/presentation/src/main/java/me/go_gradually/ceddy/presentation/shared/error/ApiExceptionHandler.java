package me.go_gradually.ceddy.presentation.shared.error;

import me.go_gradually.ceddy.application.room.model.InvalidWebhookException;
import me.go_gradually.ceddy.application.room.model.RoomProviderException;
import me.go_gradually.ceddy.application.room.model.RoomServiceUnavailableException;
import me.go_gradually.ceddy.application.session.model.DuplicateSessionException;
import me.go_gradually.ceddy.application.shared.policy.RuntimePolicy;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

import java.util.Map;
import java.util.NoSuchElementException;
import java.util.logging.Level;
import java.util.logging.Logger;

@RestControllerAdvice
public class ApiExceptionHandler {
    private static final Logger log = Logger.getLogger(ApiExceptionHandler.class.getName());

    private final RuntimePolicy runtimePolicy;

    public ApiExceptionHandler(RuntimePolicy runtimePolicy) {
        this.runtimePolicy = runtimePolicy;
    }

    @ExceptionHandler(IllegalArgumentException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, String> badRequest(Exception e) {
        return message(e.getMessage(), "Bad request");
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, String> invalidBody(MethodArgumentNotValidException e) {
        FieldError error = e.getBindingResult().getFieldError();
        if (error == null) {
            return message(null, "Invalid request body");
        }
        return message(error.getField() + " " + error.getDefaultMessage(), "Invalid request body");
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, String> missingParameter(MissingServletRequestParameterException e) {
        return message(e.getParameterName() + " is required", "Bad request");
    }

    @ExceptionHandler(MissingServletRequestPartException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, String> missingPart(MissingServletRequestPartException e) {
        return message(e.getRequestPartName() + " is required", "Bad request");
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, String> typeMismatch(MethodArgumentTypeMismatchException e) {
        return message("Invalid value for " + e.getName(), "Bad request");
    }

    @ExceptionHandler(NoSuchElementException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public Map<String, String> notFound(Exception e) {
        return message(e.getMessage(), "Not found");
    }

    @ExceptionHandler(DuplicateSessionException.class)
    @ResponseStatus(HttpStatus.CONFLICT)
    public Map<String, String> conflict(DuplicateSessionException e) {
        return message(e.getMessage(), "Conflict");
    }

    @ExceptionHandler(InvalidWebhookException.class)
    @ResponseStatus(HttpStatus.UNAUTHORIZED)
    public Map<String, String> unauthorized(InvalidWebhookException e) {
        log.warning("room.webhook rejected reason=" + e.getMessage());
        return message(e.getMessage(), "Unauthorized");
    }

    @ExceptionHandler(RoomServiceUnavailableException.class)
    @ResponseStatus(HttpStatus.SERVICE_UNAVAILABLE)
    public Map<String, String> unavailable(RoomServiceUnavailableException e) {
        return message(e.getMessage(), "Service unavailable");
    }

    @ExceptionHandler(RoomProviderException.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Map<String, String> providerFailure(RoomProviderException e) {
        log.log(Level.WARNING, "room.provider failure", e);
        return message(e.getMessage(), "Room provider failure");
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, String> unreadableBody(HttpMessageNotReadableException e) {
        return message(null, "Malformed request body");
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, String>> internalError(Exception e) {
        if (e instanceof ErrorResponse errorResponse) {
            return ResponseEntity.status(errorResponse.getStatusCode())
                    .body(message(errorResponse.getBody().getDetail(), "Request failed"));
        }
        log.log(Level.SEVERE, "api.unhandled", e);
        if (runtimePolicy.debug()) {
            return ResponseEntity.internalServerError()
                    .body(message(e.getClass().getSimpleName() + ": " + e.getMessage(), "Internal server error"));
        }
        return ResponseEntity.internalServerError().body(message(null, "Internal server error"));
    }

    private Map<String, String> message(String message, String fallback) {
        return Map.of("message", message == null || message.isBlank() ? fallback : message);
    }
}
