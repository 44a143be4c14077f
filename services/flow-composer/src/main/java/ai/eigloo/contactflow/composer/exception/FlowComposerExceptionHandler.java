package ai.eigloo.contactflow.composer.exception;

import ai.eigloo.contactflow.composer.dto.ErrorResponse;
import ai.eigloo.contactflow.graph.exception.FlowGraphException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.stream.Collectors;

/**
 * Maps flow errors and request problems to 400 responses with a stable code.
 */
@RestControllerAdvice
public class FlowComposerExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(FlowComposerExceptionHandler.class);

    public static final String VALIDATION_FAILED = "VALIDATION_FAILED";
    public static final String INVALID_ARGUMENT = "INVALID_ARGUMENT";
    public static final String UNREADABLE_REQUEST = "UNREADABLE_REQUEST";

    @ExceptionHandler(FlowGraphException.class)
    public ResponseEntity<ErrorResponse> handleFlowGraphException(FlowGraphException e) {
        logger.warn("Flow rejected [{}]: {}", e.getCode(), e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse(e.getCode().name(), e.getMessage(), e.getNodeId()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(FieldError::getDefaultMessage)
                .collect(Collectors.joining("; "));
        logger.warn("Request validation failed: {}", message);
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse(VALIDATION_FAILED, message, null));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException e) {
        logger.warn("Unreadable request body: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse(UNREADABLE_REQUEST, "Request body is not valid JSON", null));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException e) {
        logger.warn("Invalid argument: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse(INVALID_ARGUMENT, e.getMessage(), null));
    }
}
