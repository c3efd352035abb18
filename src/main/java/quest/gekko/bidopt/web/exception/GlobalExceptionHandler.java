package quest.gekko.bidopt.web.exception;

import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import quest.gekko.bidopt.exception.ErrorCategory;
import quest.gekko.bidopt.exception.OptimizerException;
import quest.gekko.bidopt.exception.UpstreamTransientException;
import quest.gekko.bidopt.web.dto.ErrorResponse;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(OptimizerException.class)
    public ResponseEntity<ErrorResponse> handleOptimizerException(OptimizerException ex, HttpServletRequest request) {
        HttpStatus status = statusFor(ex);
        if (status.is5xxServerError()) {
            log.warn("{} failure for URL: {}: {}", ex.getCategory(), request.getRequestURI(), ex.getMessage());
        } else {
            log.debug("{} rejected for URL: {}: {}", ex.getCategory(), request.getRequestURI(), ex.getMessage());
        }
        return ResponseEntity.status(status)
                .body(new ErrorResponse(ex.getMessage(), ex.getCategory().name(), ex.getDetails()));
    }

    @ExceptionHandler({ HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class })
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public ErrorResponse handleUnreadable(Exception ex, HttpServletRequest request) {
        log.warn("Bad request: {} for URL: {}", ex.getMessage(), request.getRequestURI());
        return new ErrorResponse("Invalid request", ErrorCategory.VALIDATION.name(), ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public ErrorResponse handleGeneralException(Exception ex, HttpServletRequest request) {
        log.error("Unexpected error for URL: {}", request.getRequestURI(), ex);
        return new ErrorResponse("An unexpected error occurred", null, ex.getMessage());
    }

    static HttpStatus statusFor(OptimizerException ex) {
        return switch (ex.getCategory()) {
            case AUTH -> HttpStatus.UNAUTHORIZED;
            case VALIDATION -> HttpStatus.BAD_REQUEST;
            case UPSTREAM_REJECTED -> HttpStatus.BAD_GATEWAY;
            case UPSTREAM_TRANSIENT -> ex instanceof UpstreamTransientException t && t.isTimeout()
                    ? HttpStatus.GATEWAY_TIMEOUT : HttpStatus.BAD_GATEWAY;
            case STORAGE -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }
}
