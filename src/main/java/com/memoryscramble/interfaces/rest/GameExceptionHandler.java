package com.memoryscramble.interfaces.rest;

import com.memoryscramble.domain.MemoryGameException;
import com.memoryscramble.dto.ErrorMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Maps failures to {@code {ok: false, error, message}} bodies. Stack traces never reach the
 * client.
 */
@RestControllerAdvice
public class GameExceptionHandler {
  private final Logger log = LoggerFactory.getLogger(getClass());

  @ExceptionHandler(MemoryGameException.class)
  public ResponseEntity<ErrorMessage> onGameFailure(MemoryGameException e) {
    HttpStatus status = status(e.failure());
    if (e.failure() == MemoryGameException.Failure.INVARIANT_VIOLATION) {
      log.warn("Rejected change: {}", e.getMessage());
    } else {
      log.debug("{}: {}", e.failure(), e.getMessage());
    }
    return ResponseEntity.status(status).body(new ErrorMessage(e.failure().name(), e.getMessage()));
  }

  @ExceptionHandler({
    IllegalArgumentException.class,
    MethodArgumentTypeMismatchException.class,
    MethodArgumentNotValidException.class,
    HttpMessageNotReadableException.class
  })
  public ResponseEntity<ErrorMessage> onBadRequest(Exception e) {
    String message =
        e instanceof IllegalArgumentException ? e.getMessage() : "Malformed request";
    return ResponseEntity.badRequest().body(new ErrorMessage("BAD_REQUEST", message));
  }

  @ExceptionHandler(IllegalStateException.class)
  public ResponseEntity<ErrorMessage> onConflict(IllegalStateException e) {
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(new ErrorMessage("CONFLICT", e.getMessage()));
  }

  @ExceptionHandler(InterruptedException.class)
  public ResponseEntity<ErrorMessage> onInterrupted(InterruptedException e) {
    // raised on an async worker; this dispatch thread was not interrupted
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
        .body(new ErrorMessage("INTERRUPTED", "Request was cancelled"));
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ErrorMessage> onError(Exception e) {
    if (e instanceof ErrorResponse er) {
      HttpStatusCode code = er.getStatusCode();
      return ResponseEntity.status(code)
          .body(new ErrorMessage("HTTP_" + code.value(), er.getBody().getDetail()));
    }
    log.error("Unexpected failure", e);
    return ResponseEntity.internalServerError()
        .body(new ErrorMessage("INTERNAL", "Internal server error"));
  }

  static HttpStatus status(MemoryGameException.Failure f) {
    return switch (f) {
      case GAME_NOT_FOUND -> HttpStatus.NOT_FOUND;
      case CONTESTED, GAME_EXISTS, INVARIANT_VIOLATION, GAME_CLOSED -> HttpStatus.CONFLICT;
      default -> HttpStatus.BAD_REQUEST;
    };
  }
}
