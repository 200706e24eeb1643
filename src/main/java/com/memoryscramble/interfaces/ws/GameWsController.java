package com.memoryscramble.interfaces.ws;

import com.memoryscramble.application.GameCommands;
import com.memoryscramble.domain.BoardView;
import com.memoryscramble.domain.MemoryGameException;
import com.memoryscramble.dto.ErrorMessage;
import com.memoryscramble.dto.FlipRequest;
import com.memoryscramble.dto.FlipResponse;
import com.memoryscramble.dto.LookRequest;
import jakarta.validation.ConstraintViolationException;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.messaging.handler.annotation.MessageExceptionHandler;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.handler.annotation.support.MethodArgumentNotValidException;
import org.springframework.messaging.simp.annotation.SendToUser;
import org.springframework.stereotype.Controller;
import org.springframework.validation.annotation.Validated;

/**
 * STOMP counterpart of the REST commands. Board updates themselves go out on {@code
 * /topic/games/{gameId}}; replies to the caller on {@code /user/queue/reply}.
 */
@Validated
@Controller
public class GameWsController {
  private final Logger log = LoggerFactory.getLogger(getClass());
  private final GameCommands commands;

  public GameWsController(GameCommands commands) {
    this.commands = commands;
  }

  @MessageMapping("/look")
  @SendToUser("/queue/reply")
  public BoardView look(@Valid LookRequest req) {
    return commands.look(gameId(req.gameId()), req.player());
  }

  @MessageMapping("/flip")
  @SendToUser("/queue/reply")
  public FlipResponse flip(@Valid FlipRequest req) throws InterruptedException {
    return FlipResponse.of(commands.flip(gameId(req.gameId()), req.player(), req.x(), req.y()));
  }

  @MessageExceptionHandler(MemoryGameException.class)
  @SendToUser("/queue/reply")
  public ErrorMessage onGameFailure(MemoryGameException e) {
    return new ErrorMessage(e.failure().name(), e.getMessage());
  }

  @MessageExceptionHandler({
    IllegalArgumentException.class,
    MethodArgumentNotValidException.class,
    ConstraintViolationException.class
  })
  @SendToUser("/queue/reply")
  public ErrorMessage onBadRequest(Exception e) {
    String message =
        e instanceof IllegalArgumentException ? e.getMessage() : "Malformed request";
    return new ErrorMessage("BAD_REQUEST", message);
  }

  @MessageExceptionHandler(Exception.class)
  @SendToUser("/queue/reply")
  public ErrorMessage onError(Exception e) {
    if (e instanceof InterruptedException) {
      Thread.currentThread().interrupt();
      return new ErrorMessage("INTERRUPTED", "Request was cancelled");
    }
    log.error("Unexpected failure in STOMP command", e);
    return new ErrorMessage("INTERNAL", "Internal server error");
  }

  private String gameId(String requested) {
    return requested == null || requested.isBlank() ? commands.defaultGameId() : requested;
  }
}
