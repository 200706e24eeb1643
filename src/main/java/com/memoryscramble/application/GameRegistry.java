package com.memoryscramble.application;

import com.memoryscramble.domain.BoardDefinition;
import com.memoryscramble.domain.BoardFile;
import com.memoryscramble.domain.ContestPolicy;
import com.memoryscramble.domain.GameSession;
import com.memoryscramble.domain.MemoryGameException;
import com.memoryscramble.domain.MemoryGameException.Failure;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.io.IOException;
import java.io.InputStream;
import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Service;

/**
 * Owns every running game, keyed by game id.
 *
 * <p>On startup the board file configured as {@code memory.board} is registered under {@code
 * memory.default-game}; transports that only know a single game talk to that one. Further games
 * can be created and removed at runtime. A reset swaps in a fresh session built from the same
 * definition and closes the old one, which wakes its waiters.
 */
@Service
public class GameRegistry {
  private static final Pattern GAME_ID = Pattern.compile("[a-z0-9-]{1,32}");

  private final Logger log = LoggerFactory.getLogger(getClass());
  private final SecureRandom rnd = new SecureRandom();

  private record Entry(GameSession session, BoardDefinition definition) {}

  private final Map<String, Entry> games = new ConcurrentHashMap<>();

  private final Resource boardFile;
  private final String defaultGameId;
  private final ContestPolicy policy;
  private final boolean shuffle;

  public GameRegistry(
      @Value("${memory.board:classpath:boards/perfect.txt}") Resource boardFile,
      @Value("${memory.default-game:default}") String defaultGameId,
      @Value("${memory.contest-policy:WAIT}") ContestPolicy policy,
      @Value("${memory.shuffle:true}") boolean shuffle) {
    this.boardFile = boardFile;
    this.defaultGameId = norm(defaultGameId);
    this.policy = policy;
    this.shuffle = shuffle;
  }

  /**
   * Load the configured board file and register the default game.
   *
   * @throws IOException if the board file cannot be read
   * @throws MemoryGameException {@code INVALID_BOARD_FILE} if it is malformed
   */
  @PostConstruct
  public void loadDefault() throws IOException {
    long t0 = System.nanoTime();
    BoardDefinition def;
    try (InputStream in = boardFile.getInputStream()) {
      def = BoardFile.parse(in);
    }
    create(defaultGameId, def);
    long ms = (System.nanoTime() - t0) / 1_000_000;
    log.info(
        "Loaded board {} ({}x{}, {} pairs) as game '{}' in {} ms, contest policy {}",
        boardFile.getDescription(),
        def.width(),
        def.height(),
        def.cards().size(),
        defaultGameId,
        ms,
        policy);
  }

  /** Close every game so blocked callers return. */
  @PreDestroy
  public void closeAll() {
    games.values().forEach(e -> e.session().close());
    games.clear();
  }

  /**
   * Register a new game.
   *
   * @throws MemoryGameException {@code INVALID_GAME_ID}, {@code GAME_EXISTS}, or the board
   *     construction failures
   */
  public GameSession create(String gameId, BoardDefinition def) {
    String id = checkId(gameId);
    GameSession session = new GameSession(id, def.newBoard(shuffle, rnd), policy);
    if (games.putIfAbsent(id, new Entry(session, def)) != null) {
      throw new MemoryGameException(Failure.GAME_EXISTS, "Game '" + id + "' already exists");
    }
    log.info("Created game '{}' ({}x{})", id, def.width(), def.height());
    return session;
  }

  /**
   * Look up a running game.
   *
   * @throws MemoryGameException {@code GAME_NOT_FOUND}
   */
  public GameSession get(String gameId) {
    Entry e = gameId == null ? null : games.get(norm(gameId));
    if (e == null) {
      throw new MemoryGameException(Failure.GAME_NOT_FOUND, "Game '" + gameId + "' not found");
    }
    return e.session();
  }

  /** Replace a game with a freshly shuffled board of the same cards; scores start over. */
  public GameSession reset(String gameId) {
    String id = norm(gameId);
    Entry[] old = new Entry[1];
    Entry fresh =
        games.computeIfPresent(
            id,
            (k, e) -> {
              old[0] = e;
              return new Entry(
                  new GameSession(k, e.definition().newBoard(shuffle, rnd), policy),
                  e.definition());
            });
    if (fresh == null) {
      throw new MemoryGameException(Failure.GAME_NOT_FOUND, "Game '" + gameId + "' not found");
    }
    old[0].session().close();
    log.info("Game '{}' reset", id);
    return fresh.session();
  }

  /**
   * Drop a game. Callers still blocked in it fail with {@code GAME_CLOSED}.
   *
   * @throws IllegalStateException for the default game
   */
  public void remove(String gameId) {
    String id = norm(gameId);
    if (defaultGameId.equals(id)) {
      throw new IllegalStateException("The default game cannot be removed");
    }
    Entry e = games.remove(id);
    if (e == null) {
      throw new MemoryGameException(Failure.GAME_NOT_FOUND, "Game '" + gameId + "' not found");
    }
    e.session().close();
    log.info("Game '{}' removed", id);
  }

  public List<String> ids() {
    List<String> ids = new ArrayList<>(games.keySet());
    Collections.sort(ids);
    return ids;
  }

  public String defaultGameId() {
    return defaultGameId;
  }

  public ContestPolicy policy() {
    return policy;
  }

  /** Normalize a game id (trim and lower-case). */
  private static String norm(String id) {
    return id == null ? null : id.trim().toLowerCase(Locale.ROOT);
  }

  private static String checkId(String gameId) {
    String id = norm(gameId);
    if (id == null || !GAME_ID.matcher(id).matches()) {
      throw new MemoryGameException(
          Failure.INVALID_GAME_ID,
          "Game id must be 1-32 characters of a-z, 0-9 or '-', got '" + gameId + "'");
    }
    return id;
  }
}
