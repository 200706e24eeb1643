package com.memoryscramble.interfaces.rest;

import com.memoryscramble.application.GameRegistry;
import java.util.Map;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class ConfigController {
  private final GameRegistry registry;
  private final long flipWaitMillis;
  private final long watchTimeoutMillis;

  public ConfigController(
      GameRegistry registry,
      @Value("${memory.flip-wait-timeout:30000}") long flipWaitMillis,
      @Value("${memory.watch-timeout:30000}") long watchTimeoutMillis) {
    this.registry = registry;
    this.flipWaitMillis = flipWaitMillis;
    this.watchTimeoutMillis = watchTimeoutMillis;
  }

  @GetMapping("/config")
  public Map<String, Object> config() {
    return Map.of(
        "defaultGame", registry.defaultGameId(),
        "contestPolicy", registry.policy().name(),
        "flipWaitTimeoutMs", flipWaitMillis,
        "watchTimeoutMs", watchTimeoutMillis,
        "protocolVersion", 1);
  }
}
