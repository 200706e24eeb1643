package com.memoryscramble.infrastructure;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.messaging.simp.config.ChannelRegistration;
import org.springframework.messaging.simp.config.MessageBrokerRegistry;
import org.springframework.web.socket.config.annotation.EnableWebSocketMessageBroker;
import org.springframework.web.socket.config.annotation.StompEndpointRegistry;
import org.springframework.web.socket.config.annotation.WebSocketMessageBrokerConfigurer;

/**
 * STOMP over {@code /ws}. Board updates are broadcast on {@code /topic/games/{gameId}}; command
 * replies go to {@code /user/queue/reply}.
 */
@Configuration
@EnableWebSocketMessageBroker
public class WebSocketConfig implements WebSocketMessageBrokerConfigurer {

  @Value("${memory.allowed-origins:*}")
  private String allowedOrigins;

  // a contested /app/flip occupies an inbound thread until it resolves or times out
  @Value("${memory.ws-inbound-threads:16}")
  private int inboundThreads;

  @Override
  public void configureMessageBroker(MessageBrokerRegistry r) {
    r.enableSimpleBroker("/topic", "/queue");
    r.setApplicationDestinationPrefixes("/app");
    r.setUserDestinationPrefix("/user");
  }

  @Override
  public void configureClientInboundChannel(ChannelRegistration r) {
    r.taskExecutor().corePoolSize(inboundThreads).maxPoolSize(inboundThreads);
  }

  @Override
  public void registerStompEndpoints(StompEndpointRegistry r) {
    r.addEndpoint("/ws")
      .setAllowedOriginPatterns(allowedOrigins.split("\\s*,\\s*"))
      .withSockJS();
  }
}
