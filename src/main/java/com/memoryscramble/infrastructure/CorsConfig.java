package com.memoryscramble.infrastructure;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class CorsConfig implements WebMvcConfigurer {

  @Value("${memory.allowed-origins:*}")
  private String allowedOrigins;

  @Override
  public void addCorsMappings(CorsRegistry r) {
    r.addMapping("/**")
      .allowedOriginPatterns(allowedOrigins.split("\\s*,\\s*"))
      .allowedMethods("GET", "POST", "DELETE");
  }
}
