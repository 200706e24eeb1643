package com.memoryscramble;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MemoryScrambleApplication {
  public static void main(String[] args) {
    SpringApplication.run(MemoryScrambleApplication.class, args);
  }
}
