package com.cricket.live;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LiveScoresApplication {
  public static void main(String[] args) {
    SpringApplication.run(LiveScoresApplication.class, args);
  }
}
