package io.b2mash.clauseguard;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ClauseGuardApplication {

  public static void main(String[] args) {
    SpringApplication.run(ClauseGuardApplication.class, args);
  }
}
