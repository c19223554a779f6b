package com.codeheadsystems.jwtdown.testserver;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Runnable Spring Boot application for local developer testing of the session endpoints.
 * Uses the in-memory user store (accounts are lost on restart). The signing secret is read from
 * the {@code SECRET_KEY} environment variable and the application refuses to start without it.
 * <pre>
 *   SECRET_KEY=$(openssl rand -hex 32) java -jar jwtdown-testserver.jar
 * </pre>
 */
@SpringBootApplication
public class JwtdownTestServerApplication {

  /**
   * The entry point of application.
   *
   * @param args the input arguments
   */
  public static void main(String[] args) {
    SpringApplication.run(JwtdownTestServerApplication.class, args);
  }
}
