package com.aiadvent.mcp.context;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ContextEngineApplication {

  public static void main(String[] args) {
    SpringApplication.run(ContextEngineApplication.class, args);
  }
}
