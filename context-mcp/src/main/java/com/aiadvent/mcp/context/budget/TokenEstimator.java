package com.aiadvent.mcp.context.budget;

import com.aiadvent.mcp.context.config.ContextEngineProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Collection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Character based token estimate, rounded up. */
@Component
public class TokenEstimator {

  private static final Logger log = LoggerFactory.getLogger(TokenEstimator.class);

  private final int charsPerToken;
  private final ObjectMapper objectMapper;

  public TokenEstimator(ContextEngineProperties properties, ObjectMapper objectMapper) {
    this.charsPerToken = properties.getBudget().getCharsPerToken();
    this.objectMapper = objectMapper;
  }

  public int estimate(String text) {
    if (text == null || text.isEmpty()) {
      return 0;
    }
    return (int) Math.ceil(text.length() / (double) charsPerToken);
  }

  /** Estimate of the texts joined with newlines. */
  public int estimateJoined(Collection<String> texts) {
    if (texts == null || texts.isEmpty()) {
      return 0;
    }
    return estimate(String.join("\n", texts));
  }

  /** Estimate of the JSON rendering of {@code value}; zero for {@code null}. */
  public int estimateJson(Object value) {
    if (value == null) {
      return 0;
    }
    try {
      return estimate(objectMapper.writeValueAsString(value));
    } catch (JsonProcessingException ex) {
      log.debug("Falling back to toString for token estimate: {}", ex.getMessage());
      return estimate(value.toString());
    }
  }
}
