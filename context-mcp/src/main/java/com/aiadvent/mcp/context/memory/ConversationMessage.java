package com.aiadvent.mcp.context.memory;

public record ConversationMessage(String role, String content) {

  public static final String USER = "user";
  public static final String ASSISTANT = "assistant";
  public static final String SYSTEM = "system";

  public ConversationMessage {
    role = role != null ? role : USER;
    content = content != null ? content : "";
  }

  public boolean isUser() {
    return USER.equals(role);
  }

  public boolean isAssistant() {
    return ASSISTANT.equals(role);
  }

  public boolean isSystem() {
    return SYSTEM.equals(role);
  }
}
