package com.aiadvent.mcp.context.scope;

public enum ChangeSource {
  USER_EDIT,
  AI_GENERATION,
  AI_EDIT
}
