package com.aiadvent.mcp.context.change;

public enum ChangeKind {
  CREATED,
  MODIFIED,
  UNCHANGED
}
