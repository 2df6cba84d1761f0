package com.aiadvent.mcp.context.analysis;

import java.util.List;

public record SourceStructure(
    FileType fileType,
    int lineCount,
    List<String> exports,
    List<String> imports,
    List<ImportBinding> importBindings,
    List<FunctionSignature> functions,
    ComponentHints component) {

  public SourceStructure {
    fileType = fileType != null ? fileType : FileType.UNKNOWN;
    exports = exports != null ? List.copyOf(exports) : List.of();
    imports = imports != null ? List.copyOf(imports) : List.of();
    importBindings = importBindings != null ? List.copyOf(importBindings) : List.of();
    functions = functions != null ? List.copyOf(functions) : List.of();
  }

  public record ImportBinding(String from, List<String> names, boolean defaultOnly) {
    public ImportBinding {
      names = names != null ? List.copyOf(names) : List.of();
    }
  }

  public record FunctionSignature(String name, boolean exported, boolean async) {}

  /** Present only when the file declares a PascalCase function or const. */
  public record ComponentHints(
      String name, List<String> props, List<String> hooks, List<String> stateVariables) {
    public ComponentHints {
      props = props != null ? List.copyOf(props) : List.of();
      hooks = hooks != null ? List.copyOf(hooks) : List.of();
      stateVariables = stateVariables != null ? List.copyOf(stateVariables) : List.of();
    }
  }
}
