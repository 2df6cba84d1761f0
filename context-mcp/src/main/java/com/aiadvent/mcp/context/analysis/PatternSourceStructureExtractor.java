package com.aiadvent.mcp.context.analysis;

import com.aiadvent.mcp.context.analysis.SourceStructure.ComponentHints;
import com.aiadvent.mcp.context.analysis.SourceStructure.FunctionSignature;
import com.aiadvent.mcp.context.analysis.SourceStructure.ImportBinding;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/** Line-oriented regex extraction for TypeScript/JavaScript sources. */
@Component
public class PatternSourceStructureExtractor implements SourceStructureExtractor {

  private static final Pattern DECLARED_EXPORT =
      Pattern.compile(
          "export\\s+(?:default\\s+)?(?:function|const|class|interface|type|enum)\\s+(\\w+)");
  private static final Pattern EXPORT_LIST = Pattern.compile("export\\s*\\{\\s*([^}]+)\\s*}");
  private static final Pattern AS_ALIAS = Pattern.compile("\\s+as\\s+");
  private static final Pattern IMPORT_SPECIFIER =
      Pattern.compile("import\\s+(?:[\\w{},\\s*]+\\s+from\\s+)?['\"]([^'\"]+)['\"]");
  private static final Pattern IMPORT_BINDING =
      Pattern.compile(
          "import\\s+(?:(\\w+)(?:\\s*,\\s*)?)?(?:\\{([^}]+)})?\\s+from\\s+['\"]([^'\"]+)['\"]");
  private static final Pattern FUNCTION =
      Pattern.compile(
          "(?:export\\s+)?(async\\s+)?(?:function\\s+(\\w+)|const\\s+(\\w+)\\s*=\\s*(?:async\\s*)?"
              + "\\([^)]*\\)\\s*(?::\\s*([^=>{]+))?\\s*=>)");
  private static final Pattern COMPONENT =
      Pattern.compile(
          "(?:export\\s+)?(?:default\\s+)?(?:function|const)\\s+(\\w+)\\s*(?::\\s*React\\.FC)?[^{]*\\{");
  private static final Pattern HOOK_CALL = Pattern.compile("\\buse\\w+\\s*\\(");
  private static final Pattern STATE_VARIABLE =
      Pattern.compile("const\\s+\\[(\\w+),\\s*set\\w+]\\s*=\\s*useState");
  private static final Pattern PROPS_BLOCK =
      Pattern.compile("(?:interface|type)\\s+\\w*Props\\w*\\s*(?:=\\s*)?\\{([^}]+)}");
  private static final Pattern PROP_NAME = Pattern.compile("(\\w+)\\s*\\??\\s*:");
  private static final Pattern HOOK_DECLARATION =
      Pattern.compile("(?:function|const)\\s+use[A-Z]\\w*");
  private static final Pattern COMPONENT_DECLARATION =
      Pattern.compile("function\\s+[A-Z]|const\\s+[A-Z]\\w+\\s*[=:]");
  private static final Pattern TYPE_DECLARATION =
      Pattern.compile("(?m)^\\s*(?:export\\s+)?(?:type|interface)\\s+\\w+");
  private static final Pattern VALUE_DECLARATION =
      Pattern.compile("(?m)^\\s*(?:export\\s+)?(?:default\\s+)?(?:function|const|let|var|class)\\s");

  @Override
  public SourceStructure extract(String path, String content) {
    String safePath = path != null ? path : "";
    String text = content != null ? content : "";
    return new SourceStructure(
        classify(safePath, text),
        lineCount(text),
        exports(text),
        imports(text),
        importBindings(text),
        functions(text),
        component(text));
  }

  @Override
  public FileType classify(String path, String content) {
    FileType byPath = classifyByPath(path);
    if (byPath != FileType.UNKNOWN) {
      return byPath;
    }
    return classifyByContent(content != null ? content : "");
  }

  public static int lineCount(String content) {
    if (content == null) {
      return 0;
    }
    return content.split("\n", -1).length;
  }

  static FileType classifyByPath(String path) {
    if (!StringUtils.hasText(path)) {
      return FileType.UNKNOWN;
    }
    if (path.contains("/pages/")) {
      return FileType.PAGE;
    }
    if (path.contains("/components/")) {
      return FileType.COMPONENT;
    }
    if (path.contains("/hooks/")) {
      return FileType.HOOK;
    }
    if (path.contains("/lib/") || path.contains("/utils/")) {
      return FileType.UTIL;
    }
    if (path.contains("/store/") || path.contains("/context/")) {
      return FileType.STORE;
    }
    if (path.contains("/types/")) {
      return FileType.TYPE;
    }
    if (path.endsWith(".css")) {
      return FileType.STYLE;
    }
    if (path.endsWith(".json") || path.contains("/config/")) {
      return FileType.CONFIG;
    }
    return FileType.UNKNOWN;
  }

  static FileType classifyByContent(String content) {
    if (HOOK_DECLARATION.matcher(content).find()) {
      return FileType.HOOK;
    }
    if (COMPONENT_DECLARATION.matcher(content).find()) {
      return FileType.COMPONENT;
    }
    if (TYPE_DECLARATION.matcher(content).find() && !VALUE_DECLARATION.matcher(content).find()) {
      return FileType.TYPE;
    }
    return FileType.UNKNOWN;
  }

  private List<String> exports(String content) {
    Set<String> exports = new LinkedHashSet<>();
    Matcher declared = DECLARED_EXPORT.matcher(content);
    while (declared.find()) {
      exports.add(declared.group(1));
    }
    Matcher listed = EXPORT_LIST.matcher(content);
    while (listed.find()) {
      for (String entry : listed.group(1).split(",")) {
        String name = AS_ALIAS.split(entry.trim())[0].trim();
        if (StringUtils.hasText(name)) {
          exports.add(name);
        }
      }
    }
    return new ArrayList<>(exports);
  }

  private List<String> imports(String content) {
    Set<String> imports = new LinkedHashSet<>();
    Matcher matcher = IMPORT_SPECIFIER.matcher(content);
    while (matcher.find()) {
      imports.add(matcher.group(1));
    }
    return new ArrayList<>(imports);
  }

  private List<ImportBinding> importBindings(String content) {
    List<ImportBinding> bindings = new ArrayList<>();
    Matcher matcher = IMPORT_BINDING.matcher(content);
    while (matcher.find()) {
      String defaultImport = matcher.group(1);
      String namedImports = matcher.group(2);
      List<String> names = new ArrayList<>();
      if (defaultImport != null) {
        names.add(defaultImport);
      }
      if (namedImports != null) {
        for (String entry : namedImports.split(",")) {
          String name = AS_ALIAS.split(entry.trim())[0].trim();
          if (StringUtils.hasText(name)) {
            names.add(name);
          }
        }
      }
      bindings.add(
          new ImportBinding(
              matcher.group(3), names, defaultImport != null && namedImports == null));
    }
    return bindings;
  }

  private List<FunctionSignature> functions(String content) {
    List<FunctionSignature> functions = new ArrayList<>();
    Matcher matcher = FUNCTION.matcher(content);
    while (matcher.find()) {
      String name = matcher.group(2) != null ? matcher.group(2) : matcher.group(3);
      if (name == null || name.startsWith("_")) {
        continue;
      }
      functions.add(
          new FunctionSignature(
              name, matcher.group().startsWith("export"), matcher.group(1) != null));
    }
    return functions;
  }

  private ComponentHints component(String content) {
    Matcher matcher = COMPONENT.matcher(content);
    if (!matcher.find()) {
      return null;
    }
    String name = matcher.group(1);
    if (!StringUtils.hasText(name) || !Character.isUpperCase(name.charAt(0))) {
      return null;
    }

    Set<String> hooks = new LinkedHashSet<>();
    Matcher hookMatcher = HOOK_CALL.matcher(content);
    while (hookMatcher.find()) {
      hooks.add(hookMatcher.group().replace("(", "").trim());
    }

    List<String> state = new ArrayList<>();
    Matcher stateMatcher = STATE_VARIABLE.matcher(content);
    while (stateMatcher.find()) {
      state.add(stateMatcher.group(1));
    }

    List<String> props = new ArrayList<>();
    Matcher propsMatcher = PROPS_BLOCK.matcher(content);
    if (propsMatcher.find()) {
      Matcher propName = PROP_NAME.matcher(propsMatcher.group(1));
      while (propName.find()) {
        props.add(propName.group(1));
      }
    }
    return new ComponentHints(name, props, new ArrayList<>(hooks), state);
  }
}
