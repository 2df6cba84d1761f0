package com.aiadvent.mcp.context.retrieval;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.util.StringUtils;

/** Rule based query expansion applied before the semantic search call. */
public final class QueryEnhancer {

  private static final Pattern SOURCE_EXTENSION = Pattern.compile("\\.(tsx?|jsx?|css|json)$");
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  private static final Map<String, String> ABBREVIATIONS = new LinkedHashMap<>();
  private static final Map<String, List<String>> ACTION_TERMS = new LinkedHashMap<>();
  private static final Map<String, List<String>> GAME_TERMS = new LinkedHashMap<>();

  static {
    ABBREVIATIONS.put("btn", "button");
    ABBREVIATIONS.put("msg", "message");
    ABBREVIATIONS.put("nav", "navigation navigate");
    ABBREVIATIONS.put("hdr", "header");
    ABBREVIATIONS.put("ftr", "footer");
    ABBREVIATIONS.put("dlg", "dialog modal");
    ABBREVIATIONS.put("mdl", "modal dialog");
    ABBREVIATIONS.put("txt", "text");
    ABBREVIATIONS.put("img", "image");
    ABBREVIATIONS.put("lbl", "label");
    ABBREVIATIONS.put("inp", "input");
    ABBREVIATIONS.put("err", "error");
    ABBREVIATIONS.put("cfg", "config configuration");
    ABBREVIATIONS.put("auth", "authentication authorize");
    ABBREVIATIONS.put("api", "API endpoint");
    ABBREVIATIONS.put("db", "database");
    ABBREVIATIONS.put("req", "request");
    ABBREVIATIONS.put("res", "response");
    ABBREVIATIONS.put("fn", "function");
    ABBREVIATIONS.put("cb", "callback");
    ABBREVIATIONS.put("ctx", "context");
    ABBREVIATIONS.put("ref", "reference");
    ABBREVIATIONS.put("var", "variable");
    ABBREVIATIONS.put("obj", "object");
    ABBREVIATIONS.put("arr", "array");
    ABBREVIATIONS.put("str", "string");
    ABBREVIATIONS.put("num", "number");
    ABBREVIATIONS.put("bool", "boolean");
    ABBREVIATIONS.put("bg", "background");
    ABBREVIATIONS.put("fg", "foreground");
    ABBREVIATIONS.put("clr", "color");
    ABBREVIATIONS.put("sz", "size");
    ABBREVIATIONS.put("wd", "width");
    ABBREVIATIONS.put("ht", "height");
    ABBREVIATIONS.put("mrgn", "margin");
    ABBREVIATIONS.put("pdng", "padding");
    ABBREVIATIONS.put("plyr", "player");
    ABBREVIATIONS.put("scr", "score");
    ABBREVIATIONS.put("lvl", "level");
    ABBREVIATIONS.put("gm", "game");
    ABBREVIATIONS.put("anim", "animation");
    ABBREVIATIONS.put("spr", "sprite");
    ABBREVIATIONS.put("coll", "collision");
    ABBREVIATIONS.put("phys", "physics");
    ABBREVIATIONS.put("ctrl", "control controller");

    ACTION_TERMS.put("fix", List.of("bug", "error", "issue", "debug", "problem"));
    ACTION_TERMS.put("debug", List.of("bug", "error", "issue", "fix", "problem", "console"));
    ACTION_TERMS.put("add", List.of("create", "implement", "new", "feature"));
    ACTION_TERMS.put("create", List.of("add", "implement", "new", "generate"));
    ACTION_TERMS.put("remove", List.of("delete", "cleanup", "drop", "clear"));
    ACTION_TERMS.put("delete", List.of("remove", "cleanup", "drop", "clear"));
    ACTION_TERMS.put("change", List.of("modify", "update", "edit", "alter"));
    ACTION_TERMS.put("update", List.of("modify", "change", "edit", "refresh"));
    ACTION_TERMS.put("style", List.of("css", "tailwind", "design", "layout", "appearance"));
    ACTION_TERMS.put("refactor", List.of("restructure", "reorganize", "cleanup", "optimize"));
    ACTION_TERMS.put("optimize", List.of("performance", "speed", "efficiency", "improve"));
    ACTION_TERMS.put("move", List.of("relocate", "transfer", "position"));
    ACTION_TERMS.put("rename", List.of("change name", "update name"));
    ACTION_TERMS.put("test", List.of("testing", "spec", "unit", "validate"));

    GAME_TERMS.put("player", List.of("character", "hero", "avatar", "user"));
    GAME_TERMS.put("enemy", List.of("opponent", "npc", "mob", "foe"));
    GAME_TERMS.put("score", List.of("points", "counter", "tally"));
    GAME_TERMS.put("level", List.of("stage", "map", "world", "scene"));
    GAME_TERMS.put("collision", List.of("hit", "overlap", "intersect", "detect"));
    GAME_TERMS.put("movement", List.of("motion", "position", "velocity", "direction"));
    GAME_TERMS.put("input", List.of("keyboard", "mouse", "touch", "controls"));
    GAME_TERMS.put("audio", List.of("sound", "music", "sfx", "effects"));
    GAME_TERMS.put("visual", List.of("graphics", "render", "display", "draw"));
  }

  private QueryEnhancer() {}

  public static String enhance(String query, String selectedFile, Collection<String> recentFiles) {
    String original = query != null ? query : "";
    String enhanced = original;

    if (StringUtils.hasText(selectedFile)) {
      String fileName = fileName(selectedFile);
      if (StringUtils.hasText(fileName)
          && !original.toLowerCase(Locale.ROOT).contains(fileName.toLowerCase(Locale.ROOT))) {
        enhanced = enhanced + " (in " + fileName + ")";
      }
    }
    enhanced = expandAbbreviations(enhanced);
    enhanced = addActionTerms(enhanced);
    enhanced = addGameTerms(enhanced);

    if (recentFiles != null && !recentFiles.isEmpty()) {
      String hints = relatedFileHints(original, recentFiles);
      if (hints != null) {
        enhanced = enhanced + " " + hints;
      }
    }
    return enhanced.trim();
  }

  /** Abbreviation expansion only. */
  public static String enhanceMinimal(String query) {
    return expandAbbreviations(query != null ? query : "");
  }

  static String expandAbbreviations(String query) {
    String result = query;
    for (Map.Entry<String, String> entry : ABBREVIATIONS.entrySet()) {
      Pattern pattern =
          Pattern.compile("\\b" + entry.getKey() + "\\b", Pattern.CASE_INSENSITIVE);
      Matcher matcher = pattern.matcher(result);
      if (matcher.find()) {
        result =
            matcher.replaceAll(
                Matcher.quoteReplacement(entry.getKey() + " " + entry.getValue()));
      }
    }
    return result;
  }

  static String addActionTerms(String query) {
    String lower = query.toLowerCase(Locale.ROOT);
    List<String> added = new ArrayList<>();
    for (Map.Entry<String, List<String>> entry : ACTION_TERMS.entrySet()) {
      if (lower.contains(entry.getKey())) {
        entry.getValue().stream()
            .filter(term -> !lower.contains(term) && !added.contains(term))
            .limit(2)
            .forEach(added::add);
        break;
      }
    }
    return added.isEmpty() ? query : query + " " + String.join(" ", added);
  }

  static String addGameTerms(String query) {
    String lower = query.toLowerCase(Locale.ROOT);
    List<String> added = new ArrayList<>();
    for (Map.Entry<String, List<String>> entry : GAME_TERMS.entrySet()) {
      if (lower.contains(entry.getKey())) {
        entry.getValue().stream()
            .filter(term -> !lower.contains(term) && !added.contains(term))
            .findFirst()
            .ifPresent(added::add);
      }
    }
    if (added.isEmpty()) {
      return query;
    }
    return query + " " + String.join(" ", added.subList(0, Math.min(3, added.size())));
  }

  static String relatedFileHints(String query, Collection<String> recentFiles) {
    String lower = query.toLowerCase(Locale.ROOT);
    List<String> words =
        WHITESPACE.splitAsStream(lower).filter(word -> word.length() > 2).toList();
    List<String> related = new ArrayList<>();
    recentFiles.stream()
        .limit(5)
        .map(QueryEnhancer::fileName)
        .filter(StringUtils::hasText)
        .forEach(
            name -> {
              String nameLower = name.toLowerCase(Locale.ROOT);
              boolean matches =
                  words.stream().anyMatch(word -> nameLower.contains(word))
                      && !lower.contains(name);
              if (matches) {
                related.add(name);
              }
            });
    if (related.isEmpty()) {
      return null;
    }
    return "related: " + String.join(", ", related.subList(0, Math.min(2, related.size())));
  }

  static String fileName(String path) {
    if (path == null) {
      return null;
    }
    int slash = path.lastIndexOf('/');
    String name = slash >= 0 ? path.substring(slash + 1) : path;
    return SOURCE_EXTENSION.matcher(name).replaceFirst("");
  }
}
