package com.gentoro.agentgraph.utility;

import java.util.Arrays;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

public class StringUtility {

  public static String formatWithIndent(String input, int indent) {
    if (input == null) return "";
    String spaces = " ".repeat(Math.max(0, indent));
    String formatted = input.replaceAll("\\r\\n?", "\n").trim();
    return Arrays.stream(formatted.split("\n"))
        .map(line -> spaces + line)
        .collect(Collectors.joining("\n"));
  }

  /**
   * Content of the first fenced block of the given type, e.g. {@code ```json ... ```}, or null when
   * there is none.
   */
  public static String extractSnippet(String text, String type) {
    if (text == null || text.isEmpty()) {
      return null;
    }
    Pattern pattern = Pattern.compile("(?s)```%s\\s*(.+?)\\s*```".formatted(Pattern.quote(type)));
    Matcher matcher = pattern.matcher(text);
    if (matcher.find()) {
      return matcher.group(1).trim();
    }
    return null;
  }

  /** Loggable form of a secret: first few characters and the length. */
  public static String redact(String secret) {
    if (secret == null) return "<null>";
    int visible = Math.min(6, secret.length() / 4);
    return secret.substring(0, visible) + "... (" + secret.length() + " chars)";
  }
}
