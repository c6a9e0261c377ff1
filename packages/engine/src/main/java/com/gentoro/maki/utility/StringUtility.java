package com.gentoro.maki.utility;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

public class StringUtility {

  public static String sanitize(String input) {
    return input
        .replaceAll("[^a-zA-Z0-9._-]", "_") // Replace invalid characters with underscores
        .replaceAll("_+", "_"); // Collapse multiple underscores into one
  }

  /**
   * File-safe name for an identifier. Identifiers that are already safe are returned unchanged;
   * any other is sanitized and suffixed with a short SHA-256 of the original, so distinct
   * identifiers never share a name.
   */
  public static String storageKey(String input) {
    String sanitized = sanitize(input);
    if (sanitized.equals(input)) return input;
    return sanitized + "-" + sha256Hex(input).substring(0, 12);
  }

  public static String sha256Hex(String input) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      byte[] hash = digest.digest(input.getBytes(StandardCharsets.UTF_8));
      StringBuilder hex = new StringBuilder(hash.length * 2);
      for (byte b : hash) {
        hex.append(String.format("%02x", b));
      }
      return hex.toString();
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }

  public static String formatWithIndent(String input, int indent) {
    return formatWithIndent(input, indent, 1000);
  }

  public static String formatWithIndent(String input, int indent, int limit) {
    if (input == null) return "";
    if (indent < 0) indent = 0;

    String spaces = " ".repeat(indent);
    String formatted = input.replaceAll("\\r\\n?", "\n").trim();

    String[] lines = formatted.split("\n");
    if (limit > -1 && lines.length > limit) {
      return Arrays.stream(lines).map(line -> spaces + line).limit(limit).collect(
              Collectors.joining("\n"))
          + " ...";
    } else {
      return Arrays.stream(lines).map(line -> spaces + line).collect(Collectors.joining("\n"));
    }
  }

  public static String truncate(String input, int max) {
    if (input == null) return "";
    return input.length() > max ? input.substring(0, max) + "…" : input;
  }

  /**
   * Extract the content of a fenced code block of the given type, e.g. {@code ```json ... ```}.
   * Returns null when the text holds no such block.
   */
  public static String extractSnippet(String text, String type) {
    if (text == null || text.isEmpty()) {
      return null;
    }

    String regex = "(?s)(?:```%s\\s*)(.+?)(?:\\s*```)".formatted(type);
    Pattern pattern = Pattern.compile(regex);
    Matcher matcher = pattern.matcher(text);

    if (matcher.find()) {
      return matcher.group(1).trim();
    }

    return null;
  }

  /**
   * Locate the outermost JSON object in a model completion. Handles fenced blocks first, then falls
   * back to the span between the first '{' and the last '}'.
   */
  public static String extractJsonObject(String text) {
    if (text == null) return null;
    String fenced = extractSnippet(text, "json");
    String candidate = fenced != null ? fenced : text;
    int start = candidate.indexOf('{');
    int end = candidate.lastIndexOf('}');
    if (start < 0 || end <= start) return null;
    return candidate.substring(start, end + 1);
  }

  /**
   * Split blocks into groups whose joined length stays within {@code maxChars}. A single block
   * longer than the limit is cut into pieces.
   */
  public static List<String> chunk(List<String> blocks, String separator, int maxChars) {
    List<String> chunks = new ArrayList<>();
    StringBuilder current = new StringBuilder();
    for (String block : blocks) {
      List<String> pieces = new ArrayList<>();
      if (block.length() > maxChars) {
        for (int i = 0; i < block.length(); i += maxChars) {
          pieces.add(block.substring(i, Math.min(block.length(), i + maxChars)));
        }
      } else {
        pieces.add(block);
      }
      for (String piece : pieces) {
        int extra = current.length() == 0 ? piece.length() : separator.length() + piece.length();
        if (current.length() > 0 && current.length() + extra > maxChars) {
          chunks.add(current.toString());
          current.setLength(0);
        }
        if (current.length() > 0) current.append(separator);
        current.append(piece);
      }
    }
    if (current.length() > 0) chunks.add(current.toString());
    return chunks;
  }
}
