package com.scholary.captions.source;

import com.scholary.captions.ass.AssTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Strict SRT reader and writer.
 *
 * <p>Content only counts as SRT when it consists entirely of well-formed blocks: an index line, a
 * {@code start --> end} timing line and optional text lines, separated by blank lines. Anything
 * else makes {@link #tryParse(String)} return empty, which lets callers treat the content as plain
 * text instead.
 */
public final class SrtCodec {

  private static final Pattern INDEX_PATTERN = Pattern.compile("^\\s*(\\d+)\\s*$");

  // Example: 00:01:02,500 --> 00:01:04,000 (a '.' separator is tolerated)
  private static final Pattern TIMING_PATTERN =
      Pattern.compile(
          "^\\s*(\\d+):(\\d{1,2}):(\\d{1,2})[,.](\\d{1,3})\\s*-->\\s*"
              + "(\\d+):(\\d{1,2}):(\\d{1,2})[,.](\\d{1,3})(?:\\s+.*)?$");

  private static final Pattern BLOCK_SEPARATOR = Pattern.compile("\\n\\s*\\n");

  private SrtCodec() {}

  /**
   * Parse SRT content.
   *
   * @param content raw text, CRLF line endings and a leading BOM are accepted
   * @return the blocks, or empty if the content is not valid SRT or has no blocks
   */
  public static Optional<List<SrtEntry>> tryParse(String content) {
    if (content == null) {
      return Optional.empty();
    }
    String normalized = content.replace("\r\n", "\n").replace('\r', '\n');
    if (normalized.startsWith("\uFEFF")) {
      normalized = normalized.substring(1);
    }
    normalized = normalized.strip();
    if (normalized.isEmpty()) {
      return Optional.empty();
    }

    List<SrtEntry> entries = new ArrayList<>();
    for (String block : BLOCK_SEPARATOR.split(normalized)) {
      String[] lines = block.split("\n", -1);
      if (lines.length < 2) {
        return Optional.empty();
      }
      Matcher index = INDEX_PATTERN.matcher(lines[0]);
      Matcher timing = TIMING_PATTERN.matcher(lines[1]);
      if (!index.matches() || !timing.matches()) {
        return Optional.empty();
      }
      List<String> textLines = new ArrayList<>();
      for (int i = 2; i < lines.length; i++) {
        textLines.add(lines[i].strip());
      }
      entries.add(
          new SrtEntry(
              Integer.parseInt(index.group(1)),
              seconds(timing, 1),
              seconds(timing, 5),
              String.join("\n", textLines).strip()));
    }
    return Optional.of(entries);
  }

  /**
   * Write blocks as SRT, numbering them from 1.
   *
   * @return SRT text where every block ends with a blank line
   */
  public static String compose(List<SrtEntry> entries) {
    StringBuilder sb = new StringBuilder();
    int index = 1;
    for (SrtEntry entry : entries) {
      sb.append(index++).append('\n');
      sb.append(AssTime.formatSrt(entry.start()))
          .append(" --> ")
          .append(AssTime.formatSrt(entry.end()))
          .append('\n');
      sb.append(entry.text()).append("\n\n");
    }
    return sb.toString();
  }

  private static double seconds(Matcher matcher, int firstGroup) {
    String millis = matcher.group(firstGroup + 3);
    double fraction = Integer.parseInt(millis) / Math.pow(10, millis.length());
    return Integer.parseInt(matcher.group(firstGroup)) * 3600.0
        + Integer.parseInt(matcher.group(firstGroup + 1)) * 60.0
        + Integer.parseInt(matcher.group(firstGroup + 2))
        + fraction;
  }
}
