package com.scholary.captions.filter;

import com.scholary.captions.ass.AssTime;
import com.scholary.captions.error.CaptionFormatException;
import com.scholary.captions.error.ValidationException;
import com.scholary.captions.source.SrtCodec;
import com.scholary.captions.source.SrtEntry;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Removes captions that overlap excluded time ranges.
 *
 * <p>ASS content is filtered line by line so everything except the dropped {@code Dialogue:} lines
 * stays byte-for-byte the same. SRT content is parsed, filtered and written back with fresh
 * numbering.
 */
public final class ExclusionFilter {

  private static final Logger LOGGER = LoggerFactory.getLogger(ExclusionFilter.class);

  private static final String DIALOGUE_PREFIX = "Dialogue:";

  private ExclusionFilter() {}

  /**
   * Validate the {@code exclude_time_ranges} value of a request.
   *
   * @param raw list of objects with string {@code start} and {@code end}, null for none
   * @return parsed ranges in request order
   * @throws ValidationException if the value or any range is malformed, negative or inverted
   */
  public static List<ExcludeRange> normalizeExcludeRanges(Object raw) {
    if (raw == null) {
      return List.of();
    }
    if (!(raw instanceof List)) {
      throw new ValidationException(
          "'exclude_time_ranges' should be a list of objects with 'start' and 'end' keys.");
    }

    List<ExcludeRange> ranges = new ArrayList<>();
    for (Object item : (List<?>) raw) {
      if (!(item instanceof Map)) {
        throw new ValidationException(
            "'exclude_time_ranges' should be a list of objects with 'start' and 'end' keys.");
      }
      Map<?, ?> range = (Map<?, ?>) item;
      Object start = range.get("start");
      Object end = range.get("end");
      if (!(start instanceof String) || !(end instanceof String)) {
        throw new ValidationException(
            "exclude_time_ranges start/end must be strings in hh:mm:ss.ms format.");
      }
      double startSeconds = AssTime.parseTimeString((String) start);
      double endSeconds = AssTime.parseTimeString((String) end);
      if (startSeconds < 0 || endSeconds < 0) {
        throw new ValidationException("exclude_time_ranges start/end must be non-negative.");
      }
      if (endSeconds <= startSeconds) {
        throw new ValidationException(
            "exclude_time_ranges end must be strictly greater than start.");
      }
      ranges.add(new ExcludeRange(startSeconds, endSeconds));
    }
    return ranges;
  }

  /**
   * Drop captions overlapping any range.
   *
   * @param content ASS script or SRT text
   * @param ranges ranges to exclude; empty leaves the content untouched
   * @param kind format of the content
   * @return filtered content
   * @throws CaptionFormatException if SRT content cannot be parsed
   */
  public static String filter(String content, List<ExcludeRange> ranges, SubtitleKind kind) {
    if (ranges.isEmpty()) {
      return content;
    }
    switch (kind) {
      case ASS:
        return filterAss(content, ranges);
      case SRT:
        return filterSrt(content, ranges);
      default:
        return content;
    }
  }

  private static String filterAss(String content, List<ExcludeRange> ranges) {
    // limit -1 keeps the trailing empty element, so a final newline survives the join
    String[] lines = content.split("\\R", -1);
    List<String> kept = new ArrayList<>(lines.length);
    int dropped = 0;
    for (String line : lines) {
      if (line.startsWith(DIALOGUE_PREFIX)) {
        String[] fields = line.split(",", 10);
        if (fields.length > 3
            && overlapsAny(AssTime.parse(fields[1]), AssTime.parse(fields[2]), ranges)) {
          dropped++;
          continue;
        }
      }
      kept.add(line);
    }
    LOGGER.info("Excluded {} dialogue lines across {} ranges", dropped, ranges.size());
    return String.join("\n", kept);
  }

  private static String filterSrt(String content, List<ExcludeRange> ranges) {
    List<SrtEntry> entries =
        SrtCodec.tryParse(content)
            .orElseThrow(() -> new CaptionFormatException("Invalid SRT format"));
    List<SrtEntry> kept = new ArrayList<>();
    for (SrtEntry entry : entries) {
      if (!overlapsAny(entry.start(), entry.end(), ranges)) {
        kept.add(entry);
      }
    }
    LOGGER.info(
        "Excluded {} SRT blocks across {} ranges", entries.size() - kept.size(), ranges.size());
    return SrtCodec.compose(kept);
  }

  private static boolean overlapsAny(double start, double end, List<ExcludeRange> ranges) {
    for (ExcludeRange range : ranges) {
      if (range.overlaps(start, end)) {
        return true;
      }
    }
    return false;
  }
}
