package com.scholary.captions.style;

import com.scholary.captions.error.ValidationException;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns the raw {@code settings} object of a request into {@link StyleOptions}.
 *
 * <p>Steps, in order:
 *
 * <ol>
 *   <li>Reject anything that is not a JSON object
 *   <li>Replace hyphens in keys with underscores ({@code font-size} becomes {@code font_size})
 *   <li>Merge the deprecated {@code highlight_color} into {@code word_color}
 *   <li>Coerce every recognized key to its type, falling back to the default when absent
 * </ol>
 *
 * <p>Numbers may be given as JSON numbers or numeric strings, booleans as JSON booleans or the
 * strings {@code "true"}/{@code "false"}. Any other value type is a validation error.
 */
public final class StyleOptionsNormalizer {

  private static final Logger LOGGER = LoggerFactory.getLogger(StyleOptionsNormalizer.class);

  private static final String DEPRECATED_HIGHLIGHT_COLOR = "highlight_color";

  private static final Set<String> KNOWN_KEYS =
      Set.of(
          "font_family",
          "font_size",
          "line_color",
          "word_color",
          "back_color",
          "box_color",
          "outline_color",
          "bold",
          "italic",
          "underline",
          "strikeout",
          "scale_x",
          "scale_y",
          "spacing",
          "angle",
          "border_style",
          "outline_width",
          "shadow_offset",
          "box",
          "margin_l",
          "margin_r",
          "margin_v",
          "position",
          "alignment",
          "x",
          "y",
          "all_caps",
          "max_words_per_line",
          "style");

  private StyleOptionsNormalizer() {}

  /**
   * Normalize raw request settings.
   *
   * @param rawSettings the {@code settings} value of the request, null means no settings
   * @return typed options with defaults applied
   * @throws ValidationException if the settings or one of their values has the wrong type
   */
  public static StyleOptions normalize(Object rawSettings) {
    if (rawSettings == null) {
      return StyleOptions.defaults();
    }
    if (!(rawSettings instanceof Map)) {
      throw new ValidationException("'settings' should be a dictionary.");
    }
    Map<?, ?> rawMap = (Map<?, ?>) rawSettings;

    Map<String, Object> settings = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : rawMap.entrySet()) {
      String key = String.valueOf(entry.getKey()).replace('-', '_');
      settings.put(key, entry.getValue());
    }

    if (settings.containsKey(DEPRECATED_HIGHLIGHT_COLOR)) {
      LOGGER.warn("'highlight_color' is deprecated; merging into 'word_color'.");
      settings.put("word_color", settings.remove(DEPRECATED_HIGHLIGHT_COLOR));
    }

    for (String key : settings.keySet()) {
      if (!KNOWN_KEYS.contains(key)) {
        LOGGER.debug("Ignoring unrecognized style setting: {}", key);
      }
    }

    StyleOptions defaults = StyleOptions.defaults();

    String backColor = asString(settings, "back_color", null);
    String boxColor =
        backColor != null && !backColor.isEmpty()
            ? backColor
            : asString(settings, "box_color", defaults.boxColor());

    return new StyleOptions(
        asString(settings, "font_family", defaults.fontFamily()),
        asInteger(settings, "font_size", null),
        asString(settings, "line_color", defaults.lineColor()),
        asString(settings, "word_color", defaults.wordColor()),
        boxColor,
        asString(settings, "outline_color", defaults.outlineColor()),
        asBoolean(settings, "bold", defaults.bold()),
        asBoolean(settings, "italic", defaults.italic()),
        asBoolean(settings, "underline", defaults.underline()),
        asBoolean(settings, "strikeout", defaults.strikeout()),
        asDouble(settings, "scale_x", defaults.scaleX()),
        asDouble(settings, "scale_y", defaults.scaleY()),
        asDouble(settings, "spacing", defaults.spacing()),
        asDouble(settings, "angle", defaults.angle()),
        asInteger(settings, "border_style", defaults.borderStyle()),
        asDouble(settings, "outline_width", defaults.outlineWidth()),
        asDouble(settings, "shadow_offset", defaults.shadowOffset()),
        asBoolean(settings, "box", defaults.box()),
        asInteger(settings, "margin_l", defaults.marginL()),
        asInteger(settings, "margin_r", defaults.marginR()),
        asInteger(settings, "margin_v", defaults.marginV()),
        asString(settings, "position", defaults.position()),
        asString(settings, "alignment", defaults.alignment()),
        asInteger(settings, "x", null),
        asInteger(settings, "y", null),
        asBoolean(settings, "all_caps", defaults.allCaps()),
        Math.max(0, asInteger(settings, "max_words_per_line", defaults.maxWordsPerLine())),
        asString(settings, "style", defaults.style()).toLowerCase(Locale.ROOT));
  }

  private static String asString(Map<String, Object> settings, String key, String fallback) {
    Object value = settings.get(key);
    if (value == null) {
      return fallback;
    }
    if (value instanceof String || value instanceof Number || value instanceof Boolean) {
      return value.toString();
    }
    throw invalid(key, value, "a string");
  }

  private static Integer asInteger(Map<String, Object> settings, String key, Integer fallback) {
    Object value = settings.get(key);
    if (value == null) {
      return fallback;
    }
    if (value instanceof Number) {
      return ((Number) value).intValue();
    }
    if (value instanceof String) {
      try {
        return (int) Double.parseDouble(((String) value).trim());
      } catch (NumberFormatException e) {
        throw invalid(key, value, "a number");
      }
    }
    throw invalid(key, value, "a number");
  }

  private static double asDouble(Map<String, Object> settings, String key, double fallback) {
    Object value = settings.get(key);
    if (value == null) {
      return fallback;
    }
    if (value instanceof Number) {
      return ((Number) value).doubleValue();
    }
    if (value instanceof String) {
      try {
        return Double.parseDouble(((String) value).trim());
      } catch (NumberFormatException e) {
        throw invalid(key, value, "a number");
      }
    }
    throw invalid(key, value, "a number");
  }

  private static boolean asBoolean(Map<String, Object> settings, String key, boolean fallback) {
    Object value = settings.get(key);
    if (value == null) {
      return fallback;
    }
    if (value instanceof Boolean) {
      return (Boolean) value;
    }
    if (value instanceof String) {
      String normalized = ((String) value).trim().toLowerCase(Locale.ROOT);
      if (normalized.equals("true")) {
        return true;
      }
      if (normalized.equals("false")) {
        return false;
      }
    }
    throw invalid(key, value, "a boolean");
  }

  private static ValidationException invalid(String key, Object value, String expected) {
    return new ValidationException(
        String.format("Setting '%s' must be %s, got: %s", key, expected, value));
  }
}
