package com.scholary.captions.style;

import com.scholary.captions.error.ValidationException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Case-insensitive literal substring replacement applied to caption text.
 *
 * <p>The find string is matched literally (no regex semantics) and the replacement is inserted
 * literally.
 */
public record ReplaceRule(String find, String replace) {

  private static final Logger LOGGER = LoggerFactory.getLogger(ReplaceRule.class);

  public ReplaceRule {
    if (find == null || find.isEmpty()) {
      throw new IllegalArgumentException("Replace rule needs a non-empty find string");
    }
    replace = replace == null ? "" : replace;
  }

  public String apply(String text) {
    Matcher matcher =
        Pattern.compile(Pattern.quote(find), Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE)
            .matcher(text);
    return matcher.replaceAll(Matcher.quoteReplacement(replace));
  }

  /**
   * Parse the {@code replace} value of a request.
   *
   * <p>Entries that are not objects with string {@code find} and {@code replace} keys are skipped
   * with a warning. When the same find string appears twice, the later replacement wins and keeps
   * the position of the first.
   *
   * @param raw the raw request value, null means no replacements
   * @return rules in application order
   * @throws ValidationException if the value is not a list
   */
  public static List<ReplaceRule> parseAll(Object raw) {
    if (raw == null) {
      return List.of();
    }
    if (!(raw instanceof List)) {
      throw new ValidationException(
          "'replace' should be a list of objects with 'find' and 'replace' keys.");
    }

    Map<String, String> rules = new LinkedHashMap<>();
    for (Object item : (List<?>) raw) {
      if (!(item instanceof Map)) {
        LOGGER.warn("Invalid replace item {}. Skipping.", item);
        continue;
      }
      Map<?, ?> entry = (Map<?, ?>) item;
      Object find = entry.get("find");
      Object replacement = entry.get("replace");
      if (!(find instanceof String)
          || ((String) find).isEmpty()
          || !(replacement instanceof String)) {
        LOGGER.warn("Invalid replace item {}. Skipping.", item);
        continue;
      }
      rules.put((String) find, (String) replacement);
    }

    List<ReplaceRule> parsed = new ArrayList<>();
    rules.forEach((find, replacement) -> parsed.add(new ReplaceRule(find, replacement)));
    return parsed;
  }
}
