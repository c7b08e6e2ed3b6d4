package com.scholary.captions.fonts;

import com.scholary.captions.media.CommandRunner;
import com.scholary.captions.media.CommandRunner.CommandResult;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * {@link FontScanner} using fontconfig.
 *
 * <p>System families come from {@code fc-list : family}. Every {@code .ttf}/{@code .otf} file in
 * the custom directory is offered under its file name; its real family name is looked up with
 * {@code fc-query} so the ASS file names something fontconfig can resolve.
 */
@Component
public class FontconfigScanner implements FontScanner {

  private static final Logger LOGGER = LoggerFactory.getLogger(FontconfigScanner.class);

  // fontconfig already aliases these file names to the right weight/slant; mapping them to their
  // family would lose bold/italic
  static final Set<String> FONTCONFIG_ALIAS_NAMES = Set.of("arialbd", "ariali", "arialbi");

  private final CommandRunner commandRunner;
  private final FontProperties properties;

  public FontconfigScanner(CommandRunner commandRunner, FontProperties properties) {
    this.commandRunner = commandRunner;
    this.properties = properties;
  }

  @Override
  public FontSnapshot scan() {
    Set<String> systemFamilies = listSystemFamilies();

    Set<String> customNames = new HashSet<>();
    Map<String, String> customFamilies = new HashMap<>();
    for (Path file : listCustomFontFiles()) {
      String name = stripExtension(file.getFileName().toString());
      customNames.add(name);
      if (FONTCONFIG_ALIAS_NAMES.contains(name.toLowerCase(Locale.ROOT))) {
        continue;
      }
      queryFamily(file).ifPresent(family -> customFamilies.put(name, family));
    }

    LOGGER.info(
        "Fonts scanned: {} system families, {} custom names, {} name->family mappings from {}",
        systemFamilies.size(),
        customNames.size(),
        customFamilies.size(),
        properties.customDir());
    return new FontSnapshot(systemFamilies, customNames, customFamilies);
  }

  private Set<String> listSystemFamilies() {
    try {
      CommandResult result = commandRunner.run(List.of("fc-list", ":", "family"), timeout());
      if (!result.isSuccess()) {
        LOGGER.debug("fc-list not used: exit code {}", result.exitCode());
        return Set.of();
      }
      return parseFamilies(result.stdout());
    } catch (IOException e) {
      LOGGER.debug("fc-list not used: {}", e.getMessage());
      return Set.of();
    }
  }

  private List<Path> listCustomFontFiles() {
    Path dir = Paths.get(properties.customDir());
    if (!Files.isDirectory(dir)) {
      return List.of();
    }
    try (Stream<Path> files = Files.list(dir)) {
      return files
          .filter(Files::isRegularFile)
          .filter(FontconfigScanner::isFontFile)
          .sorted()
          .collect(Collectors.toList());
    } catch (IOException e) {
      LOGGER.warn("Could not list custom fonts in {}: {}", dir, e.getMessage());
      return List.of();
    }
  }

  private Optional<String> queryFamily(Path fontFile) {
    try {
      CommandResult result =
          commandRunner.run(
              List.of("fc-query", "--format=%{family}\n", fontFile.toString()), timeout());
      if (!result.isSuccess()) {
        return Optional.empty();
      }
      return firstFamily(result.stdout());
    } catch (IOException e) {
      LOGGER.debug("fc-query failed for {}: {}", fontFile, e.getMessage());
      return Optional.empty();
    }
  }

  /** Every comma-separated family on every line of {@code fc-list} output. */
  static Set<String> parseFamilies(String fcListOutput) {
    Set<String> families = new HashSet<>();
    for (String line : fcListOutput.split("\\R")) {
      for (String family : line.split(",")) {
        String name = family.trim();
        if (!name.isEmpty()) {
          families.add(name);
        }
      }
    }
    return families;
  }

  /** First family of the first line of {@code fc-query} output. */
  static Optional<String> firstFamily(String fcQueryOutput) {
    String trimmed = fcQueryOutput.trim();
    if (trimmed.isEmpty()) {
      return Optional.empty();
    }
    String family = trimmed.split("\\R")[0].trim().split(",")[0].trim();
    return family.isEmpty() ? Optional.empty() : Optional.of(family);
  }

  private static boolean isFontFile(Path path) {
    String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
    return name.endsWith(".ttf") || name.endsWith(".otf");
  }

  private static String stripExtension(String filename) {
    int dot = filename.lastIndexOf('.');
    return dot > 0 ? filename.substring(0, dot) : filename;
  }

  private Duration timeout() {
    return Duration.ofSeconds(properties.queryTimeoutSeconds());
  }
}
