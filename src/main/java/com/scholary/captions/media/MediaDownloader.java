package com.scholary.captions.media;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Fetches videos and caption files over HTTP(S).
 *
 * <p>Downloads go to a temp file in the target directory and are moved into place once complete,
 * so a failed transfer never leaves a truncated file behind.
 */
@Component
public class MediaDownloader {

  private static final Logger LOGGER = LoggerFactory.getLogger(MediaDownloader.class);

  private static final String DEFAULT_FILENAME = "video";

  private final HttpClient httpClient;
  private final DownloaderProperties properties;

  public MediaDownloader(DownloaderProperties properties) {
    this.properties = properties;
    this.httpClient =
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.connectTimeout()))
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build();
  }

  /** Whether the value is an absolute http or https URL. */
  public static boolean isHttpUrl(String value) {
    if (value == null) {
      return false;
    }
    try {
      URI uri = new URI(value.trim());
      String scheme = uri.getScheme();
      return scheme != null
          && uri.getHost() != null
          && (scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"));
    } catch (URISyntaxException e) {
      return false;
    }
  }

  /**
   * Fetch a text document, e.g. an SRT or ASS file.
   *
   * @param url http(s) URL
   * @return the body decoded as UTF-8
   * @throws IOException on connection failure or a non-2xx status
   */
  public String fetchText(String url) throws IOException {
    LOGGER.info("Downloading captions from URL: {}", url);
    HttpResponse<byte[]> response = send(url, HttpResponse.BodyHandlers.ofByteArray());
    LOGGER.info("Captions downloaded successfully ({} bytes)", response.body().length);
    return new String(response.body(), StandardCharsets.UTF_8);
  }

  /**
   * Download a file into a directory.
   *
   * @param url http(s) URL
   * @param targetDir existing directory to place the file in
   * @return path of the downloaded file
   * @throws IOException on connection failure, a non-2xx status or a write failure
   */
  public Path download(String url, Path targetDir) throws IOException {
    Path target = targetDir.resolve(filenameFor(url));
    Path temp = Files.createTempFile(targetDir, "download-", ".part");
    LOGGER.info("Downloading {} to {}", url, target);

    try {
      HttpResponse<InputStream> response = send(url, HttpResponse.BodyHandlers.ofInputStream());
      try (InputStream body = response.body()) {
        Files.copy(body, temp, StandardCopyOption.REPLACE_EXISTING);
      }
      Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
    } finally {
      Files.deleteIfExists(temp);
    }

    LOGGER.info("Downloaded {} ({} bytes)", target.getFileName(), Files.size(target));
    return target;
  }

  private <T> HttpResponse<T> send(String url, HttpResponse.BodyHandler<T> handler)
      throws IOException {
    HttpRequest request;
    try {
      request =
          HttpRequest.newBuilder()
              .uri(URI.create(url.trim()))
              .timeout(Duration.ofSeconds(properties.readTimeout()))
              .GET()
              .build();
    } catch (IllegalArgumentException e) {
      throw new IOException("Invalid URL: " + url, e);
    }

    HttpResponse<T> response;
    try {
      response = httpClient.send(request, handler);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IOException("Download interrupted: " + url, e);
    }

    if (response.statusCode() < 200 || response.statusCode() >= 300) {
      if (response.body() instanceof InputStream) {
        ((InputStream) response.body()).close();
      }
      throw new IOException(
          String.format("GET %s returned status %d", url, response.statusCode()));
    }
    return response;
  }

  /** Last path segment of the URL, restricted to safe characters. */
  static String filenameFor(String url) {
    String path;
    try {
      path = URI.create(url.trim()).getPath();
    } catch (IllegalArgumentException e) {
      return DEFAULT_FILENAME;
    }
    if (path == null || path.isEmpty() || path.endsWith("/")) {
      return DEFAULT_FILENAME;
    }
    String name = path.substring(path.lastIndexOf('/') + 1).replaceAll("[^A-Za-z0-9._-]", "_");
    if (name.isEmpty() || name.startsWith(".") || name.toLowerCase(Locale.ROOT).endsWith(".part")) {
      return DEFAULT_FILENAME;
    }
    return name;
  }
}
