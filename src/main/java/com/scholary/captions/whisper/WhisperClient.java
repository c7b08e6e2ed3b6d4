package com.scholary.captions.whisper;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.captions.transcript.TranscriptionResult;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublisher;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * HTTP client for the Whisper transcription API.
 *
 * <p>Sends the whole media file as multipart/form-data with word timestamps enabled, parses the
 * response, and retries transient failures with exponential backoff.
 *
 * <p>The multipart body is built by hand because {@link HttpClient} has no multipart support.
 */
@Component
public class WhisperClient implements WhisperService {

  private static final Logger LOGGER = LoggerFactory.getLogger(WhisperClient.class);

  private final HttpClient httpClient;
  private final WhisperProperties properties;
  private final ObjectMapper objectMapper;

  public WhisperClient(WhisperProperties properties, ObjectMapper objectMapper) {
    this.properties = properties;
    this.objectMapper = objectMapper;

    this.httpClient =
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.connectTimeout()))
            .build();

    LOGGER.info("Initialized Whisper client: baseUrl={}", properties.baseUrl());
  }

  @Override
  public TranscriptionResult transcribe(Path mediaFile, String language) {
    String languageHint = language == null || language.isBlank() ? AUTO_LANGUAGE : language;
    LOGGER.info("Transcribing: file={}, language={}", mediaFile.getFileName(), languageHint);

    int attempt = 0;
    Exception lastException = null;

    while (attempt < properties.maxRetries()) {
      try {
        return attemptTranscribe(mediaFile, languageHint, attempt + 1).toTranscriptionResult();
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new WhisperException("Transcription interrupted", attempt, e);
      } catch (IOException e) {
        lastException = e;
        attempt++;
        if (attempt < properties.maxRetries()) {
          // Exponential backoff with jitter
          long backoffMs = (long) (Math.pow(2, attempt) * 1000 + Math.random() * 1000);
          LOGGER.warn(
              "Transcription attempt {} failed, retrying in {}ms: {}",
              attempt,
              backoffMs,
              e.getMessage());
          try {
            Thread.sleep(backoffMs);
          } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new WhisperException("Transcription interrupted", attempt, ie);
          }
        }
      }
    }

    throw new WhisperException(
        String.format("Transcription failed after %d attempts", attempt),
        attempt,
        lastException);
  }

  private WhisperResponse attemptTranscribe(Path mediaFile, String language, int attempt)
      throws IOException, InterruptedException {

    String boundary = UUID.randomUUID().toString();
    BodyPublisher bodyPublisher = buildMultipartBody(mediaFile, language, boundary);

    HttpRequest request =
        HttpRequest.newBuilder()
            .uri(URI.create(properties.baseUrl() + "/api/v1/transcribe"))
            .timeout(Duration.ofSeconds(properties.readTimeout()))
            .header("Content-Type", "multipart/form-data; boundary=" + boundary)
            .POST(bodyPublisher)
            .build();

    LOGGER.debug("Sending transcription request to {}", request.uri());

    HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

    // A rejected request will be rejected again
    if (response.statusCode() >= 400 && response.statusCode() < 500) {
      throw new WhisperException(
          String.format(
              "Whisper API rejected the request with status %d: %s",
              response.statusCode(), response.body()),
          attempt,
          null);
    }
    if (response.statusCode() != 200) {
      throw new IOException(
          String.format(
              "Whisper API returned status %d: %s", response.statusCode(), response.body()));
    }

    WhisperResponse whisperResponse =
        objectMapper.readValue(response.body(), WhisperResponse.class);

    LOGGER.info(
        "Transcription successful: {} segments, language={}",
        whisperResponse.segments() == null ? 0 : whisperResponse.segments().size(),
        whisperResponse.language());

    return whisperResponse;
  }

  /**
   * Build the multipart/form-data body.
   *
   * <pre>
   * --boundary
   * Content-Disposition: form-data; name="file"; filename="video.mp4"
   * Content-Type: application/octet-stream
   *
   * [binary data]
   * --boundary
   * Content-Disposition: form-data; name="word_timestamps"
   *
   * true
   * --boundary
   * Content-Disposition: form-data; name="language"
   *
   * en
   * --boundary--
   * </pre>
   *
   * <p>The language part is left out for {@code auto}.
   */
  private BodyPublisher buildMultipartBody(Path mediaFile, String language, String boundary)
      throws IOException {

    String filename = mediaFile.getFileName().toString();
    ByteArrayOutputStream body = new ByteArrayOutputStream();

    StringBuilder sb = new StringBuilder();
    sb.append("--").append(boundary).append("\r\n");
    sb.append("Content-Disposition: form-data; name=\"file\"; filename=\"")
        .append(filename)
        .append("\"\r\n");
    sb.append("Content-Type: application/octet-stream\r\n\r\n");
    body.writeBytes(sb.toString().getBytes(StandardCharsets.UTF_8));

    body.writeBytes(Files.readAllBytes(mediaFile));

    sb = new StringBuilder();
    sb.append("\r\n");
    appendField(sb, boundary, "word_timestamps", "true");
    if (!AUTO_LANGUAGE.equalsIgnoreCase(language)) {
      appendField(sb, boundary, "language", language);
    }
    sb.append("--").append(boundary).append("--\r\n");
    body.writeBytes(sb.toString().getBytes(StandardCharsets.UTF_8));

    return BodyPublishers.ofByteArray(body.toByteArray());
  }

  private static void appendField(StringBuilder sb, String boundary, String name, String value) {
    sb.append("--").append(boundary).append("\r\n");
    sb.append("Content-Disposition: form-data; name=\"").append(name).append("\"\r\n\r\n");
    sb.append(value).append("\r\n");
  }
}
