package com.scholary.captions.media;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class MediaDownloaderTest {

  @TempDir Path tempDir;

  private HttpServer server;
  private String baseUrl;
  private final MediaDownloader downloader = new MediaDownloader(new DownloaderProperties(5, 5));

  @BeforeEach
  void setUp() throws IOException {
    server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
    server.createContext(
        "/subs.srt", exchange -> respond(exchange, 200, "1\n00:00:00,000 --> 00:00:01,000\nHi\n"));
    server.createContext("/media/clip.mp4", exchange -> respond(exchange, 200, "not really mp4"));
    server.createContext("/missing", exchange -> respond(exchange, 404, "nope"));
    server.start();
    baseUrl = "http://127.0.0.1:" + server.getAddress().getPort();
  }

  @AfterEach
  void tearDown() {
    server.stop(0);
  }

  private static void respond(com.sun.net.httpserver.HttpExchange exchange, int status, String body)
      throws IOException {
    byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
    exchange.sendResponseHeaders(status, bytes.length);
    try (OutputStream out = exchange.getResponseBody()) {
      out.write(bytes);
    }
  }

  @Test
  void isHttpUrl_shouldOnlyAcceptAbsoluteHttpUrls() {
    assertThat(MediaDownloader.isHttpUrl("https://cdn.example.com/a.srt")).isTrue();
    assertThat(MediaDownloader.isHttpUrl("HTTP://example.com")).isTrue();
    assertThat(MediaDownloader.isHttpUrl("ftp://example.com/a.srt")).isFalse();
    assertThat(MediaDownloader.isHttpUrl("1\n00:00:00,000 --> 00:00:01,000\nHi")).isFalse();
    assertThat(MediaDownloader.isHttpUrl(null)).isFalse();
  }

  @Test
  void filenameFor_shouldUseSanitizedLastSegment() {
    assertThat(MediaDownloader.filenameFor("https://x.com/videos/my%20clip.mp4?sig=1"))
        .isEqualTo("my_clip.mp4");
    assertThat(MediaDownloader.filenameFor("https://x.com/")).isEqualTo("video");
    assertThat(MediaDownloader.filenameFor("https://x.com/.hidden")).isEqualTo("video");
  }

  @Test
  void fetchText_shouldReturnBody() throws IOException {
    assertThat(downloader.fetchText(baseUrl + "/subs.srt")).startsWith("1\n00:00:00,000");
  }

  @Test
  void fetchText_shouldFailOnErrorStatus() {
    assertThatThrownBy(() -> downloader.fetchText(baseUrl + "/missing"))
        .isInstanceOf(IOException.class)
        .hasMessageContaining("404");
  }

  @Test
  void download_shouldWriteFileWithoutLeftovers() throws IOException {
    Path file = downloader.download(baseUrl + "/media/clip.mp4", tempDir);

    assertThat(file).isEqualTo(tempDir.resolve("clip.mp4"));
    assertThat(Files.readString(file)).isEqualTo("not really mp4");
    try (Stream<Path> files = Files.list(tempDir)) {
      assertThat(files).containsExactly(file);
    }
  }

  @Test
  void download_shouldLeaveNothingBehindOnFailure() throws IOException {
    assertThatThrownBy(() -> downloader.download(baseUrl + "/missing", tempDir))
        .isInstanceOf(IOException.class);
    try (Stream<Path> files = Files.list(tempDir)) {
      assertThat(files).isEmpty();
    }
  }
}
