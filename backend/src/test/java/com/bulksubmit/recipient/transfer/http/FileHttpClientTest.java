package com.bulksubmit.recipient.transfer.http;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.bulksubmit.recipient.config.RecipientProperties;
import com.bulksubmit.recipient.transfer.model.IssueType;
import com.bulksubmit.recipient.transfer.model.TransferException;
import com.bulksubmit.recipient.transfer.queue.CancellationSignal;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class FileHttpClientTest {
  private MockWebServer server;
  private ExecutorService executor;
  private FileHttpClient client;

  @BeforeEach
  void setUp() throws Exception {
    server = new MockWebServer();
    server.start();
    RecipientProperties properties = new RecipientProperties();
    properties.setRequestTimeoutSeconds(5);
    executor = Executors.newFixedThreadPool(2);
    client = new FileHttpClient(properties, executor, new ObjectMapper());
  }

  @AfterEach
  void tearDown() throws Exception {
    server.shutdown();
    executor.shutdownNow();
  }

  @Test
  void sendsUserAgentAndForwardedHeaders() throws Exception {
    server.enqueue(new MockResponse().setHeader("Content-Type", "application/json").setBody("{\"ok\":true}"));

    JsonNode body = client.getJson(
        server.url("/manifest.json").toString(),
        Map.of("Authorization", "Bearer abc"),
        new CancellationSignal()
    );

    assertThat(body.path("ok").asBoolean()).isTrue();
    RecordedRequest request = server.takeRequest(1, TimeUnit.SECONDS);
    assertThat(request.getHeader("User-Agent")).isEqualTo("bulk-submit-recipient/0.1");
    assertThat(request.getHeader("Authorization")).isEqualTo("Bearer abc");
  }

  @Test
  void nonSuccessStatusCarriesResponseDescriptor() {
    server.enqueue(new MockResponse().setResponseCode(503).setBody("busy"));
    String url = server.url("/Patient.ndjson").toString();

    assertThatThrownBy(() -> client.open(url, "application/fhir+ndjson", Map.of(), new CancellationSignal()))
        .isInstanceOfSatisfying(TransferException.class, error -> {
          assertThat(error.getMessage()).isEqualTo("Request to " + url + " failed with status 503");
          assertThat(error.getIssueType()).isEqualTo(IssueType.PROCESSING);
          assertThat(error.getContext().response().statusCode()).isEqualTo(503);
          assertThat(error.getContext().response().body()).isEqualTo("busy");
          assertThat(error.getContext().request().url()).isEqualTo(url);
        });
  }

  @Test
  void invalidJsonIsReportedAsInvalid() {
    server.enqueue(new MockResponse().setHeader("Content-Type", "application/json").setBody("{broken"));

    assertThatThrownBy(() -> client.getJson(server.url("/manifest.json").toString(), Map.of(), new CancellationSignal()))
        .isInstanceOfSatisfying(TransferException.class, error ->
            assertThat(error.getIssueType()).isEqualTo(IssueType.INVALID));
  }

  @Test
  void cancelledSignalAbortsBeforeSending() {
    CancellationSignal signal = new CancellationSignal();
    signal.cancel();
    String url = server.url("/Patient.ndjson").toString();

    assertThatThrownBy(() -> client.open(url, null, Map.of(), signal))
        .isInstanceOf(TransferException.class)
        .hasMessage("Request to " + url + " was aborted");
    assertThat(server.getRequestCount()).isZero();
  }

  @Test
  void rejectsNonHttpUrls() {
    assertThatThrownBy(() -> client.open("ftp://example.org/file", null, Map.of(), new CancellationSignal()))
        .isInstanceOf(TransferException.class)
        .hasMessage("Invalid URL ftp://example.org/file");
  }

  @Test
  void streamsBodyAndExposesContentType() throws Exception {
    server.enqueue(new MockResponse().setHeader("Content-Type", "application/fhir+ndjson").setBody("line\n"));

    try (StreamedResponse response = client.open(
        server.url("/Patient.ndjson").toString(), "application/fhir+ndjson", null, new CancellationSignal())) {
      assertThat(response.contentType()).isEqualTo("application/fhir+ndjson");
      assertThat(new String(response.body().readAllBytes(), StandardCharsets.UTF_8)).isEqualTo("line\n");
    }
  }
}
