package com.bulksubmit.recipient.transfer.api;

import com.bulksubmit.recipient.transfer.model.SubmitterIdentity;
import com.bulksubmit.recipient.transfer.service.Submission;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import okhttp3.mockwebserver.Dispatcher;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.context.WebApplicationContext;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@ActiveProfiles("test")
class BulkSubmitEndpointTest {
    private static final SubmitterIdentity SUBMITTER = new SubmitterIdentity("https://sender.example.org", "acme");

    @Autowired
    private WebApplicationContext context;

    @Autowired
    private ObjectMapper objectMapper;

    private MockMvc mockMvc;
    private MockWebServer server;

    @BeforeEach
    void setUp() throws Exception {
        this.mockMvc = MockMvcBuilders.webAppContextSetup(context).build();
        server = new MockWebServer();
        server.setDispatcher(new Dispatcher() {
            @Override
            public MockResponse dispatch(RecordedRequest request) {
                String path = request.getPath() == null ? "" : request.getPath();
                return switch (path) {
                    case "/export/manifest.json" -> new MockResponse()
                        .setHeader("Content-Type", "application/json")
                        .setBody("{\"transactionTime\":\"2026-01-01T00:00:00Z\",\"request\":\"" + server.url("/$export")
                            + "\",\"requiresAccessToken\":false,\"output\":["
                            + "{\"type\":\"Patient\",\"url\":\"" + server.url("/export/Patient.ndjson") + "\"},"
                            + "{\"type\":\"Observation\",\"url\":\"" + server.url("/export/Observation.ndjson") + "\"}"
                            + "],\"error\":[]}");
                    case "/export/Patient.ndjson" -> new MockResponse()
                        .setHeader("Content-Type", "application/fhir+ndjson")
                        .setBody("{\"resourceType\":\"Patient\",\"id\":\"p1\"}\n");
                    case "/export/Observation.ndjson" -> new MockResponse()
                        .setHeader("Content-Type", "application/fhir+ndjson")
                        .setBody("{\"resourceType\":\"Observation\"}\n");
                    default -> new MockResponse().setResponseCode(404);
                };
            }
        });
        server.start();
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
    }

    @Test
    void missingSubmitterIsRejectedWithOperationOutcome() throws Exception {
        ObjectNode body = parameters();
        stringParam(body, "submissionId", "sub-x");
        stringParam(body, "manifestUrl", server.url("/export/manifest.json").toString());

        mockMvc.perform(post("/$bulk-submit").contentType(MediaType.APPLICATION_JSON).content(body.toString()))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.resourceType").value("OperationOutcome"))
            .andExpect(jsonPath("$.issue[0].code").value("invalid"))
            .andExpect(jsonPath("$.issue[0].diagnostics").value("Missing or invalid submitter parameter"));
    }

    @Test
    void unreadableBodyIsRejected() throws Exception {
        mockMvc.perform(post("/$bulk-submit").contentType(MediaType.APPLICATION_JSON).content("{not json"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.resourceType").value("OperationOutcome"));
    }

    @Test
    void unknownStatusSlugIsNotFound() throws Exception {
        mockMvc.perform(get("/$bulk-submit-status/does-not-exist"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.issue[0].diagnostics")
                .value("No submission found for the given id. Perhaps it expired and was cleaned up."));
    }

    @Test
    void statusKickoffPointsAtSubmission() throws Exception {
        String submissionId = "sub-" + UUID.randomUUID();
        mockMvc.perform(post("/$bulk-submit")
                .contentType(MediaType.APPLICATION_JSON)
                .content(submitBody(submissionId, "in-progress").toString()))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.issue[0].severity").value("information"))
            .andExpect(jsonPath("$.issue[0].diagnostics", startsWith("Job ")));

        String slug = Submission.computeSlug(submissionId, SUBMITTER);
        ObjectNode kickoff = parameters();
        submitterParam(kickoff);
        stringParam(kickoff, "submissionId", submissionId);
        mockMvc.perform(post("/$bulk-submit-status")
                .contentType(MediaType.APPLICATION_JSON)
                .header("Accept", "application/fhir+json")
                .header("Prefer", "respond-async")
                .content(kickoff.toString()))
            .andExpect(status().isAccepted())
            .andExpect(header().string("Content-Location", "http://recipient.test/$bulk-submit-status/" + slug))
            .andExpect(header().string("Cache-Control", "no-cache"));

        mockMvc.perform(post("/$bulk-submit-status")
                .contentType(MediaType.APPLICATION_JSON)
                .header("Prefer", "respond-sync")
                .content(kickoff.toString()))
            .andExpect(status().isBadRequest());

        mockMvc.perform(get("/$bulk-submit-status/" + slug + "/summary"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.slug").value(slug))
            .andExpect(jsonPath("$.submissionId").value(submissionId))
            .andExpect(jsonPath("$.status").value("in-progress"))
            .andExpect(jsonPath("$.jobs.length()").value(1));
    }

    @Test
    void completedSubmissionProducesStatusManifest() throws Exception {
        String submissionId = "sub-" + UUID.randomUUID();
        String manifestUrl = server.url("/export/manifest.json").toString();
        mockMvc.perform(post("/$bulk-submit")
                .contentType(MediaType.APPLICATION_JSON)
                .content(submitBody(submissionId, "complete").toString()))
            .andExpect(status().isOk());

        String slug = Submission.computeSlug(submissionId, SUBMITTER);
        JsonNode manifest = awaitManifest(slug);

        assertThat(manifest.path("extension").path("submissionId").asText()).isEqualTo(submissionId);
        assertThat(manifest.path("output").isArray()).isTrue();
        JsonNode entry = manifest.path("error").get(0);
        assertThat(entry.path("type").asText()).isEqualTo("OperationOutcome");
        assertThat(entry.path("extension").path("manifestUrl").asText()).isEqualTo(manifestUrl);
        assertThat(entry.path("extension").path("countSeverity").path("success").asInt()).isEqualTo(1);
        assertThat(entry.path("extension").path("countSeverity").path("error").asInt()).isEqualTo(1);

        String fileUrl = entry.path("url").asText();
        assertThat(fileUrl).startsWith("http://recipient.test/jobs/" + slug + "/files/");
        String filePath = fileUrl.substring("http://recipient.test".length());
        MvcResult file = mockMvc.perform(get(filePath))
            .andExpect(status().isOk())
            .andExpect(content().contentType("application/fhir+ndjson"))
            .andReturn();
        JsonNode outcome = objectMapper.readTree(file.getResponse().getContentAsString().trim());
        assertThat(outcome.path("resourceType").asText()).isEqualTo("OperationOutcome");
        assertThat(outcome.path("issue").get(0).path("details").path("text").asText())
            .startsWith("Failed to download file Observation.ndjson");

        mockMvc.perform(get("/jobs/" + slug + "/files/missing.ndjson"))
            .andExpect(status().isNotFound());
    }

    private JsonNode awaitManifest(String slug) throws Exception {
        long deadline = System.currentTimeMillis() + 10_000;
        while (System.currentTimeMillis() < deadline) {
            MvcResult result = mockMvc.perform(get("/$bulk-submit-status/" + slug)).andReturn();
            int code = result.getResponse().getStatus();
            if (code == 200) {
                return objectMapper.readTree(result.getResponse().getContentAsString());
            }
            assertThat(code).isEqualTo(202);
            assertThat(result.getResponse().getHeader("X-Progress")).endsWith("% processed");
            Thread.sleep(50);
        }
        throw new AssertionError("Submission " + slug + " did not finish in time");
    }

    private ObjectNode submitBody(String submissionId, String submissionStatus) {
        ObjectNode body = parameters();
        submitterParam(body);
        stringParam(body, "submissionId", submissionId);
        stringParam(body, "manifestUrl", server.url("/export/manifest.json").toString());
        ObjectNode statusParam = ((ArrayNode) body.get("parameter")).addObject();
        statusParam.put("name", "submissionStatus");
        statusParam.putObject("valueCoding").put("code", submissionStatus);
        ObjectNode headers = ((ArrayNode) body.get("parameter")).addObject();
        headers.put("name", "fileRequestHeaders");
        ArrayNode parts = headers.putArray("part");
        parts.addObject().put("name", "headerName").put("valueString", "X-Api-Key");
        parts.addObject().put("name", "headerValue").put("valueString", "secret");
        return body;
    }

    private ObjectNode parameters() {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("resourceType", "Parameters");
        body.putArray("parameter");
        return body;
    }

    private static void submitterParam(ObjectNode body) {
        ObjectNode param = ((ArrayNode) body.get("parameter")).addObject();
        param.put("name", "submitter");
        param.putObject("valueIdentifier")
            .put("system", SUBMITTER.system())
            .put("value", SUBMITTER.value());
    }

    private static void stringParam(ObjectNode body, String name, String value) {
        ((ArrayNode) body.get("parameter")).addObject().put("name", name).put("valueString", value);
    }
}
