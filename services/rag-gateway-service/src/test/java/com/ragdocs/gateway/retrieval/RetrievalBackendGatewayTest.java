package com.ragdocs.gateway.retrieval;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.http.HttpMethod.GET;
import static org.springframework.http.HttpMethod.POST;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withException;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ragdocs.gateway.retrieval.dto.BackendGenerateResponse;
import com.ragdocs.gateway.retrieval.dto.BackendSearchResponse;
import com.ragdocs.gateway.retrieval.dto.RawResult;
import java.io.IOException;
import java.net.SocketTimeoutException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

class RetrievalBackendGatewayTest {

    private MockRestServiceServer server;
    private MockRestServiceServer healthServer;
    private RetrievalBackendGateway gateway;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        RestTemplate healthRestTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        healthServer = MockRestServiceServer.bindTo(healthRestTemplate).build();

        RetrievalBackendProperties properties = new RetrievalBackendProperties();
        properties.setBaseUrl("http://retrieval:8000/");
        gateway = new RetrievalBackendGateway(restTemplate, healthRestTemplate, properties, new ObjectMapper());
    }

    @Test
    void searchPostsQueryAndParsesResults() {
        server.expect(requestTo("http://retrieval:8000/api/v1/search"))
            .andExpect(method(POST))
            .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
            .andExpect(jsonPath("$.query").value("install api setup"))
            .andExpect(jsonPath("$.user_id").value("user-1"))
            .andExpect(jsonPath("$.top_k").value(7))
            .andRespond(withSuccess(
                "{\"query\":\"install api setup\",\"results\":[{\"chunk_id\":\"c1\",\"content\":\"Install it.\","
                    + "\"similarity_score\":0.82,\"document_id\":\"doc-1\",\"metadata\":{\"source_file\":\"install.md\","
                    + "\"page\":3,\"chunk_order\":2,\"language\":\"en\"}}],\"query_embedding\":[0.1,0.2]}",
                MediaType.APPLICATION_JSON
            ));

        BackendSearchResponse response = gateway.search("install api setup", "user-1", 7);

        assertThat(response.getResults()).hasSize(1);
        RawResult result = response.getResults().get(0);
        assertThat(result.getChunkId()).isEqualTo("c1");
        assertThat(result.getSimilarityScore()).isEqualTo(0.82);
        assertThat(result.getMetadata().getSourceFile()).isEqualTo("install.md");
        assertThat(result.getMetadata().getPage()).isEqualTo(3);
        assertThat(result.getMetadata().getChunkOrder()).isEqualTo(2);
        assertThat(result.getMetadata().getAdditional()).containsEntry("language", "en");
        assertThat(response.getQueryEmbedding()).containsExactly(0.1, 0.2);
        server.verify();
    }

    @Test
    void missingResultsBecomeEmptyList() {
        server.expect(requestTo("http://retrieval:8000/api/v1/search"))
            .andRespond(withSuccess("{\"query\":\"x\"}", MediaType.APPLICATION_JSON));

        assertThat(gateway.search("x", null, 5).getResults()).isEmpty();
    }

    @Test
    void generateParsesAnswerAndSources() {
        server.expect(requestTo("http://retrieval:8000/api/v1/query"))
            .andExpect(method(POST))
            .andExpect(jsonPath("$.query").value("install api"))
            .andRespond(withSuccess(
                "{\"query\":\"install api\",\"answer\":\"Run the installer.\",\"sources\":[{\"chunk_id\":\"c1\","
                    + "\"content\":\"Install it.\",\"similarity_score\":0.7,\"document_id\":\"doc-1\"}]}",
                MediaType.APPLICATION_JSON
            ));

        BackendGenerateResponse response = gateway.generate("install api", null, 7);

        assertThat(response.getAnswer()).isEqualTo("Run the installer.");
        assertThat(response.getSources()).extracting(RawResult::getDocumentId).containsExactly("doc-1");
        assertThat(response.getSources().get(0).getMetadata()).isNull();
    }

    @Test
    void timeoutMapsToUnavailable() {
        server.expect(requestTo("http://retrieval:8000/api/v1/search"))
            .andRespond(withException(new SocketTimeoutException("Read timed out")));

        assertThatThrownBy(() -> gateway.search("install api", null, 5))
            .isInstanceOf(RetrievalUnavailableException.class)
            .hasMessage("Retrieval service timed out");
    }

    @Test
    void connectionFailureMapsToUnavailable() {
        server.expect(requestTo("http://retrieval:8000/api/v1/search"))
            .andRespond(withException(new IOException("Connection refused")));

        assertThatThrownBy(() -> gateway.search("install api", null, 5))
            .isInstanceOf(RetrievalUnavailableException.class)
            .hasMessage("Retrieval service is unavailable");
    }

    @Test
    void errorStatusCarriesBackendDetail() {
        server.expect(requestTo("http://retrieval:8000/api/v1/query"))
            .andRespond(withStatus(HttpStatus.INTERNAL_SERVER_ERROR)
                .contentType(MediaType.APPLICATION_JSON)
                .body("{\"detail\":\"index not loaded\"}"));

        assertThatThrownBy(() -> gateway.generate("install api", null, 5))
            .isInstanceOfSatisfying(RetrievalBackendException.class, ex -> {
                assertThat(ex.getStatus()).isEqualTo(500);
                assertThat(ex.getDetail()).isEqualTo("index not loaded");
                assertThat(ex.getMessage()).isEqualTo("Retrieval service error: 500 - index not loaded");
            });
    }

    @Test
    void errorWithoutDetailUsesUnknownError() {
        server.expect(requestTo("http://retrieval:8000/api/v1/search"))
            .andRespond(withStatus(HttpStatus.BAD_REQUEST).body("not json"));

        assertThatThrownBy(() -> gateway.search("install api", null, 5))
            .isInstanceOfSatisfying(RetrievalBackendException.class, ex -> {
                assertThat(ex.getStatus()).isEqualTo(400);
                assertThat(ex.getDetail()).isEqualTo("Unknown error");
            });
    }

    @Test
    void healthReflectsBackendStatus() {
        healthServer.expect(requestTo("http://retrieval:8000/health"))
            .andExpect(method(GET))
            .andRespond(withSuccess("{\"status\":\"healthy\"}", MediaType.APPLICATION_JSON));
        healthServer.expect(requestTo("http://retrieval:8000/health"))
            .andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE));

        assertThat(gateway.health()).isTrue();
        assertThat(gateway.health()).isFalse();
        healthServer.verify();
    }

    @Test
    void abbreviateTruncatesLongQueries() {
        assertThat(RetrievalBackendGateway.abbreviate("a".repeat(60))).isEqualTo("a".repeat(50) + "...");
        assertThat(RetrievalBackendGateway.abbreviate("short")).isEqualTo("short");
    }
}
