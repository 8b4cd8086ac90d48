package com.driftguardian.client;

import com.driftguardian.analysis.FeatureAttributions;
import com.driftguardian.analysis.ModelReference;
import com.driftguardian.exception.AttributionApiException;
import com.driftguardian.exception.AttributionApiUnavailableException;
import com.driftguardian.exception.UnsupportedModelException;
import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.core.WireMockConfiguration;
import org.junit.jupiter.api.*;
import org.springframework.test.util.ReflectionTestUtils;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.Map;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static org.assertj.core.api.Assertions.*;

class AttributionApiClientTest {

    private static WireMockServer wireMock;

    private static final ModelReference MODEL = new ModelReference("credit-v1", "xgboost");
    private static final List<String> FEATURES = List.of("age", "income");
    private static final List<Map<String, Object>> SAMPLE = List.of(
        Map.of("age", 30, "income", 52000.0),
        Map.of("age", 41, "income", 61000.0));

    private AttributionApiClient client;

    @BeforeAll
    static void startWireMock() {
        wireMock = new WireMockServer(WireMockConfiguration.wireMockConfig().dynamicPort());
        wireMock.start();
    }

    @AfterAll
    static void stopWireMock() { wireMock.stop(); }

    @BeforeEach
    void setUp() {
        wireMock.resetAll();
        client = new AttributionApiClient();
        ReflectionTestUtils.setField(client, "baseUrl", wireMock.baseUrl());
        ReflectionTestUtils.setField(client, "timeoutSeconds", 2);
        client.init();
    }

    private void stubAttributions(int status, String body) {
        wireMock.stubFor(post(urlEqualTo("/attributions")).willReturn(aResponse()
            .withStatus(status)
            .withHeader("Content-Type", "application/json")
            .withBody(body)));
    }

    @Test
    void attribute_parsesFeatureMatrix() {
        stubAttributions(200, "{\"features\":[\"age\",\"income\"],\"values\":[[0.1,-0.3],[0.2,0.5]]}");

        StepVerifier.create(client.attributeAsync(MODEL, FEATURES, SAMPLE))
            .assertNext(result -> {
                assertThat(result.features()).containsExactly("age", "income");
                assertThat(result.values()).hasDimensions(2, 2);
                assertThat(result.meanAbsolute()).containsExactly(new double[]{0.15, 0.4}, within(1e-9));
            }).verifyComplete();

        wireMock.verify(postRequestedFor(urlEqualTo("/attributions"))
            .withRequestBody(matchingJsonPath("$.model_id", equalTo("credit-v1")))
            .withRequestBody(matchingJsonPath("$.model_type", equalTo("xgboost")))
            .withRequestBody(matchingJsonPath("$.features[1]", equalTo("income")))
            .withRequestBody(matchingJsonPath("$.rows[1].age", equalTo("41"))));
    }

    @Test
    void attribute_blockingCallReturnsSameResult() {
        stubAttributions(200, "{\"features\":[\"age\",\"income\"],\"values\":[[1.0,2.0]]}");

        FeatureAttributions result = client.attribute(MODEL, FEATURES, SAMPLE);

        assertThat(result.values()[0]).containsExactly(1.0, 2.0);
    }

    @Test
    void status422_meansUnsupportedModel() {
        stubAttributions(422, "{\"detail\":\"tree models only\"}");

        StepVerifier.create(client.attributeAsync(MODEL, FEATURES, SAMPLE))
            .expectError(UnsupportedModelException.class)
            .verify();
    }

    @Test
    void unsupportedModelBody_meansUnsupportedModel() {
        stubAttributions(200, "{\"error\":\"unsupported_model\"}");

        assertThatThrownBy(() -> client.attribute(MODEL, FEATURES, SAMPLE))
            .isInstanceOf(UnsupportedModelException.class)
            .hasMessageContaining("xgboost");
    }

    @Test
    void serverError_meansUnavailableAndIsNotRetried() {
        stubAttributions(503, "{\"detail\":\"warming up\"}");

        StepVerifier.create(client.attributeAsync(MODEL, FEATURES, SAMPLE))
            .expectError(AttributionApiUnavailableException.class)
            .verify();
        wireMock.verify(1, postRequestedFor(urlEqualTo("/attributions")));
    }

    @Test
    void otherClientError_isApiError() {
        stubAttributions(400, "{\"detail\":\"bad rows\"}");

        StepVerifier.create(client.attributeAsync(MODEL, FEATURES, SAMPLE))
            .expectErrorSatisfies(ex -> assertThat(ex)
                .isInstanceOf(AttributionApiException.class)
                .hasMessageContaining("bad rows"))
            .verify();
    }

    @Test
    void malformedResponse_isApiError() {
        stubAttributions(200, "{\"features\":[\"age\",\"income\"],\"values\":[[0.1]]}");

        StepVerifier.create(client.attributeAsync(MODEL, FEATURES, SAMPLE))
            .expectError(AttributionApiException.class)
            .verify();
    }

    @Test
    void connectionRefused_isUnavailable() {
        AttributionApiClient offline = new AttributionApiClient();
        ReflectionTestUtils.setField(offline, "baseUrl", "http://localhost:1");
        ReflectionTestUtils.setField(offline, "timeoutSeconds", 1);
        offline.init();

        StepVerifier.create(offline.attributeAsync(MODEL, FEATURES, SAMPLE))
            .expectError(AttributionApiUnavailableException.class)
            .verify();
    }

    @Test
    void health_reflectsRemoteStatus() {
        wireMock.stubFor(get(urlEqualTo("/health")).willReturn(okJson("{\"status\":\"ok\"}")));
        StepVerifier.create(client.isHealthy()).expectNext(true).verifyComplete();

        wireMock.stubFor(get(urlEqualTo("/health")).willReturn(aResponse().withStatus(500)));
        StepVerifier.create(client.isHealthy()).expectNext(false).verifyComplete();
    }
}
