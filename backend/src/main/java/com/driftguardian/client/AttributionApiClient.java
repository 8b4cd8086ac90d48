package com.driftguardian.client;

import com.driftguardian.analysis.AttributionEngine;
import com.driftguardian.analysis.FeatureAttributions;
import com.driftguardian.analysis.ModelReference;
import com.driftguardian.exception.AttributionApiException;
import com.driftguardian.exception.AttributionApiUnavailableException;
import com.driftguardian.exception.UnsupportedModelException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

@Slf4j
@Component
public class AttributionApiClient implements AttributionEngine {

    static final String UNSUPPORTED_MODEL = "unsupported_model";

    @Value("${attribution.api.base-url}")
    private String baseUrl;

    @Value("${attribution.api.timeout-seconds:30}")
    private int timeoutSeconds;

    private WebClient webClient;
    private final ObjectMapper mapper = new ObjectMapper();

    @PostConstruct
    void init() {
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 5_000)
            .doOnConnected(conn -> conn.addHandlerLast(
                new ReadTimeoutHandler(timeoutSeconds, TimeUnit.SECONDS)));
        this.webClient = WebClient.builder()
            .baseUrl(baseUrl)
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .defaultHeader("Content-Type", "application/json")
            .codecs(c -> c.defaultCodecs().maxInMemorySize(16 * 1024 * 1024))
            .build();
        log.info("AttributionApiClient initialised → {}", baseUrl);
    }

    @Override
    public FeatureAttributions attribute(ModelReference model, List<String> features,
                                         List<Map<String, Object>> sample) {
        return attributeAsync(model, features, sample)
            .blockOptional(Duration.ofSeconds(timeoutSeconds + 5L))
            .orElseThrow(() -> new AttributionApiException("Attribution API returned an empty response"));
    }

    public Mono<FeatureAttributions> attributeAsync(ModelReference model, List<String> features,
                                                    List<Map<String, Object>> sample) {
        return webClient.post().uri("/attributions")
            .bodyValue(buildBody(model, features, sample))
            .retrieve()
            .onStatus(status -> status.value() == HttpStatus.UNPROCESSABLE_ENTITY.value(), resp ->
                resp.bodyToMono(String.class).defaultIfEmpty("")
                    .map(b -> new UnsupportedModelException(model.modelType())))
            .onStatus(HttpStatusCode::is4xxClientError, resp ->
                resp.bodyToMono(String.class).defaultIfEmpty("")
                    .map(b -> new AttributionApiException("Attribution API rejected request (4xx): " + b)))
            .onStatus(HttpStatusCode::is5xxServerError, resp ->
                resp.bodyToMono(String.class).defaultIfEmpty("")
                    .map(b -> new AttributionApiUnavailableException(new RuntimeException(b))))
            .bodyToMono(JsonNode.class)
            .map(json -> toAttributions(json, model))
            .onErrorMap(WebClientRequestException.class, AttributionApiUnavailableException::new);
    }

    public Mono<Boolean> isHealthy() {
        return webClient.get().uri("/health").retrieve()
            .bodyToMono(JsonNode.class)
            .map(json -> json.hasNonNull("status") && "ok".equals(json.get("status").asText()))
            .onErrorReturn(false);
    }

    private FeatureAttributions toAttributions(JsonNode json, ModelReference model) {
        if (json != null && UNSUPPORTED_MODEL.equals(json.path("error").asText(null))) {
            throw new UnsupportedModelException(model.modelType());
        }
        if (json == null || !json.has("features") || !json.has("values")) {
            throw new AttributionApiException("Attribution API response missing 'features' or 'values': "
                + String.valueOf(json));
        }
        List<String> names = new ArrayList<>();
        json.get("features").forEach(n -> names.add(n.asText()));

        JsonNode rows = json.get("values");
        double[][] values = new double[rows.size()][];
        for (int r = 0; r < rows.size(); r++) {
            JsonNode row = rows.get(r);
            if (row.size() != names.size()) {
                throw new AttributionApiException("Attribution row " + r + " has " + row.size()
                    + " values for " + names.size() + " features");
            }
            values[r] = new double[names.size()];
            for (int f = 0; f < names.size(); f++) {
                values[r][f] = row.get(f).asDouble();
            }
        }
        return new FeatureAttributions(List.copyOf(names), values);
    }

    private ObjectNode buildBody(ModelReference model, List<String> features, List<Map<String, Object>> sample) {
        ObjectNode node = mapper.createObjectNode();
        node.put("model_id",   model.modelId());
        node.put("model_type", model.modelType());
        ArrayNode names = node.putArray("features");
        features.forEach(names::add);
        ArrayNode rows = node.putArray("rows");
        sample.forEach(row -> rows.add(mapper.valueToTree(row)));
        return node;
    }
}
