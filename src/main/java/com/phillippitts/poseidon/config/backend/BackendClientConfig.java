package com.phillippitts.poseidon.config.backend;

import com.phillippitts.poseidon.service.extraction.direct.StormglassClient;
import com.phillippitts.poseidon.service.extraction.vision.OpenAiCompatibleVisionClient;
import com.phillippitts.poseidon.service.extraction.vision.VisionModelClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.ClientHttpRequestFactory;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.time.Duration;

/**
 * HTTP clients for the remote extraction backends.
 *
 * <p>Read timeouts equal each backend's own timeout so a worker thread is released at about the
 * moment the fan-out gives up on it.
 */
@Configuration
public class BackendClientConfig {

    private static final int MAX_CONNECT_TIMEOUT_MS = 10_000;

    @Bean
    public VisionModelClient visionModelClient(VisionModelConfig config, RestClient.Builder builder) {
        RestClient restClient = builder
                .baseUrl(config.baseUrl())
                .requestFactory(requestFactory(config.timeout()))
                .build();
        return new OpenAiCompatibleVisionClient(restClient, config);
    }

    @Bean
    public StormglassClient stormglassClient(DirectApiConfig config, RestClient.Builder builder) {
        RestClient restClient = builder
                .baseUrl(config.baseUrl())
                .requestFactory(requestFactory(config.timeout()))
                .build();
        return new StormglassClient(restClient, config);
    }

    static ClientHttpRequestFactory requestFactory(Duration timeout) {
        int timeoutMs = (int) Math.min(Integer.MAX_VALUE, timeout.toMillis());
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(Math.min(timeoutMs, MAX_CONNECT_TIMEOUT_MS));
        factory.setReadTimeout(timeoutMs);
        return factory;
    }
}
