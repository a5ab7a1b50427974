package com.e2eq.conformance.runtime;

import com.e2eq.conformance.transducer.EndpointKind;
import io.quarkus.runtime.annotations.StaticInitSafe;
import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.time.Duration;
import java.util.Optional;

@StaticInitSafe
@ConfigMapping(prefix = "quantum.conformance")
public interface ConformanceConfig {

    @WithDefault("3")
    int maxAttempts();

    @WithDefault("PT60S")
    Duration attemptTimeout();

    @WithDefault("classpath:/conformance/operands.yaml")
    String operandsResource();

    @WithDefault("classpath:/conformance/shapes.yaml")
    String shapesResource();

    @WithDefault("classpath:/conformance/conflict-strategies.yaml")
    String strategiesResource();

    Transducer transducer();

    interface Transducer {

        @WithDefault("OPENAI_COMPATIBLE")
        EndpointKind endpointKind();

        @WithDefault("http://localhost:11434/v1")
        String baseUrl();

        Optional<String> apiKey();

        @WithDefault("llama3.1")
        String model();

        @WithDefault("0.0")
        double temperature();

        @WithDefault("2024-02-15-preview")
        String apiVersion();
    }
}
