package com.cfgval.service;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/** Settings bound from the {@code validator.*} namespace. */
@ConfigurationProperties("validator")
public record ValidatorProperties(
        @DefaultValue Source grammarSource, @DefaultValue Cors cors) {

    /** Where grammars are fetched from; the id is appended as the last path segment. */
    public record Source(
            @DefaultValue("https://localhost:7107/api/grammar") URI baseUrl,
            @DefaultValue("5s") Duration connectTimeout,
            @DefaultValue("10s") Duration requestTimeout) {}

    public record Cors(
            @DefaultValue({"http://localhost:3000", "http://localhost:5173"})
                    List<String> allowedOrigins) {}
}
