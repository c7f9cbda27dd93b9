package com.cfgval.service.source;

import com.cfgval.generator.grammar.Grammar;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fetches grammars as JSON from {@code {baseUri}/{id}} with the JDK {@link HttpClient}.
 *
 * <p>The payload is {@code {"id", "startSymbol", "productions": [{"nonTerminal", "rightSide"}]}};
 * unknown properties are ignored. A payload without a start symbol counts as malformed.
 */
public final class HttpGrammarSource implements GrammarSource {

    private static final Logger log = LoggerFactory.getLogger(HttpGrammarSource.class);

    private static final ObjectMapper OBJECT_MAPPER =
            JsonMapper.builder()
                    .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                    .build();

    private final HttpClient httpClient;
    private final String baseUri;
    private final Duration requestTimeout;

    public HttpGrammarSource(HttpClient httpClient, URI baseUri, Duration requestTimeout) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        String base = Objects.requireNonNull(baseUri, "baseUri").toString();
        this.baseUri = base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
        this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");
    }

    public static HttpGrammarSource create(URI baseUri, Duration connectTimeout, Duration requestTimeout) {
        HttpClient client =
                HttpClient.newBuilder()
                        .connectTimeout(connectTimeout)
                        .followRedirects(HttpClient.Redirect.NORMAL)
                        .build();
        return new HttpGrammarSource(client, baseUri, requestTimeout);
    }

    @Override
    public CompletableFuture<Optional<Grammar>> fetch(String id) {
        Objects.requireNonNull(id, "id");
        URI uri = grammarUri(id);
        HttpRequest request =
                HttpRequest.newBuilder(uri)
                        .timeout(requestTimeout)
                        .header("Accept", "application/json")
                        .GET()
                        .build();
        return httpClient
                .sendAsync(request, HttpResponse.BodyHandlers.ofByteArray())
                .thenApply(response -> decode(id, response))
                .exceptionally(
                        e -> {
                            Throwable cause =
                                    e instanceof CompletionException && e.getCause() != null
                                            ? e.getCause()
                                            : e;
                            log.warn("Fetching grammar {} from {} failed: {}", id, uri, cause.toString());
                            return Optional.empty();
                        });
    }

    URI grammarUri(String id) {
        String segment = URLEncoder.encode(id, StandardCharsets.UTF_8).replace("+", "%20");
        return URI.create(baseUri + "/" + segment);
    }

    private static Optional<Grammar> decode(String id, HttpResponse<byte[]> response) {
        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            log.warn("Grammar {} not available: HTTP {}", id, response.statusCode());
            return Optional.empty();
        }
        byte[] body = response.body();
        if (body == null || body.length == 0) {
            log.warn("Grammar {} returned an empty body", id);
            return Optional.empty();
        }
        Grammar grammar;
        try {
            grammar = OBJECT_MAPPER.readValue(body, Grammar.class);
        } catch (IOException e) {
            log.warn("Malformed grammar payload for {}: {}", id, e.getMessage());
            return Optional.empty();
        }
        if (grammar == null || grammar.startSymbol() == null || grammar.startSymbol().isBlank()) {
            log.warn("Malformed grammar payload for {}: missing start symbol", id);
            return Optional.empty();
        }
        return Optional.of(grammar);
    }
}
