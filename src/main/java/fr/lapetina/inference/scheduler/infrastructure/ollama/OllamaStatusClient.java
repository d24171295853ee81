package fr.lapetina.inference.scheduler.infrastructure.ollama;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import fr.lapetina.inference.scheduler.infrastructure.capacity.OllamaCapacityFacade;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Reads the loaded-model state of Ollama servers.
 *
 * Uses java.net.http.HttpClient for non-blocking I/O and Jackson for the JSON body.
 */
public class OllamaStatusClient {

    private static final Logger log = LoggerFactory.getLogger(OllamaStatusClient.class);

    private static final long BYTES_PER_MB = 1024L * 1024L;

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Duration requestTimeout;

    public OllamaStatusClient(Duration connectTimeout, Duration requestTimeout) {
        this.requestTimeout = requestTimeout;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .version(HttpClient.Version.HTTP_1_1)
                .build();
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public OllamaStatusClient() {
        this(Duration.ofSeconds(5), Duration.ofSeconds(5));
    }

    /**
     * Fetches {@code /api/ps} from a server.
     *
     * @param baseUrl server root, e.g. {@code http://gpu-1:11434}
     * @return the resident models; fails with {@link OllamaStatusException} on a non-200 status or bad body
     */
    public CompletableFuture<List<OllamaCapacityFacade.LoadedModel>> fetchLoadedModels(URI baseUrl) {
        URI uri = URI.create(baseUrl.toString().replaceAll("/$", "") + "/api/ps");
        HttpRequest request = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(requestTimeout)
                .GET()
                .build();

        log.debug("Status poll started: uri={}", uri);

        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString())
                .thenApply(response -> {
                    if (response.statusCode() != 200) {
                        throw new CompletionException(new OllamaStatusException(
                                "Unexpected status " + response.statusCode() + " from " + uri));
                    }
                    return parseLoadedModels(response.body());
                });
    }

    /**
     * Converts an {@code /api/ps} body to loaded models, VRAM in MB.
     *
     * @throws OllamaStatusException if the body is not valid JSON
     */
    public List<OllamaCapacityFacade.LoadedModel> parseLoadedModels(String body) {
        RunningModelsResponse response;
        try {
            response = objectMapper.readValue(body, RunningModelsResponse.class);
        } catch (JsonProcessingException e) {
            throw new OllamaStatusException("Invalid /api/ps body: " + e.getOriginalMessage(), e);
        }
        return response.models().stream()
                .map(m -> new OllamaCapacityFacade.LoadedModel(
                        m.name() != null ? m.name() : m.model(),
                        m.sizeVram() / BYTES_PER_MB,
                        m.expiresAt() != null ? m.expiresAt().toInstant() : null))
                .toList();
    }

    /**
     * Failure to read a server's status.
     */
    public static class OllamaStatusException extends RuntimeException {
        public OllamaStatusException(String message) {
            super(message);
        }

        public OllamaStatusException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
