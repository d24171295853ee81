package fr.lapetina.inference.scheduler.infrastructure.ollama;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * Body of Ollama's {@code GET /api/ps}: the models currently resident in memory.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RunningModelsResponse(List<RunningModel> models) {

    public RunningModelsResponse {
        models = models != null ? List.copyOf(models) : List.of();
    }

    /**
     * @param sizeVram  bytes of the model held in VRAM
     * @param expiresAt end of the keep-alive window
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record RunningModel(
            String name,
            String model,
            long size,
            @JsonProperty("size_vram") long sizeVram,
            @JsonProperty("expires_at") OffsetDateTime expiresAt
    ) {
    }
}
