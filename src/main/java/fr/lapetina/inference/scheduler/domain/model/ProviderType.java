package fr.lapetina.inference.scheduler.domain.model;

/**
 * Provider families. Each family has one capacity facade.
 *
 * OLLAMA: self-hosted models bounded by parallel slots and VRAM
 * AZURE: metered cloud deployments bounded by per-minute rate limits
 */
public enum ProviderType {
    OLLAMA,
    AZURE;

    public static ProviderType fromString(String value) {
        return valueOf(value.trim().toUpperCase());
    }
}
