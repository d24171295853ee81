package fr.lapetina.inference.scheduler.domain.model;

import java.net.URI;
import java.util.Objects;

/**
 * One addressable model deployment: a self-hosted model instance
 * or a cloud deployment. Immutable.
 */
public final class Backend {
    private final String id;
    private final ProviderType providerType;
    private final String providerName;
    private final String modelName;
    private final int maxConcurrentRequests;
    private final long requiredVramMb;
    private final URI endpoint;

    private Backend(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "Backend ID is required");
        this.providerType = Objects.requireNonNull(builder.providerType, "Provider type is required");
        this.providerName = Objects.requireNonNull(builder.providerName, "Provider name is required");
        this.modelName = builder.modelName != null ? builder.modelName : builder.id;
        if (builder.maxConcurrentRequests < 1) {
            throw new IllegalArgumentException(
                    "maxConcurrentRequests must be at least 1: " + builder.maxConcurrentRequests);
        }
        this.maxConcurrentRequests = builder.maxConcurrentRequests;
        this.requiredVramMb = builder.requiredVramMb;
        this.endpoint = builder.endpoint;
    }

    public String getId() {
        return id;
    }

    public ProviderType getProviderType() {
        return providerType;
    }

    public String getProviderName() {
        return providerName;
    }

    public String getModelName() {
        return modelName;
    }

    public int getMaxConcurrentRequests() {
        return maxConcurrentRequests;
    }

    /**
     * VRAM needed to load the model, in MB. Zero when unknown or not applicable.
     */
    public long getRequiredVramMb() {
        return requiredVramMb;
    }

    public URI getEndpoint() {
        return endpoint;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Backend that = (Backend) o;
        return id.equals(that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Backend{" +
                "id='" + id + '\'' +
                ", provider=" + providerType + "/" + providerName +
                ", model='" + modelName + '\'' +
                ", maxConcurrent=" + maxConcurrentRequests +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private ProviderType providerType;
        private String providerName;
        private String modelName;
        private int maxConcurrentRequests = 1;
        private long requiredVramMb;
        private URI endpoint;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder providerType(ProviderType providerType) {
            this.providerType = providerType;
            return this;
        }

        public Builder providerName(String providerName) {
            this.providerName = providerName;
            return this;
        }

        public Builder modelName(String modelName) {
            this.modelName = modelName;
            return this;
        }

        public Builder maxConcurrentRequests(int max) {
            this.maxConcurrentRequests = max;
            return this;
        }

        public Builder requiredVramMb(long requiredVramMb) {
            this.requiredVramMb = requiredVramMb;
            return this;
        }

        public Builder endpoint(String endpoint) {
            this.endpoint = endpoint != null ? URI.create(endpoint) : null;
            return this;
        }

        public Builder endpoint(URI endpoint) {
            this.endpoint = endpoint;
            return this;
        }

        public Backend build() {
            return new Backend(this);
        }
    }
}
