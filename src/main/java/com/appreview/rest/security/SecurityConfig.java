package com.appreview.rest.security;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Configuration for API key authentication. Each key identifies one actor;
 * the actor's capabilities come from the {@link com.appreview.directory.ActorDirectory}.
 *
 * <p>Populated from MicroProfile Config:</p>
 * <pre>
 * review-approval.security.enabled=true
 * review-approval.security.api-key-header=X-API-Key
 * review-approval.security.api-keys=ra-key-alice=alice,ra-key-sup1=sup1
 * </pre>
 *
 * <p>With security disabled, requests name their actor in {@link #getActorHeader()}.
 * Only meant for local development.</p>
 */
public class SecurityConfig {

    private final boolean enabled;
    private final String apiKeyHeader;
    private final String actorHeader;
    private final Map<String, String> apiKeys; // key value -> actor id

    private SecurityConfig(Builder builder) {
        this.enabled = builder.enabled;
        this.apiKeyHeader = builder.apiKeyHeader;
        this.actorHeader = builder.actorHeader;
        this.apiKeys = Collections.unmodifiableMap(new HashMap<>(builder.apiKeys));
    }

    public boolean isEnabled() {
        return enabled;
    }

    public String getApiKeyHeader() {
        return apiKeyHeader;
    }

    public String getActorHeader() {
        return actorHeader;
    }

    /**
     * Looks up the actor an API key belongs to.
     *
     * @return the actor id, or null if the key is not recognized
     */
    public String getActorForKey(String apiKey) {
        if (apiKey == null || apiKey.isBlank()) {
            return null;
        }
        return apiKeys.get(apiKey);
    }

    public int keyCount() {
        return apiKeys.size();
    }

    public static SecurityConfig disabled() {
        return builder().enabled(false).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private boolean enabled = true;
        private String apiKeyHeader = "X-API-Key";
        private String actorHeader = "X-Actor-Id";
        private final Map<String, String> apiKeys = new HashMap<>();

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder apiKeyHeader(String apiKeyHeader) {
            if (apiKeyHeader == null || apiKeyHeader.isBlank()) {
                throw new IllegalArgumentException("apiKeyHeader must not be null or blank");
            }
            this.apiKeyHeader = apiKeyHeader;
            return this;
        }

        public Builder actorHeader(String actorHeader) {
            if (actorHeader == null || actorHeader.isBlank()) {
                throw new IllegalArgumentException("actorHeader must not be null or blank");
            }
            this.actorHeader = actorHeader;
            return this;
        }

        public Builder addKey(String key, String actorId) {
            if (key == null || key.isBlank()) {
                throw new IllegalArgumentException("API key must not be null or blank");
            }
            if (actorId == null || actorId.isBlank()) {
                throw new IllegalArgumentException("Actor id must not be null or blank");
            }
            this.apiKeys.put(key, actorId);
            return this;
        }

        /**
         * Adds keys from {@code key=actorId} entries. Blank entries are skipped.
         *
         * @throws IllegalArgumentException for an entry without {@code =}
         */
        public Builder addKeyMappings(Iterable<String> entries) {
            if (entries == null) return this;
            for (String entry : entries) {
                if (entry == null || entry.isBlank()) {
                    continue;
                }
                int separator = entry.indexOf('=');
                if (separator <= 0) {
                    throw new IllegalArgumentException("API key entry must be key=actorId: " + entry);
                }
                addKey(entry.substring(0, separator).trim(), entry.substring(separator + 1).trim());
            }
            return this;
        }

        public SecurityConfig build() {
            return new SecurityConfig(this);
        }
    }

    @Override
    public String toString() {
        return "SecurityConfig{" +
                "enabled=" + enabled +
                ", apiKeyHeader='" + apiKeyHeader + '\'' +
                ", keyCount=" + apiKeys.size() +
                '}';
    }
}
