package turnstile.core.config;

import java.time.Duration;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Key-value store selection and behavior.
 */
@ConfigMapping(prefix = "turnstile.store")
public interface StoreConfig {

    /**
     * Provider name ({@code redis}, {@code memory}). When absent the highest-priority
     * available provider is used.
     */
    Optional<String> provider();

    /**
     * Prefix applied to every key written by the session manager.
     */
    @WithDefault("turnstile:")
    String keyPrefix();

    /**
     * Per-operation timeout for remote stores.
     */
    @WithDefault("PT2S")
    Duration timeout();
}
