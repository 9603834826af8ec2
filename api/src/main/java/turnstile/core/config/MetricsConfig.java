package turnstile.core.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

@ConfigMapping(prefix = "turnstile.metrics")
public interface MetricsConfig {

    @WithDefault("true")
    boolean enabled();
}
