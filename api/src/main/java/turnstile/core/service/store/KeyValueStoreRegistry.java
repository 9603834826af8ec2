package turnstile.core.service.store;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;

import io.quarkus.runtime.StartupEvent;
import org.jboss.logging.Logger;

import turnstile.core.config.StoreConfig;
import turnstile.core.port.out.KeyValueStore;
import turnstile.spi.KeyValueStoreProvider;

/**
 * Registry for key-value store providers.
 *
 * <p>Discovers providers via CDI and selects one based on configuration and
 * availability. Selection happens eagerly at startup so no request thread ever
 * blocks on an availability probe.
 */
@ApplicationScoped
public class KeyValueStoreRegistry {

    private static final Logger LOG = Logger.getLogger(KeyValueStoreRegistry.class);

    private final List<KeyValueStoreProvider> providers;
    private final StoreConfig config;

    private volatile KeyValueStoreProvider selectedProvider;
    private volatile KeyValueStore store;

    @Inject
    public KeyValueStoreRegistry(Instance<KeyValueStoreProvider> providers, StoreConfig config) {
        this(providers.stream().toList(), config);
    }

    public KeyValueStoreRegistry(List<KeyValueStoreProvider> providers, StoreConfig config) {
        this.providers = List.copyOf(providers);
        this.config = config;
    }

    void onStart(@Observes StartupEvent event) {
        getSelectedProvider();
        LOG.infof("Key-value store provider initialized: %s", selectedProvider.name());
    }

    public KeyValueStore getStore() {
        if (store == null) {
            synchronized (this) {
                if (store == null) {
                    store = getSelectedProvider().createStore();
                }
            }
        }
        return store;
    }

    public KeyValueStoreProvider getSelectedProvider() {
        if (selectedProvider == null) {
            synchronized (this) {
                if (selectedProvider == null) {
                    selectedProvider = selectProvider();
                }
            }
        }
        return selectedProvider;
    }

    private KeyValueStoreProvider selectProvider() {
        Optional<String> configuredProvider = config.provider();

        if (configuredProvider.isPresent()) {
            var name = configuredProvider.get();
            var configured =
                    providers.stream().filter(p -> p.name().equals(name)).findFirst();
            if (configured.isPresent() && configured.get().isAvailable()) {
                LOG.infof("Using configured key-value store provider: %s", name);
                return configured.get();
            }
            LOG.warnf("Configured key-value store provider '%s' is not available, falling back", name);
        }

        List<KeyValueStoreProvider> availableProviders = providers.stream()
                .sorted(Comparator.comparingInt(KeyValueStoreProvider::priority).reversed())
                .filter(KeyValueStoreProvider::isAvailable)
                .toList();

        LOG.debugf(
                "Available key-value store providers: %s",
                availableProviders.stream().map(KeyValueStoreProvider::name).toList());

        if (!availableProviders.isEmpty()) {
            KeyValueStoreProvider provider = availableProviders.get(0);
            LOG.infof("Using key-value store provider: %s (priority: %d)", provider.name(), provider.priority());
            return provider;
        }

        // Memory provider is always available, so this means it was not registered
        throw new IllegalStateException("No key-value store providers available");
    }
}
