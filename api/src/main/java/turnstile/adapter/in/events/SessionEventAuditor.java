package turnstile.adapter.in.events;

import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.quarkus.runtime.StartupEvent;
import org.jboss.logging.Logger;

import turnstile.core.config.SessionConfig;
import turnstile.core.model.session.SessionEvent;
import turnstile.core.port.out.KeyValueStore;
import turnstile.core.service.session.SessionCodec;
import turnstile.core.service.store.KeyValueStoreRegistry;

/**
 * Audits session lifecycle events published by every instance sharing the store.
 *
 * <p>Subscribes to the events channel at startup and writes one log line per event.
 */
@ApplicationScoped
public class SessionEventAuditor {

    private static final Logger LOG = Logger.getLogger(SessionEventAuditor.class);

    private final KeyValueStoreRegistry registry;
    private final SessionConfig.EventsConfig config;
    private final Map<SessionEvent.Type, AtomicLong> counts = new EnumMap<>(SessionEvent.Type.class);

    private volatile KeyValueStore.Subscription subscription;

    @Inject
    public SessionEventAuditor(KeyValueStoreRegistry registry, SessionConfig sessionConfig) {
        this.registry = registry;
        this.config = sessionConfig.events();
        for (var type : SessionEvent.Type.values()) {
            counts.put(type, new AtomicLong());
        }
    }

    void onStart(@Observes StartupEvent event) {
        if (!config.enabled()) {
            LOG.info("Session lifecycle events disabled");
            return;
        }
        registry.getStore()
                .subscribe(config.channel(), this::onMessage)
                .subscribe()
                .with(
                        sub -> {
                            this.subscription = sub;
                            LOG.infof("Subscribed to session events on channel: %s", config.channel());
                        },
                        error -> LOG.warnf(error, "Could not subscribe to session events on %s", config.channel()));
    }

    @PreDestroy
    void cleanup() {
        var current = subscription;
        if (current == null) {
            return;
        }
        subscription = null;
        current.unsubscribe()
                .subscribe()
                .with(
                        ignored -> LOG.info("Unsubscribed from session events"),
                        error -> LOG.warnf(error, "Error unsubscribing from session events"));
    }

    void onMessage(String message) {
        try {
            var event = SessionCodec.readEvent(message);
            if (event.type() == null) {
                LOG.warnf("Session event without type: %s", message);
                return;
            }
            counts.get(event.type()).incrementAndGet();
            LOG.infof(
                    "Session %s: session=%s user=%s at=%d",
                    event.type().name().toLowerCase(Locale.ROOT),
                    event.sessionId(),
                    event.userId(),
                    event.timestamp());
        } catch (JsonProcessingException e) {
            LOG.warnf("Unreadable session event: %s", message);
        }
    }

    /**
     * Number of events of the given type seen by this instance.
     */
    public long count(SessionEvent.Type type) {
        return counts.get(type).get();
    }

    boolean isSubscribed() {
        return subscription != null;
    }
}
