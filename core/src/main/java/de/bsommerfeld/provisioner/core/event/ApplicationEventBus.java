package de.bsommerfeld.provisioner.core.event;

import com.google.common.eventbus.EventBus;
import com.google.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Thin wrapper around Guava's {@link EventBus}. The installer posts
 * {@link ProvisioningEvents} here; reporters and front ends subscribe
 * without the engine knowing about them.
 *
 * <p>
 * Delivery is synchronous on the posting thread. Module progress events are
 * posted from worker threads, so subscribers must be cheap.
 */
@Singleton
public class ApplicationEventBus {

    private static final Logger LOG = LoggerFactory.getLogger(ApplicationEventBus.class);
    private final EventBus eventBus;

    public ApplicationEventBus() {
        this.eventBus = new EventBus((exception, context) -> LOG.error("Event subscriber {} failed on {}",
                context.getSubscriberMethod().getName(), context.getEvent(), exception));
    }

    public void post(Object event) {
        // Progress ticks are too chatty for debug output
        if (!(event instanceof ProvisioningEvents.ModuleProgressEvent)) {
            LOG.debug("Posting event: {}", event);
        }
        eventBus.post(event);
    }

    public void register(Object listener) {
        LOG.trace("Registering listener: {}", listener.getClass().getName());
        eventBus.register(listener);
    }

    public void unregister(Object listener) {
        LOG.trace("Unregistering listener: {}", listener.getClass().getName());
        eventBus.unregister(listener);
    }
}
