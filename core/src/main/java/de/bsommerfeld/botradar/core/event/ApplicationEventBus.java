package de.bsommerfeld.botradar.core.event;

import com.google.common.eventbus.EventBus;
import com.google.common.eventbus.SubscriberExceptionContext;
import com.google.common.eventbus.SubscriberExceptionHandler;
import com.google.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Delivers {@link DetectionEvents} to report consumers (console output,
 * exporters) so the detectors never reference them directly.
 *
 * <p>
 * Delivery is synchronous on the posting thread. A consumer that throws does
 * not abort the analysis: the failure is logged with the event and the
 * subscriber method, and the remaining consumers still receive the event.
 */
@Singleton
public class ApplicationEventBus {

    private static final Logger LOG = LoggerFactory.getLogger(ApplicationEventBus.class);

    private final EventBus eventBus;
    private final AtomicInteger subscriberFailures = new AtomicInteger();

    public ApplicationEventBus() {
        this.eventBus = new EventBus(new LoggingExceptionHandler());
    }

    public void post(Object event) {
        Objects.requireNonNull(event, "event");
        LOG.debug("Publishing {}", event.getClass().getSimpleName());
        eventBus.post(event);
    }

    public void register(Object listener) {
        LOG.debug("Report consumer registered: {}", listener.getClass().getName());
        eventBus.register(listener);
    }

    public void unregister(Object listener) {
        LOG.debug("Report consumer removed: {}", listener.getClass().getName());
        eventBus.unregister(listener);
    }

    /**
     * @return how many subscriber invocations have thrown since this bus was
     *         created
     */
    public int subscriberFailures() {
        return subscriberFailures.get();
    }

    private final class LoggingExceptionHandler implements SubscriberExceptionHandler {

        @Override
        public void handleException(Throwable exception, SubscriberExceptionContext context) {
            subscriberFailures.incrementAndGet();
            LOG.error("Consumer {}#{} failed on {}",
                    context.getSubscriber().getClass().getSimpleName(),
                    context.getSubscriberMethod().getName(),
                    context.getEvent().getClass().getSimpleName(),
                    exception);
        }
    }
}
