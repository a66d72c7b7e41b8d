package villagecompute.talentqueue.jobs;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.jboss.logging.Logger;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;

/**
 * Queue → handler mapping built once at startup from the CDI-managed {@link JobHandler} beans.
 *
 * <p>
 * Each queue has at most one handler, and a handler's payload type must be the queue's payload type. Either mistake
 * fails application startup instead of surfacing later as undeliverable jobs.
 */
@ApplicationScoped
public class JobHandlerRegistry {

    private static final Logger LOG = Logger.getLogger(JobHandlerRegistry.class);

    private final Map<JobQueue, JobHandler<?>> handlers;

    @Inject
    public JobHandlerRegistry(Instance<JobHandler<?>> handlers) {
        this((Iterable<JobHandler<?>>) handlers);
    }

    public JobHandlerRegistry(Iterable<? extends JobHandler<?>> handlers) {
        this.handlers = Collections.unmodifiableMap(buildRegistry(handlers));
        LOG.infof("Initialized job handler registry with %d handlers (queues: %s)", this.handlers.size(),
                this.handlers.keySet());
    }

    /**
     * @throws IllegalStateException
     *             if two handlers claim the same queue or a handler's payload type does not match its queue
     */
    private static Map<JobQueue, JobHandler<?>> buildRegistry(Iterable<? extends JobHandler<?>> handlers) {
        Map<JobQueue, JobHandler<?>> registry = new EnumMap<>(JobQueue.class);
        for (JobHandler<?> handler : handlers) {
            JobQueue queue = handler.handlesQueue();
            if (queue == null) {
                throw new IllegalStateException(
                        "Handler " + handler.getClass().getName() + " does not declare a queue");
            }
            if (registry.containsKey(queue)) {
                throw new IllegalStateException("Duplicate handlers registered for queue " + queue.getName() + ": "
                        + registry.get(queue).getClass().getName() + " and " + handler.getClass().getName());
            }
            if (!queue.getPayloadType().equals(handler.payloadType())) {
                throw new IllegalStateException("Handler " + handler.getClass().getName() + " declares payload type "
                        + handler.payloadType().getName() + " but queue " + queue.getName() + " carries "
                        + queue.getPayloadType().getName());
            }
            registry.put(queue, handler);
            LOG.debugf("Registered handler %s for queue %s", handler.getClass().getSimpleName(), queue.getName());
        }
        return registry;
    }

    public Optional<JobHandler<?>> handlerFor(JobQueue queue) {
        return Optional.ofNullable(handlers.get(queue));
    }

    public Set<JobQueue> registeredQueues() {
        return handlers.keySet();
    }

    public int size() {
        return handlers.size();
    }
}
