package orchestrator.activation;

import orchestrator.exceptions.TransientRejectionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Issues one request per entity and applies a {@link RejectionPolicy} to
 * transient rejections.
 *
 * <p>Only {@link TransientRejectionException} is subject to the policy; any
 * other exception propagates immediately. With {@link RejectionPolicy#REQUEUE}
 * there is no retry limit: a rejected entity is retried until accepted.
 */
public final class RequestDispatcher {

    private static final Logger log = LoggerFactory.getLogger(RequestDispatcher.class);

    /**
     * A mutating request against one entity.
     */
    @FunctionalInterface
    public interface Request<T> {
        void issue(T target);
    }

    private RequestDispatcher() {}

    /**
     * Issues {@code request} for every target.
     *
     * @param action verb for log lines, e.g. "deactivate"
     * @param targets the entities, in issue order
     * @param nameOf extracts an entity's display name
     * @param request the request to issue
     * @param policy how to handle transient rejections
     * @return number of rejections that were swallowed or requeued
     * @throws TransientRejectionException if a request is rejected under {@link RejectionPolicy#PROPAGATE}
     */
    public static <T> int issueAll(String action,
                                   List<? extends T> targets,
                                   Function<? super T, String> nameOf,
                                   Request<? super T> request,
                                   RejectionPolicy policy) {
        Objects.requireNonNull(policy, "policy");
        Deque<T> queue = new ArrayDeque<>(targets);
        int rejections = 0;

        while (!queue.isEmpty()) {
            T target = queue.pollFirst();
            String name = nameOf.apply(target);
            try {
                request.issue(target);
                log.info("Sent {} request for {}", action, name);
            } catch (TransientRejectionException e) {
                switch (policy) {
                    case SWALLOW -> {
                        rejections++;
                        log.debug("Ignoring rejected {} request for {}: {}", action, name, e.getMessage());
                    }
                    case REQUEUE -> {
                        rejections++;
                        log.warn("Failed to {} {}, will retry: {}", action, name, e.getMessage());
                        queue.addLast(target);
                    }
                    case PROPAGATE -> throw e;
                }
            }
        }
        return rejections;
    }
}
