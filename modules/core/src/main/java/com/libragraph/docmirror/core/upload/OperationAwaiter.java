package com.libragraph.docmirror.core.upload;

import com.libragraph.docmirror.core.config.MirrorConfig;
import com.libragraph.docmirror.core.remote.RemoteClient;
import com.libragraph.docmirror.core.remote.RemoteOperation;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.time.Duration;

/**
 * Polls a remote operation at a fixed interval until it is done. After the first status check
 * at most {@code max-poll-attempts} further polls are made.
 */
@ApplicationScoped
public class OperationAwaiter {

    private static final Logger log = Logger.getLogger(OperationAwaiter.class);

    private RemoteClient remote;
    private Duration pollInterval;
    private int maxPollAttempts;

    @Inject
    public OperationAwaiter(RemoteClient remote, MirrorConfig config) {
        this(remote, config.worker().pollInterval(), config.worker().maxPollAttempts());
    }

    public OperationAwaiter(RemoteClient remote, Duration pollInterval, int maxPollAttempts) {
        if (maxPollAttempts < 1) {
            throw new IllegalArgumentException("maxPollAttempts must be at least 1: " + maxPollAttempts);
        }
        this.remote = remote;
        this.pollInterval = pollInterval;
        this.maxPollAttempts = maxPollAttempts;
    }

    /**
     * Blocks until the operation is done.
     *
     * @throws OperationTimeoutException when the polls run out first
     */
    public RemoteOperation await(RemoteOperation operation) {
        if (operation.done()) {
            return operation;
        }
        String name = operation.name();
        return Uni.createFrom().item(() -> remote.getOperation(name))
                .onItem().transform(op -> {
                    if (!op.done()) {
                        log.debugf("Operation %s still running", name);
                        throw new NotDone();
                    }
                    return op;
                })
                .onFailure(NotDone.class).retry()
                    .withBackOff(pollInterval, pollInterval)
                    .withJitter(0)
                    .atMost(maxPollAttempts)
                .onFailure(NotDone.class)
                    .transform(e -> new OperationTimeoutException(name, maxPollAttempts))
                .await().indefinitely();
    }

    private static final class NotDone extends RuntimeException {
        NotDone() {
            super(null, null, false, false);
        }
    }
}
