package fun.fengwk.lss.core.service.browser.runtime;

import lombok.Builder;
import lombok.Data;

/**
 * Configuration for a worker pool.
 *
 * @author fengwk
 */
@Data
@Builder
public class WorkerPoolConfig {

    /**
     * Fixed worker count, each worker owns one session.
     */
    @Builder.Default
    private int workerCount = 16;

    /**
     * Interval at which idle workers re-check the shutdown flag.
     */
    @Builder.Default
    private long pollIntervalMs = 200;

    /**
     * How long shutdown waits for workers to release their own sessions.
     */
    @Builder.Default
    private long shutdownTimeoutMs = 30000;

}
