package fun.fengwk.lss.core.service.search;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Page load and readiness configuration.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "lss.fetch")
public class FetchProperties {

    /**
     * Page navigate timeout in milliseconds.
     */
    private int navigateTimeoutMs = 30000;

    /**
     * Fixed wait after navigation, 0 polls for readiness instead.
     */
    private int settleDelayMs = 0;

    /**
     * Upper bound for the readiness poll.
     */
    private int readyTimeoutMs = 20000;

    /**
     * Interval between readiness checks.
     */
    private int stabilityCheckIntervalMs = 500;

    /**
     * Consecutive unchanged checks after which a page without markers counts as settled.
     */
    private int stabilityThreshold = 4;

    /**
     * Consecutive unchanged checks once an availability marker has rendered, capped by {@link #stabilityThreshold}.
     */
    private int markedStabilityThreshold = 2;

}
