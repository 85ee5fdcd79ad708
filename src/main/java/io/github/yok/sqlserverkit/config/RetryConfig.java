package io.github.yok.sqlserverkit.config;

import io.github.yok.sqlserverkit.db.RetryPolicy;
import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Retry settings of the administrative commands.
 *
 * <pre>
 * retry:
 *   retry-count: 3
 *   interval: 750ms
 * </pre>
 *
 * @author Yasuharu.Okawauchi
 */
@Component
@ConfigurationProperties(prefix = "retry")
@Data
public class RetryConfig {

    // Number of retries after the first attempt
    private int retryCount = RetryPolicy.DEFAULT_RETRY_COUNT;

    // Delay between two attempts
    private Duration interval = RetryPolicy.DEFAULT_INTERVAL;

    /**
     * Builds the policy from the bound values.
     *
     * @return retry policy
     * @throws IllegalArgumentException if a configured value is out of range
     */
    public RetryPolicy toPolicy() {
        return new RetryPolicy(retryCount, interval);
    }
}
