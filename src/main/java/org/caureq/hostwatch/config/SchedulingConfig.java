package org.caureq.hostwatch.config;

import org.springframework.context.SmartLifecycle;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

@Configuration
public class SchedulingConfig {

    /**
     * Dedicated single thread for alert sweeps, so they never compete with servlet threads
     * and two sweeps never overlap.
     */
    @Bean(name = "alertSweepTaskScheduler")
    public ThreadPoolTaskScheduler alertSweepTaskScheduler(AppProps props) {
        ThreadPoolTaskScheduler s = new ThreadPoolTaskScheduler();
        s.setPoolSize(1);
        s.setThreadNamePrefix("alert-sweep-");
        s.setWaitForTasksToCompleteOnShutdown(true);
        s.setAwaitTerminationSeconds(props.alertsOrDefault().shutdownTimeoutOrDefault());
        s.setRemoveOnCancelPolicy(true);
        // stops after AlertSweepScheduler, which waits for the in-flight sweep first
        s.setPhase(SmartLifecycle.DEFAULT_PHASE - 1000);
        return s;
    }
}
