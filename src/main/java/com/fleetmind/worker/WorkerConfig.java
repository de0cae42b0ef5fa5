package com.fleetmind.worker;

import com.fleetmind.FleetmindProperties;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class WorkerConfig {

    @Bean
    public ExecutableLocator executableLocator(FleetmindProperties properties) {
        return new ExecutableLocator(properties.getWorker().getExecutable());
    }

    @Bean
    public LaunchRequestFactory launchRequestFactory(ExecutableLocator locator, FleetmindProperties properties) {
        return new LaunchRequestFactory(locator, properties.getWorker());
    }

    /**
     * Local OS processes unless another launcher is registered.
     */
    @Bean
    @ConditionalOnMissingBean(WorkerLauncher.class)
    public WorkerLauncher workerLauncher() {
        return new LocalProcessLauncher();
    }
}
