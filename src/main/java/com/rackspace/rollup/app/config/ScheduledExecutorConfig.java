/*
 * Copyright 2020 Rackspace US, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.rackspace.rollup.app.config;

import java.time.Clock;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

@Configuration
public class ScheduledExecutorConfig {
    private final RefreshProperties refreshProperties;

    @Autowired
    public ScheduledExecutorConfig(RefreshProperties refreshProperties) {
        this.refreshProperties = refreshProperties;
    }

    @Bean
    public ScheduledExecutorService scheduledExecutorService() {
        return Executors.newScheduledThreadPool(refreshProperties.getProcessingThreads());
    }

    /**
     * Workers that subscribe to refresh jobs. Backed by the scheduled executor so that the
     * thread count is bounded by <code>rollup.refresh.processing-threads</code>.
     */
    @Bean(destroyMethod = "dispose")
    public Scheduler refreshWorkerScheduler(
        @Qualifier("scheduledExecutorService") ScheduledExecutorService executor) {
        return Schedulers.fromExecutorService(executor, "refresh");
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
