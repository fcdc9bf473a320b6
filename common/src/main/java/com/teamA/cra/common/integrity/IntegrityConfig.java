package com.teamA.cra.common.integrity;

import com.teamA.cra.common.request.RequestStore;
import com.teamA.cra.common.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class IntegrityConfig {

    @Bean
    public StatusIntegrityInspector statusIntegrityInspector(Clock clock) {
        return new StatusIntegrityInspector(clock);
    }

    @Bean
    public StatusIntegrityService statusIntegrityService(RequestStore requestStore, StatusIntegrityInspector inspector) {
        return new StatusIntegrityService(requestStore, inspector);
    }
}
