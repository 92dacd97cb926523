package com.campus.portal.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

@Configuration
public class ClockConfig {

    @Bean
    Clock clock(PortalProperties props) {
        return Clock.system(ZoneId.of(props.getZone()));
    }
}
