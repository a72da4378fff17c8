package com.company.tokenanalytics.config;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.binder.MeterBinder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;

/**
 * Application-specific metrics
 */
@Configuration
@Slf4j
@RequiredArgsConstructor
public class MetricsConfiguration {

    private final TokenAnalyticsProperties properties;

    @Bean
    public MeterBinder customMetrics() {
        return (reg) -> {
            // 1 when a workspace is configured, 0 when every query would be refused
            Gauge.builder("log_analytics.workspace.configured", properties,
                            props -> StringUtils.hasText(props.getLogAnalytics().getWorkspaceId()) ? 1 : 0)
                    .description("Whether a Log Analytics workspace is configured")
                    .register(reg);

            log.info("Custom metrics registered");
        };
    }
}
