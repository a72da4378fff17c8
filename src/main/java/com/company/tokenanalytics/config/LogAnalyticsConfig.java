package com.company.tokenanalytics.config;

import com.azure.core.credential.TokenCredential;
import com.azure.identity.DefaultAzureCredentialBuilder;
import com.azure.monitor.query.LogsQueryClient;
import com.azure.monitor.query.LogsQueryClientBuilder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;

/**
 * Azure Log Analytics client using the managed identity (or az login locally)
 */
@Configuration
@Slf4j
@RequiredArgsConstructor
public class LogAnalyticsConfig {

    private final TokenAnalyticsProperties properties;

    @Bean
    public TokenCredential azureCredential() {
        return new DefaultAzureCredentialBuilder().build();
    }

    @Bean
    public LogsQueryClient logsQueryClient(TokenCredential azureCredential) {
        if (!StringUtils.hasText(properties.getLogAnalytics().getWorkspaceId())) {
            log.warn("LOG_ANALYTICS_WORKSPACE_ID is not set; analytics queries will fail until it is configured");
        }
        return new LogsQueryClientBuilder()
                .credential(azureCredential)
                .buildClient();
    }
}
