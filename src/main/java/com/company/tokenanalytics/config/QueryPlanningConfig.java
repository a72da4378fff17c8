package com.company.tokenanalytics.config;

import com.company.tokenanalytics.query.KqlPlanRenderer;
import com.company.tokenanalytics.query.QueryPlanBuilder;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(TokenAnalyticsProperties.class)
public class QueryPlanningConfig {

    @Bean
    public QueryPlanBuilder queryPlanBuilder(TokenAnalyticsProperties properties) {
        return new QueryPlanBuilder(properties.getEventSchema());
    }

    @Bean
    public KqlPlanRenderer kqlPlanRenderer(TokenAnalyticsProperties properties) {
        return new KqlPlanRenderer(properties.getEventSchema());
    }
}
