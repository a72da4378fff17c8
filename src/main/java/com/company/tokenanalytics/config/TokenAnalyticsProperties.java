package com.company.tokenanalytics.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Data
@Validated
@ConfigurationProperties(prefix = "token-analytics")
public class TokenAnalyticsProperties {

    /**
     * Names interpolated into query text must be plain identifiers.
     */
    static final String IDENTIFIER = "[A-Za-z_][A-Za-z0-9_]*";

    @Valid
    private LogAnalytics logAnalytics = new LogAnalytics();

    @Valid
    private EventSchema eventSchema = new EventSchema();

    private Cors cors = new Cors();

    @Data
    public static class LogAnalytics {
        /**
         * Log Analytics workspace queried by the service. Empty disables querying.
         */
        private String workspaceId;

        @NotNull
        private Duration queryTimeout = Duration.ofMinutes(3);
    }

    /**
     * Where each plan column is read from in the event log.
     */
    @Data
    public static class EventSchema {
        @NotBlank @Pattern(regexp = IDENTIFIER)
        private String eventTable = "AppTraces";

        @NotBlank @Pattern(regexp = IDENTIFIER)
        private String payloadColumn = "Message";

        @NotBlank @Pattern(regexp = IDENTIFIER)
        private String projectField = "projeto";

        @NotBlank @Pattern(regexp = IDENTIFIER)
        private String executingUserField = "usuario_executor";

        @NotBlank @Pattern(regexp = IDENTIFIER)
        private String modelField = "model_name";

        @NotBlank @Pattern(regexp = IDENTIFIER)
        private String jobIdField = "job_id";

        @NotBlank @Pattern(regexp = IDENTIFIER)
        private String tokensInField = "tokens_entrada";

        @NotBlank @Pattern(regexp = IDENTIFIER)
        private String tokensOutField = "tokens_saida";

        @NotBlank @Pattern(regexp = IDENTIFIER)
        private String timestampColumn = "TimeGenerated";
    }

    @Data
    public static class Cors {
        private List<String> allowedOrigins = new ArrayList<>(List.of("http://localhost:3000"));
    }
}
