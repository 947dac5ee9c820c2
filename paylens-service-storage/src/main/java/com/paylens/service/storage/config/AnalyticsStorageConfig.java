package com.paylens.service.storage.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.paylens.service.core.fanout.MetricsFanout;
import com.paylens.service.core.provider.AnalyticsProvider;
import com.paylens.service.core.provider.AnalyticsSource;
import com.paylens.service.core.telemetry.AnalyticsTelemetry;
import com.paylens.service.storage.clickhouse.ClickhouseClient;
import com.paylens.service.storage.jdbc.JdbcAnalyticsClient;
import java.net.http.HttpClient;
import javax.sql.DataSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

@Slf4j
@Configuration
@EnableConfigurationProperties(AnalyticsProperties.class)
@ComponentScan(basePackages = {"com.paylens.service.core", "com.paylens.service.storage.config"})
public class AnalyticsStorageConfig {

    @Bean
    @ConditionalOnMissingBean
    public JdbcTemplate jdbcTemplate(DataSource dataSource) {
        return new JdbcTemplate(dataSource);
    }

    @Bean
    public JdbcAnalyticsClient jdbcAnalyticsClient(JdbcTemplate jdbcTemplate) {
        return new JdbcAnalyticsClient(jdbcTemplate);
    }

    @Bean
    public ClickhouseClient clickhouseClient(AnalyticsProperties properties, ObjectProvider<ObjectMapper> mapper) {
        AnalyticsProperties.Clickhouse clickhouse = properties.getClickhouse();
        HttpClient http = HttpClient.newBuilder()
                .connectTimeout(clickhouse.getRequestTimeout())
                .build();
        return new ClickhouseClient(
                http,
                mapper.getIfAvailable(ObjectMapper::new),
                clickhouse.getUrl(),
                clickhouse.getUsername(),
                clickhouse.getPassword(),
                clickhouse.getDatabase(),
                clickhouse.getRequestTimeout());
    }

    @Bean
    public MetricsFanout metricsFanout(AnalyticsQueryExecutor analyticsQueryExecutor) {
        return new MetricsFanout(analyticsQueryExecutor);
    }

    @Bean
    public AnalyticsProvider analyticsProvider(
            AnalyticsProperties properties,
            JdbcAnalyticsClient relational,
            ClickhouseClient columnar,
            AnalyticsTelemetry telemetry,
            AnalyticsQueryExecutor analyticsQueryExecutor) {
        AnalyticsSource source = AnalyticsSource.fromConfigValue(properties.getSource());
        log.info("Analytics provider source={}", source);
        return switch (source) {
            case SQLX -> AnalyticsProvider.sqlx(relational, telemetry);
            case CLICKHOUSE -> AnalyticsProvider.clickhouse(columnar, telemetry);
            case COMBINED_CKH, COMBINED_SQLX -> AnalyticsProvider.combined(
                    source, relational, columnar, telemetry, analyticsQueryExecutor);
        };
    }
}
