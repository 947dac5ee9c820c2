package com.paylens.service.storage.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

import com.paylens.service.core.payments.PaymentAnalyticsService;
import com.paylens.service.core.provider.AnalyticsProvider;
import com.paylens.service.core.provider.AnalyticsSource;
import com.paylens.service.core.sdkevents.SdkEventAnalyticsService;
import com.paylens.service.core.telemetry.AnalyticsTelemetryRegistry;
import javax.sql.DataSource;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

class AnalyticsStorageConfigTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withUserConfiguration(AnalyticsStorageConfig.class)
            .withBean(DataSource.class, () -> mock(DataSource.class));

    @Test
    void defaultsToTheRelationalStore() {
        runner.run(context -> {
            assertThat(context).hasNotFailed();
            assertThat(context.getBean(AnalyticsProvider.class).source()).isEqualTo(AnalyticsSource.SQLX);
            assertThat(context).hasSingleBean(PaymentAnalyticsService.class);
            assertThat(context).hasSingleBean(SdkEventAnalyticsService.class);
            assertThat(context).hasSingleBean(AnalyticsTelemetryRegistry.class);
        });
    }

    @Test
    void combinedSourceWiresBothStores() {
        runner.withPropertyValues(
                        "paylens.analytics.source=combined-ckh",
                        "paylens.analytics.clickhouse.url=http://clickhouse:8123",
                        "paylens.analytics.query.workers=2")
                .run(context -> {
                    assertThat(context.getBean(AnalyticsProvider.class).source())
                            .isEqualTo(AnalyticsSource.COMBINED_CKH);
                    assertThat(context.getBean(AnalyticsProperties.class).getQuery().getWorkers()).isEqualTo(2);
                });
    }

    @Test
    void unknownSourceFailsStartup() {
        runner.withPropertyValues("paylens.analytics.source=mysql")
                .run(context -> assertThat(context).hasFailed());
    }
}
