package com.vigil.service.core.config;

import com.vigil.metric.validation.DefaultSeriesValidator;
import com.vigil.metric.validation.SeriesValidator;
import com.vigil.service.core.health.InMemoryStorageCheck;
import com.vigil.service.core.health.JdbcStorageCheck;
import com.vigil.service.core.health.StorageCheck;
import com.vigil.service.core.repo.AnomalyEventRepository;
import com.vigil.service.core.repo.DetectionHistoryRepository;
import com.vigil.service.core.repo.InMemoryAnomalyEventRepository;
import com.vigil.service.core.repo.InMemoryDetectionHistoryRepository;
import com.vigil.service.core.repo.JdbcAnomalyEventRepository;
import com.vigil.service.core.repo.JdbcDetectionHistoryRepository;
import java.time.Clock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

@Configuration
@Slf4j
public class DetectionConfig {

    @Bean
    public Clock systemUtcClock() {
        return Clock.systemUTC();
    }

    @Bean
    public DetectionSettings detectionSettings(VigilProperties properties) {
        DetectionSettings settings = DetectionSettings.from(properties);
        log.info(
                "Detection settings workers={} deadline={} maxSeries={} maxGap={} disabled={}",
                settings.pipeline().workers(),
                settings.pipeline().deadline(),
                settings.pipeline().maxSeries(),
                settings.grouping().maxGap() == null
                        ? settings.grouping().gapIntervals() + "x interval"
                        : settings.grouping().maxGap(),
                settings.disabledDetectors());
        return settings;
    }

    @Bean
    public SeriesValidator seriesValidator() {
        return new DefaultSeriesValidator();
    }

    @Configuration
    @ConditionalOnProperty(prefix = "vigil.persistence", name = "mode", havingValue = "memory", matchIfMissing = true)
    static class InMemoryPersistence {

        @Bean
        public AnomalyEventRepository anomalyEventRepository() {
            return new InMemoryAnomalyEventRepository();
        }

        @Bean
        public DetectionHistoryRepository detectionHistoryRepository() {
            return new InMemoryDetectionHistoryRepository();
        }

        @Bean
        public StorageCheck storageCheck() {
            return new InMemoryStorageCheck();
        }
    }

    @Configuration
    @ConditionalOnProperty(prefix = "vigil.persistence", name = "mode", havingValue = "jdbc")
    static class JdbcPersistence {

        @Bean
        public AnomalyEventRepository anomalyEventRepository(NamedParameterJdbcTemplate jdbc) {
            return new JdbcAnomalyEventRepository(jdbc);
        }

        @Bean
        public DetectionHistoryRepository detectionHistoryRepository(NamedParameterJdbcTemplate jdbc) {
            return new JdbcDetectionHistoryRepository(jdbc);
        }

        @Bean
        public StorageCheck storageCheck(NamedParameterJdbcTemplate jdbc) {
            return new JdbcStorageCheck(jdbc);
        }
    }
}
