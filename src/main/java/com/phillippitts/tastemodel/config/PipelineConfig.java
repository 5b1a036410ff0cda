package com.phillippitts.tastemodel.config;

import com.phillippitts.tastemodel.config.properties.PipelineProperties;
import com.phillippitts.tastemodel.service.catalog.TrackCatalogService;
import com.phillippitts.tastemodel.service.health.HealthMonitor;
import com.phillippitts.tastemodel.service.metrics.PipelineMetrics;
import com.phillippitts.tastemodel.service.pipeline.RetrainCoordinator;
import com.phillippitts.tastemodel.service.registry.ModelRegistry;
import com.phillippitts.tastemodel.service.training.Trainer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.event.EventListener;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.Executor;

/**
 * Builds the process-wide {@link RetrainCoordinator} and starts its workers once the
 * application is ready, when {@code pipeline.auto-start} is set.
 */
@Configuration
public class PipelineConfig {

    private static final Logger LOG = LogManager.getLogger(PipelineConfig.class);

    @Bean(destroyMethod = "stop")
    public RetrainCoordinator retrainCoordinator(PipelineProperties properties,
                                                 ModelRegistry registry,
                                                 List<Trainer> trainers,
                                                 TrackCatalogService catalog,
                                                 HealthMonitor healthMonitor,
                                                 @Qualifier("trainingExecutor") Executor trainingExecutor,
                                                 ApplicationEventPublisher publisher,
                                                 PipelineMetrics metrics) {
        return new RetrainCoordinator(properties, registry, trainers, catalog, healthMonitor,
                trainingExecutor, publisher, metrics, Clock.systemUTC());
    }

    @EventListener(ApplicationReadyEvent.class)
    public void autoStart(ApplicationReadyEvent event) {
        PipelineProperties properties = event.getApplicationContext().getBean(PipelineProperties.class);
        if (!properties.isAutoStart()) {
            LOG.info("pipeline.auto-start=false; start via POST /pipeline/start");
            return;
        }
        event.getApplicationContext().getBean(RetrainCoordinator.class).start();
    }
}
