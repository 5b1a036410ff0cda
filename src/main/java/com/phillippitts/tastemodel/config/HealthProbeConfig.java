package com.phillippitts.tastemodel.config;

import com.phillippitts.tastemodel.config.properties.HealthMonitorProperties;
import com.phillippitts.tastemodel.service.health.HttpServingProbe;
import com.phillippitts.tastemodel.service.health.ServingProbe;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Chooses the serving probe.
 *
 * <p>With {@code health.monitor.probe-url} set, the HTTP probe checks that URL. Without it the
 * service is its own serving path, so connectivity is always reported and the score is
 * driven by the request counters alone.
 */
@Configuration
public class HealthProbeConfig {

    private static final Logger LOG = LogManager.getLogger(HealthProbeConfig.class);

    @Bean
    public ServingProbe servingProbe(HealthMonitorProperties properties) {
        String url = properties.getProbeUrl();
        if (url == null || url.isBlank()) {
            LOG.info("No health.monitor.probe-url configured; using in-process probe");
            return () -> true;
        }
        LOG.info("Serving probe: GET {} (timeout {}ms)", url, properties.getProbeTimeoutMs());
        return new HttpServingProbe(url, properties.getProbeTimeoutMs());
    }
}
