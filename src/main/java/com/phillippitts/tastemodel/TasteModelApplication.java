package com.phillippitts.tastemodel;

import com.phillippitts.tastemodel.config.properties.CatalogProperties;
import com.phillippitts.tastemodel.config.properties.HealthMonitorProperties;
import com.phillippitts.tastemodel.config.properties.PipelineProperties;
import com.phillippitts.tastemodel.config.properties.RegistryProperties;
import com.phillippitts.tastemodel.config.properties.SimilarityProperties;
import com.phillippitts.tastemodel.config.properties.ThreadPoolProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        PipelineProperties.class,
        RegistryProperties.class,
        HealthMonitorProperties.class,
        SimilarityProperties.class,
        CatalogProperties.class,
        ThreadPoolProperties.class
})
@EnableScheduling
public class TasteModelApplication {

    public static void main(String[] args) {
        SpringApplication.run(TasteModelApplication.class, args);
    }

}
