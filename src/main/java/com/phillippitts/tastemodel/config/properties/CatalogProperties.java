package com.phillippitts.tastemodel.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration for the track catalog.
 */
@ConfigurationProperties(prefix = "catalog")
public class CatalogProperties {

    /** Optional JSON file with tracks to load at startup. */
    private String seedPath = "";

    public String getSeedPath() {
        return seedPath;
    }

    public void setSeedPath(String seedPath) {
        this.seedPath = seedPath;
    }
}
