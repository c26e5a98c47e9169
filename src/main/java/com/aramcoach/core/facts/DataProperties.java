package com.aramcoach.core.facts;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Where per-patch data files live. Each patch is a directory named after the
 * patch id containing {@code champions.json}, {@code items.json},
 * {@code runes.json} and optionally {@code guides.json} and {@code winrates.json}.
 */
@Component
@ConfigurationProperties(prefix = "aramcoach.data")
public class DataProperties {

    private String location = "classpath:data/patches";
    private boolean cacheFacts = true;

    public String getLocation() {
        return location;
    }

    public void setLocation(String location) {
        this.location = location;
    }

    public boolean isCacheFacts() {
        return cacheFacts;
    }

    public void setCacheFacts(boolean cacheFacts) {
        this.cacheFacts = cacheFacts;
    }
}
