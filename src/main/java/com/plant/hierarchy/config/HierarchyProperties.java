package com.plant.hierarchy.config;

import com.plant.hierarchy.engine.OrphanPolicy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Data
@Configuration
@ConfigurationProperties(prefix = "hierarchy")
public class HierarchyProperties {

    /**
     * How orphans and cycles are resolved by repair, and how a reparent
     * onto a missing label is treated
     */
    private OrphanPolicy orphanPolicy = OrphanPolicy.REJECT;

    /**
     * Run repair on a freshly built batch before committing it, if it does not validate
     */
    private boolean repairOnRebuild = true;

    private Icons icons = new Icons();
    private Cache cache = new Cache();

    @Data
    public static class Icons {
        private String baseDir = "/tmp/hierarchy_icons";
        private long maxSizeBytes = 1024 * 1024;
    }

    @Data
    public static class Cache {
        private boolean enabled = false;
        private Duration ttl = Duration.ofHours(1);
    }
}
