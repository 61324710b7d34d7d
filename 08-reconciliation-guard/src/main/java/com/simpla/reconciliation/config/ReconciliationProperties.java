package com.simpla.reconciliation.config;

import com.simpla.reconciliation.engine.TargetConflictPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "reconciliation")
public class ReconciliationProperties {

    /**
     * Which article number wins when destino_articulo and texto_nuevo disagree.
     */
    private TargetConflictPolicy targetConflictPolicy = TargetConflictPolicy.PREFER_EXPLICIT;

    /**
     * Spring resource location of the manual chapter overrides.
     */
    private String chapterOverridesLocation = "classpath:chapter-overrides.json";

    public TargetConflictPolicy getTargetConflictPolicy() {
        return targetConflictPolicy;
    }

    public void setTargetConflictPolicy(TargetConflictPolicy targetConflictPolicy) {
        this.targetConflictPolicy = targetConflictPolicy;
    }

    public String getChapterOverridesLocation() {
        return chapterOverridesLocation;
    }

    public void setChapterOverridesLocation(String chapterOverridesLocation) {
        this.chapterOverridesLocation = chapterOverridesLocation;
    }
}
