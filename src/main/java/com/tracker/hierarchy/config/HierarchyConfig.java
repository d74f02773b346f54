package com.tracker.hierarchy.config;

import com.tracker.hierarchy.constants.HierarchyConstants;
import com.tracker.hierarchy.model.BuildStrategy;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Hierarchy extraction defaults, used when a request leaves a field unset.
 */
@Configuration
@ConfigurationProperties(prefix = "hierarchy")
public class HierarchyConfig {

    /**
     * Deepest depth any output node may have
     */
    private int maxDepth = HierarchyConstants.Limits.DEFAULT_MAX_DEPTH;

    /**
     * Keep closed leaf items
     */
    private boolean includeClosed = true;

    /**
     * Edge discovery strategy
     */
    private BuildStrategy strategy = BuildStrategy.TRAVERSAL;

    /**
     * Groups fetched up front by the batch strategy
     */
    private List<Long> scopeGroupIds = new ArrayList<>();

    /**
     * Decimal places of completionPct
     */
    private int completionScale = HierarchyConstants.Metrics.COMPLETION_SCALE;

    /**
     * Source of "now" for the metrics pass
     */
    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    // Getters and Setters
    public int getMaxDepth() {
        return maxDepth;
    }

    public void setMaxDepth(int maxDepth) {
        this.maxDepth = maxDepth;
    }

    public boolean isIncludeClosed() {
        return includeClosed;
    }

    public void setIncludeClosed(boolean includeClosed) {
        this.includeClosed = includeClosed;
    }

    public BuildStrategy getStrategy() {
        return strategy;
    }

    public void setStrategy(BuildStrategy strategy) {
        this.strategy = strategy;
    }

    public List<Long> getScopeGroupIds() {
        return scopeGroupIds;
    }

    public void setScopeGroupIds(List<Long> scopeGroupIds) {
        this.scopeGroupIds = scopeGroupIds;
    }

    public int getCompletionScale() {
        return completionScale;
    }

    public void setCompletionScale(int completionScale) {
        this.completionScale = completionScale;
    }
}
