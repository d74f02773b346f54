package com.tracker.hierarchy.constants;

/**
 * Hierarchy extraction constants
 */
public final class HierarchyConstants {

    private HierarchyConstants() {
        // constants holder
    }

    /**
     * Build limits
     */
    public static final class Limits {
        private Limits() {}

        /** Default deepest depth of a build */
        public static final int DEFAULT_MAX_DEPTH = 20;
    }

    /**
     * Metrics
     */
    public static final class Metrics {
        private Metrics() {}

        /** Decimal places of completionPct */
        public static final int COMPLETION_SCALE = 2;
    }

    /**
     * GitLab REST API
     */
    public static final class GitLab {
        private GitLab() {}

        /** Pagination header carrying the next page number, empty on the last page */
        public static final String NEXT_PAGE_HEADER = "X-Next-Page";

        /** Largest page size the API accepts */
        public static final int MAX_PAGE_SIZE = 100;
    }
}
