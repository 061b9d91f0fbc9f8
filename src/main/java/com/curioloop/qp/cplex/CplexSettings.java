/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.qp.cplex;

/**
 * Library-level options applied when a CPLEX model is opened.
 * <p>
 * Defaults can be overridden process-wide with the system properties
 * {@value #VERBOSE_PROPERTY} and {@value #THREADS_PROPERTY}.
 * </p>
 */
public final class CplexSettings {

    /** System property enabling CPLEX screen output */
    public static final String VERBOSE_PROPERTY = "qp.cplex.verbose";

    /** System property setting the CPLEX thread count */
    public static final String THREADS_PROPERTY = "qp.cplex.threads";

    private final boolean verbose;
    private final int threads;

    private CplexSettings(Builder builder) {
        this.verbose = builder.verbose;
        this.threads = builder.threads;
    }

    /**
     * Creates a new builder seeded from system properties.
     * @return New builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates default settings.
     * @return Default settings
     */
    public static CplexSettings defaults() {
        return builder().build();
    }

    /**
     * Checks if CPLEX screen output is enabled.
     * @return true if verbose
     */
    public boolean isVerbose() {
        return verbose;
    }

    /**
     * Gets the thread count passed to CPLEX.
     * @return Threads (0 = CPLEX default)
     */
    public int getThreads() {
        return threads;
    }

    @Override
    public String toString() {
        return "CplexSettings{verbose=" + verbose + ", threads=" + threads + '}';
    }

    /**
     * Builder for CPLEX settings.
     */
    public static final class Builder {
        private boolean verbose = Boolean.getBoolean(VERBOSE_PROPERTY);
        private int threads = Integer.getInteger(THREADS_PROPERTY, 0);

        private Builder() {}

        /**
         * Enables or disables CPLEX screen output.
         * @param enable true to print CPLEX logs
         * @return This builder
         */
        public Builder verbose(boolean enable) {
            this.verbose = enable;
            return this;
        }

        /**
         * Sets the thread count.
         * @param n Threads (0 = CPLEX default)
         * @return This builder
         */
        public Builder threads(int n) {
            this.threads = n;
            return this;
        }

        /**
         * Builds the settings.
         * @return Settings
         * @throws IllegalArgumentException if threads is negative
         */
        public CplexSettings build() {
            if (threads < 0) {
                throw new IllegalArgumentException("Threads must be non-negative");
            }
            return new CplexSettings(this);
        }
    }
}
