/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package dev.mars.pgq.api.model;

import java.util.Objects;

/**
 * Time-partitioning policy of a partitioned queue.
 *
 * <p>Every field except {@code defaultPartition} is stored in the partition engine's
 * {@code part_config} row and read back from there. {@code defaultPartition} is a
 * structural fact: on read it reports whether a {@code *_default} child partition
 * currently exists, and it only takes effect when the table is first registered.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0
 */
public final class PartitionConfig {

    public static final String DEFAULT_INTERVAL = "1 day";
    public static final int DEFAULT_PREMAKE = 7;
    public static final String DEFAULT_RETENTION = "14 days";
    public static final String DEFAULT_DATETIME_STRING = "YYYYMMDD";
    public static final int DEFAULT_OPTIMIZE_CONSTRAINT = 30;
    public static final boolean DEFAULT_DEFAULT_PARTITION = true;

    private final String interval;
    private final int premake;
    private final String retention;
    private final String datetimeString;
    private final int optimizeConstraint;
    private final boolean defaultPartition;

    private PartitionConfig(Builder builder) {
        this.interval = Objects.requireNonNull(builder.interval, "interval");
        this.premake = builder.premake;
        this.retention = builder.retention;
        this.datetimeString = builder.datetimeString;
        this.optimizeConstraint = builder.optimizeConstraint;
        this.defaultPartition = builder.defaultPartition;
    }

    public String getInterval() { return interval; }
    public int getPremake() { return premake; }
    public String getRetention() { return retention; }
    public String getDatetimeString() { return datetimeString; }
    public int getOptimizeConstraint() { return optimizeConstraint; }
    public boolean isDefaultPartition() { return defaultPartition; }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .interval(interval)
            .premake(premake)
            .retention(retention)
            .datetimeString(datetimeString)
            .optimizeConstraint(optimizeConstraint)
            .defaultPartition(defaultPartition);
    }

    /**
     * Compares only the fields persisted in {@code part_config}.
     */
    public boolean storedFieldsEqual(PartitionConfig other) {
        return other != null
            && interval.equals(other.interval)
            && premake == other.premake
            && Objects.equals(retention, other.retention)
            && Objects.equals(datetimeString, other.datetimeString)
            && optimizeConstraint == other.optimizeConstraint;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PartitionConfig)) return false;
        PartitionConfig that = (PartitionConfig) o;
        return storedFieldsEqual(that) && defaultPartition == that.defaultPartition;
    }

    @Override
    public int hashCode() {
        return Objects.hash(interval, premake, retention, datetimeString, optimizeConstraint, defaultPartition);
    }

    @Override
    public String toString() {
        return "PartitionConfig{" +
            "interval='" + interval + '\'' +
            ", premake=" + premake +
            ", retention='" + retention + '\'' +
            ", datetimeString='" + datetimeString + '\'' +
            ", optimizeConstraint=" + optimizeConstraint +
            ", defaultPartition=" + defaultPartition +
            '}';
    }

    public static class Builder {
        private String interval = DEFAULT_INTERVAL;
        private int premake = DEFAULT_PREMAKE;
        private String retention = DEFAULT_RETENTION;
        private String datetimeString = DEFAULT_DATETIME_STRING;
        private int optimizeConstraint = DEFAULT_OPTIMIZE_CONSTRAINT;
        private boolean defaultPartition = DEFAULT_DEFAULT_PARTITION;

        public Builder interval(String interval) { this.interval = interval; return this; }
        public Builder premake(int premake) { this.premake = premake; return this; }
        public Builder retention(String retention) { this.retention = retention; return this; }
        public Builder datetimeString(String datetimeString) { this.datetimeString = datetimeString; return this; }
        public Builder optimizeConstraint(int optimizeConstraint) { this.optimizeConstraint = optimizeConstraint; return this; }
        public Builder defaultPartition(boolean defaultPartition) { this.defaultPartition = defaultPartition; return this; }

        public PartitionConfig build() {
            if (interval == null || interval.isBlank()) {
                throw new IllegalArgumentException("Partition interval cannot be null or blank");
            }
            if (premake < 0) {
                throw new IllegalArgumentException("Partition premake must be non-negative");
            }
            return new PartitionConfig(this);
        }
    }
}
