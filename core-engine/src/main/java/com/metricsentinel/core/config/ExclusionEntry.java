package com.metricsentinel.core.config;

import java.util.Objects;

/**
 * One {@code - exclusion: <glob>} item of a rule set.
 *
 * @since 1.0.0
 */
public class ExclusionEntry {

    private String exclusion;

    public ExclusionEntry() {
    }

    public ExclusionEntry(String exclusion) {
        this.exclusion = exclusion;
    }

    public String getExclusion() {
        return exclusion;
    }

    public void setExclusion(String exclusion) {
        this.exclusion = exclusion;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ExclusionEntry that))
            return false;
        return Objects.equals(exclusion, that.exclusion);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(exclusion);
    }

    @Override
    public String toString() {
        return "ExclusionEntry{exclusion='" + exclusion + "'}";
    }
}
