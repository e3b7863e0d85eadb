package com.scout.core.portfolio;

import com.scout.core.model.Pattern;

import java.util.List;
import java.util.Objects;

/**
 * Inferred causes for one simultaneous or cascading pattern.
 */
public final class PatternCause {

    private final Pattern pattern;
    private final List<CauseHypothesis> likelyCauses;

    public PatternCause(Pattern pattern, List<CauseHypothesis> likelyCauses) {
        this.pattern = Objects.requireNonNull(pattern, "pattern must not be null");
        this.likelyCauses = List.copyOf(likelyCauses);
    }

    public Pattern getPattern() {
        return pattern;
    }

    public List<CauseHypothesis> getLikelyCauses() {
        return likelyCauses;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof PatternCause that))
            return false;
        return pattern.equals(that.pattern) && likelyCauses.equals(that.likelyCauses);
    }

    @Override
    public int hashCode() {
        return Objects.hash(pattern, likelyCauses);
    }
}
