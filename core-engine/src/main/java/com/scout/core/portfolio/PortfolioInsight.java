package com.scout.core.portfolio;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;

/**
 * Headline finding or recommendation derived from a portfolio analysis.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class PortfolioInsight {

    private final String priority;
    private final String headline;
    private final String detail;
    private final String action;

    private PortfolioInsight(String priority, String headline, String detail, String action) {
        this.priority = priority;
        this.headline = Objects.requireNonNull(headline, "headline must not be null");
        this.detail = detail;
        this.action = action;
    }

    public static PortfolioInsight insight(String headline, String detail, String action) {
        return new PortfolioInsight(null, headline, detail, action);
    }

    public static PortfolioInsight recommendation(String priority, String headline, String action) {
        return new PortfolioInsight(priority, headline, null, action);
    }

    public String getPriority() {
        return priority;
    }

    public String getHeadline() {
        return headline;
    }

    public String getDetail() {
        return detail;
    }

    public String getAction() {
        return action;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof PortfolioInsight that))
            return false;
        return Objects.equals(priority, that.priority)
                && headline.equals(that.headline)
                && Objects.equals(detail, that.detail)
                && Objects.equals(action, that.action);
    }

    @Override
    public int hashCode() {
        return Objects.hash(priority, headline, detail, action);
    }

    @Override
    public String toString() {
        return "PortfolioInsight{" + headline + '}';
    }
}
