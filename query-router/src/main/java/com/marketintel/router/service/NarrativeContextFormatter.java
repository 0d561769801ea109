package com.marketintel.router.service;

import com.marketintel.router.config.QueryRouterProperties;
import com.marketintel.router.model.BasicStats;
import com.marketintel.router.model.CanonicalRecord;
import com.marketintel.router.model.Correlation;
import com.marketintel.router.model.Distribution;
import com.marketintel.router.model.Patterns;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Plain-text summary of a result for the narrative layer.
 *
 * Sections: quick statistics, top records, distribution, patterns. The text is
 * cut at narrative.max-chars so a large result never floods the prompt.
 * Estimated correlations are always labelled as estimates.
 */
@Component
public class NarrativeContextFormatter {

    static final String TRUNCATION_MARK = "\n[truncated]";

    private final QueryRouterProperties.Narrative settings;

    public NarrativeContextFormatter(QueryRouterProperties properties) {
        this.settings = properties.getNarrative();
    }

    public String format(String endpoint, List<CanonicalRecord> records,
                         BasicStats stats, Distribution distribution, Patterns patterns) {
        StringBuilder out = new StringBuilder();

        out.append("Analysis: ").append(endpoint).append('\n');
        out.append("Quick statistics\n");
        line(out, "Areas analyzed: %d", stats.count());
        line(out, "Average score: %.2f", stats.mean());
        line(out, "Median score: %.2f", stats.median());
        line(out, "Standard deviation: %.2f", stats.stdDev());
        line(out, "Score range: %.2f (%s) to %.2f (%s)",
                stats.min().score(), stats.min().area(), stats.max().score(), stats.max().area());
        if (stats.totalPopulation() != null) {
            line(out, "Total population: %.0f", stats.totalPopulation());
        }

        if (!records.isEmpty()) {
            out.append("\nTop areas\n");
            records.stream().limit(settings.getTopRecords()).forEach(r ->
                    line(out, "%d. %s (%s): %.2f", r.getRank(), r.getAreaName(), r.getAreaId(), r.getValue()));
        }

        if (!distribution.buckets().isEmpty()) {
            out.append("\nDistribution\n");
            for (Distribution.Bucket bucket : distribution.buckets()) {
                line(out, "%s: %d areas (%.1f%%)", bucket.range(), bucket.count(), bucket.percentage());
            }
        }
        line(out, "Quartiles: Q1=%.2f Q2=%.2f Q3=%.2f IQR=%.2f",
                distribution.q1(), distribution.q2(), distribution.q3(), distribution.iqr());
        line(out, "Outliers: %d, shape: %s", distribution.outliers().size(),
                distribution.shape().name().toLowerCase(Locale.ROOT));

        appendPatterns(out, patterns);

        return truncate(out.toString());
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private void appendPatterns(StringBuilder out, Patterns patterns) {
        if (!patterns.clusters().isEmpty()) {
            out.append("\nScore bands\n");
            for (Patterns.ScoreCluster cluster : patterns.clusters()) {
                line(out, "%s: %d areas (avg %.2f)", cluster.name(), cluster.size(), cluster.avgScore());
            }
        }
        if (!patterns.correlations().isEmpty()) {
            out.append("\nCorrelations\n");
            for (Correlation c : patterns.correlations()) {
                line(out, "%s: %+.2f (%s)%s", c.factor(), c.coefficient(),
                        c.significance().name().toLowerCase(Locale.ROOT),
                        c.isEstimated() ? " [estimate, not measured]" : "");
            }
        }
        if (!patterns.trends().isEmpty()) {
            out.append("\nTrends\n");
            for (Patterns.Trend trend : patterns.trends()) {
                line(out, "%s (%s): %s", trend.pattern(),
                        trend.strength().name().toLowerCase(Locale.ROOT), String.join(", ", trend.areas()));
            }
        }
    }

    private String truncate(String text) {
        int max = settings.getMaxChars();
        if (text.length() <= max) {
            return text;
        }
        return text.substring(0, Math.max(0, max - TRUNCATION_MARK.length())) + TRUNCATION_MARK;
    }

    private static void line(StringBuilder out, String format, Object... args) {
        out.append("- ").append(String.format(Locale.ROOT, format, args)).append('\n');
    }
}
