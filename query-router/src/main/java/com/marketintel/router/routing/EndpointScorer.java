package com.marketintel.router.routing;

import com.marketintel.router.catalog.EndpointKeywordTable;
import com.marketintel.router.catalog.KeywordProfile;
import com.marketintel.router.config.QueryRouterProperties;
import com.marketintel.router.model.EndpointScore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Scores every auto-selectable endpoint against a free-text query.
 *
 * Per endpoint:
 *  1. primary keywords (word-boundary match) × primaryMultiplier × weight
 *  2. context phrases (containment) × contextMultiplier × weight
 *  3. minus avoidPenalty per avoid term present (not weighted)
 *  4. plus the intent bonus for (query intent, endpoint)
 *  5. plus concept bonuses (two or more brands, lifestyle, demographic, SHAP terms)
 *
 * Results are sorted by score descending; equal scores keep keyword table order.
 */
@Component
@Slf4j
public class EndpointScorer {

    private static final Pattern BETWEEN_PLACES = Pattern.compile("between\\s+[A-Z][a-z]+\\s+and\\s+[A-Z][a-z]+");
    private static final Pattern BETWEEN_VERSUS = Pattern.compile("between\\s+\\w+\\s+vs?\\s+\\w+", Pattern.CASE_INSENSITIVE);

    private static final Map<QueryIntent, List<String>> INTENT_KEYWORDS = intentKeywords();

    private final EndpointKeywordTable keywordTable;
    private final FieldKeywordIndex fieldIndex;
    private final QueryRouterProperties.Scoring scoring;

    private final Map<String, Pattern> boundaryPatterns = new ConcurrentHashMap<>();

    public EndpointScorer(EndpointKeywordTable keywordTable,
                          FieldKeywordIndex fieldIndex,
                          QueryRouterProperties properties) {
        this.keywordTable = keywordTable;
        this.fieldIndex = fieldIndex;
        this.scoring = properties.getScoring();
    }

    /**
     * Score all endpoints for a query, best first.
     */
    public List<EndpointScore> score(String query) {
        String lower = query == null ? "" : query.toLowerCase(Locale.ROOT);

        QueryIntent intent = classifyIntent(query == null ? "" : query);
        Set<ConceptTrigger> triggers = conceptTriggers(query);
        List<String> brands = fieldIndex.mentionedBrands(query);

        List<KeywordProfile> profiles = keywordTable.profiles();
        List<Ranked> ranked = new ArrayList<>(profiles.size());

        for (int i = 0; i < profiles.size(); i++) {
            KeywordProfile profile = profiles.get(i);
            List<String> reasons = new ArrayList<>();
            double score = 0;

            List<String> primary = profile.primaryKeywords().stream()
                    .filter(kw -> matchesWord(lower, kw))
                    .collect(Collectors.toList());
            if (!primary.isEmpty()) {
                score += primary.size() * scoring.getPrimaryMultiplier() * profile.weight();
                reasons.add("Primary keywords: " + String.join(", ", primary));
            }

            List<String> context = profile.contextKeywords().stream()
                    .filter(lower::contains)
                    .collect(Collectors.toList());
            if (!context.isEmpty()) {
                score += context.size() * scoring.getContextMultiplier() * profile.weight();
                reasons.add("Context matches: " + String.join(", ", context));
            }

            List<String> avoid = profile.avoidTerms().stream()
                    .filter(lower::contains)
                    .collect(Collectors.toList());
            if (!avoid.isEmpty()) {
                score -= avoid.size() * scoring.getAvoidPenalty();
                reasons.add("Avoid terms present: " + String.join(", ", avoid));
            }

            double intentBonus = lookup(scoring.getIntentBonuses(), intent, profile.endpoint());
            if (intentBonus > 0) {
                score += intentBonus;
                reasons.add("Intent bonus: " + intent.name().toLowerCase(Locale.ROOT) + " (+" + intentBonus + ")");
            }

            for (ConceptTrigger trigger : triggers) {
                double bonus = lookup(scoring.getConceptBonuses(), trigger, profile.endpoint());
                if (bonus > 0) {
                    score += bonus;
                    reasons.add(trigger == ConceptTrigger.MULTIPLE_BRANDS
                            ? "Multiple brands mentioned: " + String.join(", ", brands) + " (+" + bonus + ")"
                            : "Concept bonus: " + trigger.name().toLowerCase(Locale.ROOT) + " (+" + bonus + ")");
                }
            }

            ranked.add(new Ranked(i, new EndpointScore(profile.endpoint(), score, List.copyOf(reasons))));
        }

        ranked.sort(Comparator.comparingDouble((Ranked r) -> r.score().score()).reversed()
                .thenComparingInt(Ranked::order));

        List<EndpointScore> result = ranked.stream().map(Ranked::score).collect(Collectors.toList());
        if (log.isDebugEnabled() && !result.isEmpty()) {
            log.debug("Scored '{}' → intent={}, top={} ({})", query, intent,
                    result.get(0).endpoint(), result.get(0).score());
        }
        return result;
    }

    /**
     * Highest scoring endpoint, or the configured default when nothing scores above zero.
     */
    public String getBestEndpoint(String query) {
        return bestOf(score(query));
    }

    public String bestOf(List<EndpointScore> scores) {
        if (scores.isEmpty() || scores.get(0).score() <= 0) {
            return scoring.getDefaultEndpoint();
        }
        return scores.get(0).endpoint();
    }

    /**
     * Classify the query into one intent. First match wins; relationship is checked
     * before comparison so that "relationship between X and Y" is not read as a
     * comparison of two places.
     */
    public QueryIntent classifyIntent(String query) {
        String lower = query.toLowerCase(Locale.ROOT);

        if (lower.contains("relationship")
                || (lower.contains("relate") && !lower.contains("unrelated"))
                || lower.contains("influence")
                || lower.contains("affect")
                || lower.contains("factor")) {
            return QueryIntent.RELATIONSHIP;
        }

        // "between Boston and Denver" compares places; "between income and sales" is a relationship
        if (lower.contains("between")) {
            if (BETWEEN_PLACES.matcher(query).find() || BETWEEN_VERSUS.matcher(query).find()) {
                return QueryIntent.COMPARISON;
            }
            return QueryIntent.RELATIONSHIP;
        }

        for (Map.Entry<QueryIntent, List<String>> entry : INTENT_KEYWORDS.entrySet()) {
            if (entry.getValue().stream().anyMatch(lower::contains)) {
                return entry.getKey();
            }
        }
        return QueryIntent.ANALYSIS;
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private Set<ConceptTrigger> conceptTriggers(String query) {
        Set<ConceptTrigger> triggers = EnumSet.noneOf(ConceptTrigger.class);
        if (fieldIndex.mentionedBrands(query).size() >= 2) {
            triggers.add(ConceptTrigger.MULTIPLE_BRANDS);
        }
        Set<ConceptGroup> groups = fieldIndex.mentionedGroups(query);
        if (groups.contains(ConceptGroup.LIFESTYLE) || groups.contains(ConceptGroup.ACTIVITY)) {
            triggers.add(ConceptTrigger.LIFESTYLE);
        }
        if (groups.contains(ConceptGroup.DEMOGRAPHIC)) triggers.add(ConceptTrigger.DEMOGRAPHIC);
        if (groups.contains(ConceptGroup.SHAP)) triggers.add(ConceptTrigger.SHAP);
        return triggers;
    }

    private boolean matchesWord(String lowerQuery, String keyword) {
        Pattern pattern = boundaryPatterns.computeIfAbsent(keyword,
                kw -> Pattern.compile("\\b" + Pattern.quote(kw) + "\\b", Pattern.CASE_INSENSITIVE));
        return pattern.matcher(lowerQuery).find();
    }

    private static <K> double lookup(Map<K, Map<String, Double>> table, K key, String endpoint) {
        Map<String, Double> row = table.get(key);
        if (row == null) return 0;
        Double bonus = row.get(endpoint);
        return bonus == null ? 0 : bonus;
    }

    private static Map<QueryIntent, List<String>> intentKeywords() {
        Map<QueryIntent, List<String>> keywords = new LinkedHashMap<>();
        keywords.put(QueryIntent.COMPARISON, List.of("compare", "versus", "vs", "difference"));
        keywords.put(QueryIntent.RANKING, List.of("top", "best", "highest", "lowest", "rank"));
        keywords.put(QueryIntent.LOCATION, List.of("where", "which areas", "which markets", "which cities"));
        keywords.put(QueryIntent.ANALYSIS, List.of("analyze", "show", "what", "how"));
        keywords.put(QueryIntent.TREND, List.of("trend", "growth", "change", "momentum"));
        keywords.put(QueryIntent.DEMOGRAPHIC, List.of("who", "demographic", "population", "age", "income"));
        return keywords;
    }

    private record Ranked(int order, EndpointScore score) {}
}
