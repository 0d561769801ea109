package com.marketintel.router.routing;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Decides whether a query needs results from several endpoints merged together.
 *
 * Two triggers:
 *  - the query matches one of the compound patterns below
 *  - the query names analysis phrases from two or more different families
 *
 * "compare Brooklyn and Philadelphia" → false
 * "strategic and competitive analysis of new markets" → true
 */
@Component
@Slf4j
public class MultiEndpointDetector {

    private static final List<Pattern> COMPOUND_PATTERNS = compile(
            "where should.*expand.*consider",
            "invest.*consider.*competition.*demographic",
            "why.*underperform.*root cause",
            "diagnose.*consider.*multiple",
            "strategy.*competition.*demographic",
            "optimize.*across.*endpoint",
            "risk.*opportunity",
            "high.*low.*invest",
            "compare.*across.*segment",
            "versus.*demographic",
            "multiple.*analysis",
            "comprehensive.*consider",
            "competitive.*and.*demographic.*analysis",
            "strategic.*and.*competitive.*analysis");

    private static final Map<String, List<String>> PHRASE_FAMILIES = phraseFamilies();

    public boolean isMultiEndpoint(String query) {
        if (query == null || query.isBlank()) {
            return false;
        }
        for (Pattern pattern : COMPOUND_PATTERNS) {
            if (pattern.matcher(query).find()) {
                log.debug("Multi-endpoint pattern '{}' matched query '{}'", pattern.pattern(), query);
                return true;
            }
        }
        int families = countFamilyMentions(query);
        if (families >= 2) {
            log.debug("Query '{}' names {} analysis families", query, families);
            return true;
        }
        return false;
    }

    /**
     * Number of distinct analysis families whose phrases appear in the query.
     */
    public int countFamilyMentions(String query) {
        if (query == null) return 0;
        String lower = query.toLowerCase(Locale.ROOT);
        return (int) PHRASE_FAMILIES.values().stream()
                .filter(phrases -> phrases.stream().anyMatch(lower::contains))
                .count();
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private static List<Pattern> compile(String... regexes) {
        return Arrays.stream(regexes)
                .map(r -> Pattern.compile(r, Pattern.CASE_INSENSITIVE))
                .collect(Collectors.toList());
    }

    private static Map<String, List<String>> phraseFamilies() {
        Map<String, List<String>> families = new LinkedHashMap<>();
        families.put("competitive", List.of("competitive analysis", "competition analysis",
                "competitor analysis", "market share analysis"));
        families.put("demographic", List.of("demographic analysis", "population analysis",
                "income analysis", "age analysis"));
        families.put("spatial", List.of("cluster analysis", "spatial analysis",
                "location analysis", "geographic analysis"));
        families.put("predictive", List.of("predictive analysis", "forecast analysis", "trend analysis"));
        families.put("risk", List.of("risk analysis", "anomaly analysis", "volatile analysis"));
        families.put("strategic", List.of("strategic analysis", "strategy analysis", "investment analysis"));
        return families;
    }
}
