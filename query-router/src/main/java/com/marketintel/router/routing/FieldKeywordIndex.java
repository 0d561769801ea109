package com.marketintel.router.routing;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Hand-curated table of the concepts users ask about and the fields that hold them.
 *
 * Matching is plain case-insensitive containment of each keyword phrase in the
 * lowercased query: no stemming, no tokenising. A concept matches when any of
 * its phrases appears.
 *
 * Example: "where do millennials buy nike?" → millennial (value_MILLENN_CY, ...), nike (MP30034A_B, ...)
 */
@Component
public class FieldKeywordIndex {

    private final Map<String, FieldConcept> concepts = new LinkedHashMap<>();

    public FieldKeywordIndex() {
        // ── Brands ──────────────────────────────────────────────────────────────
        brand("nike", "MP30034A_B", "Nike athletic shoes purchased", "nike", "swoosh");
        brand("adidas", "MP30029A_B", "Adidas athletic shoes purchased", "adidas", "three stripes");
        brand("jordan", "MP30032A_B", "Jordan athletic shoes purchased", "jordan", "air jordan", "jumpman");
        brand("newBalance", "MP30033A_B", "New Balance athletic shoes purchased", "new balance");
        brand("puma", "MP30035A_B", "Puma athletic shoes purchased", "puma");
        brand("converse", "MP30031A_B", "Converse athletic shoes purchased", "converse", "chuck taylor", "all star");
        brand("asics", "MP30030A_B", "ASICS athletic shoes purchased", "asics");

        // ── Activities and lifestyle ────────────────────────────────────────────
        concept("running", ConceptGroup.ACTIVITY, "Running or jogging shoes purchased",
                List.of("running", "jogging", "marathon", "runner", "jog"),
                List.of("MP30021A_B", "MP30021A_B_P"));
        concept("athletic", ConceptGroup.ACTIVITY, "Athletic footwear purchased",
                List.of("athletic", "sports", "training", "workout", "exercise"),
                List.of("MP30016A_B", "MP30016A_B_P"));
        concept("fitness", ConceptGroup.LIFESTYLE, "Fitness and health lifestyle indicators",
                List.of("fitness", "fit", "health", "healthy", "wellness", "active"),
                List.of("MP30016A_B", "MP30021A_B"));
        concept("yoga", ConceptGroup.ACTIVITY, "Yoga and wellness activities",
                List.of("yoga", "pilates", "mindfulness", "meditation"),
                List.of("MP30018A_B", "MP30018A_B_P"));
        concept("gym", ConceptGroup.ACTIVITY, "Gym and training activities",
                List.of("gym", "workout", "weightlifting", "crossfit", "training"),
                List.of("MP30016A_B", "MP30019A_B"));

        // ── Demographics ────────────────────────────────────────────────────────
        demographic("genZ", "GENZ_CY", "Generation Z population (born 1997-2012)",
                "gen z", "generation z", "genz", "young adults", "digital natives", "zoomer");
        demographic("millennial", "MILLENN_CY", "Millennial population (born 1981-1996)",
                "millennial", "gen y", "generation y", "echo boomers");
        demographic("genAlpha", "GENALPHACY", "Generation Alpha population (born 2013+)",
                "gen alpha", "generation alpha", "alpha generation", "youngest generation");
        demographic("asian", "ASIAN_CY", "Asian population",
                "asian population", "asian american", "asian demographics");
        demographic("black", "BLACK_CY", "Black population",
                "black population", "african american");
        demographic("white", "WHITE_CY", "White population",
                "white population", "white demographics");
        demographic("americanIndian", "AMERIND_CY", "American Indian/Alaska Native population",
                "american indian", "native american", "indigenous", "tribal", "first nations");
        demographic("pacificIslander", "PACIFIC_CY", "Native Hawaiian and Pacific Islander population",
                "pacific islander", "hawaiian", "polynesian", "micronesian", "melanesian");
        demographic("multiRace", "RACE2UP_CY", "Population of two or more races",
                "multi race", "mixed race", "biracial", "multiracial", "two or more races");
        demographic("hispanicBlack", "HISPBLK_CY", "Hispanic or Latino Black population",
                "hispanic black", "afro latino", "afro hispanic", "latino black");
        demographic("hispanicWhite", "HISPWHT_CY", "Hispanic or Latino White population",
                "hispanic white", "white hispanic", "white latino");
        concept("medianIncome", ConceptGroup.DEMOGRAPHIC, "Median disposable income",
                List.of("median income", "median household income", "middle income", "median earnings"),
                List.of("value_MEDDI_CY"));
        concept("wealthIndex", ConceptGroup.DEMOGRAPHIC, "Wealth index indicator",
                List.of("wealth index", "wealth score", "affluence index", "wealth indicator"),
                List.of("value_WLTHINDXCY"));
        concept("diversityIndex", ConceptGroup.DEMOGRAPHIC, "Diversity index measure",
                List.of("diversity index", "diversity score", "ethnic diversity", "racial diversity"),
                List.of("value_DIVINDX_CY"));
        concept("income", ConceptGroup.DEMOGRAPHIC, "Income and wealth indicators",
                List.of("income", "earnings", "salary", "wealth", "affluent", "rich", "poor"),
                List.of("value_MEDDI_CY", "value_WLTHINDXCY"));
        concept("age", ConceptGroup.DEMOGRAPHIC, "Age demographics",
                List.of("age", "young", "old", "elderly", "senior"),
                List.of("Age"));
        concept("totalPopulation", ConceptGroup.DEMOGRAPHIC, "Total population count",
                List.of("total population", "population total", "overall population"),
                List.of("TOTPOP_CY", "value_TOTPOP_CY"));
        demographic("householdPopulation", "HHPOP_CY", "Population living in households",
                "household population", "people in households", "household residents");
        demographic("familyPopulation", "FAMPOP_CY", "Population living in family households",
                "family population", "people in families", "family residents");

        // ── Explanatory (SHAP) weights ──────────────────────────────────────────
        shap("shapGenZ", "GENZ_CY", "SHAP values for Generation Z influence on predictions",
                "shap gen z", "gen z influence", "generation z factor", "young adult impact");
        shap("shapMillennial", "MILLENN_CY", "SHAP values for Millennial population influence",
                "shap millennial", "millennial influence", "gen y factor", "millennial impact");
        shap("shapAsian", "ASIAN_CY", "SHAP values for Asian population influence on predictions",
                "shap asian", "asian influence", "asian factor", "asian contribution");
        shap("shapHispanic", "HISPAI_CY", "SHAP values for Hispanic/Latino population influence",
                "shap hispanic", "hispanic influence", "latino factor", "hispanic contribution");
        shap("shapHousehold", "HHPOP_CY", "SHAP values for household population influence",
                "shap household", "household influence", "household factor");
        shap("shapIncome", "MEDDI_CY", "SHAP values for median income influence on predictions",
                "shap income", "income influence", "income factor", "economic impact");
        shap("shapWealth", "WLTHINDXCY", "SHAP values for wealth index influence",
                "shap wealth", "wealth influence", "wealth factor", "affluence impact");
        shap("shapDiversity", "DIVINDX_CY", "SHAP values for diversity index influence",
                "shap diversity", "diversity influence", "diversity factor");
        shap("shapNike", "MP30034A_B", "SHAP values for Nike brand influence on predictions",
                "shap nike", "nike influence", "nike factor", "nike impact");
        shap("shapAdidas", "MP30029A_B", "SHAP values for Adidas brand influence",
                "shap adidas", "adidas influence", "adidas factor", "adidas impact");
        shap("shapJordan", "MP30032A_B", "SHAP values for Jordan brand influence",
                "shap jordan", "jordan influence", "air jordan factor", "jordan impact");

        // ── Administrative ──────────────────────────────────────────────────────
        concept("zipDescription", ConceptGroup.ADMINISTRATIVE, "ZIP code area description",
                List.of("zip description", "area description", "location description", "zip code name"),
                List.of("value_DESCRIPTION"));
        concept("recordId", ConceptGroup.ADMINISTRATIVE, "Record identifier",
                List.of("record id", "identifier", "unique id", "row id"),
                List.of("ID"));
    }

    // ── Lookups ───────────────────────────────────────────────────────────────

    /**
     * Fields of every concept the query mentions, in table order.
     */
    public List<FieldMatch> lookup(String query) {
        String lower = lower(query);
        List<FieldMatch> matches = new ArrayList<>();
        for (FieldConcept concept : concepts.values()) {
            if (concept.mentionedIn(lower)) {
                concept.fields().forEach(f -> matches.add(new FieldMatch(f, concept.description())));
            }
        }
        return matches;
    }

    public List<FieldConcept> mentionedConcepts(String query) {
        String lower = lower(query);
        return concepts.values().stream()
                .filter(c -> c.mentionedIn(lower))
                .collect(Collectors.toList());
    }

    public Set<ConceptGroup> mentionedGroups(String query) {
        Set<ConceptGroup> groups = EnumSet.noneOf(ConceptGroup.class);
        mentionedConcepts(query).forEach(c -> groups.add(c.group()));
        return groups;
    }

    /**
     * Brand concept names mentioned in the query, ordered by where they first appear.
     * "adidas vs nike" → [adidas, nike]
     */
    public List<String> mentionedBrands(String query) {
        String lower = lower(query);
        return concepts.values().stream()
                .filter(c -> c.group() == ConceptGroup.BRAND && c.mentionedIn(lower))
                .sorted(Comparator.comparingInt(c -> c.firstPositionIn(lower)))
                .map(FieldConcept::name)
                .collect(Collectors.toList());
    }

    public List<String> brandNames() {
        return concepts.values().stream()
                .filter(c -> c.group() == ConceptGroup.BRAND)
                .map(FieldConcept::name)
                .collect(Collectors.toList());
    }

    /**
     * Market share fields of a brand, value_-prefixed variant first.
     */
    public List<String> brandShareFields(String brand) {
        FieldConcept concept = concepts.get(brand);
        if (concept == null || concept.group() != ConceptGroup.BRAND) {
            return List.of();
        }
        return concept.fields().stream()
                .filter(f -> f.endsWith("_P"))
                .sorted(Comparator.comparing((String f) -> !f.startsWith("value_")))
                .collect(Collectors.toList());
    }

    // ── Table construction ────────────────────────────────────────────────────

    private void concept(String name, ConceptGroup group, String description, List<String> keywords, List<String> fields) {
        concepts.put(name, new FieldConcept(name, group, keywords, fields, description));
    }

    private void brand(String name, String code, String description, String... keywords) {
        concept(name, ConceptGroup.BRAND, description, List.of(keywords),
                List.of(code, code + "_P", "value_" + code, "value_" + code + "_P"));
    }

    private void demographic(String name, String code, String description, String... keywords) {
        concept(name, ConceptGroup.DEMOGRAPHIC, description, List.of(keywords),
                List.of("value_" + code, "value_" + code + "_P"));
    }

    private void shap(String name, String code, String description, String... keywords) {
        concept(name, ConceptGroup.SHAP, description, List.of(keywords),
                List.of("shap_" + code, "shap_" + code + "_P"));
    }

    private static String lower(String query) {
        return query == null ? "" : query.toLowerCase(Locale.ROOT);
    }
}
