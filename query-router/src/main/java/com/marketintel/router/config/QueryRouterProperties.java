package com.marketintel.router.config;

import com.marketintel.router.routing.ConceptTrigger;
import com.marketintel.router.routing.QueryIntent;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Process-wide settings for the routing and standardisation pipeline.
 *
 * Built once by Spring and handed to the scorer, cache, geo filter and
 * narrative formatter through their constructors. Tests construct it
 * directly with {@code new QueryRouterProperties()} to get the defaults.
 */
@Component
@ConfigurationProperties(prefix = "query-router")
@Data
public class QueryRouterProperties {

    private Scoring scoring = new Scoring();
    private Cache cache = new Cache();
    private Blob blob = new Blob();
    private Geo geo = new Geo();
    private Narrative narrative = new Narrative();

    /**
     * Hand-tuned scoring constants. Treated as configuration; the regression
     * tests pin the routing outcomes they produce, not the numbers themselves.
     */
    @Data
    public static class Scoring {
        private String defaultEndpoint = "/strategic-analysis";
        private double primaryMultiplier = 3.0;
        private double contextMultiplier = 2.0;
        private double avoidPenalty = 2.0;
        private Map<QueryIntent, Map<String, Double>> intentBonuses = defaultIntentBonuses();
        private Map<ConceptTrigger, Map<String, Double>> conceptBonuses = defaultConceptBonuses();

        private static Map<QueryIntent, Map<String, Double>> defaultIntentBonuses() {
            Map<QueryIntent, Map<String, Double>> bonuses = new EnumMap<>(QueryIntent.class);
            bonuses.put(QueryIntent.COMPARISON, table(
                    "/comparative-analysis", 3.0,
                    "/brand-difference", 2.0,
                    "/competitive-analysis", 1.0));
            bonuses.put(QueryIntent.RANKING, table(
                    "/strategic-analysis", 3.0,
                    "/competitive-analysis", 2.0,
                    "/demographic-insights", 1.0));
            bonuses.put(QueryIntent.DEMOGRAPHIC, table(
                    "/demographic-insights", 3.0,
                    "/customer-profile", 2.0));
            bonuses.put(QueryIntent.TREND, table(
                    "/trend-analysis", 3.0));
            bonuses.put(QueryIntent.RELATIONSHIP, table(
                    "/demographic-insights", 3.0,
                    "/strategic-analysis", 2.0,
                    "/customer-profile", 1.0));
            return bonuses;
        }

        private static Map<ConceptTrigger, Map<String, Double>> defaultConceptBonuses() {
            Map<ConceptTrigger, Map<String, Double>> bonuses = new EnumMap<>(ConceptTrigger.class);
            bonuses.put(ConceptTrigger.MULTIPLE_BRANDS, table(
                    "/brand-difference", 3.0,
                    "/competitive-analysis", 2.0));
            bonuses.put(ConceptTrigger.LIFESTYLE, table(
                    "/customer-profile", 2.0,
                    "/demographic-insights", 1.0));
            bonuses.put(ConceptTrigger.DEMOGRAPHIC, table(
                    "/demographic-insights", 2.0,
                    "/customer-profile", 1.0));
            bonuses.put(ConceptTrigger.SHAP, table(
                    "/feature-interactions", 3.0,
                    "/demographic-insights", 2.0));
            return bonuses;
        }

        private static Map<String, Double> table(Object... pairs) {
            Map<String, Double> table = new LinkedHashMap<>();
            for (int i = 0; i < pairs.length; i += 2) {
                table.put((String) pairs[i], (Double) pairs[i + 1]);
            }
            return table;
        }
    }

    @Data
    public static class Cache {
        /** Root of the locally exported endpoint datasets. */
        private String dataDir = "data";
        /** Per-endpoint file, relative to dataDir. {@code %s} is the cache key. */
        private String individualFilePattern = "endpoints/%s.json";
        /** Combined file keyed by cache key. */
        private String combinedFile = "endpoints/all_endpoints.json";
        /** Older exports with a top-level {@code datasets} object. */
        private List<String> legacyFiles = new ArrayList<>(List.of(
                "microservice-export-all-endpoints.json",
                "microservice-export.json"));
        private int loaderThreads = 4;
        private boolean preloadOnStartup = false;
        private List<String> preloadEndpoints = new ArrayList<>();
        private String refreshCron = "-";
    }

    @Data
    public static class Blob {
        private boolean enabled = false;
        /** Blob container URL; datasets resolve to {baseUrl}/{cacheKey}.json */
        private String baseUrl = "";
        /** Explicit blob URLs per cache key, checked before baseUrl. */
        private Map<String, String> urls = new LinkedHashMap<>();
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration readTimeout = Duration.ofSeconds(60);
    }

    @Data
    public static class Geo {
        private List<Entity> entities = defaultEntities();

        @Data
        public static class Entity {
            private String name;
            private List<String> aliases = new ArrayList<>();
            private List<String> zipPrefixes = new ArrayList<>();

            public static Entity of(String name, List<String> aliases, List<String> zipPrefixes) {
                Entity entity = new Entity();
                entity.setName(name);
                entity.setAliases(new ArrayList<>(aliases));
                entity.setZipPrefixes(new ArrayList<>(zipPrefixes));
                return entity;
            }
        }

        private static List<Entity> defaultEntities() {
            return new ArrayList<>(List.of(
                    Entity.of("Brooklyn", List.of("brooklyn", "bk"), List.of("112")),
                    Entity.of("Manhattan", List.of("manhattan"), List.of("100", "101", "102")),
                    Entity.of("Queens", List.of("queens"), List.of("110", "111", "113", "114", "116")),
                    Entity.of("Bronx", List.of("bronx", "the bronx"), List.of("104")),
                    Entity.of("Philadelphia", List.of("philadelphia", "philly"), List.of("190", "191")),
                    Entity.of("Pittsburgh", List.of("pittsburgh"), List.of("152")),
                    Entity.of("Newark", List.of("newark"), List.of("071")),
                    Entity.of("Jersey City", List.of("jersey city"), List.of("073"))));
        }
    }

    @Data
    public static class Narrative {
        private int topRecords = 10;
        private int maxChars = 6000;
    }
}
