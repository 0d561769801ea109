package com.marketintel.router.geo;

import com.marketintel.router.config.QueryRouterProperties;
import com.marketintel.router.config.QueryRouterProperties.Geo.Entity;
import com.marketintel.router.processing.RecordFieldExtractor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Geo filter backed by the configured alias table.
 *
 * An entity matches when one of its aliases appears in the query as whole words.
 * A record belongs to a matched entity when one of its name fields contains the
 * entity name, or its area id starts with one of the entity's ZIP prefixes.
 *
 * "compare Brooklyn and Philadelphia" → [Brooklyn, Philadelphia]
 */
@Component
@Slf4j
public class AliasTableGeoFilter implements GeoFilter {

    private final List<CompiledEntity> entities;

    public AliasTableGeoFilter(QueryRouterProperties properties) {
        this.entities = properties.getGeo().getEntities().stream()
                .map(CompiledEntity::of)
                .collect(Collectors.toList());
    }

    @Override
    public GeoFilterResult resolve(String query, List<Map<String, Object>> records) {
        List<Map<String, Object>> rows = records == null ? List.of() : records;
        List<CompiledEntity> matched = matchEntities(query);
        List<String> names = matched.stream().map(e -> e.entity().getName()).collect(Collectors.toList());

        if (matched.isEmpty()) {
            return new GeoFilterResult(List.of(), rows, rows.size());
        }

        List<Map<String, Object>> kept = rows.stream()
                .filter(row -> matched.stream().anyMatch(e -> e.contains(row)))
                .collect(Collectors.toList());
        log.info("Geo filter {} kept {} of {} records", names, kept.size(), rows.size());
        return new GeoFilterResult(names, kept, rows.size());
    }

    /** Entities named in the query, ordered by first mention. */
    public List<String> entitiesIn(String query) {
        return matchEntities(query).stream().map(e -> e.entity().getName()).collect(Collectors.toList());
    }

    private List<CompiledEntity> matchEntities(String query) {
        if (query == null || query.isBlank()) return List.of();
        String lower = query.toLowerCase(Locale.ROOT);
        List<Hit> hits = new ArrayList<>();
        for (CompiledEntity entity : entities) {
            int position = entity.firstMention(lower);
            if (position >= 0) hits.add(new Hit(entity, position));
        }
        hits.sort(Comparator.comparingInt(Hit::position));
        return hits.stream().map(Hit::entity).collect(Collectors.toList());
    }

    private record Hit(CompiledEntity entity, int position) {}

    private record CompiledEntity(Entity entity, List<Pattern> aliasPatterns, String lowerName) {

        static CompiledEntity of(Entity entity) {
            List<String> aliases = new ArrayList<>(entity.getAliases());
            aliases.add(entity.getName());
            List<Pattern> patterns = aliases.stream()
                    .map(a -> Pattern.compile("\\b" + Pattern.quote(a.toLowerCase(Locale.ROOT)) + "\\b"))
                    .collect(Collectors.toList());
            return new CompiledEntity(entity, patterns, entity.getName().toLowerCase(Locale.ROOT));
        }

        int firstMention(String lowerQuery) {
            int first = -1;
            for (Pattern pattern : aliasPatterns) {
                Matcher m = pattern.matcher(lowerQuery);
                if (m.find() && (first < 0 || m.start() < first)) {
                    first = m.start();
                }
            }
            return first;
        }

        boolean contains(Map<String, Object> row) {
            for (String field : RecordFieldExtractor.NAME_FIELDS) {
                Object name = row.get(field);
                if (name != null && name.toString().toLowerCase(Locale.ROOT).contains(lowerName)) {
                    return true;
                }
            }
            String id = RecordFieldExtractor.areaId(row).orElse("");
            return entity.getZipPrefixes().stream().anyMatch(id::startsWith);
        }
    }
}
