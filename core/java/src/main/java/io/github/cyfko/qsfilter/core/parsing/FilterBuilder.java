package io.github.cyfko.qsfilter.core.parsing;

import io.github.cyfko.qsfilter.core.api.FilterDescriptor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Builds filter descriptors from a decoded query-string map.
 * <p>
 * One descriptor is produced per entry, in the iteration order of the map. No schema
 * validation happens here: unknown fields, unknown operators and bad values are reported
 * by the query applier, which knows the column types.
 * </p>
 *
 * <pre>{@code
 * Map<String, String> query = new LinkedHashMap<>();
 * query.put("age__gt", "55");
 * query.put("surname__like", "%joe%");
 *
 * List<FilterDescriptor> filters = FilterBuilder.buildFilters(query);
 * // [FilterDescriptor[name=age, op=gt, value=55],
 * //  FilterDescriptor[name=surname, op=like, value=%joe%]]
 * }</pre>
 *
 * @since 1.0.0
 */
public final class FilterBuilder {

    private FilterBuilder() {
        throw new UnsupportedOperationException("Utility class - cannot be instantiated");
    }

    /**
     * @param query decoded query parameters without reserved keys
     * @return an unmodifiable list of descriptors, empty for an empty map
     * @throws io.github.cyfko.qsfilter.core.exception.InvalidParameterException if a key has no field name
     */
    public static List<FilterDescriptor> buildFilters(Map<String, String> query) {
        if (query.isEmpty()) {
            return List.of();
        }
        List<FilterDescriptor> filters = new ArrayList<>(query.size());
        for (Map.Entry<String, String> entry : query.entrySet()) {
            filters.add(ParameterParser.parse(entry.getKey(), entry.getValue()));
        }
        return Collections.unmodifiableList(filters);
    }
}
