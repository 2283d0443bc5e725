package io.github.cyfko.qsfilter.core.model;

import io.github.cyfko.qsfilter.core.exception.InvalidParameterException;

import java.math.BigInteger;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Splits a decoded query-string map into pagination directives and filter parameters.
 * <p>
 * Four keys are reserved and never reach the filter grammar:
 * </p>
 * <ul>
 *   <li>{@code _limit} - maximum number of records</li>
 *   <li>{@code _offset} - number of records to skip</li>
 *   <li>{@code _order} - the order field</li>
 *   <li>{@code _desc} - when present (any value), sort in descending order</li>
 * </ul>
 *
 * <pre>{@code
 * // GET /deliveries?delivery_id__gt=55&_order=delivery_date&_desc&_limit=20
 * RequestParameters params = RequestParameters.from(queryMap);
 * params.pagination();  // Pagination[limit=20, offset=null, orderBy=delivery_date, ascending=false]
 * params.filters();     // {delivery_id__gt=55}
 * }</pre>
 *
 * @param pagination the pagination directive
 * @param filters    the remaining, non-reserved parameters in their original order
 * @since 1.0.0
 */
public record RequestParameters(Pagination pagination, Map<String, String> filters) {

    public static final String LIMIT = "_limit";
    public static final String OFFSET = "_offset";
    public static final String ORDER = "_order";
    public static final String DESC = "_desc";

    private static final Set<String> RESERVED = Set.of(LIMIT, OFFSET, ORDER, DESC);

    public RequestParameters {
        if (pagination == null) {
            pagination = Pagination.none();
        }
        filters = filters == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(filters));
    }

    /**
     * Separates reserved keys from filter keys.
     *
     * @param query decoded query parameters, iteration order preserved
     * @return the pagination directive and the filter parameters
     * @throws InvalidParameterException if {@code _limit} or {@code _offset} is not a non-negative integer
     */
    public static RequestParameters from(Map<String, String> query) {
        Map<String, String> filters = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : query.entrySet()) {
            if (!isReserved(entry.getKey())) {
                filters.put(entry.getKey(), entry.getValue());
            }
        }

        Pagination pagination = new Pagination(
                parseCount(LIMIT, query.get(LIMIT)),
                parseCount(OFFSET, query.get(OFFSET)),
                query.get(ORDER),
                !query.containsKey(DESC)
        );
        return new RequestParameters(pagination, filters);
    }

    public static boolean isReserved(String key) {
        return RESERVED.contains(key);
    }

    private static Integer parseCount(String key, String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        BigInteger value;
        try {
            value = new BigInteger(raw.trim());
        } catch (NumberFormatException e) {
            throw new InvalidParameterException(key, "Parameter " + key + " must be an integer, got '" + raw + "'", e);
        }
        if (value.signum() < 0) {
            throw new InvalidParameterException(key, "Parameter " + key + " cannot be negative, got " + value);
        }
        // Oversized counts saturate at Integer.MAX_VALUE
        return value.bitLength() < Integer.SIZE ? value.intValue() : Integer.MAX_VALUE;
    }
}
