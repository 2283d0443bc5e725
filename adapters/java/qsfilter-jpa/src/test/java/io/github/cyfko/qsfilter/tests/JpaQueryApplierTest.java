package io.github.cyfko.qsfilter.tests;

import io.github.cyfko.qsfilter.core.api.FilterDescriptor;
import io.github.cyfko.qsfilter.core.config.FilterConfig;
import io.github.cyfko.qsfilter.core.exception.ColumnNotFoundException;
import io.github.cyfko.qsfilter.core.exception.InvalidParameterException;
import io.github.cyfko.qsfilter.core.exception.UnsupportedOperatorException;
import io.github.cyfko.qsfilter.core.model.Pagination;
import io.github.cyfko.qsfilter.jpa.FilteredQuery;
import io.github.cyfko.qsfilter.jpa.JpaQueryApplier;
import io.github.cyfko.qsfilter.jpa.target.EntityTarget;
import io.github.cyfko.qsfilter.jpa.target.FlatSelection;
import io.github.cyfko.qsfilter.tests.entities.User;
import jakarta.persistence.EntityManager;
import jakarta.persistence.EntityManagerFactory;
import jakarta.persistence.Tuple;
import jakarta.persistence.TypedQuery;
import jakarta.persistence.criteria.Selection;
import org.junit.jupiter.api.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Query composition and pagination over the shared user fixture.
 */
@DisplayName("JPA Query Applier Test")
class JpaQueryApplierTest {

    private static EntityManagerFactory emf;

    private final JpaQueryApplier applier = new JpaQueryApplier();

    @BeforeAll
    static void setup() {
        emf = TestData.createPopulated();
    }

    @AfterAll
    static void teardown() {
        if (emf != null) emf.close();
    }

    private FlatSelection users() {
        return FlatSelection.of(emf, User.class).join("location");
    }

    private static <R, T> List<T> execute(FilteredQuery<R> query, Function<R, T> mapper) {
        EntityManager em = emf.createEntityManager();
        try {
            return query.getResultList(em).stream().map(mapper).collect(Collectors.toList());
        } finally {
            em.close();
        }
    }

    private static List<Integer> ids(FilteredQuery<Tuple> query) {
        return execute(query, row -> row.get("userId", Integer.class));
    }

    @Nested
    @DisplayName("Without filters")
    class NoFilterTests {

        @Test
        @DisplayName("No filters leaves the query without restriction")
        void noRestriction() {
            FilteredQuery<Tuple> query = applier.apply(users(), List.of());

            assertNull(query.criteria().getRestriction());
            assertEquals(3, ids(query).size());
        }

        @Test
        @DisplayName("Column set is the basic attributes of the root and the joined entity")
        void columnSetUnchanged() {
            FilteredQuery<Tuple> query = applier.apply(users(), List.of());

            Set<String> aliases = query.criteria().getSelection().getCompoundSelectionItems().stream()
                    .map(Selection::getAlias)
                    .collect(Collectors.toSet());
            assertEquals(Set.of("active", "balance", "userId", "userName",
                    "locationDate", "locationId", "locationName"), aliases);
        }

        @Test
        @DisplayName("Entity target without filters returns every entity")
        void entityTarget() {
            FilteredQuery<User> query = applier.apply(EntityTarget.of(emf, User.class), List.of());

            assertNull(query.criteria().getRestriction());
            assertEquals(Set.of("Micha", "Oli", "Tom"), Set.copyOf(execute(query, User::getUserName)));
        }
    }

    @Nested
    @DisplayName("Limit")
    class LimitTests {

        @Test
        void defaultLimitIsTheCeiling() {
            FilteredQuery<Tuple> query = applier.apply(users(), List.of());

            assertEquals(FilterConfig.DEFAULT_MAX_LIMIT, query.limit());
            assertEquals(3, ids(query).size());
        }

        @Test
        void explicitLimit() {
            FilteredQuery<Tuple> query = applier.apply(users(), List.of(), 2, null, null, true);

            assertEquals(2, query.limit());
            assertEquals(2, ids(query).size());
        }

        @Test
        void limitAboveCeilingIsClamped() {
            FilteredQuery<Tuple> query = applier.apply(users(), List.of(), 999999, null, null, true);

            assertEquals(10000, query.limit());
            assertEquals(3, ids(query).size());
        }

        @Test
        void configuredCeiling() {
            JpaQueryApplier small = new JpaQueryApplier(FilterConfig.builder().maxLimit(1).build());

            FilteredQuery<Tuple> query = small.apply(users(), List.of(), 5, null, null, true);

            assertEquals(1, query.limit());
            assertEquals(1, ids(query).size());
        }

        @Test
        void negativeLimitIsAFilterError() {
            InvalidParameterException e = assertThrows(InvalidParameterException.class,
                    () -> applier.apply(users(), List.of(), -1, null, null, true));
            assertEquals("_limit", e.getField());
        }

        @Test
        void oversizedReservedLimitIsClamped() {
            FilteredQuery<Tuple> query = applier.apply(users(), Map.of("_limit", "3000000000"));

            assertEquals(10000, query.limit());
            assertEquals(3, ids(query).size());
        }

        @Test
        void limitIsSetOnTheTypedQuery() {
            FilteredQuery<Tuple> query = applier.apply(users(), List.of(), 2, null, null, true);

            EntityManager em = emf.createEntityManager();
            try {
                TypedQuery<Tuple> typed = query.createQuery(em);
                assertEquals(2, typed.getMaxResults());
                assertEquals(0, typed.getFirstResult());
            } finally {
                em.close();
            }
        }
    }

    @Nested
    @DisplayName("Offset and order")
    class OffsetOrderTests {

        @Test
        void offsetSkipsRows() {
            FilteredQuery<Tuple> query = applier.apply(users(), List.of(), null, 2, "userId", true);

            assertTrue(query.hasOffset());
            assertEquals(List.of(3), ids(query));
        }

        @Test
        void zeroOffsetIsOmitted() {
            FilteredQuery<Tuple> query = applier.apply(users(), List.of(), null, 0, null, true);

            assertFalse(query.hasOffset());
            assertNull(query.offset());
            assertEquals(3, ids(query).size());
        }

        @Test
        void ascendingOrder() {
            FilteredQuery<Tuple> query = applier.apply(users(), List.of(), null, null, "userId", true);

            assertEquals(List.of(1, 2, 3), ids(query));
        }

        @Test
        void descendingOrder() {
            FilteredQuery<Tuple> query = applier.apply(users(), List.of(), null, null, "userId", false);

            assertEquals(List.of(3, 2, 1), ids(query));
        }

        @Test
        void orderColumnIsCaseInsensitiveOnFlatSelections() {
            FilteredQuery<Tuple> query = applier.apply(users(), List.of(), null, null, "USERNAME", false);

            assertEquals(List.of("Tom", "Oli", "Micha"), execute(query, row -> row.get("userName", String.class)));
        }

        @Test
        void orderOnJoinedColumn() {
            FilteredQuery<Tuple> query = applier.apply(users(), List.of(), 1, null, "locationName", false);

            assertEquals(List.of("Tom"), execute(query, row -> row.get("userName", String.class)));
        }

        @Test
        void unknownOrderColumn() {
            ColumnNotFoundException e = assertThrows(ColumnNotFoundException.class,
                    () -> applier.apply(users(), List.of(), null, null, "nope", true));
            assertEquals("nope", e.getField());
        }

        @Test
        @DisplayName("Ordering by a to-many attribute is rejected while building")
        void orderByCollection() {
            UnsupportedOperatorException e = assertThrows(UnsupportedOperatorException.class,
                    () -> applier.apply(EntityTarget.of(emf, User.class), List.of(), null, null, "pets", true));
            assertEquals("pets", e.getField());
        }

        @Test
        void orderByToOneAssociation() {
            assertThrows(UnsupportedOperatorException.class,
                    () -> applier.apply(EntityTarget.of(emf, User.class), Map.of("_order", "location")));
        }

        @Test
        void orderByUnclassifiedBasicColumn() {
            FilteredQuery<User> query = applier.apply(EntityTarget.of(emf, User.class),
                    List.of(FilterDescriptor.unary("balance", "is_not_null")), null, null, "balance", false);

            assertEquals(List.of("Micha", "Tom"), execute(query, User::getUserName));
        }

        @Test
        void entityOrder() {
            FilteredQuery<User> query = applier.apply(EntityTarget.of(emf, User.class), List.of(),
                    Pagination.of(2, 1, "userName", true));

            assertEquals(List.of("Oli", "Tom"), execute(query, User::getUserName));
        }
    }

    @Nested
    @DisplayName("Query-string map")
    class QueryMapTests {

        @Test
        void reservedKeysDrivePagination() {
            Map<String, String> params = new LinkedHashMap<>();
            params.put("_limit", "1");
            params.put("_order", "userId");
            params.put("_desc", "");
            params.put("locationName", "Karlsruhe");

            FilteredQuery<Tuple> query = applier.apply(users(), params);

            assertEquals(List.of(2), ids(query));
        }

        @Test
        void relationshipKeyOnEntityTarget() {
            FilteredQuery<User> query = applier.apply(EntityTarget.of(emf, User.class),
                    Map.of("pets__with__petName__eq", "Hooch"));

            assertEquals(List.of("Micha"), execute(query, User::getUserName));
        }

        @Test
        void invalidReservedValue() {
            assertThrows(InvalidParameterException.class,
                    () -> applier.apply(users(), Map.of("_offset", "two")));
        }
    }

    @Test
    @DisplayName("Filters are combined with AND")
    void filtersAreConjunctive() {
        FilteredQuery<Tuple> query = applier.apply(users(), List.of(
                new FilterDescriptor("locationName", "eq", "Karlsruhe"),
                new FilterDescriptor("userName", "ne", "Micha")));

        assertNotNull(query.criteria().getRestriction());
        assertEquals(List.of(2), ids(query));
    }

    @Test
    @DisplayName("Building never touches the database")
    void queryIsNotExecuted() {
        FilteredQuery<Tuple> first = applier.apply(users(), List.of(new FilterDescriptor("userId", "eq", "1")));
        FilteredQuery<Tuple> second = applier.apply(users(), List.of(new FilterDescriptor("userId", "eq", "1")));

        assertNotSame(first.criteria(), second.criteria());
        assertEquals(ids(first), ids(second));
    }
}
