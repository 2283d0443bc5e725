package io.github.cyfko.qsfilter.tests;

import io.github.cyfko.qsfilter.core.api.FilterDescriptor;
import io.github.cyfko.qsfilter.core.exception.ColumnNotFoundException;
import io.github.cyfko.qsfilter.core.exception.MalformedSubqueryException;
import io.github.cyfko.qsfilter.core.exception.NotMappedException;
import io.github.cyfko.qsfilter.core.exception.UnsupportedOperatorException;
import io.github.cyfko.qsfilter.core.parsing.FilterBuilder;
import io.github.cyfko.qsfilter.jpa.FilteredQuery;
import io.github.cyfko.qsfilter.jpa.JpaQueryApplier;
import io.github.cyfko.qsfilter.jpa.target.EntityTarget;
import io.github.cyfko.qsfilter.jpa.target.FlatSelection;
import io.github.cyfko.qsfilter.tests.entities.Pet;
import io.github.cyfko.qsfilter.tests.entities.User;
import jakarta.persistence.EntityManager;
import jakarta.persistence.EntityManagerFactory;
import org.junit.jupiter.api.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * One-hop relationship filters ({@code with}) on to-many and to-one associations.
 */
@DisplayName("Relationship Filter Test")
class RelationshipFilterTest {

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

    private List<String> userNames(Map<String, String> params) {
        return userNames(FilterBuilder.buildFilters(params));
    }

    private List<String> userNames(List<FilterDescriptor> filters) {
        FilteredQuery<User> query = applier.apply(EntityTarget.of(emf, User.class), filters, null, null, "userId", true);

        EntityManager em = emf.createEntityManager();
        try {
            return query.getResultList(em).stream().map(User::getUserName).collect(Collectors.toList());
        } finally {
            em.close();
        }
    }

    @Nested
    @DisplayName("To-many")
    class ToManyTests {

        @Test
        @DisplayName("pets__with__petName__eq=Hooch")
        void anyPetMatches() {
            assertEquals(List.of("Micha"), userNames(Map.of("pets__with__petName__eq", "Hooch")));
        }

        @Test
        @DisplayName("Owners appear once even when several related rows match")
        void noDuplicates() {
            assertEquals(List.of("Micha", "Tom"), userNames(Map.of("pets__with__petName__in", "Hooch,Rex,Lassie")));
        }

        @Test
        void noRelatedRowMatches() {
            assertEquals(List.of(), userNames(Map.of("pets__with__petName__eq", "Nobody")));
        }

        @Test
        void twoCharacterSubOperatorIsLowercased() {
            assertEquals(List.of("Micha"), userNames(Map.of("pets__with__petName__EQ", "Hooch")));
        }

        @Test
        void subOperatorOnIntegers() {
            assertEquals(List.of("Micha"), userNames(Map.of("pets__with__petId__lt", "3")));
        }

        @Test
        void combinedWithPlainFilter() {
            Map<String, String> params = new LinkedHashMap<>();
            params.put("userName__ne", "Micha");
            params.put("pets__with__petName__ilike", "%SIE");

            assertEquals(List.of("Tom"), userNames(params));
        }

        @Test
        @DisplayName("is_null on a to-many attribute means no related rows")
        void emptyCollection() {
            assertEquals(List.of("Oli"), userNames(List.of(FilterDescriptor.unary("pets", "is_null"))));
            assertEquals(List.of("Micha", "Tom"), userNames(List.of(FilterDescriptor.unary("pets", "is_not_null"))));
        }
    }

    @Nested
    @DisplayName("To-one")
    class ToOneTests {

        @Test
        @DisplayName("location__with__locationName__eq=Stuttgart")
        void relatedRowMatches() {
            assertEquals(List.of("Tom"), userNames(Map.of("location__with__locationName__eq", "Stuttgart")));
        }

        @Test
        void caseInsensitiveSubOperator() {
            assertEquals(List.of("Micha", "Oli"), userNames(Map.of("location__with__locationName__ieq", "karlsruhe")));
        }

        @Test
        void timestampThroughRelationship() {
            assertEquals(List.of("Tom"), userNames(Map.of("location__with__locationDate__gt", "2016-03-01")));
        }

        @Test
        void nullCheckOnAssociation() {
            assertEquals(List.of(), userNames(List.of(FilterDescriptor.unary("location", "is_null"))));
        }

        @Test
        void fromTheManySide() {
            FilteredQuery<Pet> query = applier.apply(EntityTarget.of(emf, Pet.class),
                    FilterBuilder.buildFilters(Map.of("owner__with__userName__eq", "Micha")),
                    null, null, "petId", true);

            EntityManager em = emf.createEntityManager();
            try {
                List<String> pets = query.getResultList(em).stream().map(Pet::getPetName).collect(Collectors.toList());
                assertEquals(List.of("Hooch", "Rex"), pets);
            } finally {
                em.close();
            }
        }
    }

    @Nested
    @DisplayName("Rejections")
    class RejectionTests {

        @Test
        void withOnBasicAttribute() {
            NotMappedException e = assertThrows(NotMappedException.class,
                    () -> userNames(List.of(new FilterDescriptor("userName", "with", "x__eq=1"))));
            assertEquals("userName", e.getField());
        }

        @Test
        void withOnUnknownAttribute() {
            assertThrows(ColumnNotFoundException.class,
                    () -> userNames(List.of(new FilterDescriptor("friends", "with", "x__eq=1"))));
        }

        @Test
        void withOnFlatSelection() {
            FlatSelection users = FlatSelection.of(emf, User.class).join("location");

            assertThrows(NotMappedException.class, () -> applier.apply(users,
                    List.of(new FilterDescriptor("location", "with", "locationName__eq=Stuttgart"))));
        }

        @Test
        void missingSeparator() {
            MalformedSubqueryException e = assertThrows(MalformedSubqueryException.class,
                    () -> userNames(List.of(new FilterDescriptor("pets", "with", "petName__eq"))));
            assertEquals("pets", e.getField());
        }

        @Test
        void nestedRelationship() {
            assertThrows(UnsupportedOperatorException.class,
                    () -> userNames(List.of(new FilterDescriptor("pets", "with", "owner__with=userName__eq=Oli"))));
        }

        @Test
        void subOperatorMustFitTheRelatedColumn() {
            assertThrows(UnsupportedOperatorException.class,
                    () -> userNames(Map.of("pets__with__petName__gt", "3")));
        }

        @Test
        void unknownRelatedColumn() {
            ColumnNotFoundException e = assertThrows(ColumnNotFoundException.class,
                    () -> userNames(Map.of("pets__with__color__eq", "brown")));
            assertEquals("color", e.getField());
        }

        @Test
        @DisplayName("Only basic attributes of the related entity are reachable")
        void associationOfRelatedEntityIsNotAColumn() {
            ColumnNotFoundException e = assertThrows(ColumnNotFoundException.class,
                    () -> userNames(Map.of("pets__with__owner__is_null", "")));
            assertEquals("owner", e.getField());
        }

        @Test
        void unknownSubOperator() {
            assertThrows(UnsupportedOperatorException.class,
                    () -> userNames(Map.of("pets__with__petName__LIKE", "H%")));
        }
    }
}
