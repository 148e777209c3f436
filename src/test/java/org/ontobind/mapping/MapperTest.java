package org.ontobind.mapping;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.hp.hpl.jena.ontology.Individual;
import com.hp.hpl.jena.ontology.OntClass;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.ontobind.mapping.Zoo.Bag;
import org.ontobind.mapping.Zoo.Car;
import org.ontobind.mapping.Zoo.Cat;
import org.ontobind.mapping.Zoo.Dog;
import org.ontobind.mapping.Zoo.DogMapper;
import org.ontobind.mapping.Zoo.Kennel;
import org.ontobind.mapping.Zoo.Node;
import org.ontobind.mapping.Zoo.Owner;
import org.ontobind.mapping.Zoo.Person;
import org.ontobind.mapping.Zoo.Tag;
import org.ontobind.ontology.JenaOntologyStore;
import org.ontobind.ontology.ReversingOntologyStore;
import org.ontobind.ontology.UnresolvableNameException;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.ontobind.ontology.TestStores.EXAMPLE_NS;
import static org.ontobind.ontology.TestStores.zoo;

class MapperTest {

    private JenaOntologyStore store;

    @BeforeEach
    void setUp() {
        store = zoo();
    }

    private int individualsOf(final String className) {
        final OntClass ontClass = store.getModel().getOntClass(EXAMPLE_NS + className);
        return store.getModel().listIndividuals(ontClass).toList().size();
    }

    @Nested
    @DisplayName("Round trip")
    class RoundTrip {

        @Test
        void scalarField() {
            final DogMapper mapper = new DogMapper(store);
            final Dog dog = new Dog("pluto");

            assertEquals(dog, mapper.decode(mapper.encode(dog)));
        }

        @Test
        void functionalReferenceAndOrderedList() {
            final Mapper<Person> mapper = Zoo.personMapper(store);
            final Person person = new Person("mario", new Dog("pluto"),
                    List.of(new Car("model1"), new Car("model2"), new Car("model3")));

            assertEquals(person, mapper.decode(mapper.encode(person)));
        }

        @Test
        void absentReferenceAndEmptyList() {
            final Mapper<Person> mapper = Zoo.personMapper(store);
            final Person person = new Person("luigi", null, List.of());

            assertEquals(person, mapper.decode(mapper.encode(person)));
        }

        @Test
        void multiValuedReference() {
            final Mapper<Owner> mapper = Zoo.ownerMapper(store);
            final Owner owner = new Owner("mario", Set.of(new Dog("pluto"), new Dog("rex")));

            assertEquals(owner, mapper.decode(mapper.encode(owner)));
            assertEquals(2, individualsOf("Dog"));
        }

        @Test
        void multiValuedDataPropertyInAnotherNamespace() {
            final Mapper<Cat> mapper = Zoo.catMapper(store, false);
            final Cat cat = new Cat("tom", 3, Set.of("black", "white"));

            assertEquals(cat, mapper.decode(mapper.encode(cat)));
        }

        @Test
        void plainClassWithFields() {
            final Mapper<Kennel> mapper = Zoo.kennelMapper(store);
            final Kennel kennel = new Kennel("north", 12);

            assertEquals(kennel, mapper.decode(mapper.encode(kennel)));
        }

        @Test
        void longAndShortFieldsKeepTheirType() {
            final Mapper<Tag> mapper = Zoo.tagMapper(store);
            final Tag tag = new Tag("x", 5L, (short) 2);

            final Tag decoded = mapper.decode(mapper.encode(tag));

            assertEquals(tag, decoded);
            assertEquals(Long.class, decoded.id().getClass());
        }

        @Test
        void setOfLongsKeepsItsElementType() {
            final Mapper<Bag> mapper = Zoo.bagMapper(store);
            final Bag bag = new Bag("x", Set.of(1L, 2L, 3_000_000_000L));

            assertEquals(bag, mapper.decode(mapper.encode(bag)));
        }

        @Test
        @DisplayName("self-referencing type graph through lazily built mappers")
        void recursiveTypeGraph() {
            final Mapper<Node> mapper = Zoo.nodeMapper(store);
            final Node tree = new Node("root", List.of(
                    new Node("a", List.of(new Node("a1", List.of()), new Node("a2", List.of()))),
                    new Node("b", List.of())));

            assertEquals(tree, mapper.decode(mapper.encode(tree)));
        }
    }

    @Nested
    @DisplayName("Identity resolution")
    class IdentityResolution {

        @Test
        void identityKeyReturnsTheFirstIndividualUnchanged() {
            final Mapper<Cat> mapper = Zoo.catMapper(store, true);

            final Individual first = mapper.encode(new Cat("tom", 3, Set.of("black")));
            final Individual second = mapper.encode(new Cat("tom", 9, Set.of("white")));

            assertEquals(first, second);
            assertEquals(1, individualsOf("Cat"));
            assertEquals(new Cat("tom", 3, Set.of("black")), mapper.decode(second));
        }

        @Test
        void differentIdentityKeysCreateDifferentIndividuals() {
            final Mapper<Cat> mapper = Zoo.catMapper(store, true);

            assertNotEquals(mapper.encode(new Cat("tom", 3, Set.of())), mapper.encode(new Cat("felix", 3, Set.of())));
        }

        @Test
        void withoutKeyEveryFieldMustMatch() {
            final Mapper<Cat> mapper = Zoo.catMapper(store, false);

            final Individual tom3 = mapper.encode(new Cat("tom", 3, Set.of("black")));
            final Individual tom4 = mapper.encode(new Cat("tom", 4, Set.of("black")));
            final Individual tomBlackWhite = mapper.encode(new Cat("tom", 3, Set.of("black", "white")));

            assertNotEquals(tom3, tom4);
            assertNotEquals(tom3, tomBlackWhite);
            assertEquals(tom3, mapper.encode(new Cat("tom", 3, Set.of("black"))));
            assertEquals(3, individualsOf("Cat"));
        }

        @Test
        void sameSingleFieldWithoutKeyFindsTheExistingIndividual() {
            final DogMapper mapper = new DogMapper(store);

            final Individual first = mapper.encode(new Dog("pluto"));
            final Individual second = mapper.encode(new Dog("pluto"));

            assertEquals(first, second);
            assertEquals(1, individualsOf("Dog"));
            assertEquals("pluto", first.getPropertyValue(store.getModel().getOntProperty(EXAMPLE_NS + "entity_name")).asLiteral().getString());
        }

        @Test
        void referencedObjectsTakePartInTheSearch() {
            final Mapper<Person> mapper = Zoo.personMapper(store);

            final Individual withPluto = mapper.encode(new Person("mario", new Dog("pluto"), List.of()));
            final Individual withRex = mapper.encode(new Person("mario", new Dog("rex"), List.of()));

            assertNotEquals(withPluto, withRex);
            assertEquals(withPluto, mapper.encode(new Person("mario", new Dog("pluto"), List.of(new Car("other")))));
        }

        @Test
        void searchingCreatesTheReferencedIndividuals() {
            final Mapper<Person> mapper = Zoo.personMapper(store);
            mapper.encode(new Person("mario", new Dog("pluto"), List.of()));

            mapper.encode(new Person("mario", new Dog("rex"), List.of()));

            assertEquals(2, individualsOf("Dog"));
        }

        @Test
        void twoIdentityKeysAreRejected() {
            final Mapper.Builder<Cat> builder = Mapper.builder(Cat.class)
                    .targetClass("Cat")
                    .map("name", DataPropertyMapping.identityKey("entity_name"))
                    .map("age", DataPropertyMapping.identityKey("age"));

            assertThrows(MappingConfigurationException.class, () -> builder.build(store));
        }
    }

    @Nested
    @DisplayName("Fields that cannot be searched on")
    class UnsearchableFields {

        private ListAppender<ILoggingEvent> appender;
        private Logger mapperLogger;

        @BeforeEach
        void attachAppender() {
            mapperLogger = (Logger) LoggerFactory.getLogger(Mapper.class);
            appender = new ListAppender<>();
            appender.start();
            mapperLogger.addAppender(appender);
        }

        @Test
        void listFieldIsLeftOutOfTheSearchWithAWarning() {
            final Mapper<Person> mapper = Zoo.personMapper(store);
            try {
                final Individual first = mapper.encode(new Person("mario", null, List.of(new Car("a"))));
                final Individual second = mapper.encode(new Person("mario", null, List.of(new Car("b"))));

                assertEquals(first, second);
            } finally {
                mapperLogger.detachAppender(appender);
            }

            final List<ILoggingEvent> warnings = appender.list.stream()
                    .filter(event -> event.getLevel() == Level.WARN)
                    .collect(Collectors.toList());
            assertEquals(2, warnings.size());
            assertTrue(warnings.get(0).getFormattedMessage().contains("'cars'"));
        }
    }

    @Nested
    @DisplayName("List ordering")
    class ListOrdering {

        @Test
        void orderSurvivesAStoreReturningPivotsBackwards() {
            final ReversingOntologyStore reversing = new ReversingOntologyStore(store);
            final Mapper<Person> mapper = Zoo.personMapper(reversing);
            final List<Car> cars = List.of(new Car("A"), new Car("B"), new Car("C"));

            final Person decoded = mapper.decode(mapper.encode(new Person("luigi", null, cars)));

            assertEquals(cars, decoded.cars());
        }
    }

    @Nested
    @DisplayName("Errors")
    class Errors {

        @Test
        void unknownTargetClassPropagatesTheStoreError() {
            final Mapper<Dog> mapper = new Mapper<>(Dog.class, QualifiedName.of("Unicorn"),
                    Map.of("name", new DataPropertyMapping("entity_name")), store);

            assertThrows(UnresolvableNameException.class, () -> mapper.encode(new Dog("pluto")));
        }

        @Test
        void unknownPropertyPropagatesTheStoreError() {
            final Mapper<Dog> mapper = new Mapper<>(Dog.class, QualifiedName.of("Dog"),
                    Map.of("name", new DataPropertyMapping("weight")), store);

            final UnresolvableNameException exception = assertThrows(UnresolvableNameException.class, () -> mapper.encode(new Dog("pluto")));
            assertEquals("weight", exception.getName());
        }

        @Test
        void decodeResolvesTheTargetClassToo() {
            final Individual individual = new DogMapper(store).encode(new Dog("pluto"));
            final Mapper<Dog> mapper = new Mapper<>(Dog.class, QualifiedName.of("Unicorn"),
                    Map.of("name", new DataPropertyMapping("entity_name")), store);

            assertThrows(UnresolvableNameException.class, () -> mapper.decode(individual));
        }

        @Test
        void decodingIntoAMismatchingTypeFails() {
            final Individual individual = new DogMapper(store).encode(new Dog("pluto"));
            final Mapper<Car> carShapedMapper = new Mapper<>(Car.class, QualifiedName.of("Dog"),
                    Map.of("name", new DataPropertyMapping("entity_name")), store);

            assertThrows(DomainConstructionException.class, () -> carShapedMapper.decode(individual));
        }
    }
}
