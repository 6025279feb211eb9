package dev.aparikh.msgexplorer.explore;

import dev.aparikh.msgexplorer.config.EngineProperties;
import dev.aparikh.msgexplorer.datatable.QueryResolver;
import dev.aparikh.msgexplorer.dimension.DimensionRegistry;
import dev.aparikh.msgexplorer.error.QueryValidationException;
import dev.aparikh.msgexplorer.error.ReferenceNotFoundException;
import dev.aparikh.msgexplorer.filter.FilterSpec;
import dev.aparikh.msgexplorer.group.Group;
import dev.aparikh.msgexplorer.model.Message;
import dev.aparikh.msgexplorer.testing.InMemoryMessageCorpus;
import dev.aparikh.msgexplorer.testing.TestCatalogs;
import dev.aparikh.msgexplorer.testing.TestMessages;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExampleMessageServiceTest {

    private EngineProperties properties;
    private InMemoryMessageCorpus corpus;
    private ExampleMessageService service;

    @BeforeEach
    void setUp() {
        properties = new EngineProperties();
        corpus = new InMemoryMessageCorpus(TestMessages.sampleCorpus());
        QueryResolver resolver = new QueryResolver(new DimensionRegistry(), TestCatalogs.datasets(1L),
                TestCatalogs.groups(
                        new Group(7L, 1L, "Soup", "soup", List.of()),
                        new Group(8L, 1L, "Replies", null, List.of("reply"))),
                properties);
        service = new ExampleMessageService(resolver, corpus, properties);
    }

    @Test
    void focusNarrowsTheFilteredSlice() {
        List<Message> messages = service.examples(new ExampleMessagesQuery(1L,
                List.of(FilterSpec.timeWindow("time", Instant.parse("2015-02-25T00:00:00Z"), null)),
                List.of(FilterSpec.value("message_type", "tweet")),
                List.of(),
                List.of()));

        assertThat(messages).extracting(Message::id).containsExactly("m1", "m4");
    }

    @Test
    void excludesApplyToExamples() {
        List<Message> messages = service.examples(new ExampleMessagesQuery(1L, List.of(),
                List.of(FilterSpec.value("message_type", "tweet")),
                List.of(FilterSpec.value("language", "es")),
                List.of()));

        assertThat(messages).extracting(Message::id).containsExactly("m1");
    }

    @Test
    void groupsSelectMessagesOfAnyGroup() {
        List<Message> messages = service.examples(new ExampleMessagesQuery(1L, List.of(), List.of(), List.of(),
                List.of(8L, 7L)));

        assertThat(messages).extracting(Message::id).containsExactly("m1", "m2", "m3", "m4");
    }

    @Test
    void sampleIsCappedAtTheConfiguredLimit() {
        properties.setExampleMessageLimit(2);

        List<Message> messages = service.examples(new ExampleMessagesQuery(1L, null, null, null, null));

        assertThat(messages).extracting(Message::id).containsExactly("m1", "m2");
    }

    @Test
    void invalidFocusIsReportedWithItsPath() {
        assertThatThrownBy(() -> service.examples(new ExampleMessagesQuery(1L, List.of(),
                List.of(FilterSpec.value("time", "2015")), List.of(), List.of())))
                .isInstanceOf(QueryValidationException.class)
                .hasFieldOrPropertyWithValue("field", "focus[0].value");
        assertThat(corpus.scans()).isZero();
    }

    @Test
    void unknownGroupIsNotFound() {
        assertThatThrownBy(() -> service.examples(new ExampleMessagesQuery(1L, List.of(), List.of(), List.of(),
                List.of(42L))))
                .isInstanceOf(ReferenceNotFoundException.class)
                .hasFieldOrPropertyWithValue("field", "groups");
    }
}
