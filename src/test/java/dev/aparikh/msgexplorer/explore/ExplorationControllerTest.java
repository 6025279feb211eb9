package dev.aparikh.msgexplorer.explore;

import dev.aparikh.msgexplorer.datatable.QueryResolver;
import dev.aparikh.msgexplorer.dimension.DimensionRegistry;
import dev.aparikh.msgexplorer.error.ReferenceNotFoundException;
import dev.aparikh.msgexplorer.history.ActionHistoryRecorder;
import dev.aparikh.msgexplorer.model.Message;
import dev.aparikh.msgexplorer.testing.TestCatalogs;
import dev.aparikh.msgexplorer.testing.TestMessages;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(controllers = ExplorationController.class)
@Import(DimensionRegistry.class)
class ExplorationControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private ExampleMessageService exampleMessageService;

    @MockitoBean
    private KeywordSuggestionService keywordSuggestionService;

    @MockitoBean
    private KeywordSearchService keywordSearchService;

    @MockitoBean
    private QueryResolver resolver;

    @MockitoBean
    private ActionHistoryRecorder history;

    @Test
    void exampleMessagesReturnsTheSample() throws Exception {
        Message message = TestMessages.sampleCorpus().get(0);
        when(exampleMessageService.examples(any(ExampleMessagesQuery.class))).thenReturn(List.of(message));

        mockMvc.perform(post("/api/messages")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "dataset": 1,
                                  "focus": [{"dimension": "message_type", "value": "tweet"}],
                                  "groups": [7]
                                }
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.dataset").value(1))
                .andExpect(jsonPath("$.focus[0].value").value("tweet"))
                .andExpect(jsonPath("$.filters").isEmpty())
                .andExpect(jsonPath("$.messages[0].id").value("m1"))
                .andExpect(jsonPath("$.messages[0].text").value("Soup for lunch #soup #lunch"));

        ArgumentCaptor<ExampleMessagesQuery> captor = ArgumentCaptor.forClass(ExampleMessagesQuery.class);
        verify(exampleMessageService).examples(captor.capture());
        assertThat(captor.getValue().focus()).hasSize(1);
        assertThat(captor.getValue().groupIds()).containsExactly(7L);
        verify(history).record(any(), eq("example-messages"), any());
    }

    @Test
    void searchReturnsMessagesMatchingTheKeywordExpression() throws Exception {
        Message message = TestMessages.sampleCorpus().get(1);
        when(keywordSearchService.search(1L, "soup lad,NOT job", List.of("retweet"))).thenReturn(List.of(message));

        mockMvc.perform(post("/api/search")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "dataset": 1,
                                  "keywords": "soup lad,NOT job",
                                  "types_list": ["retweet"]
                                }
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.dataset").value(1))
                .andExpect(jsonPath("$.keywords").value("soup lad,NOT job"))
                .andExpect(jsonPath("$.types_list[0]").value("retweet"))
                .andExpect(jsonPath("$.messages[0].id").value("m2"));

        verify(history).record(any(), eq("search"), any());
    }

    @Test
    void searchWithoutTypesSearchesAllTypes() throws Exception {
        when(keywordSearchService.search(1L, null, List.of())).thenReturn(List.of());

        mockMvc.perform(post("/api/search")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"dataset\": 1}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.types_list").isEmpty())
                .andExpect(jsonPath("$.messages").isEmpty());
    }

    @Test
    void searchRequiresADataset() throws Exception {
        mockMvc.perform(post("/api/search")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"keywords\": \"soup\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.field").value("dataset"));
    }

    @Test
    void keywordsReturnsSuggestions() throws Exception {
        when(keywordSuggestionService.suggest(1L, "soup la"))
                .thenReturn(new KeywordSuggestions(1L, "soup la", List.of("soup lad")));

        mockMvc.perform(get("/api/keywords").param("dataset", "1").param("q", "soup la"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.dataset").value(1))
                .andExpect(jsonPath("$.q").value("soup la"))
                .andExpect(jsonPath("$.keywords[0]").value("soup lad"));

        verify(history).record(any(), eq("auto-complete:get-list"), any());
    }

    @Test
    void keywordsRequiresADataset() throws Exception {
        mockMvc.perform(get("/api/keywords").param("q", "soup"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.field").value("dataset"));
    }

    @Test
    void datasetReturnsTheCatalogRecord() throws Exception {
        when(resolver.requireDataset(1L)).thenReturn(TestCatalogs.dataset(1L));

        mockMvc.perform(get("/api/dataset").param("id", "1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value(1))
                .andExpect(jsonPath("$.message_count").value(4))
                .andExpect(jsonPath("$.start_time").value("2015-02-25T00:00:00Z"));

        verify(history).record(any(), eq("dataset:get"), any());
    }

    @Test
    void unknownDatasetIsNotFound() throws Exception {
        when(resolver.requireDataset(99L)).thenThrow(ReferenceNotFoundException.dataset(99L));

        mockMvc.perform(get("/api/dataset").param("id", "99"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("NOT_FOUND"));
    }

    @Test
    void dimensionsListsTheCatalog() throws Exception {
        mockMvc.perform(get("/api/dimensions"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(12))
                .andExpect(jsonPath("$[0].key").value("time"))
                .andExpect(jsonPath("$[0].kind").value("temporal"))
                .andExpect(jsonPath("$[1].labels.tweet").value("Tweet"));
    }
}
