package fr.lapetina.congress.gateway.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import fr.lapetina.congress.gateway.domain.exception.CongressApiException;
import fr.lapetina.congress.gateway.domain.model.ErrorKind;
import fr.lapetina.congress.gateway.domain.model.SearchRequest;
import fr.lapetina.congress.gateway.domain.validation.ParameterValidator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SearchServiceTest {

    private RecordingExecutor executor;
    private SearchService searchService;

    @BeforeEach
    void setUp() {
        executor = new RecordingExecutor();
        searchService = new SearchService(executor, ParameterValidator.defaults());
    }

    @Test
    @DisplayName("should send query, filters, sort and paging to the collection endpoint")
    void shouldBuildUpstreamCall() {
        SearchRequest request = SearchRequest.builder()
                .collection("Bill")
                .query(" clean air ")
                .filter("type", "hr")
                .filter("fromDateTime", "2023-01-01T00:00:00Z")
                .sort("updateDate+desc")
                .limit(20)
                .offset(40)
                .build();

        searchService.search(request).join();

        assertThat(executor.endpoints).containsExactly("/bill");
        assertThat(executor.params.get(0))
                .containsEntry("q", "clean air")
                .containsEntry("type", "hr")
                .containsEntry("fromDateTime", "2023-01-01T00:00:00Z")
                .containsEntry("sort", "updateDate+desc")
                .containsEntry("limit", "20")
                .containsEntry("offset", "40");
    }

    @Test
    @DisplayName("should normalize date-time filters")
    void shouldNormalizeDateTimes() {
        Map<String, String> params = searchService.toQueryParams("amendment", SearchRequest.builder()
                .collection("amendment")
                .filter("toDateTime", "2023-06-30T12:00:00.000Z")
                .build());

        assertThat(params).containsEntry("toDateTime", "2023-06-30T12:00:00Z");
    }

    @Test
    @DisplayName("should refuse a congress filter instead of ignoring it")
    void shouldRefuseCongressFilter() {
        SearchRequest request = SearchRequest.builder().collection("bill").filter("congress", "118").build();

        assertThatThrownBy(() -> searchService.search(request))
                .isInstanceOf(CongressApiException.class)
                .hasMessageStartingWith("Filter 'congress' is not supported for collection 'bill'")
                .extracting(e -> ((CongressApiException) e).getKind())
                .isEqualTo(ErrorKind.INVALID_PARAMETER);
        assertThat(executor.endpoints).isEmpty();
    }

    @Test
    @DisplayName("should reject unknown collections, filters and sorts")
    void shouldRejectInvalidInput() {
        assertThatThrownBy(() -> searchService.search(SearchRequest.builder().collection("votes").build()))
                .hasMessageStartingWith("Invalid search collection 'votes'");
        assertThatThrownBy(() -> searchService.search(SearchRequest.builder().collection(null).build()))
                .hasMessage("Search collection is required");
        assertThatThrownBy(() -> searchService.search(
                SearchRequest.builder().collection("bill").filter("sponsor", "x").build()))
                .hasMessage("Filter 'sponsor' is not supported for collection 'bill'");
        assertThatThrownBy(() -> searchService.search(
                SearchRequest.builder().collection("bill").sort("title").build()))
                .hasMessage("Invalid sort 'title'. Must be one of: updateDate+asc, updateDate+desc");
        assertThatThrownBy(() -> searchService.search(
                SearchRequest.builder().collection("bill").filter("fromDateTime", "yesterday").build()))
                .hasMessageContaining("Must be an ISO-8601 date-time");
        assertThatThrownBy(() -> searchService.search(
                SearchRequest.builder().collection("bill").query("   ").build()))
                .hasMessage("Search query must not be blank");
        assertThatThrownBy(() -> searchService.search(
                SearchRequest.builder().collection("bill").limit(500).build()))
                .hasMessageContaining("between 1 and 250");

        assertThat(executor.endpoints).isEmpty();
    }

    @Test
    @DisplayName("should name the envelope after the collection")
    void shouldNameEnvelope() {
        assertThat(SearchService.envelopeUri("treaty")).isEqualTo("congress-gov://search/treaty");
    }

    private static final class RecordingExecutor extends RequestExecutor {
        private final List<String> endpoints = new ArrayList<>();
        private final List<Map<String, String>> params = new ArrayList<>();

        RecordingExecutor() {
            super(null, null, null);
        }

        @Override
        public CompletableFuture<JsonNode> execute(String endpoint, Map<String, String> query) {
            endpoints.add(endpoint);
            params.add(query);
            return CompletableFuture.completedFuture(JsonNodeFactory.instance.objectNode());
        }
    }
}
