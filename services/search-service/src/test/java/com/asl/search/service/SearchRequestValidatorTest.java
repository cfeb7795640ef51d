package com.asl.search.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.asl.search.api.dto.ErrorResponse.FieldError;
import com.asl.search.api.dto.ResultCategory;
import com.asl.search.api.dto.SearchRequest;
import com.asl.search.completion.TextCompletionRegistry;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class SearchRequestValidatorTest {
    private final SearchLoopProperties loopProperties = new SearchLoopProperties();
    private final SearchRequestValidator validator = new SearchRequestValidator(
        new TextCompletionRegistry(Map.of("openai", (prompt, options) -> "[]"), "openai"),
        loopProperties
    );

    @Test
    void appliesDefaults() {
        SearchRequest request = new SearchRequest();
        request.setQuery("  rust   compiler ");

        SearchCommand command = validator.validate(request, "team-1", 9L, "req-1");

        assertThat(command.getQuery()).isEqualTo("rust compiler");
        assertThat(command.getLimit()).isEqualTo(5);
        assertThat(command.getSources()).containsExactly(ResultCategory.WEB);
        assertThat(command.getCategories()).isEmpty();
        assertThat(command.getTimeoutMs()).isEqualTo(60000);
        assertThat(command.getLang()).isEqualTo("en");
        assertThat(command.getCountry()).isEqualTo("us");
        assertThat(command.getOrigin()).isEqualTo("api");
        assertThat(command.isAsyncScraping()).isFalse();
        assertThat(command.isPreview()).isFalse();
        assertThat(command.getTeamId()).isEqualTo("team-1");
        assertThat(command.getApiKeyId()).isEqualTo(9L);
        assertThat(command.getRequestId()).isEqualTo("req-1");
    }

    @Test
    void resolvesSourcesAndCategoriesWithoutDuplicates() {
        SearchRequest request = new SearchRequest();
        request.setQuery("rust");
        request.setSources(List.of("news", "web", "NEWS"));
        request.setCategories(List.of("GitHub", "research", "github"));

        SearchCommand command = validator.validate(request, "team-1", null, "req-2");

        assertThat(command.getSources()).containsExactly(ResultCategory.NEWS, ResultCategory.WEB);
        assertThat(command.getCategories()).containsExactly("github", "research");
    }

    @Test
    void collectsEveryFieldError() {
        SearchRequest request = new SearchRequest();
        request.setQuery(" ");
        request.setLimit(0);
        request.setSources(List.of("videos"));
        request.setCategories(List.of("recipes"));
        request.setTimeout(10);
        request.setCompletionBackend("missing");

        InvalidSearchRequestException error = assertThrows(InvalidSearchRequestException.class,
            () -> validator.validate(request, "team-1", null, "req-3"));

        assertThat(error.getFieldErrors()).extracting(FieldError::getField)
            .containsExactly("query", "limit", "sources", "categories", "timeout", "completionBackend");
    }

    @Test
    void rejectsOverlongQueryAndLimit() {
        SearchRequest request = new SearchRequest();
        request.setQuery("x".repeat(501));
        request.setLimit(101);

        InvalidSearchRequestException error = assertThrows(InvalidSearchRequestException.class,
            () -> validator.validate(request, "team-1", null, "req-4"));

        assertThat(error.getFieldErrors()).extracting(FieldError::getField).containsExactly("query", "limit");
    }

    @Test
    void missingBodyIsRejected() {
        InvalidSearchRequestException error = assertThrows(InvalidSearchRequestException.class,
            () -> validator.validate(null, "team-1", null, "req-5"));

        assertThat(error.getFieldErrors()).extracting(FieldError::getField).containsExactly("body");
    }

    @Test
    void previewRequiresConfiguredMatchingToken() {
        SearchRequest request = new SearchRequest();
        request.setQuery("rust");
        request.setSearchPreviewToken("secret");

        assertThat(validator.validate(request, "team-1", null, "req-6").isPreview()).isFalse();

        loopProperties.setPreviewToken("secret");
        assertThat(validator.validate(request, "team-1", null, "req-7").isPreview()).isTrue();

        request.setSearchPreviewToken("other");
        assertThat(validator.validate(request, "team-1", null, "req-8").isPreview()).isFalse();
    }

    @Test
    void knownCompletionBackendIsAccepted() {
        SearchRequest request = new SearchRequest();
        request.setQuery("rust");
        request.setCompletionBackend(" openai ");

        assertThat(validator.validate(request, "team-1", null, "req-9").getCompletionBackend()).isEqualTo("openai");
    }
}
