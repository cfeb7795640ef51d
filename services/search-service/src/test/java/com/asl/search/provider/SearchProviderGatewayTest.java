package com.asl.search.provider;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.springframework.http.HttpMethod.POST;
import static org.springframework.test.web.client.ExpectedCount.times;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.asl.search.provider.dto.ProviderSearchRequest;
import com.asl.search.provider.dto.ProviderSearchResponse;
import com.asl.search.resilience.SearchResilienceProperties;
import com.asl.search.resilience.SearchResilienceRegistry;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

class SearchProviderGatewayTest {

    @Test
    void postsVariantQueryAndParsesCategories() {
        RestTemplate restTemplate = new RestTemplate();
        MockRestServiceServer server = MockRestServiceServer.bindTo(restTemplate).build();
        SearchProviderGateway gateway = new SearchProviderGateway(restTemplate, properties(), registry(5));

        server.expect(requestTo("http://provider.local/search"))
            .andExpect(method(POST))
            .andExpect(jsonPath("$.query").value("ev range"))
            .andExpect(jsonPath("$.numResults").value(10))
            .andExpect(jsonPath("$.types[0]").value("web"))
            .andRespond(withSuccess(
                "{\"web\":[{\"url\":\"https://a.example\",\"title\":\"A\",\"description\":\"about a\",\"position\":1}],"
                    + "\"news\":[{\"url\":\"https://n.example\",\"title\":\"N\",\"snippet\":\"news\",\"date\":\"1d\"}]}",
                MediaType.APPLICATION_JSON));

        ProviderSearchResponse response = gateway.search(request().forQuery("ev range"));

        assertThat(response.getWeb()).hasSize(1);
        assertThat(response.getWeb().get(0).getDescription()).isEqualTo("about a");
        assertThat(response.getWeb().get(0).getPosition()).isEqualTo(1);
        assertThat(response.getNews().get(0).getSnippet()).isEqualTo("news");
        server.verify();
    }

    @Test
    void serverErrorIsUnavailable() {
        RestTemplate restTemplate = new RestTemplate();
        MockRestServiceServer server = MockRestServiceServer.bindTo(restTemplate).build();
        SearchProviderGateway gateway = new SearchProviderGateway(restTemplate, properties(), registry(5));

        server.expect(requestTo("http://provider.local/search")).andRespond(withServerError());

        assertThrows(SearchProviderUnavailableException.class, () -> gateway.search(request()));
    }

    @Test
    void openBreakerShortCircuits() {
        RestTemplate restTemplate = new RestTemplate();
        MockRestServiceServer server = MockRestServiceServer.bindTo(restTemplate).build();
        SearchProviderGateway gateway = new SearchProviderGateway(restTemplate, properties(), registry(2));

        server.expect(times(2), requestTo("http://provider.local/search")).andRespond(withServerError());

        assertThrows(SearchProviderUnavailableException.class, () -> gateway.search(request()));
        assertThrows(SearchProviderUnavailableException.class, () -> gateway.search(request()));
        SearchProviderUnavailableException open = assertThrows(SearchProviderUnavailableException.class,
            () -> gateway.search(request()));
        assertThat(open.getMessage()).isEqualTo("search_provider_circuit_open");
        server.verify();
    }

    private static ProviderSearchRequest request() {
        ProviderSearchRequest request = new ProviderSearchRequest();
        request.setQuery("ev");
        request.setNumResults(10);
        request.setTypes(List.of("web"));
        return request;
    }

    private static SearchProviderProperties properties() {
        SearchProviderProperties properties = new SearchProviderProperties();
        properties.setBaseUrl("http://provider.local");
        return properties;
    }

    private static SearchResilienceRegistry registry(int providerFailureThreshold) {
        SearchResilienceProperties properties = new SearchResilienceProperties();
        properties.setProviderFailureThreshold(providerFailureThreshold);
        return new SearchResilienceRegistry(properties);
    }
}
