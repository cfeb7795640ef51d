package com.asl.search.completion;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.springframework.http.HttpMethod.POST;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

class CompletionGatewayTest {

    @Test
    void sendsChatRequestAndReturnsMessageContent() {
        RestTemplate restTemplate = new RestTemplate();
        MockRestServiceServer server = MockRestServiceServer.bindTo(restTemplate).build();
        CompletionGateway gateway = new CompletionGateway(restTemplate, "openai", backend());

        server.expect(requestTo("http://llm.local/v1/chat/completions"))
            .andExpect(method(POST))
            .andExpect(header("Authorization", "Bearer sk-test"))
            .andExpect(jsonPath("$.model").value("gpt-4o-mini"))
            .andExpect(jsonPath("$.messages[0].role").value("user"))
            .andExpect(jsonPath("$.messages[0].content").value("hello"))
            .andExpect(jsonPath("$.temperature").value(0.2))
            .andRespond(withSuccess(
                "{\"choices\":[{\"message\":{\"role\":\"assistant\",\"content\":\"[\\\"a\\\"]\"}}]}",
                MediaType.APPLICATION_JSON));

        String text = gateway.complete("hello", CompletionOptions.withTemperature(0.2));

        assertThat(text).isEqualTo("[\"a\"]");
        server.verify();
    }

    @Test
    void missingContentIsUnavailable() {
        RestTemplate restTemplate = new RestTemplate();
        MockRestServiceServer server = MockRestServiceServer.bindTo(restTemplate).build();
        CompletionGateway gateway = new CompletionGateway(restTemplate, "openai", backend());

        server.expect(requestTo("http://llm.local/v1/chat/completions"))
            .andRespond(withSuccess("{\"choices\":[]}", MediaType.APPLICATION_JSON));

        assertThrows(CompletionUnavailableException.class,
            () -> gateway.complete("hello", CompletionOptions.withTemperature(0.0)));
    }

    @Test
    void serverErrorIsUnavailable() {
        RestTemplate restTemplate = new RestTemplate();
        MockRestServiceServer server = MockRestServiceServer.bindTo(restTemplate).build();
        CompletionGateway gateway = new CompletionGateway(restTemplate, "openai", backend());

        server.expect(requestTo("http://llm.local/v1/chat/completions")).andRespond(withServerError());

        assertThrows(CompletionUnavailableException.class,
            () -> gateway.complete("hello", CompletionOptions.withTemperature(0.0)));
    }

    private static CompletionProperties.Backend backend() {
        CompletionProperties.Backend backend = new CompletionProperties.Backend();
        backend.setBaseUrl("http://llm.local/");
        backend.setApiKey("sk-test");
        return backend;
    }
}
