package com.company.scheduler.client;

import com.company.scheduler.cache.CaffeineCompletionCache;
import com.company.scheduler.config.SchedulerProperties;
import com.company.scheduler.exception.UpstreamUnavailableException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.ExpectedCount;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class HttpTextGenerationClientTest {

    private static final String URL = "http://text-gen.test/api/chat";

    private SchedulerProperties properties;
    private MockRestServiceServer server;
    private HttpTextGenerationClient client;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        properties = new SchedulerProperties();
        properties.getTextGeneration().setUrl(URL);
        client = new HttpTextGenerationClient(restTemplate, properties,
                new CaffeineCompletionCache(Duration.ofMinutes(5), 100));
    }

    @Test
    void shouldPostChatRequestAndReadReply() {
        server.expect(requestTo(URL))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.model").value("kimi"))
                .andExpect(jsonPath("$.stream").value(false))
                .andExpect(jsonPath("$.messages[0].role").value("system"))
                .andExpect(jsonPath("$.messages[1].content").value("user prompt"))
                .andRespond(withSuccess("{\"choices\":[{\"message\":{\"content\":\"Hello\"}}]}",
                        MediaType.APPLICATION_JSON));

        assertThat(client.complete("kimi", "system prompt", "user prompt")).isEqualTo("Hello");
        server.verify();
    }

    @Test
    void identicalRequestShouldBeServedFromCache() {
        server.expect(ExpectedCount.once(), requestTo(URL))
                .andRespond(withSuccess("{\"choices\":[{\"message\":{\"content\":\"Cached\"}}]}",
                        MediaType.APPLICATION_JSON));

        assertThat(client.complete("glm", "s", "u")).isEqualTo("Cached");
        assertThat(client.complete("glm", "s", "u")).isEqualTo("Cached");
        server.verify();
    }

    @Test
    void emptyReplyShouldUsePlaceholderAndNotBeCached() {
        server.expect(ExpectedCount.twice(), requestTo(URL))
                .andRespond(withSuccess("{\"choices\":[]}", MediaType.APPLICATION_JSON));

        assertThat(client.complete("glm", "s", "u")).isEqualTo(properties.getContent().getEmptyReplyText());
        assertThat(client.complete("glm", "s", "u")).isEqualTo(properties.getContent().getEmptyReplyText());
        server.verify();
    }

    @Test
    void serverErrorShouldSurfaceAsUpstreamUnavailable() {
        server.expect(requestTo(URL)).andRespond(withServerError());

        assertThatThrownBy(() -> client.complete("glm", "s", "u"))
                .isInstanceOf(UpstreamUnavailableException.class);
    }

    @Test
    void shouldFallBackToDeltaContent() throws Exception {
        ObjectMapper mapper = new ObjectMapper();

        assertThat(HttpTextGenerationClient.extractReply(
                mapper.readTree("{\"choices\":[{\"delta\":{\"content\":\"partial\"}}]}"))).contains("partial");
        assertThat(HttpTextGenerationClient.extractReply(mapper.readTree("{}"))).isEmpty();
        assertThat(HttpTextGenerationClient.extractReply(null)).isEmpty();
    }
}
