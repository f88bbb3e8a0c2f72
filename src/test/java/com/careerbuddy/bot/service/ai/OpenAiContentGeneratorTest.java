package com.careerbuddy.bot.service.ai;

import com.careerbuddy.bot.exception.UpstreamGenerationException;
import com.careerbuddy.bot.model.Tier;
import com.careerbuddy.bot.model.answers.Experience;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.RestTemplate;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class OpenAiContentGeneratorTest {

    private static final String API_URL = "https://ai.example.com/v1/chat/completions";

    private final ObjectMapper mapper = new ObjectMapper();

    @Mock
    private RestTemplate restTemplate;

    @Captor
    private ArgumentCaptor<HttpEntity<Map<String, Object>>> requestCaptor;

    private OpenAiContentGenerator generator;

    @BeforeEach
    void setUp() {
        generator = new OpenAiContentGenerator(restTemplate);
        ReflectionTestUtils.setField(generator, "apiUrl", API_URL);
        ReflectionTestUtils.setField(generator, "apiKey", "test-key");
        ReflectionTestUtils.setField(generator, "model", "gpt-4o-mini");
    }

    private void respondWith(String content) {
        JsonNode body = mapper.createObjectNode()
                .set("choices", mapper.createArrayNode()
                        .add(mapper.createObjectNode()
                                .set("message", mapper.createObjectNode().put("content", content))));
        when(restTemplate.exchange(eq(API_URL), eq(HttpMethod.POST), any(HttpEntity.class), eq(JsonNode.class)))
                .thenReturn(ResponseEntity.ok(body));
    }

    private static GenerationRequest request(Tier tier) {
        Experience experience = new Experience("Analyst", "Acme", "Lagos", "2020", "Present");
        experience.getBullets().add("Built the weekly sales dashboard");
        return GenerationRequest.builder()
                .jobId(5L)
                .tier(tier)
                .targetRole("Data Analyst")
                .experiences(List.of(experience))
                .skills(List.of("SQL"))
                .originalContent("Old resume text")
                .build();
    }

    @Test
    @DisplayName("Should split the skill list and cap it at ten")
    void shouldParseSkills() {
        respondWith("SQL, Python, Tableau, Excel, R, Spark, dbt, Airflow, Looker, Statistics, Power BI, x");

        List<String> skills = generator.suggestSkills(request(Tier.FREE));

        assertThat(skills).hasSize(10).startsWith("SQL", "Python");
    }

    @Test
    @DisplayName("Should include experience in the pro prompt")
    @SuppressWarnings("unchecked")
    void shouldUseProPrompt() {
        respondWith("A summary.");

        generator.writeSummary(request(Tier.PRO));

        verify(restTemplate).exchange(eq(API_URL), eq(HttpMethod.POST), requestCaptor.capture(), eq(JsonNode.class));
        List<Map<String, Object>> messages = (List<Map<String, Object>>) requestCaptor.getValue().getBody().get("messages");
        assertThat((String) messages.get(1).get("content"))
                .contains("Analyst at Acme")
                .contains("Built the weekly sales dashboard");
        assertThat(requestCaptor.getValue().getHeaders().getFirst("Authorization")).isEqualTo("Bearer test-key");
    }

    @Test
    @DisplayName("Should strip surrounding quotes from the summary")
    void shouldStripQuotes() {
        respondWith("\"Analyst who ships insights.\"");

        assertThat(generator.writeSummary(request(Tier.FREE))).isEqualTo("Analyst who ships insights.");
    }

    @Test
    @DisplayName("Should reject an empty completion")
    void shouldRejectEmptyCompletion() {
        respondWith("   ");

        assertThatThrownBy(() -> generator.revampResume(request(Tier.FREE)))
                .isInstanceOf(UpstreamGenerationException.class);
    }

    @Test
    @DisplayName("Should wrap HTTP errors")
    void shouldWrapHttpErrors() {
        when(restTemplate.exchange(eq(API_URL), eq(HttpMethod.POST), any(HttpEntity.class), eq(JsonNode.class)))
                .thenThrow(new HttpServerErrorException(HttpStatus.BAD_GATEWAY));

        assertThatThrownBy(() -> generator.suggestSkills(request(Tier.FREE)))
                .isInstanceOf(UpstreamGenerationException.class)
                .hasMessageContaining("502");
    }

    @Test
    @DisplayName("Should not call the API without a key")
    void shouldRequireApiKey() {
        ReflectionTestUtils.setField(generator, "apiKey", "");

        assertThatThrownBy(() -> generator.writeSummary(request(Tier.FREE)))
                .isInstanceOf(UpstreamGenerationException.class);
        verifyNoInteractions(restTemplate);
    }
}
