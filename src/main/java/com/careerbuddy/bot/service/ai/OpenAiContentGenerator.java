package com.careerbuddy.bot.service.ai;

import com.careerbuddy.bot.exception.UpstreamGenerationException;
import com.careerbuddy.bot.model.answers.Experience;
import com.fasterxml.jackson.databind.JsonNode;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Content generator backed by an OpenAI compatible chat completions endpoint. Pro users get the
 * richer prompts that use their experience.
 */
@Service
public class OpenAiContentGenerator implements ContentGenerator {

    private static final Logger log = LoggerFactory.getLogger(OpenAiContentGenerator.class);

    private static final int MAX_SKILLS = 10;

    private final RestTemplate restTemplate;

    @Value("${ai.api.url}")
    private String apiUrl;

    @Value("${ai.api.key:}")
    private String apiKey;

    @Value("${ai.model:gpt-4o-mini}")
    private String model;

    @Autowired
    public OpenAiContentGenerator(RestTemplate restTemplate) {
        this.restTemplate = restTemplate;
    }

    @Override
    public List<String> suggestSkills(GenerationRequest request) {
        String prompt = request.isPro() ? proSkillsPrompt(request) : basicSkillsPrompt(request);
        String text = complete("You are a professional resume writer helping candidates identify relevant skills.",
                prompt, 0.7, 200);

        List<String> skills = Arrays.stream(text.split(","))
                .map(String::trim)
                .filter(s -> s.length() > 1)
                .limit(MAX_SKILLS)
                .toList();
        if (skills.isEmpty()) {
            throw new UpstreamGenerationException("Generator returned no skills");
        }
        log.info("Generated {} skills for job {}", skills.size(), request.getJobId());
        return skills;
    }

    @Override
    public String writeSummary(GenerationRequest request) {
        String prompt = request.isPro() ? proSummaryPrompt(request) : basicSummaryPrompt(request);
        String summary = stripQuotes(complete("You are a professional resume writer.", prompt, 0.8,
                request.isPro() ? 250 : 150));
        log.info("Generated summary for job {} ({} chars)", request.getJobId(), summary.length());
        return summary;
    }

    @Override
    public String revampResume(GenerationRequest request) {
        if (request.getOriginalContent() == null || request.getOriginalContent().isBlank()) {
            throw new UpstreamGenerationException("Nothing to revamp for job " + request.getJobId());
        }
        String requirements = request.isPro()
                ? """
                  - Enhance all bullet points with quantifiable metrics and business impact
                  - Use strong action verbs (Led, Drove, Increased, Reduced)
                  - Highlight leadership and strategic contributions
                  - Make it ATS-friendly and keep the same structure"""
                : """
                  - Fix grammar and spelling errors
                  - Use consistent formatting and action verbs
                  - Improve clarity and keep it concise
                  - Make it ATS-friendly""";
        String prompt = "Improve the following resume content:\n\n" + request.getOriginalContent()
                + "\n\nRequirements:\n" + requirements + "\n\nReturn only the improved resume content.";

        String revamped = complete("You are a professional resume writer who improves resume content.", prompt, 0.7, 1500);
        log.info("Revamped resume for job {} ({} chars)", request.getJobId(), revamped.length());
        return revamped;
    }

    @NotNull
    private String complete(String system, String prompt, double temperature, int maxTokens) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new UpstreamGenerationException("AI API key is not configured");
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        headers.setBearerAuth(apiKey);

        List<Map<String, Object>> messages = new ArrayList<>();
        messages.add(message("system", system));
        messages.add(message("user", prompt));

        Map<String, Object> body = new HashMap<>();
        body.put("model", model);
        body.put("messages", messages);
        body.put("temperature", temperature);
        body.put("max_tokens", maxTokens);

        log.debug("Sending completion request, prompt length {}", prompt.length());
        try {
            ResponseEntity<JsonNode> response = restTemplate.exchange(
                    apiUrl, HttpMethod.POST, new HttpEntity<>(body, headers), JsonNode.class);

            JsonNode content = response.getBody() == null ? null
                    : response.getBody().path("choices").path(0).path("message").path("content");
            if (content == null || content.isMissingNode() || content.asText().isBlank()) {
                throw new UpstreamGenerationException("Empty completion from AI API");
            }
            return content.asText().trim();
        } catch (HttpStatusCodeException e) {
            throw new UpstreamGenerationException("AI API returned " + e.getStatusCode(), e);
        } catch (RestClientException e) {
            throw new UpstreamGenerationException("AI API call failed: " + e.getMessage(), e);
        }
    }

    private static Map<String, Object> message(String role, String content) {
        Map<String, Object> message = new HashMap<>();
        message.put("role", role);
        message.put("content", content);
        return message;
    }

    private static String basicSkillsPrompt(GenerationRequest request) {
        return "List 8-10 relevant skills for a " + roleOf(request) + " role.\n\n"
                + "Include a mix of technical and soft skills appropriate for this position.\n\n"
                + "Return ONLY a comma-separated list of skills, nothing else.";
    }

    private static String proSkillsPrompt(GenerationRequest request) {
        StringBuilder context = new StringBuilder("Target Role: ").append(roleOf(request)).append('\n');
        appendExperience(context, request.getExperiences(), 3, 2);
        return "Based on the following information about a job candidate, suggest 8-10 highly relevant, "
                + "specific skills for their resume.\n\n" + context
                + "\nInclude tools and technologies from their experience, domain expertise, advanced skills for the "
                + "target role and strategic soft skills.\n\nReturn ONLY a comma-separated list of skills, nothing else.";
    }

    private static String basicSummaryPrompt(GenerationRequest request) {
        List<String> skills = request.getSkills().subList(0, Math.min(3, request.getSkills().size()));
        return "Write a brief 2-sentence professional summary for a " + roleOf(request) + ".\n\n"
                + "Their experience: " + request.getExperiences().size() + " position(s)\n"
                + "Key skills: " + (skills.isEmpty() ? "various skills" : String.join(", ", skills)) + "\n"
                + personalInfoLine(request)
                + "\nUse a natural, professional tone. Return only the summary text.";
    }

    private static String proSummaryPrompt(GenerationRequest request) {
        StringBuilder context = new StringBuilder("Target Role: ").append(roleOf(request)).append('\n');
        if (!request.getSkills().isEmpty()) {
            context.append("Key Skills: ").append(String.join(", ", request.getSkills())).append('\n');
        }
        appendExperience(context, request.getExperiences(), 2, 3);
        context.append(personalInfoLine(request));
        return "Based on the following resume information, write a compelling, senior-level professional summary.\n\n"
                + context
                + "\nWrite 3 sentences that show seniority and impact, highlight quantifiable achievements and tools, "
                + "and sound natural. Return only the summary text, no quotes, no labels.";
    }

    private static void appendExperience(StringBuilder context, List<Experience> experiences, int maxRoles, int maxBullets) {
        if (experiences.isEmpty()) {
            return;
        }
        context.append("Work Experience:\n");
        for (Experience exp : experiences.subList(0, Math.min(maxRoles, experiences.size()))) {
            context.append("- ").append(exp.getRole()).append(" at ").append(exp.getCompany()).append('\n');
            for (String bullet : exp.getBullets().subList(0, Math.min(maxBullets, exp.getBullets().size()))) {
                context.append("  • ").append(bullet).append('\n');
            }
        }
    }

    private static String personalInfoLine(GenerationRequest request) {
        String info = request.getPersonalInfo();
        return info == null || info.isBlank() ? "" : "About them: " + info + "\n";
    }

    private static String roleOf(GenerationRequest request) {
        return request.getTargetRole() == null || request.getTargetRole().isBlank() ? "professional" : request.getTargetRole();
    }

    private static String stripQuotes(String text) {
        if (text.length() > 1 && text.startsWith("\"") && text.endsWith("\"")) {
            return text.substring(1, text.length() - 1).trim();
        }
        return text;
    }
}
