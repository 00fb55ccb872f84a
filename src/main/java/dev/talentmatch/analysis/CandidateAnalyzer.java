package dev.talentmatch.analysis;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.input.PromptTemplate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Adapter between the ranking pipeline and the LLM-based structured assessment.
 *
 * <p>The chat model is treated as untrusted text: replies are stripped of code fences, parsed as a
 * JSON object and normalised into {@link AnalysisResult} / {@link JobRequirements}. Missing fields
 * get safe defaults and scores are clamped to [0, 100]. Blank input, empty replies, malformed JSON
 * and any exception thrown by the model all resolve to a fallback result; nothing escapes {@link
 * #analyze(String, String)} or {@link #extractRequirements(String)}.
 */
@Service
public class CandidateAnalyzer {

  private static final Logger log = LoggerFactory.getLogger(CandidateAnalyzer.class);

  static final String MISSING_JOB_DESCRIPTION = "Please provide a Job Description.";
  static final String MISSING_CV = "Please provide a CV.";
  static final String EMPTY_REPLY = "LLM returned empty output. Please try again.";
  static final String ANALYSIS_FAILED = "Analysis could not be completed. Please try again.";

  static final int RAW_REPLY_LOG_LIMIT = 500;

  private static final PromptTemplate ANALYSIS_PROMPT =
      PromptTemplate.from(
          """
          You are an expert HR analyst specializing in candidate evaluation. Analyze the CV \
          against the Job Description and provide a comprehensive assessment.

          Job Description:
          {{job_description}}

          Candidate CV:
          {{cv_text}}

          Respond with a JSON object of exactly this shape:
          {
            "candidate_name": "candidate name as written in the CV",
            "skill_match_score": <0-100, percentage of required skills found in the CV>,
            "experience_score": <0-100, relevance of the experience to the role>,
            "tool_tech_score": <0-100, alignment with required tools and technologies>,
            "seniority_score": <0-100, match with the required seniority level>,
            "matched_skills": ["skill", ...],
            "missing_skills": ["skill", ...],
            "explanation": "strengths and gaps in 2-3 sentences"
          }

          Focus on:
          1. Extract all required skills from the Job Description and check their presence in the CV
          2. Evaluate years and relevance of experience
          3. Match tools, technologies and frameworks mentioned
          4. Assess seniority level alignment
          5. Give a clear, actionable explanation

          Return ONLY valid JSON, no additional text.
          """);

  private static final PromptTemplate REQUIREMENTS_PROMPT =
      PromptTemplate.from(
          """
          Extract the key requirements from the following Job Description:

          {{job_description}}

          Respond with a JSON object of exactly this shape:
          {
            "required_skills": ["skill", ...],
            "required_tools": ["tool", ...],
            "required_experience_years": <number>,
            "seniority_level": "junior/mid/senior/lead",
            "key_responsibilities": ["responsibility", ...]
          }

          Return ONLY valid JSON, no additional text.
          """);

  private final ChatModel chatModel;
  private final ObjectMapper objectMapper;
  private final AnalysisProperties properties;

  public CandidateAnalyzer(
      ChatModel chatModel, ObjectMapper objectMapper, AnalysisProperties properties) {
    this.chatModel = chatModel;
    this.objectMapper = objectMapper;
    this.properties = properties;
  }

  /**
   * Assesses one candidate against a job description.
   *
   * @param jobDescription job description text
   * @param candidateText CV text
   * @return normalised result; a fallback with all scores 0 when the assessment fails
   */
  public AnalysisResult analyze(@Nullable String jobDescription, @Nullable String candidateText) {
    if (jobDescription == null || jobDescription.isBlank()) {
      log.warn("Skipping analysis: empty job description");
      return AnalysisResult.fallback(MISSING_JOB_DESCRIPTION);
    }
    if (candidateText == null || candidateText.isBlank()) {
      log.warn("Skipping analysis: empty CV text");
      return AnalysisResult.fallback(MISSING_CV);
    }

    String prompt =
        ANALYSIS_PROMPT
            .apply(
                Map.of(
                    "job_description", truncate(jobDescription, properties.maxInputChars()),
                    "cv_text", truncate(candidateText, properties.maxInputChars())))
            .text();

    String reply;
    try {
      reply = chatModel.chat(prompt);
    } catch (RuntimeException e) {
      log.warn("Candidate analysis call failed: {}", e.getMessage());
      return AnalysisResult.fallback(ANALYSIS_FAILED);
    }

    String payload = stripCodeFences(reply);
    if (payload.isEmpty()) {
      log.warn("Candidate analysis returned an empty reply");
      return AnalysisResult.fallback(EMPTY_REPLY);
    }

    JsonNode root = parseObject(payload);
    if (root == null) {
      return AnalysisResult.fallback(ANALYSIS_FAILED);
    }

    AnalysisResult result =
        new AnalysisResult(
            text(root, "candidate_name", AnalysisResult.UNKNOWN_CANDIDATE),
            number(root, "skill_match_score"),
            number(root, "experience_score"),
            number(root, "tool_tech_score"),
            number(root, "seniority_score"),
            strings(root, "matched_skills"),
            strings(root, "missing_skills"),
            text(root, "explanation", AnalysisResult.DEFAULT_EXPLANATION));
    log.debug("Analysed CV for candidate {}", result.candidateName());
    return result;
  }

  /**
   * Extracts the requirements stated in a job description.
   *
   * @return extracted requirements; {@link JobRequirements#empty()} when extraction fails
   */
  public JobRequirements extractRequirements(@Nullable String jobDescription) {
    if (jobDescription == null || jobDescription.isBlank()) {
      log.warn("Skipping requirement extraction: empty job description");
      return JobRequirements.empty();
    }

    String prompt =
        REQUIREMENTS_PROMPT
            .apply(
                Map.of(
                    "job_description",
                    truncate(jobDescription, properties.requirementsMaxInputChars())))
            .text();

    String reply;
    try {
      reply = chatModel.chat(prompt);
    } catch (RuntimeException e) {
      log.warn("Requirement extraction call failed: {}", e.getMessage());
      return JobRequirements.empty();
    }

    JsonNode root = parseObject(stripCodeFences(reply));
    if (root == null) {
      return JobRequirements.empty();
    }
    return new JobRequirements(
        strings(root, "required_skills"),
        strings(root, "required_tools"),
        number(root, "required_experience_years"),
        text(root, "seniority_level", JobRequirements.UNKNOWN_SENIORITY),
        strings(root, "key_responsibilities"));
  }

  /** Removes a leading {@code ```json} or {@code ```} fence and a trailing {@code ```} fence. */
  static String stripCodeFences(@Nullable String reply) {
    if (reply == null) {
      return "";
    }
    String cleaned = reply.strip();
    if (cleaned.startsWith("```json")) {
      cleaned = cleaned.substring(7);
    } else if (cleaned.startsWith("```")) {
      cleaned = cleaned.substring(3);
    }
    if (cleaned.endsWith("```")) {
      cleaned = cleaned.substring(0, cleaned.length() - 3);
    }
    return cleaned.strip();
  }

  static String truncate(String text, int maxChars) {
    return text.length() > maxChars ? text.substring(0, maxChars) : text;
  }

  private @Nullable JsonNode parseObject(String payload) {
    if (payload.isEmpty()) {
      log.warn("Structured reply was empty");
      return null;
    }
    try {
      JsonNode root = objectMapper.readTree(payload);
      if (root != null && root.isObject()) {
        return root;
      }
      log.warn("Structured reply is not a JSON object: {}", truncate(payload, RAW_REPLY_LOG_LIMIT));
    } catch (JsonProcessingException e) {
      log.warn("Failed to parse structured reply: {}", e.getOriginalMessage());
      log.warn("Raw reply: {}", truncate(payload, RAW_REPLY_LOG_LIMIT));
    }
    return null;
  }

  private static String text(JsonNode root, String field, String defaultValue) {
    JsonNode node = root.get(field);
    if (node == null || node.isNull() || node.isContainerNode()) {
      return defaultValue;
    }
    String value = node.asText().strip();
    return value.isEmpty() ? defaultValue : value;
  }

  private static double number(JsonNode root, String field) {
    JsonNode node = root.get(field);
    if (node == null || node.isNull()) {
      return 0.0;
    }
    if (node.isNumber()) {
      return node.asDouble();
    }
    if (node.isTextual()) {
      try {
        return Double.parseDouble(node.asText().strip());
      } catch (NumberFormatException e) {
        log.debug("Non-numeric value for {}: {}", field, node.asText());
      }
    }
    return 0.0;
  }

  private static List<String> strings(JsonNode root, String field) {
    JsonNode node = root.get(field);
    if (node == null || !node.isArray()) {
      return List.of();
    }
    List<String> values = new ArrayList<>();
    for (JsonNode element : node) {
      if (element.isValueNode() && !element.isNull()) {
        String value = element.asText().strip();
        if (!value.isEmpty()) {
          values.add(value);
        }
      }
    }
    return values;
  }
}
