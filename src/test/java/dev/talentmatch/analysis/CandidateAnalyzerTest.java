package dev.talentmatch.analysis;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.model.chat.ChatModel;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class CandidateAnalyzerTest {

  private static final String JD = "Senior Java engineer with Spring Boot and PostgreSQL.";
  private static final String CV = "Jane Doe. Eight years of Java, Spring Boot, Kafka.";

  private static final String VALID_REPLY =
      """
      {
        "candidate_name": "Jane Doe",
        "skill_match_score": 80,
        "experience_score": 70,
        "tool_tech_score": 90,
        "seniority_score": 60,
        "matched_skills": ["Java", "Spring Boot"],
        "missing_skills": ["PostgreSQL"],
        "explanation": "Strong Java background, no PostgreSQL."
      }
      """;

  @Mock ChatModel chatModel;

  @Captor ArgumentCaptor<String> promptCaptor;

  private CandidateAnalyzer analyzer;

  @BeforeEach
  void setUp() {
    AnalysisProperties properties =
        new AnalysisProperties("test-key", "gpt-4.1", Duration.ofSeconds(90), 15000, 10000, 4);
    analyzer = new CandidateAnalyzer(chatModel, new ObjectMapper(), properties);
  }

  // --- Happy path ---

  @Test
  void parsesWellFormedReply() {
    when(chatModel.chat(anyString())).thenReturn(VALID_REPLY);

    AnalysisResult result = analyzer.analyze(JD, CV);

    assertThat(result.candidateName()).isEqualTo("Jane Doe");
    assertThat(result.skillMatchScore()).isEqualTo(80.0);
    assertThat(result.experienceScore()).isEqualTo(70.0);
    assertThat(result.toolTechScore()).isEqualTo(90.0);
    assertThat(result.seniorityScore()).isEqualTo(60.0);
    assertThat(result.matchedSkills()).containsExactly("Java", "Spring Boot");
    assertThat(result.missingSkills()).containsExactly("PostgreSQL");
    assertThat(result.explanation()).isEqualTo("Strong Java background, no PostgreSQL.");
  }

  @Test
  void promptCarriesBothDocuments() {
    when(chatModel.chat(anyString())).thenReturn(VALID_REPLY);

    analyzer.analyze(JD, CV);

    verify(chatModel).chat(promptCaptor.capture());
    assertThat(promptCaptor.getValue()).contains(JD).contains(CV).contains("skill_match_score");
  }

  @Test
  void stripsJsonCodeFence() {
    when(chatModel.chat(anyString())).thenReturn("```json\n" + VALID_REPLY + "\n```");

    assertThat(analyzer.analyze(JD, CV).skillMatchScore()).isEqualTo(80.0);
  }

  @Test
  void stripsBareCodeFence() {
    when(chatModel.chat(anyString())).thenReturn("```\n" + VALID_REPLY + "```");

    assertThat(analyzer.analyze(JD, CV).candidateName()).isEqualTo("Jane Doe");
  }

  // --- Normalisation ---

  @Test
  void missingFieldsGetSafeDefaults() {
    when(chatModel.chat(anyString())).thenReturn("{\"skill_match_score\": 55}");

    AnalysisResult result = analyzer.analyze(JD, CV);

    assertThat(result.candidateName()).isEqualTo(AnalysisResult.UNKNOWN_CANDIDATE);
    assertThat(result.skillMatchScore()).isEqualTo(55.0);
    assertThat(result.experienceScore()).isZero();
    assertThat(result.toolTechScore()).isZero();
    assertThat(result.seniorityScore()).isZero();
    assertThat(result.matchedSkills()).isEmpty();
    assertThat(result.missingSkills()).isEmpty();
    assertThat(result.explanation()).isEqualTo(AnalysisResult.DEFAULT_EXPLANATION);
  }

  @Test
  void scoresAreClampedIntoRange() {
    when(chatModel.chat(anyString()))
        .thenReturn(
            "{\"skill_match_score\": 140, \"experience_score\": -5,"
                + " \"tool_tech_score\": \"85.5\", \"seniority_score\": \"high\"}");

    AnalysisResult result = analyzer.analyze(JD, CV);

    assertThat(result.skillMatchScore()).isEqualTo(100.0);
    assertThat(result.experienceScore()).isZero();
    assertThat(result.toolTechScore()).isEqualTo(85.5);
    assertThat(result.seniorityScore()).isZero();
  }

  // --- Fallbacks ---

  @Test
  void malformedReplyYieldsFallbackWithExplanation() {
    when(chatModel.chat(anyString())).thenReturn("Sure! The candidate looks great.");

    AnalysisResult result = analyzer.analyze(JD, CV);

    assertFallback(result);
    assertThat(result.explanation()).isEqualTo(CandidateAnalyzer.ANALYSIS_FAILED);
  }

  @Test
  void nonObjectJsonYieldsFallback() {
    when(chatModel.chat(anyString())).thenReturn("[1, 2, 3]");

    assertFallback(analyzer.analyze(JD, CV));
  }

  @Test
  void emptyReplyYieldsFallback() {
    when(chatModel.chat(anyString())).thenReturn("```json\n```");

    AnalysisResult result = analyzer.analyze(JD, CV);

    assertFallback(result);
    assertThat(result.explanation()).isEqualTo(CandidateAnalyzer.EMPTY_REPLY);
  }

  @Test
  void callFailureYieldsFallbackInsteadOfPropagating() {
    when(chatModel.chat(anyString())).thenThrow(new RuntimeException("timeout"));

    AnalysisResult result = analyzer.analyze(JD, CV);

    assertFallback(result);
    assertThat(result.explanation()).isNotBlank();
  }

  @Test
  void blankInputIsRejectedWithoutCallingTheModel() {
    AnalysisResult noJd = analyzer.analyze("  ", CV);
    AnalysisResult noCv = analyzer.analyze(JD, null);

    assertFallback(noJd);
    assertThat(noJd.explanation()).isEqualTo(CandidateAnalyzer.MISSING_JOB_DESCRIPTION);
    assertFallback(noCv);
    assertThat(noCv.explanation()).isEqualTo(CandidateAnalyzer.MISSING_CV);
    verifyNoInteractions(chatModel);
  }

  @Test
  void longInputsAreTruncatedBeforeTheCall() {
    when(chatModel.chat(anyString())).thenReturn(VALID_REPLY);

    analyzer.analyze("J".repeat(20000), "C".repeat(16000));

    verify(chatModel).chat(promptCaptor.capture());
    String prompt = promptCaptor.getValue();
    assertThat(prompt).contains("J".repeat(15000)).doesNotContain("J".repeat(15001));
    assertThat(prompt).contains("C".repeat(15000)).doesNotContain("C".repeat(15001));
  }

  // --- Requirement extraction ---

  @Test
  void extractsRequirements() {
    when(chatModel.chat(anyString()))
        .thenReturn(
            """
            ```json
            {
              "required_skills": ["Java", "SQL"],
              "required_tools": ["Kafka"],
              "required_experience_years": 5,
              "seniority_level": "senior",
              "key_responsibilities": ["Own the payments service"]
            }
            ```""");

    JobRequirements requirements = analyzer.extractRequirements(JD);

    assertThat(requirements.requiredSkills()).containsExactly("Java", "SQL");
    assertThat(requirements.requiredTools()).containsExactly("Kafka");
    assertThat(requirements.requiredExperienceYears()).isEqualTo(5.0);
    assertThat(requirements.seniorityLevel()).isEqualTo("senior");
    assertThat(requirements.keyResponsibilities()).containsExactly("Own the payments service");
  }

  @Test
  void requirementExtractionFallsBackToEmpty() {
    when(chatModel.chat(anyString())).thenReturn("not json");

    assertThat(analyzer.extractRequirements(JD)).isEqualTo(JobRequirements.empty());
    assertThat(analyzer.extractRequirements(" ")).isEqualTo(JobRequirements.empty());
  }

  @Test
  void requirementPromptUsesSmallerBudget() {
    when(chatModel.chat(anyString())).thenReturn("{}");

    analyzer.extractRequirements("R".repeat(12000));

    verify(chatModel).chat(promptCaptor.capture());
    assertThat(promptCaptor.getValue()).contains("R".repeat(10000)).doesNotContain("R".repeat(10001));
  }

  @Test
  void stripCodeFencesHandlesNullAndPlainReplies() {
    assertThat(CandidateAnalyzer.stripCodeFences(null)).isEmpty();
    assertThat(CandidateAnalyzer.stripCodeFences("  {}  ")).isEqualTo("{}");
  }

  private static void assertFallback(AnalysisResult result) {
    assertThat(result.candidateName()).isEqualTo(AnalysisResult.UNKNOWN_CANDIDATE);
    assertThat(result.skillMatchScore()).isZero();
    assertThat(result.experienceScore()).isZero();
    assertThat(result.toolTechScore()).isZero();
    assertThat(result.seniorityScore()).isZero();
    assertThat(result.matchedSkills()).isEmpty();
    assertThat(result.missingSkills()).isEmpty();
    assertThat(result.explanation()).isNotBlank();
  }
}
