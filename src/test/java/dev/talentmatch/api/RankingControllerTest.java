package dev.talentmatch.api;

import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import dev.talentmatch.analysis.JobRequirements;
import dev.talentmatch.config.GlobalExceptionHandler;
import dev.talentmatch.ingestion.DocumentExtractionException;
import dev.talentmatch.ingestion.IngestionException;
import dev.talentmatch.matching.MatchingService;
import dev.talentmatch.matching.RankingReport;
import dev.talentmatch.ranking.CandidateScore;
import dev.talentmatch.session.SessionClosedException;
import dev.talentmatch.session.SessionId;
import dev.talentmatch.session.SessionManager;
import dev.talentmatch.session.SessionProperties;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.util.unit.DataSize;

@ExtendWith(MockitoExtension.class)
class RankingControllerTest {

  private static final String JD = "Senior Java engineer";

  @TempDir Path baseDir;

  @Mock MatchingService matchingService;

  private SessionManager sessionManager;
  private MockMvc mvc;

  @BeforeEach
  void setUp() {
    sessionManager =
        new SessionManager(
            new SessionProperties(baseDir, Duration.ofHours(24), Duration.ofHours(1)),
            Clock.systemUTC());
    UploadValidator validator =
        new UploadValidator(
            new UploadProperties(List.of(".pdf", ".doc", ".docx"), DataSize.ofMegabytes(10), 50));
    mvc =
        MockMvcBuilders.standaloneSetup(
                new RankingController(matchingService, sessionManager, validator))
            .setControllerAdvice(new GlobalExceptionHandler())
            .build();
  }

  // --- POST /api/rankings ---

  @Test
  void rankReturnsTopCandidatesWithDownloadLinks() throws Exception {
    SessionId sessionId = SessionId.random();
    CandidateScore jane =
        new CandidateScore(
            "Jane Doe",
            baseDir.resolve(sessionId.value()).resolve("jane_doe.pdf").toString(),
            80,
            70,
            90,
            60,
            82,
            77.6,
            List.of("Java"),
            List.of("Kubernetes"),
            "Strong backend profile.");
    when(matchingService.rank(eq(JD), anyList(), eq(1)))
        .thenReturn(new RankingReport(sessionId, List.of(jane), 2, List.of("broken.pdf"), 1.25));

    mvc.perform(
            multipart("/api/rankings")
                .file(cv("jane_doe.pdf"))
                .file(cv("broken.pdf"))
                .param("jobDescription", JD)
                .param("topN", "1"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.sessionId").value(sessionId.value()))
        .andExpect(jsonPath("$.totalCandidates").value(2))
        .andExpect(jsonPath("$.skippedFiles[0]").value("broken.pdf"))
        .andExpect(jsonPath("$.topCandidates[0].rank").value(1))
        .andExpect(jsonPath("$.topCandidates[0].name").value("Jane Doe"))
        .andExpect(jsonPath("$.topCandidates[0].finalScore").value(77.6))
        .andExpect(jsonPath("$.topCandidates[0].fileName").value("jane_doe.pdf"))
        .andExpect(
            jsonPath("$.topCandidates[0].downloadUrl")
                .value("/api/sessions/" + sessionId.value() + "/files/jane_doe.pdf"));
  }

  @Test
  void rankRejectsUnsupportedFileType() throws Exception {
    mvc.perform(multipart("/api/rankings").file(cv("notes.txt")).param("jobDescription", JD))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.detail").value(containsString("Unsupported file type")));

    verifyNoInteractions(matchingService);
  }

  @Test
  void rankMapsUnreadableUploadsTo422() throws Exception {
    when(matchingService.rank(eq(JD), anyList(), eq(3)))
        .thenThrow(new DocumentExtractionException("No text could be extracted"));

    mvc.perform(multipart("/api/rankings").file(cv("a.pdf")).param("jobDescription", JD))
        .andExpect(status().isUnprocessableEntity());
  }

  @Test
  void rankMapsClosedSessionTo409() throws Exception {
    when(matchingService.rank(eq(JD), anyList(), eq(3)))
        .thenThrow(new SessionClosedException(SessionId.random()));

    mvc.perform(multipart("/api/rankings").file(cv("a.pdf")).param("jobDescription", JD))
        .andExpect(status().isConflict());
  }

  @Test
  void rankHidesIngestionFaultDetails() throws Exception {
    when(matchingService.rank(eq(JD), anyList(), eq(3)))
        .thenThrow(new IngestionException("pgvector at 10.0.0.5 refused", new RuntimeException()));

    mvc.perform(multipart("/api/rankings").file(cv("a.pdf")).param("jobDescription", JD))
        .andExpect(status().isInternalServerError())
        .andExpect(
            jsonPath("$.detail").value("The ranking could not be completed, please try again"));
  }

  // --- Sessions ---

  @Test
  void downloadServesStoredFileAsAttachment() throws Exception {
    SessionId sessionId = sessionManager.create();
    sessionManager.save(sessionId, "jane_doe.pdf", "pdf-bytes".getBytes(StandardCharsets.UTF_8));

    mvc.perform(get("/api/sessions/{id}/files/{name}", sessionId.value(), "jane_doe.pdf"))
        .andExpect(status().isOk())
        .andExpect(header().string("Content-Disposition", containsString("attachment")))
        .andExpect(header().string("Content-Disposition", containsString("jane_doe.pdf")))
        .andExpect(content().bytes("pdf-bytes".getBytes(StandardCharsets.UTF_8)));
  }

  @Test
  void downloadOfUnknownFileIs404() throws Exception {
    SessionId sessionId = sessionManager.create();

    mvc.perform(get("/api/sessions/{id}/files/{name}", sessionId.value(), "missing.pdf"))
        .andExpect(status().isNotFound());
  }

  @Test
  void malformedSessionIdIs400() throws Exception {
    mvc.perform(get("/api/sessions/{id}/files/{name}", "not-a-session", "a.pdf"))
        .andExpect(status().isBadRequest());
  }

  @Test
  void deleteSessionCleansUp() throws Exception {
    SessionId sessionId = SessionId.random();

    mvc.perform(delete("/api/sessions/{id}", sessionId.value())).andExpect(status().isNoContent());

    verify(matchingService).cleanup(sessionId);
  }

  // --- POST /api/requirements ---

  @Test
  void requirementsAcceptsJson() throws Exception {
    when(matchingService.extractRequirements(anyString()))
        .thenReturn(
            new JobRequirements(List.of("Java"), List.of("Maven"), 5, "senior", List.of("Lead")));

    mvc.perform(
            post("/api/requirements")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"jobDescription\": \"" + JD + "\"}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.requiredSkills[0]").value("Java"))
        .andExpect(jsonPath("$.requiredExperienceYears").value(5.0))
        .andExpect(jsonPath("$.seniorityLevel").value("senior"));
  }

  @Test
  void requirementsAcceptsPlainText() throws Exception {
    when(matchingService.extractRequirements(JD)).thenReturn(JobRequirements.empty());

    mvc.perform(post("/api/requirements").contentType(MediaType.TEXT_PLAIN).content(JD))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.seniorityLevel").value(JobRequirements.UNKNOWN_SENIORITY));
  }

  @Test
  void requirementsRejectsBlankDescription() throws Exception {
    mvc.perform(
            post("/api/requirements")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"jobDescription\": \"  \"}"))
        .andExpect(status().isBadRequest());

    verifyNoInteractions(matchingService);
  }

  private static MockMultipartFile cv(String filename) {
    return new MockMultipartFile(
        "files", filename, "application/pdf", "cv".getBytes(StandardCharsets.UTF_8));
  }
}
