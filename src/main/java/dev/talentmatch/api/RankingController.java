package dev.talentmatch.api;

import dev.talentmatch.analysis.JobRequirements;
import dev.talentmatch.matching.MatchingService;
import dev.talentmatch.matching.RankingReport;
import dev.talentmatch.matching.UploadedDocument;
import dev.talentmatch.session.SessionFileNotFoundException;
import dev.talentmatch.session.SessionId;
import dev.talentmatch.session.SessionManager;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/** HTTP entry points for ranking requests and session housekeeping. */
@RestController
@RequestMapping("/api")
public class RankingController {

  private static final Logger log = LoggerFactory.getLogger(RankingController.class);

  private final MatchingService matchingService;
  private final SessionManager sessionManager;
  private final UploadValidator uploadValidator;

  public RankingController(
      MatchingService matchingService,
      SessionManager sessionManager,
      UploadValidator uploadValidator) {
    this.matchingService = matchingService;
    this.sessionManager = sessionManager;
    this.uploadValidator = uploadValidator;
  }

  @PostMapping(path = "/rankings", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  public RankingResponse rank(
      @RequestParam("jobDescription") String jobDescription,
      @RequestParam("files") List<MultipartFile> files,
      @RequestParam(name = "topN", defaultValue = "3") int topN) {
    uploadValidator.validate(jobDescription, files);
    List<UploadedDocument> uploads = new ArrayList<>(files.size());
    for (MultipartFile file : files) {
      uploads.add(new UploadedDocument(file.getOriginalFilename(), readBytes(file)));
    }
    log.info("Ranking {} CVs (top {})", uploads.size(), topN);
    RankingReport report = matchingService.rank(jobDescription, uploads, topN);
    return RankingResponse.from(report);
  }

  @PostMapping(path = "/requirements", consumes = MediaType.APPLICATION_JSON_VALUE)
  public JobRequirements requirements(@RequestBody RequirementsRequest request) {
    if (request.jobDescription() == null || request.jobDescription().isBlank()) {
      throw new IllegalArgumentException("Job description must not be blank");
    }
    return matchingService.extractRequirements(request.jobDescription());
  }

  @PostMapping(path = "/requirements", consumes = MediaType.TEXT_PLAIN_VALUE)
  public JobRequirements requirementsFromText(@RequestBody String jobDescription) {
    return requirements(new RequirementsRequest(jobDescription));
  }

  @GetMapping("/sessions/{sessionId}/files/{filename}")
  public ResponseEntity<Resource> download(
      @PathVariable String sessionId, @PathVariable String filename) {
    SessionId id = SessionId.of(sessionId);
    Path path =
        sessionManager
            .resolve(id, filename)
            .orElseThrow(() -> new SessionFileNotFoundException(id, filename));
    return ResponseEntity.ok()
        .contentType(MediaType.APPLICATION_OCTET_STREAM)
        .header(
            HttpHeaders.CONTENT_DISPOSITION,
            ContentDisposition.attachment().filename(filename).build().toString())
        .body(new FileSystemResource(path));
  }

  @DeleteMapping("/sessions/{sessionId}")
  public ResponseEntity<Void> deleteSession(@PathVariable String sessionId) {
    matchingService.cleanup(SessionId.of(sessionId));
    return ResponseEntity.noContent().build();
  }

  private static byte[] readBytes(MultipartFile file) {
    try {
      return file.getBytes();
    } catch (IOException e) {
      throw new IllegalArgumentException("Could not read upload " + file.getOriginalFilename(), e);
    }
  }
}
