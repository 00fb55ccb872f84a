package dev.talentmatch.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.util.unit.DataSize;
import org.springframework.web.multipart.MultipartFile;

class UploadValidatorTest {

  private static final String JD = "Java engineer";

  private final UploadValidator validator =
      new UploadValidator(
          new UploadProperties(List.of(".pdf", ".doc", ".docx"), DataSize.ofBytes(16), 3));

  @Test
  void acceptsValidRequest() {
    assertThatCode(() -> validator.validate(JD, List.of(file("jane.pdf"), file("JOHN.DOCX"))))
        .doesNotThrowAnyException();
  }

  @Test
  void rejectsBlankJobDescription() {
    assertThatThrownBy(() -> validator.validate(" ", List.of(file("jane.pdf"))))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("Job description");
    assertThatThrownBy(() -> validator.validate(null, List.of(file("jane.pdf"))))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void requiresAtLeastOneFile() {
    assertThatThrownBy(() -> validator.validate(JD, List.of()))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> validator.validate(JD, null))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void enforcesFileCountLimit() {
    List<MultipartFile> files = new ArrayList<>();
    for (int i = 0; i < 4; i++) {
      files.add(file("cv" + i + ".pdf"));
    }

    assertThatThrownBy(() -> validator.validate(JD, files))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("Too many files");
  }

  @Test
  void rejectsDuplicateNames() {
    assertThatThrownBy(() -> validator.validate(JD, List.of(file("a.pdf"), file("a.pdf"))))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("Duplicate");
  }

  @Test
  void rejectsEmptyAndOversizedFiles() {
    MockMultipartFile empty = new MockMultipartFile("files", "empty.pdf", null, new byte[0]);
    MockMultipartFile large = new MockMultipartFile("files", "large.pdf", null, new byte[17]);

    assertThatThrownBy(() -> validator.validate(JD, List.of(empty)))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("empty");
    assertThatThrownBy(() -> validator.validate(JD, List.of(large)))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("maximum size");
  }

  @ParameterizedTest
  @ValueSource(
      strings = {"resume.txt", "resume", "../cv.pdf", "dir/cv.pdf", "a\\b.pdf", ".pdf", " "})
  void rejectsUnsafeOrUnsupportedNames(String filename) {
    assertThatThrownBy(() -> validator.validateFilename(filename))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void extensionCheckIgnoresCase() {
    assertThat(validator.validateFilename("Jane.PDF")).isEqualTo("Jane.PDF");
    assertThat(validator.validateFilename("cv.Doc")).isEqualTo("cv.Doc");
  }

  private static MockMultipartFile file(String name) {
    return new MockMultipartFile("files", name, null, "content".getBytes(StandardCharsets.UTF_8));
  }
}
