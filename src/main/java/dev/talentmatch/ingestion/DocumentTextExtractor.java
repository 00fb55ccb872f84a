package dev.talentmatch.ingestion;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.tika.exception.TikaException;
import org.apache.tika.metadata.Metadata;
import org.apache.tika.metadata.TikaCoreProperties;
import org.apache.tika.parser.AutoDetectParser;
import org.apache.tika.parser.ParseContext;
import org.apache.tika.sax.BodyContentHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.xml.sax.SAXException;

/**
 * Extracts plain text from stored uploads (PDF, DOC, DOCX) with Apache Tika's {@link
 * AutoDetectParser}. The file name is passed to Tika as a detection hint.
 */
@Component
public class DocumentTextExtractor {

  private static final Logger log = LoggerFactory.getLogger(DocumentTextExtractor.class);

  /**
   * Extracts the body text of a document.
   *
   * @param path stored upload
   * @return extracted text, stripped of surrounding whitespace; may be empty
   * @throws DocumentExtractionException if the file cannot be read or parsed
   */
  public String extract(Path path) {
    AutoDetectParser parser = new AutoDetectParser();
    BodyContentHandler handler = new BodyContentHandler(-1);
    Metadata metadata = new Metadata();
    metadata.set(TikaCoreProperties.RESOURCE_NAME_KEY, path.getFileName().toString());
    try (InputStream in = Files.newInputStream(path)) {
      parser.parse(in, handler, metadata, new ParseContext());
    } catch (IOException | SAXException | TikaException e) {
      log.error("Text extraction failed for {}: {}", path.getFileName(), e.getMessage());
      throw new DocumentExtractionException("Could not extract text from " + path.getFileName(), e);
    }
    String text = handler.toString().strip();
    log.debug("Extracted {} characters from {} ({})", text.length(), path.getFileName(),
        metadata.get(Metadata.CONTENT_TYPE));
    return text;
  }
}
