package dev.talentmatch.ingestion.chunking;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Recursive-separator chunker for plain résumé and job description text.
 *
 * <p>The text is split on the coarsest separator it contains (paragraph break first, then line
 * break, sentence end, space and finally single characters). Each separator stays attached to the
 * start of the piece that follows it, so concatenating neighbouring pieces always yields a
 * contiguous slice of the input. Pieces shorter than the chunk size are greedily merged into
 * chunks; consecutive chunks share up to {@code overlap} characters of trailing context. Pieces
 * that are still too long are split again with the next finer separator.
 *
 * <p>Every chunk is stripped of surrounding whitespace and blank chunks are dropped. The output is
 * a pure function of input and configuration, which keeps chunk identity keys stable across
 * re-ingestion.
 */
@Component
public class RecursiveTextChunker {

  private static final Logger log = LoggerFactory.getLogger(RecursiveTextChunker.class);

  static final List<String> DEFAULT_SEPARATORS = List.of("\n\n", "\n", ". ", " ", "");

  private final int chunkSize;
  private final int overlap;
  private final List<String> separators;

  @Autowired
  public RecursiveTextChunker(ChunkingProperties properties) {
    this(properties.chunkSize(), properties.overlap());
  }

  public RecursiveTextChunker(int chunkSize, int overlap) {
    this(chunkSize, overlap, DEFAULT_SEPARATORS);
  }

  RecursiveTextChunker(int chunkSize, int overlap, List<String> separators) {
    if (chunkSize < 1) {
      throw new IllegalArgumentException("chunkSize must be positive");
    }
    if (overlap < 0 || overlap >= chunkSize) {
      throw new IllegalArgumentException("overlap must be in [0, chunkSize)");
    }
    if (separators.isEmpty()) {
      throw new IllegalArgumentException("separators must not be empty");
    }
    this.chunkSize = chunkSize;
    this.overlap = overlap;
    this.separators = List.copyOf(separators);
  }

  /**
   * Splits text into ordered, non-empty chunks.
   *
   * @param text raw document text; null, empty or whitespace-only input yields an empty list
   * @return chunks in document order
   */
  public List<String> split(@Nullable String text) {
    if (text == null || text.isBlank()) {
      return List.of();
    }
    List<String> chunks = splitRecursively(text, separators);
    log.debug("Split {} characters into {} chunks", text.length(), chunks.size());
    return List.copyOf(chunks);
  }

  public int chunkSize() {
    return chunkSize;
  }

  public int overlap() {
    return overlap;
  }

  private List<String> splitRecursively(String text, List<String> candidates) {
    String separator = candidates.get(candidates.size() - 1);
    List<String> finer = List.of();
    for (int i = 0; i < candidates.size(); i++) {
      String candidate = candidates.get(i);
      if (candidate.isEmpty()) {
        separator = candidate;
        break;
      }
      if (text.contains(candidate)) {
        separator = candidate;
        finer = candidates.subList(i + 1, candidates.size());
        break;
      }
    }

    List<String> chunks = new ArrayList<>();
    List<String> fitting = new ArrayList<>();
    for (String piece : splitKeepingSeparator(text, separator)) {
      if (piece.length() < chunkSize) {
        fitting.add(piece);
        continue;
      }
      if (!fitting.isEmpty()) {
        chunks.addAll(merge(fitting));
        fitting = new ArrayList<>();
      }
      if (finer.isEmpty()) {
        String stripped = piece.strip();
        if (!stripped.isEmpty()) {
          chunks.add(stripped);
        }
      } else {
        chunks.addAll(splitRecursively(piece, finer));
      }
    }
    if (!fitting.isEmpty()) {
      chunks.addAll(merge(fitting));
    }
    return chunks;
  }

  /**
   * Splits on every occurrence of {@code separator}, prefixing each piece after the first with the
   * separator it was split on. The empty separator yields single code points.
   */
  static List<String> splitKeepingSeparator(String text, String separator) {
    List<String> pieces = new ArrayList<>();
    if (separator.isEmpty()) {
      text.codePoints().forEach(cp -> pieces.add(new String(Character.toChars(cp))));
      return pieces;
    }
    int start = 0;
    int next = text.indexOf(separator);
    while (next >= 0) {
      if (next > start) {
        pieces.add(text.substring(start, next));
      }
      start = next;
      next = text.indexOf(separator, start + separator.length());
    }
    if (start < text.length()) {
      pieces.add(text.substring(start));
    }
    return pieces;
  }

  /** Greedily packs pieces into chunks of at most {@code chunkSize}, keeping an overlap window. */
  private List<String> merge(List<String> pieces) {
    List<String> merged = new ArrayList<>();
    Deque<String> window = new ArrayDeque<>();
    int total = 0;
    for (String piece : pieces) {
      int length = piece.length();
      if (total + length > chunkSize && !window.isEmpty()) {
        addStripped(merged, window);
        while (total > overlap || (total + length > chunkSize && total > 0)) {
          total -= window.removeFirst().length();
        }
      }
      window.addLast(piece);
      total += length;
    }
    addStripped(merged, window);
    return merged;
  }

  private static void addStripped(List<String> target, Deque<String> window) {
    String chunk = String.join("", window).strip();
    if (!chunk.isEmpty()) {
      target.add(chunk);
    }
  }
}
