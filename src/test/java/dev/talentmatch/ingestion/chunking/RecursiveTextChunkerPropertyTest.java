package dev.talentmatch.ingestion.chunking;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.Provide;

/**
 * Property-based tests for {@link RecursiveTextChunker} invariants using jqwik.
 *
 * <p>Inputs are built from words and every separator the chunker knows about, so all levels of the
 * separator hierarchy get exercised.
 */
class RecursiveTextChunkerPropertyTest {

  @Provide
  Arbitrary<String> documents() {
    Arbitrary<String> token =
        Arbitraries.oneOf(
            Arbitraries.strings().alpha().ofMinLength(1).ofMaxLength(15),
            Arbitraries.of(" ", "  ", "\n", "\n\n", ". ", ".", "\t"));
    return token.list().ofMaxSize(200).map(tokens -> String.join("", tokens));
  }

  @Provide
  Arbitrary<RecursiveTextChunker> chunkers() {
    return Arbitraries.integers()
        .between(5, 120)
        .flatMap(
            size ->
                Arbitraries.integers()
                    .between(0, size - 1)
                    .map(overlap -> new RecursiveTextChunker(size, overlap)));
  }

  @Provide
  Arbitrary<String> blanks() {
    return Arbitraries.of(" ", "\n", "\t", "\r").list().ofMaxSize(20).map(l -> String.join("", l));
  }

  @Property
  void chunksAreNonEmptyStrippedAndBounded(
      @ForAll("documents") String text, @ForAll("chunkers") RecursiveTextChunker chunker) {
    List<String> chunks = chunker.split(text);

    assertThat(chunks)
        .allSatisfy(
            chunk -> {
              assertThat(chunk).isNotBlank();
              assertThat(chunk).isEqualTo(chunk.strip());
              assertThat(chunk.length()).isLessThanOrEqualTo(chunker.chunkSize());
            });
  }

  @Property
  void everyChunkIsAContiguousSliceOfTheInput(
      @ForAll("documents") String text, @ForAll("chunkers") RecursiveTextChunker chunker) {
    assertThat(chunker.split(text)).allSatisfy(chunk -> assertThat(text).contains(chunk));
  }

  @Property
  void firstAndLastChunksAnchorTheDocument(
      @ForAll("documents") String text, @ForAll("chunkers") RecursiveTextChunker chunker) {
    List<String> chunks = chunker.split(text);
    String stripped = text.strip();

    if (stripped.isEmpty()) {
      assertThat(chunks).isEmpty();
    } else {
      assertThat(stripped).startsWith(chunks.get(0));
      assertThat(stripped).endsWith(chunks.get(chunks.size() - 1));
    }
  }

  @Property
  void splittingIsDeterministic(
      @ForAll("documents") String text, @ForAll("chunkers") RecursiveTextChunker chunker) {
    RecursiveTextChunker twin = new RecursiveTextChunker(chunker.chunkSize(), chunker.overlap());

    assertThat(twin.split(text)).isEqualTo(chunker.split(text));
  }

  @Property
  void blankInputYieldsNoChunks(@ForAll("blanks") String blank) {
    assertThat(new RecursiveTextChunker(1000, 200).split(blank)).isEmpty();
  }

  @Property
  void textShorterThanChunkSizeIsOneChunk(@ForAll("documents") String text) {
    RecursiveTextChunker chunker = new RecursiveTextChunker(5000, 0);

    List<String> chunks = chunker.split(text);

    if (!text.isBlank()) {
      assertThat(chunks).containsExactly(text.strip());
    }
  }
}
