package dev.talentmatch.ingestion;

import org.jspecify.annotations.Nullable;

/**
 * Derives a candidate display name from a CV's file name and text.
 *
 * <p>Order of preference:
 *
 * <ol>
 *   <li>the file stem with {@code _} and {@code -} turned into spaces and title-cased, if it has at
 *       most three purely alphabetic tokens ({@code john_doe.pdf} becomes {@code John Doe});
 *   <li>the first of the first five text lines that has at most three words, each alphabetic once
 *       dots are removed ({@code Dr. Jane Roe});
 *   <li>the raw file stem.
 * </ol>
 */
public final class CandidateNameExtractor {

  static final int MAX_NAME_TOKENS = 3;
  static final int MAX_SCANNED_LINES = 5;

  private CandidateNameExtractor() {}

  public static String extract(String fileName, @Nullable String text) {
    String stem = stem(fileName);
    String fromStem = titleCase(stem.replace('_', ' ').replace('-', ' '));
    String[] stemTokens = tokens(fromStem);
    if (stemTokens.length > 0
        && stemTokens.length <= MAX_NAME_TOKENS
        && isAlphabetic(fromStem.replace(" ", ""))) {
      return String.join(" ", stemTokens);
    }

    if (text != null) {
      String[] lines = text.split("\n", -1);
      for (int i = 0; i < Math.min(lines.length, MAX_SCANNED_LINES); i++) {
        String line = lines[i].strip();
        String[] words = tokens(line);
        if (words.length == 0 || words.length > MAX_NAME_TOKENS) {
          continue;
        }
        boolean nameShaped = true;
        for (String word : words) {
          if (!isAlphabetic(word.replace(".", ""))) {
            nameShaped = false;
            break;
          }
        }
        if (nameShaped) {
          return line;
        }
      }
    }
    return stem;
  }

  static String stem(String fileName) {
    String name = fileName;
    int slash = Math.max(name.lastIndexOf('/'), name.lastIndexOf('\\'));
    if (slash >= 0) {
      name = name.substring(slash + 1);
    }
    int dot = name.lastIndexOf('.');
    return dot > 0 ? name.substring(0, dot) : name;
  }

  /** Upper-cases the first letter of every run of letters and lower-cases the rest. */
  static String titleCase(String value) {
    StringBuilder result = new StringBuilder(value.length());
    boolean previousIsLetter = false;
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      if (Character.isLetter(c)) {
        result.append(previousIsLetter ? Character.toLowerCase(c) : Character.toUpperCase(c));
        previousIsLetter = true;
      } else {
        result.append(c);
        previousIsLetter = false;
      }
    }
    return result.toString();
  }

  private static String[] tokens(String value) {
    String trimmed = value.strip();
    return trimmed.isEmpty() ? new String[0] : trimmed.split("\\s+");
  }

  private static boolean isAlphabetic(String value) {
    return !value.isEmpty() && value.codePoints().allMatch(Character::isLetter);
  }
}
