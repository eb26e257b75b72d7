package com.intentcluster.clustering.service.text;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Collection;

import org.apache.lucene.analysis.CharArraySet;
import org.apache.lucene.analysis.WordlistLoader;

import lombok.extern.slf4j.Slf4j;

/**
 * Closed list of English stop words. Loaded once and never mutated after construction, so a
 * single instance is shared by every normalizer in the process.
 */
@Slf4j
public final class StopWordLexicon {

  private static final String COMMENT_PREFIX = "#";

  private final CharArraySet words;

  private StopWordLexicon(CharArraySet words) {
    this.words = CharArraySet.unmodifiableSet(words);
  }

  /**
   * Loads a word-per-line list from the classpath. Lines starting with {@code #} are comments.
   *
   * @param resource classpath location, with or without a leading slash
   * @return the loaded lexicon
   * @throws IllegalStateException if the resource does not exist
   * @throws UncheckedIOException if the resource cannot be read
   */
  public static StopWordLexicon fromClasspath(String resource) {
    String path = resource.startsWith("/") ? resource.substring(1) : resource;
    ClassLoader loader = StopWordLexicon.class.getClassLoader();

    try (InputStream is = loader.getResourceAsStream(path)) {
      if (is == null) {
        throw new IllegalStateException("Stop word resource not found: " + resource);
      }
      try (Reader reader = new InputStreamReader(is, StandardCharsets.UTF_8)) {
        CharArraySet loaded =
            WordlistLoader.getWordSet(reader, COMMENT_PREFIX, new CharArraySet(256, true));
        log.info("Loaded {} stop words from {}", loaded.size(), resource);
        return new StopWordLexicon(loaded);
      }
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read stop word resource: " + resource, e);
    }
  }

  public static StopWordLexicon of(Collection<String> words) {
    return new StopWordLexicon(new CharArraySet(words, true));
  }

  public boolean contains(String word) {
    return words.contains(word);
  }

  public int size() {
    return words.size();
  }

  CharArraySet asCharArraySet() {
    return words;
  }
}
