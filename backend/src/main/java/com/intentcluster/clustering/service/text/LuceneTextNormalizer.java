package com.intentcluster.clustering.service.text;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.CharArraySet;
import org.apache.lucene.analysis.LowerCaseFilter;
import org.apache.lucene.analysis.StopFilter;
import org.apache.lucene.analysis.StopwordAnalyzerBase;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.Tokenizer;
import org.apache.lucene.analysis.charfilter.MappingCharFilter;
import org.apache.lucene.analysis.charfilter.NormalizeCharMap;
import org.apache.lucene.analysis.en.EnglishPossessiveFilter;
import org.apache.lucene.analysis.en.KStemFilter;
import org.apache.lucene.analysis.standard.StandardTokenizer;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;
import org.springframework.stereotype.Component;

import lombok.extern.slf4j.Slf4j;

/**
 * English normalizer built on a Lucene analysis chain: UAX#29 word segmentation, possessive
 * stripping, lower-casing, stop word removal and Krovetz lemmatization.
 *
 * <p>Typographic single quotes are folded to the ASCII apostrophe before tokenizing, so
 * {@code don\u2019t} meets the stop list as {@code don't}.
 *
 * <p>The analyzer is safe for concurrent use; Lucene keeps one token stream per thread.
 */
@Slf4j
@Component
public class LuceneTextNormalizer implements TextNormalizer, AutoCloseable {

  private static final String FIELD_NAME = "utterance";

  private final Analyzer analyzer;

  public LuceneTextNormalizer(StopWordLexicon lexicon) {
    this.analyzer = new IntentAnalyzer(lexicon.asCharArraySet());
  }

  @Override
  public List<String> normalize(String text) {
    List<String> tokens = new ArrayList<>();
    if (text == null || text.isBlank()) {
      return tokens;
    }

    try (TokenStream stream = analyzer.tokenStream(FIELD_NAME, text)) {
      CharTermAttribute term = stream.addAttribute(CharTermAttribute.class);
      stream.reset();
      while (stream.incrementToken()) {
        tokens.add(term.toString());
      }
      stream.end();
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to analyze utterance", e);
    }

    log.trace("Normalized '{}' to {}", text, tokens);
    return tokens;
  }

  @Override
  public void close() {
    analyzer.close();
  }

  private static final class IntentAnalyzer extends StopwordAnalyzerBase {

    private static final NormalizeCharMap APOSTROPHES = apostropheMap();

    IntentAnalyzer(CharArraySet stopwords) {
      super(stopwords);
    }

    private static NormalizeCharMap apostropheMap() {
      NormalizeCharMap.Builder builder = new NormalizeCharMap.Builder();
      builder.add("\u2019", "'");
      builder.add("\u2018", "'");
      return builder.build();
    }

    @Override
    protected Reader initReader(String fieldName, Reader reader) {
      return new MappingCharFilter(APOSTROPHES, reader);
    }

    @Override
    protected Reader initReaderForNormalization(String fieldName, Reader reader) {
      return new MappingCharFilter(APOSTROPHES, reader);
    }

    @Override
    protected TokenStreamComponents createComponents(String fieldName) {
      Tokenizer source = new StandardTokenizer();
      TokenStream result = new EnglishPossessiveFilter(source);
      result = new LowerCaseFilter(result);
      // stop words are matched on surface forms, before KStem rewrites them
      result = new StopFilter(result, stopwords);
      result = new KStemFilter(result);
      return new TokenStreamComponents(source, result);
    }

    @Override
    protected TokenStream normalize(String fieldName, TokenStream in) {
      return new LowerCaseFilter(in);
    }
  }
}
