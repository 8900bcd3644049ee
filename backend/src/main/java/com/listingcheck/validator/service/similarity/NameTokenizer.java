package com.listingcheck.validator.service.similarity;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits product names into the terms the similarity model is built on: lower-cased word tokens of
 * at least two characters, plus every pair of adjacent tokens.
 */
public final class NameTokenizer {

  private static final Pattern TOKEN = Pattern.compile("\\b\\w\\w+\\b", Pattern.UNICODE_CHARACTER_CLASS);

  static final int MAX_NGRAM = 2;

  private NameTokenizer() {}

  public static List<String> tokens(String text) {
    List<String> tokens = new ArrayList<>();
    if (text == null || text.isEmpty()) {
      return tokens;
    }
    Matcher matcher = TOKEN.matcher(text.toLowerCase(Locale.ROOT));
    while (matcher.find()) {
      tokens.add(matcher.group());
    }
    return tokens;
  }

  /** Unigrams followed by bigrams, in order of appearance. Duplicates are kept. */
  public static List<String> terms(String text) {
    List<String> tokens = tokens(text);
    List<String> terms = new ArrayList<>(tokens);
    for (int n = 2; n <= MAX_NGRAM; n++) {
      for (int i = 0; i + n <= tokens.size(); i++) {
        terms.add(String.join(" ", tokens.subList(i, i + n)));
      }
    }
    return terms;
  }
}
