// Copyright 2024 The Bazel Authors. All rights reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package dev.makedb.expand;

import com.google.common.base.CharMatcher;
import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import java.util.ArrayList;
import java.util.List;

/**
 * The percent-pattern primitives: locating the wildcard marker of a pattern and substituting a
 * stem for it.
 *
 * <p>A {@code %} preceded by an odd number of backslashes is literal. Finding the marker removes
 * the backslashes that served as quotes: half of a run that precedes an active marker, and half
 * plus the quoting one of a run that precedes a literal marker.
 */
public final class PatternSubstitution {
  public static final char PERCENT = '%';

  private static final CharMatcher BLANK = CharMatcher.anyOf(" \t\n");
  private static final Splitter WORDS = Splitter.on(BLANK).omitEmptyStrings();

  private PatternSubstitution() {}

  /**
   * Returns the index of the first unquoted {@code %} in {@code pattern}, or -1 if there is none.
   * Quoting backslashes in front of every examined {@code %} are removed from {@code pattern}.
   */
  public static int findPercent(StringBuilder pattern) {
    int i = 0;
    while (true) {
      i = pattern.indexOf("%", i);
      if (i < 0) {
        return -1;
      }
      int backslashes = 0;
      while (i - backslashes - 1 >= 0 && pattern.charAt(i - backslashes - 1) == '\\') {
        backslashes++;
      }
      if (backslashes == 0) {
        return i;
      }
      boolean quoted = backslashes % 2 == 1;
      int remove = quoted ? (backslashes + 1) / 2 : backslashes / 2;
      pattern.delete(i - remove, i);
      i -= remove;
      if (!quoted) {
        return i;
      }
      i++;
    }
  }

  /** Convenience form of {@link #findPercent(StringBuilder)} for a pattern that needs no edit. */
  public static boolean hasPercent(String pattern) {
    return findPercent(new StringBuilder(pattern)) >= 0;
  }

  /**
   * Replaces the character at {@code percent}, which must be the marker, with {@code stem}.
   */
  public static String substitute(CharSequence name, int percent, String stem) {
    return new StringBuilder(name.length() + stem.length())
        .append(name, 0, percent)
        .append(stem)
        .append(name, percent + 1, name.length())
        .toString();
  }

  /**
   * Returns the text matched by {@code %} when {@code word} matches {@code pattern}, or null.
   * A pattern without a marker matches only itself, with an empty stem.
   */
  static String match(String pattern, String word) {
    StringBuilder p = new StringBuilder(pattern);
    int percent = findPercent(p);
    if (percent < 0) {
      return p.toString().equals(word) ? "" : null;
    }
    String prefix = p.substring(0, percent);
    String suffix = p.substring(percent + 1);
    if (word.length() < prefix.length() + suffix.length()
        || !word.startsWith(prefix)
        || !word.endsWith(suffix)) {
      return null;
    }
    return word.substring(prefix.length(), word.length() - suffix.length());
  }

  /** The {@code patsubst} function: rewrites each word of {@code text} that matches. */
  public static String patsubst(String pattern, String replacement, String text) {
    StringBuilder r = new StringBuilder(replacement);
    int replacementPercent = findPercent(r);
    List<String> out = new ArrayList<>();
    for (String word : WORDS.split(text)) {
      String stem = match(pattern, word);
      if (stem == null) {
        out.add(word);
      } else if (replacementPercent < 0) {
        out.add(r.toString());
      } else {
        out.add(substitute(r, replacementPercent, stem));
      }
    }
    return Joiner.on(' ').join(out);
  }

  /** Splits {@code text} into its blank-separated words. */
  public static Iterable<String> words(String text) {
    return WORDS.split(text);
  }

  /**
   * Splits unexpanded {@code text} into its blank-separated words. A {@code $(...)} or
   * {@code ${...}} reference is part of the word it starts in, blanks inside it included.
   */
  public static List<String> unexpandedWords(String text) {
    List<String> words = new ArrayList<>();
    int n = text.length();
    int i = 0;
    while (true) {
      while (i < n && isBlank(text.charAt(i))) {
        i++;
      }
      if (i == n) {
        return words;
      }
      int start = i;
      while (i < n && !isBlank(text.charAt(i))) {
        if (text.charAt(i) != '$' || i + 1 == n) {
          i++;
          continue;
        }
        char next = text.charAt(i + 1);
        if (next == '(' || next == '{') {
          int close = findClose(text, i + 1);
          i = close < 0 ? n : close + 1;
        } else if (next == '$') {
          i += 2;
        } else {
          i++;
        }
      }
      words.add(text.substring(start, i));
    }
  }

  /**
   * Returns the index of the bracket that closes the one at {@code open}, or -1 if the reference
   * is unterminated.
   */
  static int findClose(String text, int open) {
    char openChar = text.charAt(open);
    char closeChar = openChar == '(' ? ')' : '}';
    int level = 0;
    for (int i = open; i < text.length(); i++) {
      char c = text.charAt(i);
      if (c == openChar) {
        level++;
      } else if (c == closeChar && --level == 0) {
        return i;
      }
    }
    return -1;
  }

  public static boolean isBlank(char c) {
    return BLANK.matches(c);
  }
}
