/*
 * Copyright 2025 The Cellcount Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.cellcount.parser;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;

/**
 * Splits netlist source text into Tokens.
 *
 * <p>Tokens are produced on demand: each call to {@link #next} scans just far enough to find one
 * more token. Comments, line breaks and horizontal whitespace are consumed but never returned. A
 * Lexer reads its input once, in order, and can't be restarted.
 *
 * <p>Any character that can't start a token causes a {@link LexicalError} to be thrown from {@link
 * #hasNext} or {@link #next}; after that the Lexer reports no more tokens.
 */
public final class Lexer implements Iterator<Token> {

  /**
   * Alternatives are tried in order at each position, so e.g. a run of digits is always a NUMBER
   * even though {@code \w+} would also match it. The final alternative matches any one character,
   * so the pattern can't fail to match at a position within the input.
   *
   * <p>{@code \d} and {@code \w} match any Unicode decimal digit or word character;
   * {@link Integer#parseInt} accepts the same digits.
   */
  private static final Pattern TOKEN =
      Pattern.compile(
          "(?<comment>//[^\\n]*(?:\\n|\\z))"
              + "|(?<newline>\\r?\\n)"
              + "|(?<number>\\d+)"
              + "|(?<word>\\w+)"
              + "|(?<punctuation>[()\\[\\]:.,;])"
              + "|(?<whitespace>[ \\t]+)"
              + "|(?<mismatch>(?s:.))",
          Pattern.UNICODE_CHARACTER_CLASS);

  private final String input;
  private final Matcher matcher;

  /** The index in {@link #input} at which scanning will resume. */
  private int pos;

  /** The 1-based line number of the character at {@link #pos}. */
  private int line = 1;

  /** The index in {@link #input} of the first character of the current line. */
  private int lineStart;

  /** If non-null, the token that the next call to {@link #next} will return. */
  private @Nullable Token pending;

  /** Set when the end of input is reached or a LexicalError is thrown. */
  private boolean done;

  public Lexer(String input) {
    this.input = input;
    this.matcher = TOKEN.matcher(input);
  }

  @Override
  public boolean hasNext() {
    if (pending == null && !done) {
      pending = scan();
      done = (pending == null);
    }
    return pending != null;
  }

  @Override
  public Token next() {
    if (!hasNext()) {
      throw new NoSuchElementException();
    }
    Token result = pending;
    pending = null;
    return result;
  }

  /** Returns the next token, or null if there are no more. */
  private @Nullable Token scan() {
    while (pos < input.length()) {
      matcher.region(pos, input.length());
      if (!matcher.lookingAt()) {
        throw new AssertionError();
      }
      int start = pos;
      pos = matcher.end();
      int column = start - lineStart + 1;
      if (matcher.group("comment") != null || matcher.group("newline") != null) {
        line++;
        lineStart = pos;
        continue;
      }
      if (matcher.group("whitespace") != null) {
        continue;
      }
      if (matcher.group("number") != null) {
        return number(matcher.group(), column);
      } else if (matcher.group("word") != null) {
        String word = matcher.group();
        return Token.of(TokenKind.forWord(word), word, line, column);
      } else if (matcher.group("punctuation") != null) {
        String p = matcher.group();
        return Token.of(TokenKind.forPunctuation(p), p, line, column);
      } else {
        done = true;
        throw LexicalError.unexpectedCharacter(matcher.group(), line, column);
      }
    }
    return null;
  }

  private Token number(String text, int column) {
    int value;
    try {
      value = Integer.parseInt(text);
    } catch (NumberFormatException e) {
      done = true;
      throw LexicalError.numberTooLarge(text, line, column);
    }
    return Token.ofNumber(text, value, line, column);
  }
}
