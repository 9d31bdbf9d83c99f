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

import com.google.common.collect.ImmutableMap;
import org.jspecify.annotations.Nullable;

/**
 * The kinds of token produced by the {@link Lexer}.
 *
 * <p>Keywords and punctuation each get their own kind, so the parser never compares token text.
 * Kinds are printed (e.g. in error messages) as their literal enclosed in single quotes ("{@code
 * ';'}") or, for IDENTIFIER and NUMBER, as their symbolic name.
 */
public enum TokenKind {
  MODULE("module"),
  ENDMODULE("endmodule"),
  INPUT("input"),
  OUTPUT("output"),
  WIRE("wire"),
  IDENTIFIER(null),
  NUMBER(null),
  LEFT_PAREN("("),
  RIGHT_PAREN(")"),
  LEFT_SQUARE("["),
  RIGHT_SQUARE("]"),
  COLON(":"),
  DOT("."),
  COMMA(","),
  SEMICOLON(";");

  /** The exact source text of tokens of this kind, or null if it varies. */
  private final @Nullable String literal;

  TokenKind(@Nullable String literal) {
    this.literal = literal;
  }

  /** A Map from literal text to kind, covering the keywords and the punctuation. */
  private static final ImmutableMap<String, TokenKind> BY_LITERAL;

  static {
    ImmutableMap.Builder<String, TokenKind> builder = ImmutableMap.builder();
    for (TokenKind kind : values()) {
      if (kind.literal != null) {
        builder.put(kind.literal, kind);
      }
    }
    BY_LITERAL = builder.buildOrThrow();
  }

  /** Returns the keyword kind for {@code word}, or IDENTIFIER if it isn't a keyword. */
  static TokenKind forWord(String word) {
    return BY_LITERAL.getOrDefault(word, IDENTIFIER);
  }

  /**
   * Returns the kind of a single-character punctuation token. Throws an exception if there is no
   * such punctuation.
   */
  static TokenKind forPunctuation(String text) {
    TokenKind result = BY_LITERAL.get(text);
    if (result == null) {
      throw new IllegalArgumentException("No punctuation " + text);
    }
    return result;
  }

  @Override
  public String toString() {
    return (literal == null) ? name() : "'" + literal + "'";
  }
}
