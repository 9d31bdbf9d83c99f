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

import com.google.common.base.Preconditions;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.Iterator;
import org.jspecify.annotations.Nullable;

/**
 * Gives the {@link Parser} a one-token window onto a stream of tokens: {@code current} is the most
 * recently consumed token and {@code lookahead} is the next one.
 */
final class TokenCursor {
  private final Iterator<Token> tokens;

  /** The last token consumed; null until the first token has been consumed. */
  private @Nullable Token current;

  /** The next unconsumed token; null at the end of the stream. */
  private @Nullable Token lookahead;

  /** Creates a TokenCursor and pulls the first token into {@code lookahead}. */
  TokenCursor(Iterator<Token> tokens) {
    this.tokens = tokens;
    advance();
  }

  /** Returns the last token consumed, or null if none has been. */
  @Nullable Token current() {
    return current;
  }

  /** Returns the kind of the next token, or null if there are no more. */
  @Nullable TokenKind peek() {
    return (lookahead == null) ? null : lookahead.kind();
  }

  /** Returns true if every token has been consumed. */
  boolean atEnd() {
    return lookahead == null;
  }

  /** Unconditionally consumes the next token (if any). */
  void advance() {
    current = lookahead;
    lookahead = tokens.hasNext() ? tokens.next() : null;
  }

  /**
   * If the next token has the given kind, consumes it and returns true; otherwise leaves the
   * cursor unchanged and returns false.
   */
  @CanIgnoreReturnValue
  boolean accept(TokenKind kind) {
    if (peek() == kind) {
      advance();
      return true;
    }
    return false;
  }

  /**
   * Consumes the next token and returns it if it has the given kind; otherwise throws a
   * SyntaxError that refers to the last token consumed.
   */
  @CanIgnoreReturnValue
  Token expect(TokenKind kind) {
    if (!accept(kind)) {
      throw SyntaxError.expected(errorToken(), kind);
    }
    return last();
  }

  /** Throws a SyntaxError unless every token has been consumed. */
  void expectEnd() {
    if (!atEnd()) {
      throw SyntaxError.expectedEndOfFile(errorToken());
    }
  }

  /**
   * Returns the token that errors should refer to: the last one matched, or (if nothing has been
   * matched yet) the first token of the input.
   */
  @Nullable Token errorToken() {
    return (current != null) ? current : lookahead;
  }

  /** Returns the last token consumed, which must exist. */
  Token last() {
    Preconditions.checkState(current != null);
    return current;
  }
}
