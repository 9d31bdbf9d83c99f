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

import com.google.errorprone.annotations.FormatMethod;
import org.jspecify.annotations.Nullable;

/**
 * Thrown by the {@link Parser} when the token stream doesn't match the grammar. The reported
 * position is that of the last token that was successfully matched.
 */
public final class SyntaxError extends ParseError {

  private SyntaxError(String msg, int lineNum, int column) {
    super(msg, lineNum, column);
  }

  /** Returns a new SyntaxError referring to the given token. */
  static SyntaxError at(@Nullable Token token, String msg) {
    int lineNum;
    int column;
    if (token != null) {
      lineNum = token.line();
      column = token.column();
    } else {
      // Only possible if the input had no tokens at all, which always parses.
      lineNum = 0;
      column = 0;
    }
    return new SyntaxError(msg, lineNum, column);
  }

  /** Returns a new SyntaxError referring to the given token. */
  @FormatMethod
  static SyntaxError at(@Nullable Token token, String fmt, Object... fmtArgs) {
    return at(token, String.format(fmt, fmtArgs));
  }

  /** Returns a new "Expected %s" SyntaxError. */
  static SyntaxError expected(@Nullable Token token, TokenKind kind) {
    return at(token, "Expected %s", kind);
  }

  /** Returns a new "Expected end of file" SyntaxError. */
  static SyntaxError expectedEndOfFile(@Nullable Token token) {
    return at(token, "Expected end of file");
  }

  /** Returns a new "Module '%s' is already defined" SyntaxError. */
  static SyntaxError duplicateModule(Token name) {
    return at(name, "Module '%s' is already defined", name.text());
  }
}
