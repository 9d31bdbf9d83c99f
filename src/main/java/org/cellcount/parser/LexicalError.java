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

/** Thrown by the {@link Lexer} when it finds text that can't be part of any token. */
public final class LexicalError extends ParseError {

  private LexicalError(String msg, int lineNum, int column) {
    super(msg, lineNum, column);
  }

  @FormatMethod
  static LexicalError at(int lineNum, int column, String fmt, Object... fmtArgs) {
    return new LexicalError(String.format(fmt, fmtArgs), lineNum, column);
  }

  /** Returns a new "Unexpected character '%s'" LexicalError. */
  static LexicalError unexpectedCharacter(String text, int lineNum, int column) {
    return at(lineNum, column, "Unexpected character '%s'", printable(text));
  }

  /** Returns a new "Number too large: %s" LexicalError. */
  static LexicalError numberTooLarge(String text, int lineNum, int column) {
    return at(lineNum, column, "Number too large: %s", text);
  }

  /** Control characters (a stray carriage return, say) are shown as unicode escapes. */
  private static String printable(String text) {
    char c = text.charAt(0);
    return Character.isISOControl(c) ? String.format("\\u%04x", (int) c) : text;
  }
}
