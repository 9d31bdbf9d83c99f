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

/**
 * A single token. {@code line} and {@code column} are 1-based and locate the token's first
 * character; {@code number} is the converted value of a NUMBER token and zero for all other kinds.
 */
public record Token(TokenKind kind, String text, int number, int line, int column) {

  /** Returns a token of any kind other than NUMBER. */
  static Token of(TokenKind kind, String text, int line, int column) {
    Preconditions.checkArgument(kind != TokenKind.NUMBER);
    return new Token(kind, text, 0, line, column);
  }

  /** Returns a NUMBER token. */
  static Token ofNumber(String text, int number, int line, int column) {
    return new Token(TokenKind.NUMBER, text, number, line, column);
  }

  @Override
  public String toString() {
    return String.format("%s '%s' (%s:%s)", kind.name(), text, line, column);
  }
}
