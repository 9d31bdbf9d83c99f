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

/**
 * All errors detected while reading netlist source throw a ParseError. There are exactly two kinds:
 * {@link LexicalError} (a character that cannot start any token) and {@link SyntaxError} (a token
 * sequence that doesn't match the grammar).
 */
public abstract class ParseError extends RuntimeException {
  public final String msg;
  public final int lineNum;
  public final int column;

  // Only the two subclasses in this package.
  ParseError(String msg, int lineNum, int column) {
    super(msg);
    this.msg = msg;
    this.lineNum = lineNum;
    this.column = column;
  }

  @Override
  public String getMessage() {
    return String.format("%s (%s:%s)", msg, lineNum, column);
  }
}
