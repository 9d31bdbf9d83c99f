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

import static org.cellcount.parser.TokenKind.COLON;
import static org.cellcount.parser.TokenKind.COMMA;
import static org.cellcount.parser.TokenKind.DOT;
import static org.cellcount.parser.TokenKind.ENDMODULE;
import static org.cellcount.parser.TokenKind.IDENTIFIER;
import static org.cellcount.parser.TokenKind.LEFT_PAREN;
import static org.cellcount.parser.TokenKind.LEFT_SQUARE;
import static org.cellcount.parser.TokenKind.MODULE;
import static org.cellcount.parser.TokenKind.NUMBER;
import static org.cellcount.parser.TokenKind.RIGHT_PAREN;
import static org.cellcount.parser.TokenKind.RIGHT_SQUARE;
import static org.cellcount.parser.TokenKind.SEMICOLON;

import com.google.common.collect.ImmutableList;
import java.util.HashSet;
import java.util.Set;
import org.cellcount.design.Argument;
import org.cellcount.design.Design;
import org.cellcount.design.Instance;
import org.cellcount.design.Module;
import org.cellcount.design.Net;
import org.cellcount.design.NetKind;
import org.jspecify.annotations.Nullable;

/**
 * A recursive-descent parser for structural netlists. Each method named {@code parseX} handles the
 * grammar rule for X, documented in EBNF on the method; a single token of lookahead always
 * determines which alternative to take.
 *
 * <p>The parser only checks syntax (and that module names are distinct); it doesn't check that
 * connected nets are declared or that port names match the instantiated module.
 */
public final class Parser {
  private final TokenCursor cursor;

  private Parser(TokenCursor cursor) {
    this.cursor = cursor;
  }

  /**
   * Parses netlist source text.
   *
   * @throws LexicalError if the text contains a character that can't start a token
   * @throws SyntaxError if the tokens don't match the grammar
   */
  public static Design parse(String input) {
    Parser parser = new Parser(new TokenCursor(new Lexer(input)));
    Design design = parser.parseFile();
    parser.cursor.expectEnd();
    return design;
  }

  /**
   * {@code file = { "module" IDENTIFIER "(" params ")" ";" nets instances "endmodule" }}
   */
  private Design parseFile() {
    ImmutableList.Builder<Module> modules = ImmutableList.builder();
    Set<String> names = new HashSet<>();
    while (cursor.accept(MODULE)) {
      Token name = cursor.expect(IDENTIFIER);
      if (!names.add(name.text())) {
        throw SyntaxError.duplicateModule(name);
      }
      cursor.expect(LEFT_PAREN);
      ImmutableList<String> params = parseParams();
      cursor.expect(RIGHT_PAREN);
      cursor.expect(SEMICOLON);
      ImmutableList<Net> nets = parseNets();
      ImmutableList<Instance> instances = parseInstances();
      cursor.expect(ENDMODULE);
      modules.add(new Module(name.text(), params, nets, instances));
    }
    return new Design(modules.build());
  }

  /** {@code params = IDENTIFIER { "," IDENTIFIER }} */
  private ImmutableList<String> parseParams() {
    ImmutableList.Builder<String> params = ImmutableList.builder();
    do {
      params.add(cursor.expect(IDENTIFIER).text());
    } while (cursor.accept(COMMA));
    return params.build();
  }

  /** {@code nets = { ("input" | "output" | "wire") dims IDENTIFIER ";" }} */
  private ImmutableList<Net> parseNets() {
    ImmutableList.Builder<Net> nets = ImmutableList.builder();
    for (NetKind kind = acceptNetKind(); kind != null; kind = acceptNetKind()) {
      Range dims = parseDims();
      String name = cursor.expect(IDENTIFIER).text();
      cursor.expect(SEMICOLON);
      nets.add(new Net(kind, name, dims.msb(), dims.lsb()));
    }
    return nets.build();
  }

  /** If the next token starts a net declaration, consumes it and returns the kind of net. */
  private @Nullable NetKind acceptNetKind() {
    TokenKind next = cursor.peek();
    if (next == null) {
      return null;
    }
    NetKind result =
        switch (next) {
          case INPUT -> NetKind.INPUT;
          case OUTPUT -> NetKind.OUTPUT;
          case WIRE -> NetKind.WIRE;
          default -> null;
        };
    if (result != null) {
      cursor.advance();
    }
    return result;
  }

  /** A declared bit range. */
  private record Range(int msb, int lsb) {
    static final Range NONE = new Range(0, 0);
  }

  /** {@code dims = [ "[" NUMBER ":" NUMBER "]" ]} */
  private Range parseDims() {
    if (!cursor.accept(LEFT_SQUARE)) {
      return Range.NONE;
    }
    int msb = cursor.expect(NUMBER).number();
    cursor.expect(COLON);
    int lsb = cursor.expect(NUMBER).number();
    cursor.expect(RIGHT_SQUARE);
    return new Range(msb, lsb);
  }

  /** {@code instances = { IDENTIFIER IDENTIFIER "(" args ")" ";" }} */
  private ImmutableList<Instance> parseInstances() {
    ImmutableList.Builder<Instance> instances = ImmutableList.builder();
    while (cursor.accept(IDENTIFIER)) {
      String type = cursor.last().text();
      String name = cursor.expect(IDENTIFIER).text();
      cursor.expect(LEFT_PAREN);
      ImmutableList<Argument> args = parseArgs();
      cursor.expect(RIGHT_PAREN);
      cursor.expect(SEMICOLON);
      instances.add(new Instance(type, name, args));
    }
    return instances.build();
  }

  /** {@code args = arg { "," arg }} */
  private ImmutableList<Argument> parseArgs() {
    ImmutableList.Builder<Argument> args = ImmutableList.builder();
    do {
      args.add(parseArg());
    } while (cursor.accept(COMMA));
    return args.build();
  }

  /**
   * {@code arg = "." IDENTIFIER "(" IDENTIFIER [ "[" NUMBER [ ":" NUMBER ] "]" ] ")"}
   *
   * <p>A single-bit select ({@code x[3]}) sets both msb and lsb to that bit.
   */
  private Argument parseArg() {
    cursor.expect(DOT);
    String param = cursor.expect(IDENTIFIER).text();
    cursor.expect(LEFT_PAREN);
    String arg = cursor.expect(IDENTIFIER).text();
    int msb = 0;
    int lsb = 0;
    if (cursor.accept(LEFT_SQUARE)) {
      msb = cursor.expect(NUMBER).number();
      lsb = msb;
      if (cursor.accept(COLON)) {
        lsb = cursor.expect(NUMBER).number();
      }
      cursor.expect(RIGHT_SQUARE);
    }
    cursor.expect(RIGHT_PAREN);
    return new Argument(param, arg, msb, lsb);
  }
}
