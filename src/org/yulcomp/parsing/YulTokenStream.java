/*
 * Copyright 2026 The Yulcomp Authors.
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
package org.yulcomp.parsing;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Splits Yul source text into lexemes.
 *
 * <p>Whitespace and comments are skipped. Keywords are reported as identifiers; the parser
 * tells them apart.
 */
final class YulTokenStream {

  enum Kind {
    IDENTIFIER,
    NUMBER,
    STRING,
    LBRACE,
    RBRACE,
    LPAREN,
    RPAREN,
    COMMA,
    COLON,
    ASSIGN,
    ARROW,
    EOF
  }

  /** One lexeme together with the position of its first character. */
  static final class Lexeme {
    final Kind kind;
    final String text;
    final int lineno;
    final int charno;

    Lexeme(Kind kind, String text, int lineno, int charno) {
      this.kind = kind;
      this.text = text;
      this.lineno = lineno;
      this.charno = charno;
    }

    boolean is(Kind kind) {
      return this.kind == kind;
    }

    boolean isKeyword(String keyword) {
      return kind == Kind.IDENTIFIER && text.equals(keyword);
    }

    @Override
    public String toString() {
      return kind == Kind.EOF ? "end of input" : "'" + text + "'";
    }
  }

  private final String source;
  private int pos = 0;
  private int lineno = 1;
  private int charno = 1;

  YulTokenStream(String source) {
    this.source = checkNotNull(source);
  }

  Lexeme next() {
    skipWhitespaceAndComments();
    int startLine = lineno;
    int startChar = charno;
    if (pos >= source.length()) {
      return new Lexeme(Kind.EOF, "", startLine, startChar);
    }

    char c = source.charAt(pos);
    switch (c) {
      case '{':
        return single(Kind.LBRACE, startLine, startChar);
      case '}':
        return single(Kind.RBRACE, startLine, startChar);
      case '(':
        return single(Kind.LPAREN, startLine, startChar);
      case ')':
        return single(Kind.RPAREN, startLine, startChar);
      case ',':
        return single(Kind.COMMA, startLine, startChar);
      case ':':
        if (peekChar(1) == '=') {
          advance(2);
          return new Lexeme(Kind.ASSIGN, ":=", startLine, startChar);
        }
        return single(Kind.COLON, startLine, startChar);
      case '-':
        if (peekChar(1) == '>') {
          advance(2);
          return new Lexeme(Kind.ARROW, "->", startLine, startChar);
        }
        break;
      case '"':
        return string(startLine, startChar);
      default:
        if (isIdentifierStart(c)) {
          return identifier(startLine, startChar);
        }
        if (isDigit(c)) {
          return number(startLine, startChar);
        }
        break;
    }
    throw new YulParseException("Unexpected character '" + c + "'", startLine, startChar);
  }

  private Lexeme single(Kind kind, int startLine, int startChar) {
    String text = source.substring(pos, pos + 1);
    advance(1);
    return new Lexeme(kind, text, startLine, startChar);
  }

  private Lexeme identifier(int startLine, int startChar) {
    int start = pos;
    while (pos < source.length() && isIdentifierPart(source.charAt(pos))) {
      advance(1);
    }
    return new Lexeme(Kind.IDENTIFIER, source.substring(start, pos), startLine, startChar);
  }

  private Lexeme number(int startLine, int startChar) {
    int start = pos;
    if (source.charAt(pos) == '0' && (peekChar(1) == 'x' || peekChar(1) == 'X')) {
      advance(2);
      if (!isHexDigit(peekChar(0))) {
        throw new YulParseException("Malformed hex number", startLine, startChar);
      }
      while (isHexDigit(peekChar(0))) {
        advance(1);
      }
    } else {
      while (isDigit(peekChar(0))) {
        advance(1);
      }
    }
    if (isIdentifierPart(peekChar(0))) {
      throw new YulParseException(
          "Malformed number '" + source.substring(start, pos + 1) + "'", startLine, startChar);
    }
    return new Lexeme(Kind.NUMBER, source.substring(start, pos), startLine, startChar);
  }

  /** Keeps the quotes and escapes, so the literal prints back exactly as written. */
  private Lexeme string(int startLine, int startChar) {
    int start = pos;
    advance(1);
    while (true) {
      if (pos >= source.length() || source.charAt(pos) == '\n') {
        throw new YulParseException("Unterminated string literal", startLine, startChar);
      }
      char c = source.charAt(pos);
      if (c == '\\') {
        advance(2);
      } else {
        advance(1);
        if (c == '"') {
          break;
        }
      }
    }
    return new Lexeme(Kind.STRING, source.substring(start, pos), startLine, startChar);
  }

  private void skipWhitespaceAndComments() {
    while (pos < source.length()) {
      char c = source.charAt(pos);
      if (Character.isWhitespace(c)) {
        advance(1);
      } else if (c == '/' && peekChar(1) == '/') {
        while (pos < source.length() && source.charAt(pos) != '\n') {
          advance(1);
        }
      } else if (c == '/' && peekChar(1) == '*') {
        int startLine = lineno;
        int startChar = charno;
        advance(2);
        while (!(peekChar(0) == '*' && peekChar(1) == '/')) {
          if (pos >= source.length()) {
            throw new YulParseException("Unterminated comment", startLine, startChar);
          }
          advance(1);
        }
        advance(2);
      } else {
        return;
      }
    }
  }

  private char peekChar(int offset) {
    int i = pos + offset;
    return i < source.length() ? source.charAt(i) : '\0';
  }

  private void advance(int count) {
    for (int i = 0; i < count && pos < source.length(); i++) {
      if (source.charAt(pos) == '\n') {
        lineno++;
        charno = 1;
      } else {
        charno++;
      }
      pos++;
    }
  }

  private static boolean isIdentifierStart(char c) {
    return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_' || c == '$';
  }

  private static boolean isIdentifierPart(char c) {
    return isIdentifierStart(c) || isDigit(c) || c == '.';
  }

  private static boolean isDigit(char c) {
    return c >= '0' && c <= '9';
  }

  private static boolean isHexDigit(char c) {
    return isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
  }
}
