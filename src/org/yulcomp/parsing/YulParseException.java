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

/** Thrown when Yul source text cannot be parsed. */
public final class YulParseException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  private final int lineno;
  private final int charno;

  YulParseException(String message, int lineno, int charno) {
    super(lineno + ":" + charno + ": " + message);
    this.lineno = lineno;
    this.charno = charno;
  }

  public int getLineno() {
    return lineno;
  }

  public int getCharno() {
    return charno;
  }
}
