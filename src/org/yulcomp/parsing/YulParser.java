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

import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;
import org.yulcomp.ir.IR;
import org.yulcomp.ir.Node;
import org.yulcomp.parsing.YulTokenStream.Kind;
import org.yulcomp.parsing.YulTokenStream.Lexeme;

/**
 * Recursive descent parser for Yul blocks.
 *
 * <p>The input is a single outermost block. The result is a {@code BLOCK} node laid out as
 * described on {@link IR}, with every node carrying the position of its first lexeme.
 */
public final class YulParser {

  private static final Logger logger = Logger.getLogger(YulParser.class.getName());

  private static final ImmutableSet<String> KEYWORDS =
      ImmutableSet.of(
          "let", "function", "if", "switch", "case", "default", "for", "break", "continue",
          "leave", "true", "false");

  private final YulTokenStream tokens;
  private Lexeme current;

  private YulParser(String source) {
    this.tokens = new YulTokenStream(source);
    this.current = tokens.next();
  }

  /** Parses {@code source}, which must consist of exactly one block. */
  public static Node parse(String source) {
    logger.finest("Parsing Yul block");
    YulParser parser = new YulParser(source);
    Node root = parser.parseBlock();
    parser.expect(Kind.EOF);
    return root;
  }

  private Node parseBlock() {
    Lexeme start = expect(Kind.LBRACE);
    Node block = at(IR.block(), start);
    while (!current.is(Kind.RBRACE)) {
      if (current.is(Kind.EOF)) {
        throw error("Expected '}' but found " + current);
      }
      block.addChildToBack(parseStatement());
    }
    advance();
    return block;
  }

  private Node parseStatement() {
    Lexeme start = current;
    switch (current.kind) {
      case LBRACE:
        return parseBlock();
      case IDENTIFIER:
        break;
      default:
        throw error("Expected statement but found " + current);
    }

    switch (current.text) {
      case "function":
        return parseFunction();
      case "let":
        return parseVarDecl();
      case "if":
        {
          advance();
          Node cond = parseExpression();
          return at(IR.ifNode(cond, parseBlock()), start);
        }
      case "switch":
        return parseSwitch();
      case "for":
        {
          advance();
          Node pre = parseBlock();
          Node cond = parseExpression();
          Node post = parseBlock();
          return at(IR.forNode(pre, cond, post, parseBlock()), start);
        }
      case "break":
        advance();
        return at(IR.breakNode(), start);
      case "continue":
        advance();
        return at(IR.continueNode(), start);
      case "leave":
        advance();
        return at(IR.leave(), start);
      default:
        return parseAssignmentOrCall();
    }
  }

  private Node parseFunction() {
    Lexeme start = advance();
    String name = expectIdentifier().text;
    expect(Kind.LPAREN);
    List<Node> params = new ArrayList<>();
    if (!current.is(Kind.RPAREN)) {
      params = parseTypedNameList();
    }
    expect(Kind.RPAREN);
    List<Node> results = new ArrayList<>();
    if (current.is(Kind.ARROW)) {
      advance();
      results = parseTypedNameList();
    }
    Node body = parseBlock();
    return at(
        IR.function(
            name,
            IR.paramList(params.toArray(new Node[0])),
            IR.resultList(results.toArray(new Node[0])),
            body),
        start);
  }

  private Node parseVarDecl() {
    Lexeme start = advance();
    List<Node> names = parseTypedNameList();
    Node value = null;
    if (current.is(Kind.ASSIGN)) {
      advance();
      value = parseExpression();
    }
    return at(IR.let(names, value), start);
  }

  private List<Node> parseTypedNameList() {
    List<Node> names = new ArrayList<>();
    names.add(parseTypedName());
    while (current.is(Kind.COMMA)) {
      advance();
      names.add(parseTypedName());
    }
    return names;
  }

  private Node parseTypedName() {
    Lexeme name = expectIdentifier();
    String type = null;
    if (current.is(Kind.COLON)) {
      advance();
      type = expectIdentifier().text;
    }
    return at(IR.typedName(name.text, type), name);
  }

  private Node parseSwitch() {
    Lexeme start = advance();
    Node switchNode = at(IR.switchNode(parseExpression()), start);
    while (current.isKeyword("case")) {
      Lexeme caseStart = advance();
      Node value = parseLiteral();
      switchNode.addChildToBack(at(IR.caseNode(value, parseBlock()), caseStart));
    }
    if (current.isKeyword("default")) {
      Lexeme defaultStart = advance();
      switchNode.addChildToBack(at(IR.defaultCase(parseBlock()), defaultStart));
    }
    if (switchNode.hasOneChild()) {
      throw new YulParseException(
          "Switch statement without any cases", start.lineno, start.charno);
    }
    return switchNode;
  }

  private Node parseAssignmentOrCall() {
    Lexeme first = expectIdentifier();
    if (current.is(Kind.LPAREN)) {
      return at(IR.exprResult(parseCallArguments(first)), first);
    }
    List<Node> targets = new ArrayList<>();
    targets.add(at(IR.name(first.text), first));
    while (current.is(Kind.COMMA)) {
      advance();
      Lexeme target = expectIdentifier();
      targets.add(at(IR.name(target.text), target));
    }
    if (!current.is(Kind.ASSIGN)) {
      throw error("Expected ':=' but found " + current);
    }
    advance();
    return at(IR.assign(targets, parseExpression()), first);
  }

  private Node parseExpression() {
    switch (current.kind) {
      case IDENTIFIER:
        if (current.text.equals("true") || current.text.equals("false")) {
          return parseLiteral();
        }
        Lexeme name = expectIdentifier();
        if (current.is(Kind.LPAREN)) {
          return parseCallArguments(name);
        }
        return at(IR.name(name.text), name);
      case NUMBER:
      case STRING:
        return parseLiteral();
      default:
        throw error("Expected expression but found " + current);
    }
  }

  private Node parseCallArguments(Lexeme function) {
    expect(Kind.LPAREN);
    Node call = at(IR.call(function.text), function);
    if (!current.is(Kind.RPAREN)) {
      call.addChildToBack(parseExpression());
      while (current.is(Kind.COMMA)) {
        advance();
        call.addChildToBack(parseExpression());
      }
    }
    expect(Kind.RPAREN);
    return call;
  }

  private Node parseLiteral() {
    Lexeme value = current;
    boolean isBool = value.isKeyword("true") || value.isKeyword("false");
    if (!value.is(Kind.NUMBER) && !value.is(Kind.STRING) && !isBool) {
      throw error("Expected literal but found " + current);
    }
    advance();
    String type = null;
    if (current.is(Kind.COLON)) {
      advance();
      type = expectIdentifier().text;
    }
    return at(IR.literal(value.text, type), value);
  }

  private Lexeme expectIdentifier() {
    if (!current.is(Kind.IDENTIFIER) || KEYWORDS.contains(current.text)) {
      throw error("Expected identifier but found " + current);
    }
    return advance();
  }

  private Lexeme expect(Kind kind) {
    if (!current.is(kind)) {
      throw error("Expected " + describe(kind) + " but found " + current);
    }
    return advance();
  }

  private Lexeme advance() {
    Lexeme consumed = current;
    if (!current.is(Kind.EOF)) {
      current = tokens.next();
    }
    return consumed;
  }

  private YulParseException error(String message) {
    return new YulParseException(message, current.lineno, current.charno);
  }

  private static Node at(Node n, Lexeme lexeme) {
    return n.setLinenoCharno(lexeme.lineno, lexeme.charno);
  }

  private static String describe(Kind kind) {
    switch (kind) {
      case LBRACE:
        return "'{'";
      case RBRACE:
        return "'}'";
      case LPAREN:
        return "'('";
      case RPAREN:
        return "')'";
      case EOF:
        return "end of input";
      default:
        return kind.name().toLowerCase();
    }
  }
}
