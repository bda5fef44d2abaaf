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
package org.yulcomp.ir;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * An AST construction helper class.
 *
 * <p>Child layouts:
 *
 * <ul>
 *   <li>{@code FUNCTION "f"}: {@code PARAM_LIST}, {@code RESULT_LIST}, {@code BLOCK}
 *   <li>{@code VAR_DECL}: one or more {@code TYPED_NAME}, then an optional value
 *   <li>{@code ASSIGN}: one or more {@code NAME} targets, then the value
 *   <li>{@code CALL "f"}: the arguments
 *   <li>{@code IF}: condition, {@code BLOCK}
 *   <li>{@code SWITCH}: expression, {@code CASE}s, an optional trailing {@code DEFAULT}
 *   <li>{@code CASE}: {@code LITERAL}, {@code BLOCK}; {@code DEFAULT}: {@code BLOCK}
 *   <li>{@code FOR}: pre {@code BLOCK}, condition, post {@code BLOCK}, body {@code BLOCK}
 * </ul>
 */
public final class IR {

  private IR() {}

  public static Node block() {
    return new Node(Token.BLOCK);
  }

  public static Node block(Node... stmts) {
    Node block = block();
    for (Node stmt : stmts) {
      checkState(mayBeStatement(stmt), "Block node cannot contain %s", stmt.getToken());
      block.addChildToBack(stmt);
    }
    return block;
  }

  public static Node block(List<Node> stmts) {
    return block(stmts.toArray(new Node[0]));
  }

  public static Node function(String name, Node params, Node results, Node body) {
    checkState(params.isParamList());
    checkState(results.isResultList());
    checkState(body.isBlock());
    Node fn = Node.newString(Token.FUNCTION, name);
    fn.addChildToBack(params);
    fn.addChildToBack(results);
    fn.addChildToBack(body);
    return fn;
  }

  public static Node paramList(Node... params) {
    return typedNameList(Token.PARAM_LIST, params);
  }

  public static Node resultList(Node... results) {
    return typedNameList(Token.RESULT_LIST, results);
  }

  private static Node typedNameList(Token token, Node... names) {
    Node list = new Node(token);
    for (Node name : names) {
      checkState(name.isTypedName(), name);
      list.addChildToBack(name);
    }
    return list;
  }

  public static Node typedName(String name) {
    return typedName(name, null);
  }

  public static Node typedName(String name, @Nullable String type) {
    checkArgument(!name.isEmpty(), "empty name");
    return Node.newString(Token.TYPED_NAME, name).setTypeName(type);
  }

  /** A declaration without a value. */
  public static Node let(Node name) {
    return let(List.of(name), null);
  }

  public static Node let(Node name, Node value) {
    return let(List.of(name), value);
  }

  public static Node let(List<Node> names, @Nullable Node value) {
    checkArgument(!names.isEmpty(), "declaration without names");
    Node decl = new Node(Token.VAR_DECL);
    for (Node name : names) {
      checkState(name.isTypedName(), name);
      decl.addChildToBack(name);
    }
    if (value != null) {
      checkState(mayBeExpression(value), value);
      decl.addChildToBack(value);
    }
    return decl;
  }

  public static Node assign(Node target, Node value) {
    return assign(List.of(target), value);
  }

  public static Node assign(List<Node> targets, Node value) {
    checkArgument(!targets.isEmpty(), "assignment without targets");
    checkState(mayBeExpression(value), value);
    Node assign = new Node(Token.ASSIGN);
    for (Node target : targets) {
      checkState(target.isName(), target);
      assign.addChildToBack(target);
    }
    assign.addChildToBack(value);
    return assign;
  }

  public static Node name(String name) {
    checkArgument(!name.isEmpty(), "empty name");
    return Node.newString(Token.NAME, name);
  }

  public static Node number(String text) {
    return literal(text, null);
  }

  public static Node literal(String text, @Nullable String type) {
    return Node.newString(Token.LITERAL, text).setTypeName(type);
  }

  public static Node call(String function, Node... args) {
    Node call = Node.newString(Token.CALL, function);
    for (Node arg : args) {
      checkState(mayBeExpression(arg), arg);
      call.addChildToBack(arg);
    }
    return call;
  }

  public static Node exprResult(Node expr) {
    checkState(expr.isCall(), "Only calls may be used as statements: %s", expr);
    return new Node(Token.EXPR_RESULT, expr);
  }

  public static Node ifNode(Node cond, Node body) {
    checkState(mayBeExpression(cond));
    checkState(body.isBlock());
    return new Node(Token.IF, cond, body);
  }

  public static Node switchNode(Node expr, Node... cases) {
    checkState(mayBeExpression(expr));
    Node switchNode = new Node(Token.SWITCH, expr);
    for (Node caseNode : cases) {
      checkState(
          caseNode.getToken() == Token.CASE || caseNode.getToken() == Token.DEFAULT, caseNode);
      switchNode.addChildToBack(caseNode);
    }
    return switchNode;
  }

  public static Node caseNode(Node value, Node body) {
    checkState(value.isLiteral());
    checkState(body.isBlock());
    return new Node(Token.CASE, value, body);
  }

  public static Node defaultCase(Node body) {
    checkState(body.isBlock());
    return new Node(Token.DEFAULT, body);
  }

  public static Node forNode(Node pre, Node cond, Node post, Node body) {
    checkState(pre.isBlock());
    checkState(mayBeExpression(cond));
    checkState(post.isBlock());
    checkState(body.isBlock());
    Node forNode = new Node(Token.FOR, pre, cond, post);
    forNode.addChildToBack(body);
    return forNode;
  }

  public static Node breakNode() {
    return new Node(Token.BREAK);
  }

  public static Node continueNode() {
    return new Node(Token.CONTINUE);
  }

  public static Node leave() {
    return new Node(Token.LEAVE);
  }

  public static boolean mayBeExpression(Node n) {
    switch (n.getToken()) {
      case NAME:
      case LITERAL:
      case CALL:
        return true;
      default:
        return false;
    }
  }

  public static boolean mayBeStatement(Node n) {
    switch (n.getToken()) {
      case BLOCK:
      case FUNCTION:
      case VAR_DECL:
      case ASSIGN:
      case EXPR_RESULT:
      case IF:
      case SWITCH:
      case FOR:
      case BREAK:
      case CONTINUE:
      case LEAVE:
        return true;
      default:
        return false;
    }
  }
}
