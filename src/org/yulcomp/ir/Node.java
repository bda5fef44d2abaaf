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
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.errorprone.annotations.CheckReturnValue;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * A node in a Yul tree.
 *
 * <p>Children form a linked list: {@code first.previous} is the last child, and the last child's
 * {@code next} is null. Nodes are mutated in place by the optimizer passes; {@link #setString}
 * is how a pass renames a declaration or reference.
 */
public final class Node {

  private Token token;
  private @Nullable Node next;
  // For the first child this points at the last sibling.
  private @Nullable Node previous;
  private @Nullable Node first;
  private @Nullable Node parent;

  private @Nullable String str;
  private @Nullable String type;

  private int lineno = -1;
  private int charno = -1;

  public Node(Token token) {
    this.token = checkNotNull(token);
  }

  public Node(Token token, Node child) {
    this(token);
    addChildToBack(child);
  }

  public Node(Token token, Node left, Node right) {
    this(token);
    addChildToBack(left);
    addChildToBack(right);
  }

  public Node(Token token, Node left, Node mid, Node right) {
    this(token);
    addChildToBack(left);
    addChildToBack(mid);
    addChildToBack(right);
  }

  public static Node newString(Token token, String str) {
    checkArgument(token.hasString(), "%s does not carry a string", token);
    Node n = new Node(token);
    n.setString(str);
    return n;
  }

  public Token getToken() {
    return token;
  }

  public boolean hasChildren() {
    return first != null;
  }

  public boolean hasOneChild() {
    return first != null && first.next == null;
  }

  public int getChildCount() {
    int c = 0;
    for (Node n = first; n != null; n = n.next) {
      c++;
    }
    return c;
  }

  public Node getOnlyChild() {
    checkState(hasOneChild(), "Expected exactly one child: %s", this);
    return first;
  }

  public @Nullable Node getFirstChild() {
    return first;
  }

  public @Nullable Node getSecondChild() {
    return first.next;
  }

  public @Nullable Node getLastChild() {
    return first != null ? first.previous : null;
  }

  public @Nullable Node getNext() {
    return next;
  }

  public @Nullable Node getPrevious() {
    return parent == null || this == parent.first ? null : previous;
  }

  public @Nullable Node getParent() {
    return parent;
  }

  public boolean hasParent() {
    return parent != null;
  }

  /**
   * Gets the ith child, note that this is O(N) where N is the number of children.
   */
  public Node getChildAtIndex(int i) {
    Node n = first;
    while (i > 0) {
      n = n.next;
      i--;
    }
    return n;
  }

  public void addChildToFront(Node child) {
    child.checkDetached();
    child.parent = this;
    if (first == null) {
      child.previous = child;
    } else {
      child.previous = first.previous;
      child.next = first;
      first.previous = child;
    }
    first = child;
  }

  public void addChildToBack(Node child) {
    checkArgument(
        child.parent == null,
        "Cannot add already-owned child node.\nChild: %s\nExisting parent: %s\nNew parent: %s",
        child,
        child.parent,
        this);
    child.checkDetached();
    if (first == null) {
      child.previous = child;
      first = child;
    } else {
      Node last = first.previous;
      last.next = child;
      child.previous = last;
      first.previous = child;
    }
    child.parent = this;
  }

  /** Swaps {@code replacement} and its subtree into the position of {@code this}. */
  public void replaceWith(Node replacement) {
    checkState(parent != null, "Has no parent: %s", this);
    replacement.checkDetached();

    Node existingParent = parent;
    Node existingNext = next;
    Node existingPrevious = previous;

    this.parent = null;
    replacement.parent = existingParent;

    this.previous = null;
    if (existingPrevious == this) {
      // Only child.
      replacement.previous = replacement;
      existingParent.first = replacement;
      return;
    }
    replacement.previous = existingPrevious;
    if (existingParent.first == this) {
      existingParent.first = replacement;
    } else {
      existingPrevious.next = replacement;
    }

    if (existingNext == null) {
      existingParent.first.previous = replacement;
    } else {
      this.next = null;
      existingNext.previous = replacement;
      replacement.next = existingNext;
    }
  }

  /** Removes this node from its parent, but retains its subtree. */
  @CanIgnoreReturnValue
  public Node detach() {
    checkState(parent != null, "Has no parent: %s", this);

    Node existingParent = parent;
    Node existingNext = next;
    Node existingPrevious = previous;

    this.parent = null;
    this.next = null;
    this.previous = null;

    if (existingParent.first == this) {
      existingParent.first = existingNext;
      if (existingNext != null) {
        existingNext.previous = existingPrevious;
      }
    } else {
      existingPrevious.next = existingNext;
      if (existingNext == null) {
        existingParent.first.previous = existingPrevious;
      } else {
        existingNext.previous = existingPrevious;
      }
    }
    return this;
  }

  private void checkDetached() {
    checkState(this.parent == null, "Has parent: %s", this);
    checkState(this.next == null, "Has next: %s", this);
    checkState(this.previous == null, "Has previous: %s", this);
  }

  public Iterable<Node> children() {
    return () ->
        new Iterator<Node>() {
          private @Nullable Node cursor = first;

          @Override
          public boolean hasNext() {
            return cursor != null;
          }

          @Override
          public Node next() {
            if (cursor == null) {
              throw new NoSuchElementException();
            }
            Node n = cursor;
            cursor = cursor.next;
            return n;
          }
        };
  }

  public String getString() {
    checkState(token.hasString(), "%s does not carry a string", token);
    return str;
  }

  public void setString(String str) {
    checkState(token.hasString(), "%s does not carry a string", token);
    this.str = checkNotNull(str);
  }

  /** The declared type of a typed name or literal, e.g. {@code u256}, or null if untyped. */
  public @Nullable String getTypeName() {
    return type;
  }

  @CanIgnoreReturnValue
  public Node setTypeName(@Nullable String type) {
    this.type = type;
    return this;
  }

  @CanIgnoreReturnValue
  public Node setLinenoCharno(int lineno, int charno) {
    this.lineno = lineno;
    this.charno = charno;
    return this;
  }

  public int getLineno() {
    return lineno;
  }

  public int getCharno() {
    return charno;
  }

  /** Returns "line:column", or "?" when the node has no source position. */
  public String getLocation() {
    return lineno == -1 ? "?" : lineno + ":" + charno;
  }

  @CheckReturnValue
  public Node cloneTree() {
    Node result = new Node(token);
    result.str = str;
    result.type = type;
    result.lineno = lineno;
    result.charno = charno;
    for (Node c = first; c != null; c = c.next) {
      result.addChildToBack(c.cloneTree());
    }
    return result;
  }

  /** Structural equality: tokens, payloads, types and children. Source positions are ignored. */
  public boolean isEquivalentTo(Node node) {
    if (token != node.token
        || !Objects.equals(str, node.str)
        || !Objects.equals(type, node.type)) {
      return false;
    }
    Node a = first;
    Node b = node.first;
    while (a != null && b != null) {
      if (!a.isEquivalentTo(b)) {
        return false;
      }
      a = a.next;
      b = b.next;
    }
    return a == null && b == null;
  }

  public boolean isBlock() {
    return token == Token.BLOCK;
  }

  public boolean isFunction() {
    return token == Token.FUNCTION;
  }

  public boolean isParamList() {
    return token == Token.PARAM_LIST;
  }

  public boolean isResultList() {
    return token == Token.RESULT_LIST;
  }

  public boolean isVarDecl() {
    return token == Token.VAR_DECL;
  }

  public boolean isTypedName() {
    return token == Token.TYPED_NAME;
  }

  public boolean isAssign() {
    return token == Token.ASSIGN;
  }

  public boolean isName() {
    return token == Token.NAME;
  }

  public boolean isLiteral() {
    return token == Token.LITERAL;
  }

  public boolean isCall() {
    return token == Token.CALL;
  }

  public boolean isSwitch() {
    return token == Token.SWITCH;
  }

  public boolean isFor() {
    return token == Token.FOR;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append(token);
    if (str != null) {
      sb.append(' ').append(str);
    }
    if (type != null) {
      sb.append(" :").append(type);
    }
    if (lineno != -1) {
      sb.append(' ').append(lineno).append(':').append(charno);
    }
    return sb.toString();
  }

  @CheckReturnValue
  public String toStringTree() {
    StringBuilder sb = new StringBuilder();
    toStringTreeHelper(this, 0, sb);
    return sb.toString();
  }

  private static void toStringTreeHelper(Node n, int level, StringBuilder sb) {
    for (int i = 0; i != level; ++i) {
      sb.append("    ");
    }
    sb.append(n);
    sb.append('\n');
    for (Node cursor = n.first; cursor != null; cursor = cursor.next) {
      toStringTreeHelper(cursor, level + 1, sb);
    }
  }
}
