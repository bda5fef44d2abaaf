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
package org.yulcomp.optimizer;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.Strings;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import org.yulcomp.ir.Node;

/**
 * CodePrinter prints out Yul code.
 *
 * <p>The compact form puts everything on one line with single spaces, e.g. {@code { let a := 1
 * f(a) }}; it is what the tests compare. The pretty form puts each statement on its own line.
 */
public final class CodePrinter {

  private static final int INDENT = 2;

  private final boolean prettyPrint;
  private final StringBuilder sb = new StringBuilder();
  private int indent = 0;

  private CodePrinter(boolean prettyPrint) {
    this.prettyPrint = prettyPrint;
  }

  /** Builder for CodePrinter. */
  public static final class Builder {
    private final Node root;
    private boolean prettyPrint = false;

    /**
     * Sets the root node from which to generate the source code.
     *
     * @param node The root node.
     */
    public Builder(Node node) {
      root = checkNotNull(node);
    }

    /** Sets whether pretty printing should be used. */
    @CanIgnoreReturnValue
    public Builder setPrettyPrint(boolean prettyPrint) {
      this.prettyPrint = prettyPrint;
      return this;
    }

    /** Generates the source code and returns it. */
    public String build() {
      CodePrinter printer = new CodePrinter(prettyPrint);
      printer.add(root);
      return printer.sb.toString();
    }
  }

  private void add(Node n) {
    switch (n.getToken()) {
      case BLOCK:
        addBlock(n);
        break;
      case FUNCTION:
        sb.append("function ").append(n.getString()).append('(');
        addList(n.getFirstChild());
        sb.append(')');
        Node results = n.getSecondChild();
        if (results.hasChildren()) {
          sb.append(" -> ");
          addList(results);
        }
        sb.append(' ');
        addBlock(n.getLastChild());
        break;
      case VAR_DECL:
        {
          sb.append("let ");
          Node child = n.getFirstChild();
          boolean first = true;
          for (; child != null && child.isTypedName(); child = child.getNext()) {
            if (!first) {
              sb.append(", ");
            }
            first = false;
            add(child);
          }
          if (child != null) {
            sb.append(" := ");
            add(child);
          }
          break;
        }
      case ASSIGN:
        for (Node target = n.getFirstChild(); target != n.getLastChild(); target = target.getNext()) {
          if (target != n.getFirstChild()) {
            sb.append(", ");
          }
          add(target);
        }
        sb.append(" := ");
        add(n.getLastChild());
        break;
      case EXPR_RESULT:
        add(n.getOnlyChild());
        break;
      case IF:
        sb.append("if ");
        add(n.getFirstChild());
        sb.append(' ');
        addBlock(n.getLastChild());
        break;
      case SWITCH:
        sb.append("switch ");
        add(n.getFirstChild());
        for (Node c = n.getSecondChild(); c != null; c = c.getNext()) {
          separator();
          add(c);
        }
        break;
      case CASE:
        sb.append("case ");
        add(n.getFirstChild());
        sb.append(' ');
        addBlock(n.getLastChild());
        break;
      case DEFAULT:
        sb.append("default ");
        addBlock(n.getOnlyChild());
        break;
      case FOR:
        sb.append("for ");
        addBlock(n.getFirstChild());
        sb.append(' ');
        add(n.getSecondChild());
        sb.append(' ');
        addBlock(n.getChildAtIndex(2));
        sb.append(' ');
        addBlock(n.getLastChild());
        break;
      case BREAK:
        sb.append("break");
        break;
      case CONTINUE:
        sb.append("continue");
        break;
      case LEAVE:
        sb.append("leave");
        break;
      case TYPED_NAME:
      case LITERAL:
        sb.append(n.getString());
        if (n.getTypeName() != null) {
          sb.append(':').append(n.getTypeName());
        }
        break;
      case NAME:
        sb.append(n.getString());
        break;
      case CALL:
        sb.append(n.getString()).append('(');
        addList(n);
        sb.append(')');
        break;
      case PARAM_LIST:
      case RESULT_LIST:
        addList(n);
        break;
    }
  }

  private void addList(Node list) {
    for (Node c = list.getFirstChild(); c != null; c = c.getNext()) {
      if (c != list.getFirstChild()) {
        sb.append(", ");
      }
      add(c);
    }
  }

  private void addBlock(Node block) {
    if (!block.hasChildren()) {
      sb.append("{ }");
      return;
    }
    sb.append('{');
    indent += INDENT;
    for (Node stmt : block.children()) {
      separator();
      add(stmt);
    }
    indent -= INDENT;
    separator();
    sb.append('}');
  }

  private void separator() {
    if (prettyPrint) {
      sb.append('\n').append(Strings.repeat(" ", indent));
    } else {
      sb.append(' ');
    }
  }
}
