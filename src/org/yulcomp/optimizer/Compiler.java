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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableSet;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.yulcomp.ir.Node;
import org.yulcomp.parsing.YulParseException;
import org.yulcomp.parsing.YulParser;

/**
 * Compiler (and the other classes in this package) does the following:
 *
 * <ul>
 *   <li>parses Yul source into a tree
 *   <li>computes the names renaming must not introduce
 *   <li>runs the optimization passes over the tree
 *   <li>prints the result back out
 * </ul>
 *
 * <p>This class is not thread-safe.
 */
public class Compiler extends AbstractCompiler {

  private static final Logger logger = Logger.getLogger(Compiler.class.getName());

  private final CompilerOptions options;

  private boolean codeChanged = false;
  private int changeCount = 0;

  public Compiler() {
    this(new CompilerOptions());
  }

  public Compiler(CompilerOptions options) {
    this.options = checkNotNull(options);
  }

  public CompilerOptions getOptions() {
    return options;
  }

  /** Parses and optimizes {@code source}, and returns the optimized tree. */
  public Node compile(String source) {
    Node root = parse(source);
    optimize(root);
    return root;
  }

  /**
   * Parses {@code source}.
   *
   * @throws YulParseException if the source is not a well-formed Yul block
   */
  public Node parse(String source) {
    logger.finest("Parsing input");
    return YulParser.parse(source);
  }

  /** Runs the enabled passes over {@code root}, in place. */
  public void optimize(Node root) {
    logger.fine(() -> "Optimizing with " + options);
    if (options.shouldRunVarNameCleaner()) {
      runPass("varNameCleaner", new VarNameCleaner(this, computeBlacklist(root)), root);
    }
  }

  private void runPass(String name, CompilerPass pass, Node root) {
    logger.fine("Running pass " + name);
    Stopwatch stopwatch = Stopwatch.createStarted();
    pass.process(root);
    logger.fine(() -> "Finished pass " + name + " in " + stopwatch);
  }

  /**
   * The names renaming must not introduce: the reserved names from the options plus, if enabled,
   * the names declared by function definitions in {@code root}.
   */
  @VisibleForTesting
  ImmutableSet<String> computeBlacklist(Node root) {
    ImmutableSet.Builder<String> blacklist = ImmutableSet.builder();
    blacklist.addAll(options.getReservedNames());
    if (options.shouldReserveFunctionNames() || options.shouldReserveFunctionSignatureNames()) {
      NameCollector collector = new NameCollector(this);
      collector.process(root);
      if (options.shouldReserveFunctionNames()) {
        blacklist.addAll(collector.getFunctionNames());
      }
      if (options.shouldReserveFunctionSignatureNames()) {
        blacklist.addAll(collector.getSignatureNames());
      }
    }
    return blacklist.build();
  }

  public String toSource(Node root) {
    return new CodePrinter.Builder(root).setPrettyPrint(options.isPrettyPrint()).build();
  }

  @Override
  public Dialect getDialect() {
    return options.getDialect();
  }

  @Override
  public void reportChangeToEnclosingScope(Node n) {
    codeChanged = true;
    changeCount++;
  }

  @Override
  public boolean hasCodeChanged() {
    return codeChanged;
  }

  @Override
  public void resetCodeChange() {
    codeChanged = false;
  }

  /** The number of changes reported over the lifetime of this compiler. */
  public int getChangeCount() {
    return changeCount;
  }

  @Override
  void throwInternalError(String message, Throwable cause) {
    throw new RuntimeException(
        "INTERNAL COMPILER ERROR.\nPlease report this problem.\n\n" + message, cause);
  }

  public static void setLoggingLevel(Level level) {
    logger.setLevel(level);
    Logger.getLogger(Compiler.class.getPackage().getName()).setLevel(level);
  }
}
