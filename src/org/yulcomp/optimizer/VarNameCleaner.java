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

import com.google.common.collect.ImmutableSortedSet;
import java.util.Collection;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;
import org.yulcomp.ir.Node;

/**
 * VarNameCleaner gives variables back the readable names that disambiguation took from them,
 * when that is possible without a clash. For example:
 *
 * <pre>
 * input:  a, a_1, a_1_2        output: a, a_1, a_2
 * input:  a, a_1, a_1_2, a_2   output: a, a_1, a_2, a_3
 * input:  a_15, a_17           output: a, a_1
 * </pre>
 *
 * <p>Declarations are renamed in "shouldTraverse", on the way down, so the new name is known
 * before anything below or after the declaration refers to it. References are renamed in
 * "visit". Names are handled in program order and the outcome depends on that order: a
 * declaration whose stripped name is already taken gets the first free numbered name.
 *
 * <p>A name is never changed to a builtin of the dialect or to a blacklisted name. Function
 * names, function parameters and return variables are not renamed, and they are not registered
 * either: without a blacklist, {@code let x_1} inside {@code function g(x)} becomes {@code x}
 * and shadows the parameter. Callers that construct this pass directly must therefore put the
 * function, parameter and return variable names of the tree on the blacklist. {@link
 * Compiler#computeBlacklist} collects them with {@link NameCollector} according to {@link
 * CompilerOptions}.
 */
public final class VarNameCleaner implements CompilerPass {

  private static final Logger logger = Logger.getLogger(VarNameCleaner.class.getName());

  private final AbstractCompiler compiler;
  private final ImmutableSortedSet<String> blacklist;
  private final long maxSuffix;

  /**
   * Creates the pass with an empty blacklist. Only safe for trees that define no functions, see
   * the class comment.
   */
  public VarNameCleaner(AbstractCompiler compiler) {
    this(compiler, ImmutableSortedSet.of());
  }

  /**
   * @param blacklist names that must not be introduced by renaming, for example because they are
   *     used for another purpose in the compilation unit
   */
  public VarNameCleaner(AbstractCompiler compiler, Collection<String> blacklist) {
    this(compiler, blacklist, Long.MAX_VALUE);
  }

  VarNameCleaner(AbstractCompiler compiler, Collection<String> blacklist, long maxSuffix) {
    this.compiler = checkNotNull(compiler);
    // Sorted once, for logarithmic lookups.
    this.blacklist = ImmutableSortedSet.copyOf(blacklist);
    this.maxSuffix = maxSuffix;
  }

  @Override
  public void process(Node root) {
    NameRegistry registry = new NameRegistry();
    CleanNames callback =
        new CleanNames(
            new CleanNameResolver(compiler.getDialect(), blacklist, registry, maxSuffix),
            registry);
    NodeTraversal.traverse(compiler, root, callback);
    logger.fine(
        () -> "Cleaned " + callback.renamed + " variable names, " + registry.size()
            + " names registered");
  }

  /** Renames declarations on the way down and references on the way up. */
  private class CleanNames implements NodeTraversal.Callback {
    private final CleanNameResolver resolver;
    private final NameRegistry registry;
    private int renamed = 0;

    CleanNames(CleanNameResolver resolver, NameRegistry registry) {
      this.resolver = resolver;
      this.registry = registry;
    }

    @Override
    public boolean shouldTraverse(NodeTraversal t, Node n, @Nullable Node parent) {
      if (n.isVarDecl()) {
        visitDeclaration(n);
      }
      return true;
    }

    @Override
    public void visit(NodeTraversal t, Node n, @Nullable Node parent) {
      if (n.isName()) {
        visitReference(n);
      }
    }

    private void visitDeclaration(Node decl) {
      for (Node binding = decl.getFirstChild();
          binding != null && binding.isTypedName();
          binding = binding.getNext()) {
        String oldName = binding.getString();
        String newName = resolver.makeCleanName(oldName);
        if (!newName.equals(oldName)) {
          binding.setString(newName);
          compiler.reportChangeToEnclosingScope(binding);
          renamed++;
          if (logger.isLoggable(Level.FINEST)) {
            logger.finest("Renamed " + oldName + " to " + newName + " at " + binding.getLocation());
          }
        }
      }
    }

    private void visitReference(Node name) {
      Optional<String> newName = registry.lookup(name.getString());
      if (newName.isPresent()) {
        name.setString(newName.get());
        compiler.reportChangeToEnclosingScope(name);
      }
    }
  }
}
