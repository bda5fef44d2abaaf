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

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableSet;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

/** Compiler options */
public class CompilerOptions {

  private Dialect dialect = Dialects.evm();

  /** Names that renaming must never introduce. */
  private final Set<String> reservedNames = new LinkedHashSet<>();

  /** Reserve the names of all functions defined in the input. */
  private boolean reserveFunctionNames = true;

  /** Reserve the names of all function parameters and return variables in the input. */
  private boolean reserveFunctionSignatureNames = true;

  private boolean runVarNameCleaner = true;

  private boolean prettyPrint = false;

  public Dialect getDialect() {
    return dialect;
  }

  public void setDialect(Dialect dialect) {
    this.dialect = checkNotNull(dialect);
  }

  public ImmutableSet<String> getReservedNames() {
    return ImmutableSet.copyOf(reservedNames);
  }

  public void setReservedNames(Collection<String> names) {
    reservedNames.clear();
    reservedNames.addAll(names);
  }

  public void addReservedName(String name) {
    reservedNames.add(checkNotNull(name));
  }

  public boolean shouldReserveFunctionNames() {
    return reserveFunctionNames;
  }

  public void setReserveFunctionNames(boolean reserveFunctionNames) {
    this.reserveFunctionNames = reserveFunctionNames;
  }

  public boolean shouldReserveFunctionSignatureNames() {
    return reserveFunctionSignatureNames;
  }

  public void setReserveFunctionSignatureNames(boolean reserveFunctionSignatureNames) {
    this.reserveFunctionSignatureNames = reserveFunctionSignatureNames;
  }

  public boolean shouldRunVarNameCleaner() {
    return runVarNameCleaner;
  }

  public void setRunVarNameCleaner(boolean runVarNameCleaner) {
    this.runVarNameCleaner = runVarNameCleaner;
  }

  public boolean isPrettyPrint() {
    return prettyPrint;
  }

  public void setPrettyPrint(boolean prettyPrint) {
    this.prettyPrint = prettyPrint;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("dialect", dialect)
        .add("reservedNames", reservedNames)
        .add("reserveFunctionNames", reserveFunctionNames)
        .add("reserveFunctionSignatureNames", reserveFunctionSignatureNames)
        .add("runVarNameCleaner", runVarNameCleaner)
        .add("prettyPrint", prettyPrint)
        .toString();
  }
}
