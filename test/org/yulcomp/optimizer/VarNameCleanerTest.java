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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableSet;
import java.util.Set;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.yulcomp.ir.Node;
import org.yulcomp.parsing.YulParser;

@RunWith(JUnit4.class)
public final class VarNameCleanerTest extends CompilerTestCase {

  private Dialect dialect;
  private Set<String> blacklist;
  private int numRepetitions;

  @Override
  @Before
  public void setUp() throws Exception {
    super.setUp();
    dialect = Dialects.none();
    blacklist = ImmutableSet.of();
    numRepetitions = 1;
  }

  @Override
  protected CompilerOptions getOptions() {
    CompilerOptions options = new CompilerOptions();
    options.setDialect(dialect);
    return options;
  }

  @Override
  protected CompilerPass getProcessor(Compiler compiler) {
    return new VarNameCleaner(compiler, blacklist);
  }

  @Override
  protected int getNumRepetitions() {
    // Names given up by a rename stay reserved for the rest of a run, so a second run over
    // the output can pick lower numbers. Idempotence is checked by testIdempotent.
    return numRepetitions;
  }

  private void testIdempotent(String js, String expected) {
    numRepetitions = 2;
    test(js, expected);
    numRepetitions = 1;
  }

  @Test
  public void testNestedSuffixes() {
    testIdempotent(
        "{ let a := 1 let a_1 := 2 let a_1_2 := 3 }",
        "{ let a := 1 let a_1 := 2 let a_2 := 3 }");
  }

  @Test
  public void testNestedSuffixesWithExistingNumberedName() {
    testIdempotent(
        "{ let a := 1 let a_1 := 2 let a_1_2 := 3 let a_2 := 4 }",
        "{ let a := 1 let a_1 := 2 let a_2 := 3 let a_3 := 4 }");
  }

  @Test
  public void testLargeSuffixesAreRenumbered() {
    testIdempotent("{ let a_15 := 1 let a_17 := 2 }", "{ let a := 1 let a_1 := 2 }");
  }

  @Test
  public void testBuiltinIsNotIntroduced() {
    dialect = Dialects.withBuiltins("test", ImmutableSet.of("abi_decode"));
    testIdempotent("{ let abi_decode_256 := 1 }", "{ let abi_decode_1 := 1 }");
  }

  @Test
  public void testEvmBuiltinKeepsNumberedName() {
    dialect = Dialects.evm();
    testSame("{ let mload_1 := 0 let x := mload(mload_1) }");
    test("{ let add_4 := 1 let add_1 := 2 }", "{ let add_1 := 1 let add_2 := 2 }");
  }

  @Test
  public void testBuiltinIsOnlyCheckedForTheStrippedName() {
    dialect = Dialects.withBuiltins("test", ImmutableSet.of("a", "a_1"));
    // a_1 is a builtin too, but numbered names are only checked against the blacklist.
    test("{ let a_9 := 1 }", "{ let a_1 := 1 }");
  }

  @Test
  public void testUndeclaredReferenceIsUnchanged() {
    testSame("{ let x := add(y_1, 2) }");
    test("{ let y_2 := y_1 }", "{ let y := y_1 }");
  }

  @Test
  public void testBlacklistedStrippedNameKeepsOriginal() {
    blacklist = ImmutableSet.of("a");
    testSame("{ let a_1 := 1 let b := a_1 }");
  }

  @Test
  public void testBlacklistedFallbackIsSkipped() {
    blacklist = ImmutableSet.of("a_1");
    test("{ let a := 1 let a_5 := 2 }", "{ let a := 1 let a_2 := 2 }");
  }

  @Test
  public void testCleanNameIsUnchanged() {
    testIdempotent("{ let x := 1 x := add(x, 1) }", "{ let x := 1 x := add(x, 1) }");
  }

  @Test
  public void testReferencesFollowDeclarations() {
    test(
        "{ let a_1 := 1 let b_2 := add(a_1, 2) a_1 := b_2 }",
        "{ let a := 1 let b := add(a, 2) a := b }");
  }

  @Test
  public void testMultipleBindings() {
    test("{ let a_1, b_1 := f() a_1, b_1 := g(b_1, a_1) }", "{ let a, b := f() a, b := g(b, a) }");
  }

  @Test
  public void testMultipleBindingsOfTheSameBase() {
    // a_1 is the original name of the first binding, so it is taken.
    test("{ let a_1, a_2 := f() }", "{ let a, a_2 := f() }");
  }

  @Test
  public void testOutcomeDependsOnDeclarationOrder() {
    test("{ let a_2 := 1 let a_1 := 2 }", "{ let a := 1 let a_1 := 2 }");
    test("{ let a_1 := 1 let a_2 := 2 }", "{ let a := 1 let a_2 := 2 }");
  }

  @Test
  public void testOuterCleanNameReferencedInInnerScope() {
    testSame("{ let a := 1 { let a_1 := a } }");
  }

  @Test
  public void testInternalDigitsAreNotSuffixes() {
    test("{ let x1_y_2 := 1 let v2 := 0 }", "{ let x1_y := 1 let v2 := 0 }");
    testSame("{ let a_1b := 1 let c__d := 2 }");
  }

  @Test
  public void testNameThatIsAllSuffix() {
    testSame("{ let _1 := 1 let __2_3 := _1 }");
  }

  @Test
  public void testRepeatedUnderscores() {
    test("{ let a__1 := 1 let b_2__3 := a__1 }", "{ let a := 1 let b := a }");
  }

  @Test
  public void testTypedNames() {
    test(
        "{ let x_1:u256 := 1:u256 let y_3:bool := true:bool }",
        "{ let x:u256 := 1:u256 let y:bool := true:bool }");
  }

  @Test
  public void testControlFlow() {
    test(
        lines(
            "{",
            "  let i_1 := 0",
            "  for { let j_3 := 0 } lt(j_3, 10) { j_3 := add(j_3, 1) } {",
            "    if eq(j_3, i_1) { break }",
            "    continue",
            "  }",
            "  switch i_1",
            "  case 0 { i_1 := 1 }",
            "  default { i_1 := 2 }",
            "}"),
        lines(
            "{",
            "  let i := 0",
            "  for { let j := 0 } lt(j, 10) { j := add(j, 1) } {",
            "    if eq(j, i) { break }",
            "    continue",
            "  }",
            "  switch i",
            "  case 0 { i := 1 }",
            "  default { i := 2 }",
            "}"));
  }

  @Test
  public void testFunctionSignaturesAreNotRenamed() {
    testSame("{ function g(a_1) -> b_1 { b_1 := a_1 } }");
    testSame("{ function f_1() { } f_1() }");
  }

  @Test
  public void testSignatureNamesNeedTheBlacklist() {
    // Parameters are not registered, so only the blacklist keeps x_1 from becoming x.
    test(
        "{ function g(x) -> y { let x_1 := x y := x_1 } }",
        "{ function g(x) -> y { let x := x y := x } }");

    Compiler compiler = new Compiler(getOptions());
    NameCollector collector = new NameCollector(compiler);
    collector.process(YulParser.parse("{ function g(x) -> y { } }"));
    blacklist = collector.getSignatureNames();
    testSame("{ function g(x) -> y { let x_1 := x y := x_1 } }");
  }

  @Test
  public void testFunctionBodies() {
    test(
        lines(
            "{",
            "  function f(x) -> r {",
            "    let t_1 := x",
            "    r := t_1",
            "  }",
            "  let t_2 := f(1)",
            "}"),
        lines(
            "{",
            "  function f(x) -> r {",
            "    let t := x",
            "    r := t",
            "  }",
            "  let t_2 := f(1)",
            "}"));
  }

  @Test
  public void testDeclarationWithoutValue() {
    test("{ let a_1 let b_1 := a_1 }", "{ let a let b := a }");
  }

  @Test
  public void testExhaustedSuffixesAbortThePass() {
    Compiler compiler = new Compiler(getOptions());
    Node root = YulParser.parse("{ let a := 1 let a_1 := 2 let a_2 := 3 let a_7 := 4 }");
    VarNameCleaner pass = new VarNameCleaner(compiler, ImmutableSet.of(), 3);

    RuntimeException e = assertThrows(RuntimeException.class, () -> pass.process(root));

    assertThat(e).hasMessageThat().startsWith("INTERNAL COMPILER ERROR.");
    assertThat(e).hasMessageThat().contains("available suffix for a");
    assertThat(e).hasCauseThat().isInstanceOf(IllegalStateException.class);
  }

  @Test
  public void testEachRunStartsWithAnEmptyRegistry() {
    Compiler compiler = new Compiler(getOptions());
    VarNameCleaner pass = new VarNameCleaner(compiler);
    Node first = YulParser.parse("{ let a_1 := 1 }");
    Node second = YulParser.parse("{ let a_2 := 1 }");

    pass.process(first);
    pass.process(second);

    assertThat(toSource(first)).isEqualTo("{ let a := 1 }");
    assertThat(toSource(second)).isEqualTo("{ let a := 1 }");
  }
}
