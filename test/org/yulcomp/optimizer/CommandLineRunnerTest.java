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
import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.io.Files;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class CommandLineRunnerTest {

  @Rule public final TemporaryFolder tempFolder = new TemporaryFolder();

  private ByteArrayOutputStream outReader;
  private ByteArrayOutputStream errReader;
  private CommandLineRunner lastRunner;

  @Before
  public void setUp() {
    outReader = new ByteArrayOutputStream();
    errReader = new ByteArrayOutputStream();
    lastRunner = null;
  }

  private CommandLineRunner createRunner(String stdin, String... args) {
    lastRunner =
        new CommandLineRunner(
            args,
            new ByteArrayInputStream(stdin.getBytes(UTF_8)),
            new PrintStream(outReader, true),
            new PrintStream(errReader, true));
    return lastRunner;
  }

  private String run(String stdin, String... args) {
    CommandLineRunner runner = createRunner(stdin, args);
    if (runner.shouldRunCompiler()) {
      runner.run();
    }
    return outReader.toString().trim();
  }

  private String err() {
    return errReader.toString();
  }

  @Test
  public void testCleansStdin() {
    assertThat(run("{ let a_1 := 1 let b_2_3 := a_1 }")).isEqualTo("{ let a := 1 let b := a }");
    assertThat(lastRunner.hasErrors()).isFalse();
  }

  @Test
  public void testHelp() {
    CommandLineRunner runner = createRunner("", "--help");

    assertThat(runner.shouldRunCompiler()).isFalse();
    assertThat(runner.hasErrors()).isFalse();
    assertThat(outReader.toString()).contains("--dialect");
    assertThat(outReader.toString()).contains("--reserved");
  }

  @Test
  public void testBadDialect() {
    CommandLineRunner runner = createRunner("", "--dialect", "ewasm");

    assertThat(runner.shouldRunCompiler()).isFalse();
    assertThat(runner.hasErrors()).isTrue();
    assertThat(err()).contains("Bad value for --dialect: ewasm");
  }

  @Test
  public void testBadLoggingLevel() {
    CommandLineRunner runner = createRunner("", "--logging_level", "LOUD");

    assertThat(runner.shouldRunCompiler()).isFalse();
    assertThat(err()).contains("Bad value for --logging_level: LOUD");
  }

  @Test
  public void testUnknownFlag() {
    CommandLineRunner runner = createRunner("", "--no_such_flag");

    assertThat(runner.shouldRunCompiler()).isFalse();
    assertThat(runner.hasErrors()).isTrue();
  }

  @Test
  public void testDialectNone() {
    assertThat(run("{ let mload_1 := 0 }", "--dialect", "none")).isEqualTo("{ let mload := 0 }");
  }

  @Test
  public void testDialectEvm() {
    assertThat(run("{ let mload_1 := 0 }")).isEqualTo("{ let mload_1 := 0 }");
  }

  @Test
  public void testReserved() {
    assertThat(run("{ let a_1 := 1 let b_1 := 2 }", "--reserved", "a", "--reserved", "b"))
        .isEqualTo("{ let a_1 := 1 let b_1 := 2 }");
  }

  @Test
  public void testCleaningDisabled() {
    assertThat(run("{ let a_1 := 1 }", "--clean_var_names", "false"))
        .isEqualTo("{ let a_1 := 1 }");
  }

  @Test
  public void testFunctionNameReservationDisabled() {
    assertThat(
            run(
                "{ function f() { } let f_1 := 1 }",
                "--reserve_function_names",
                "false"))
        .isEqualTo("{ function f() { } let f := 1 }");
  }

  @Test
  public void testPrettyPrint() {
    assertThat(run("{ let a_1 := 1 }", "--pretty_print"))
        .isEqualTo(CompilerTestCase.lines("{", "  let a := 1", "}"));
  }

  @Test
  public void testCreateOptions() {
    CommandLineRunner runner =
        createRunner(
            "",
            "--dialect",
            "none",
            "--reserved",
            "x",
            "--reserve_function_signature_names",
            "no",
            "--pretty_print");

    CompilerOptions options = runner.createOptions();

    assertThat(options.getDialect().getName()).isEqualTo("none");
    assertThat(options.getReservedNames()).containsExactly("x");
    assertThat(options.shouldReserveFunctionNames()).isTrue();
    assertThat(options.shouldReserveFunctionSignatureNames()).isFalse();
    assertThat(options.shouldRunVarNameCleaner()).isTrue();
    assertThat(options.isPrettyPrint()).isTrue();
  }

  @Test
  public void testParseErrorIsReported() {
    String out = run("{ let := 1 }");

    assertThat(out).isEmpty();
    assertThat(lastRunner.hasErrors()).isTrue();
    assertThat(err()).contains("stdin:1:7: Expected identifier but found ':='");
  }

  @Test
  public void testReadsFiles() throws IOException {
    File first = tempFolder.newFile("first.yul");
    Files.asCharSink(first, UTF_8).write("{ let a_1 := 1 }");
    File second = tempFolder.newFile("second.yul");
    Files.asCharSink(second, UTF_8).write("{ let b_2 := 2 }");

    String out = run("", first.getPath(), second.getPath());

    assertThat(out).contains("{ let a := 1 }");
    assertThat(out).contains("{ let b := 2 }");
    assertThat(lastRunner.hasErrors()).isFalse();
  }

  @Test
  public void testParseErrorNamesTheFile() throws IOException {
    File bad = tempFolder.newFile("bad.yul");
    Files.asCharSink(bad, UTF_8).write("{ let a := }");

    run("", bad.getPath());

    assertThat(lastRunner.hasErrors()).isTrue();
    assertThat(err()).contains(bad.getPath() + ":1:12: Expected expression but found '}'");
  }

  @Test
  public void testMissingFile() {
    run("", new File(tempFolder.getRoot(), "missing.yul").getPath());

    assertThat(lastRunner.hasErrors()).isTrue();
    assertThat(err()).contains("ERROR - Cannot read ");
  }

  @Test
  public void testMissingFileDoesNotStopLaterFiles() throws IOException {
    String missing = new File(tempFolder.getRoot(), "missing.yul").getPath();
    File good = tempFolder.newFile("good.yul");
    Files.asCharSink(good, UTF_8).write("{ let c_3 := 3 }");

    String out = run("", missing, good.getPath());

    assertThat(lastRunner.hasErrors()).isTrue();
    assertThat(err()).contains("ERROR - Cannot read " + missing);
    assertThat(out).isEqualTo("{ let c := 3 }");
  }

  @Test
  public void testParseErrorDoesNotStopLaterFiles() throws IOException {
    File bad = tempFolder.newFile("broken.yul");
    Files.asCharSink(bad, UTF_8).write("{ let }");
    File good = tempFolder.newFile("fine.yul");
    Files.asCharSink(good, UTF_8).write("{ let d_1 := 1 }");

    String out = run("", bad.getPath(), good.getPath());

    assertThat(lastRunner.hasErrors()).isTrue();
    assertThat(out).isEqualTo("{ let d := 1 }");
  }
}
