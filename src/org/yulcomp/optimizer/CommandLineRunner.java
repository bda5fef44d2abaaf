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

import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableSet;
import com.google.common.io.CharStreams;
import com.google.common.io.Files;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.logging.Level;
import org.kohsuke.args4j.Argument;
import org.kohsuke.args4j.CmdLineException;
import org.kohsuke.args4j.CmdLineParser;
import org.kohsuke.args4j.Option;
import org.kohsuke.args4j.OptionDef;
import org.kohsuke.args4j.spi.OptionHandler;
import org.kohsuke.args4j.spi.Parameters;
import org.kohsuke.args4j.spi.Setter;
import org.yulcomp.ir.Node;
import org.yulcomp.parsing.YulParseException;

/**
 * CommandLineRunner translates flags into Compiler options, reads the Yul input files (or stdin
 * when none are given), and prints the optimized code to stdout.
 *
 * <pre>
 *   public static void main(String[] args) {
 *     CommandLineRunner runner = new CommandLineRunner(args);
 *     if (runner.shouldRunCompiler()) {
 *       runner.run();
 *     }
 *     if (runner.hasErrors()) {
 *       System.exit(-1);
 *     }
 *   }
 * </pre>
 *
 * This class is totally not thread-safe.
 */
public class CommandLineRunner {

  /** Flags accepted on the command line. */
  static class Flags {
    @Option(
        name = "--help",
        handler = BooleanOptionHandler.class,
        usage = "Displays this message on stdout and exit")
    private boolean displayHelp = false;

    @Option(
        name = "--dialect",
        usage = "The Yul dialect of the input, which decides the builtin names. Options: evm, none")
    private String dialect = "evm";

    @Option(
        name = "--reserved",
        usage = "A name renaming must never introduce. You may specify multiple")
    private List<String> reserved = new ArrayList<>();

    @Option(
        name = "--reserve_function_names",
        handler = BooleanOptionHandler.class,
        usage = "Never rename a variable to the name of a function defined in the input")
    private boolean reserveFunctionNames = true;

    @Option(
        name = "--reserve_function_signature_names",
        handler = BooleanOptionHandler.class,
        usage =
            "Never rename a variable to the name of a function parameter or return variable "
                + "in the input")
    private boolean reserveFunctionSignatureNames = true;

    @Option(
        name = "--clean_var_names",
        handler = BooleanOptionHandler.class,
        usage = "Strip disambiguation suffixes from variable names where possible")
    private boolean cleanVarNames = true;

    @Option(
        name = "--pretty_print",
        handler = BooleanOptionHandler.class,
        usage = "Print one statement per line")
    private boolean prettyPrint = false;

    @Option(
        name = "--logging_level",
        usage =
            "The logging level (standard java.util.logging.Level values) for Compiler progress")
    private String loggingLevel = Level.WARNING.getName();

    @Argument private List<String> arguments = new ArrayList<>();

    private final CmdLineParser parser;

    Flags() {
      parser = new CmdLineParser(this);
    }

    /** Parse the given args list. */
    private void parse(String[] args) throws CmdLineException {
      parser.parseArgument(args);
      try {
        Dialects.forName(dialect);
      } catch (IllegalArgumentException e) {
        throw new CmdLineException(parser, "Bad value for --dialect: " + dialect, e);
      }
      try {
        Level.parse(loggingLevel);
      } catch (IllegalArgumentException e) {
        throw new CmdLineException(parser, "Bad value for --logging_level: " + loggingLevel, e);
      }
    }

    private void printUsage(PrintStream ps) {
      ps.println("Usage: yulcomp [options] [file ...]");
      parser.printUsage(ps);
      ps.flush();
    }
  }

  /**
   * Set of options that can be used with the --flag=value form as well as the --flag value form.
   * A missing value means true.
   */
  public static class BooleanOptionHandler extends OptionHandler<Boolean> {
    private static final Set<String> TRUES = ImmutableSet.of("true", "on", "yes", "1");
    private static final Set<String> FALSES = ImmutableSet.of("false", "off", "no", "0");

    public BooleanOptionHandler(
        CmdLineParser parser, OptionDef option, Setter<? super Boolean> setter) {
      super(parser, option, setter);
    }

    @Override
    public int parseArguments(Parameters params) throws CmdLineException {
      String param = null;
      try {
        param = params.getParameter(0);
      } catch (CmdLineException e) {
        param = null; // to stop linter complaints
      }

      if (param == null) {
        setter.addValue(true);
        return 0;
      } else {
        String lowerParam = param.toLowerCase();
        if (TRUES.contains(lowerParam)) {
          setter.addValue(true);
        } else if (FALSES.contains(lowerParam)) {
          setter.addValue(false);
        } else {
          setter.addValue(true);
          return 0;
        }
        return 1;
      }
    }

    @Override
    public String getDefaultMetaVariable() {
      return null;
    }
  }

  private final Flags flags = new Flags();
  private final InputStream in;
  private final PrintStream out;
  private final PrintStream err;

  private boolean isConfigValid = false;
  private int errorCount = 0;

  public CommandLineRunner(String[] args) {
    this(args, System.in, System.out, System.err);
  }

  @VisibleForTesting
  CommandLineRunner(String[] args, InputStream in, PrintStream out, PrintStream err) {
    this.in = in;
    this.out = out;
    this.err = err;
    try {
      flags.parse(args);
      isConfigValid = true;
    } catch (CmdLineException e) {
      err.println(e.getMessage());
      flags.printUsage(err);
      errorCount++;
    }
  }

  /** Whether the flags were valid and help was not requested. */
  public boolean shouldRunCompiler() {
    if (isConfigValid && flags.displayHelp) {
      flags.printUsage(out);
      return false;
    }
    return isConfigValid;
  }

  public boolean hasErrors() {
    return errorCount > 0;
  }

  @VisibleForTesting
  CompilerOptions createOptions() {
    CompilerOptions options = new CompilerOptions();
    options.setDialect(Dialects.forName(flags.dialect));
    options.setReservedNames(flags.reserved);
    options.setReserveFunctionNames(flags.reserveFunctionNames);
    options.setReserveFunctionSignatureNames(flags.reserveFunctionSignatureNames);
    options.setRunVarNameCleaner(flags.cleanVarNames);
    options.setPrettyPrint(flags.prettyPrint);
    return options;
  }

  /** Compiles every input and prints the results. Errors are reported on stderr. */
  public void run() {
    Compiler.setLoggingLevel(Level.parse(flags.loggingLevel));
    CompilerOptions options = createOptions();
    if (flags.arguments.isEmpty()) {
      try {
        compileAndPrint(options, "stdin", CharStreams.toString(new InputStreamReader(in, UTF_8)));
      } catch (IOException e) {
        reportReadError("stdin", e);
      }
    } else {
      // An unreadable file is reported and the remaining files are still compiled.
      for (String path : flags.arguments) {
        String source;
        try {
          source = Files.asCharSource(new File(path), UTF_8).read();
        } catch (IOException e) {
          reportReadError(path, e);
          continue;
        }
        compileAndPrint(options, path, source);
      }
    }
    out.flush();
  }

  private void reportReadError(String inputName, IOException e) {
    err.println("ERROR - Cannot read " + inputName + ": " + e.getMessage());
    errorCount++;
  }

  private void compileAndPrint(CompilerOptions options, String inputName, String source) {
    Compiler compiler = new Compiler(options);
    try {
      Node root = compiler.compile(source);
      out.println(compiler.toSource(root));
    } catch (YulParseException e) {
      err.println(inputName + ":" + e.getMessage());
      errorCount++;
    }
  }

  public static void main(String[] args) {
    CommandLineRunner runner = new CommandLineRunner(args);
    if (runner.shouldRunCompiler()) {
      runner.run();
    }
    if (runner.hasErrors()) {
      System.exit(-1);
    }
  }
}
