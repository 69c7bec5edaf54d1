// Copyright 2010-2025 Google LLC
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//     http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package com.google.fzninsight.summary;

import com.google.fzninsight.flatzinc.FznModel;
import com.google.fzninsight.flatzinc.FznParser;
import com.google.fzninsight.objective.ObjectiveFormulation;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Prints a natural language summary of a FlatZinc model.
 *
 * <p>Usage: {@code FznSummary <file.fzn> [--max-depth=N] [--max-length=N]
 * [--categorize-constraints]}
 */
public final class FznSummary {
  private static final Logger logger = Logger.getLogger(FznSummary.class.getName());

  private static final String MAX_DEPTH_FLAG = "--max-depth=";
  private static final String MAX_LENGTH_FLAG = "--max-length=";
  private static final String CATEGORIZE_FLAG = "--categorize-constraints";
  private static final String SEARCH_PREFIX = "The model suggests";

  private FznSummary() {}

  /** Returns the Problem, Variables and Constraints sections for {@code model}. */
  public static String summarize(FznModel model, int maxDepth, int maxLength) {
    return summarize(model, maxDepth, maxLength, false);
  }

  /**
   * Returns the Problem, Variables and Constraints sections for {@code model}, with the
   * constraints grouped by category when {@code categorizeConstraints} is set.
   */
  public static String summarize(
      FznModel model, int maxDepth, int maxLength, boolean categorizeConstraints) {
    final String problem = ProblemDescriber.describe(model, maxDepth, maxLength);
    String search = SearchDescriber.describe(model);
    if (search.startsWith(SEARCH_PREFIX)) {
      search = "Where the model suggests" + search.substring(SEARCH_PREFIX.length());
    }
    final String combined =
        (problem.endsWith(".") ? problem.substring(0, problem.length() - 1) : problem)
            + ". "
            + search;
    return "Problem:\n  "
        + combined
        + "\n\nVariables:\n"
        + VariableDescriber.describe(model)
        + "\n\nConstraints:\n"
        + ConstraintDescriber.describe(model, categorizeConstraints);
  }

  /** Runs the command line and returns the exit status. */
  static int run(String[] args, PrintStream out) {
    String file = null;
    int maxDepth = ObjectiveFormulation.DEFAULT_MAX_DEPTH;
    int maxLength = ProblemDescriber.DEFAULT_MAX_LENGTH;
    boolean categorize = false;
    try {
      for (String arg : args) {
        if (arg.startsWith(MAX_DEPTH_FLAG)) {
          maxDepth = Integer.parseInt(arg.substring(MAX_DEPTH_FLAG.length()));
        } else if (arg.startsWith(MAX_LENGTH_FLAG)) {
          maxLength = Integer.parseInt(arg.substring(MAX_LENGTH_FLAG.length()));
        } else if (arg.equals(CATEGORIZE_FLAG)) {
          categorize = true;
        } else if (file == null) {
          file = arg;
        } else {
          logger.severe("Unexpected argument: " + arg);
          return 2;
        }
      }
    } catch (NumberFormatException e) {
      logger.severe("Invalid numeric flag: " + e.getMessage());
      return 2;
    }
    if (file == null || maxDepth < 0 || maxLength < 1) {
      logger.severe(
          "Usage: FznSummary <file.fzn> [--max-depth=N] [--max-length=N]"
              + " [--categorize-constraints]");
      return 2;
    }
    final Path path = Paths.get(file);
    if (!Files.isRegularFile(path)) {
      logger.severe("No such file: " + path);
      return 1;
    }
    final FznModel model;
    try {
      model = FznParser.parseFile(path);
    } catch (IOException e) {
      logger.log(Level.SEVERE, "Cannot read " + path, e);
      return 1;
    }
    logger.info("Parsed " + model);
    out.println(summarize(model, maxDepth, maxLength, categorize));
    return 0;
  }

  public static void main(String[] args) {
    final int status = run(args, System.out);
    if (status != 0) {
      System.exit(status);
    }
  }
}
