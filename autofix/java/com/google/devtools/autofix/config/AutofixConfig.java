/*
 * Copyright 2026 The Kythe Authors. All rights reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.google.devtools.autofix.config;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.Parameters;
import com.google.devtools.autofix.source.OffsetUnit;

/** Configuration of the autofix layer of a scan. */
@Parameters(separators = "=")
public class AutofixConfig {
  @Parameter(
    names = {"--help", "-h"},
    description = "Help requested",
    help = true
  )
  private boolean help;

  @Parameter(
    names = {"--autofix", "-a"},
    description = "Apply autofix patches to the scanned files. WARNING: data loss can occur."
  )
  private boolean autofix;

  @Parameter(
    names = "--dryrun",
    description =
        "Render fixes and report the fixed lines, but never write them to disk, even with "
            + "--autofix."
  )
  private boolean dryRun;

  @Parameter(
    names = "--verbose",
    description = "Log every rendered fix, not only the ones that failed."
  )
  private boolean verboseLogging;

  @Parameter(
    names = "--offset_unit",
    description = "Unit of the offsets reported by the parsers and the matcher."
  )
  private OffsetUnit offsetUnit = OffsetUnit.CHARACTERS;

  private final JCommander jc;

  public AutofixConfig(String programName) {
    jc = new JCommander(this);
    jc.setProgramName(programName);
  }

  /**
   * Parses the given command-line arguments, setting each known flag. If --help is requested, the
   * binary's usage message will be printed and the program will exit with non-zero code.
   */
  public final void parseCommandLine(String[] args) {
    jc.parse(args);
    if (getHelp()) {
      showHelpAndExit();
    }
  }

  /** Print the binary's usage message, and exit with a non-zero code. */
  public void showHelpAndExit() {
    jc.usage();
    System.exit(1);
  }

  public final boolean getHelp() {
    return help;
  }

  public final boolean getAutofix() {
    return autofix;
  }

  public final boolean getDryRun() {
    return dryRun;
  }

  /** Returns true if fixed files should be written back to disk. */
  public final boolean shouldWriteFixes() {
    return autofix && !dryRun;
  }

  public final boolean getVerboseLogging() {
    return verboseLogging;
  }

  public final OffsetUnit getOffsetUnit() {
    return offsetUnit;
  }

  public AutofixConfig setAutofix(boolean autofix) {
    this.autofix = autofix;
    return this;
  }

  public AutofixConfig setDryRun(boolean dryRun) {
    this.dryRun = dryRun;
    return this;
  }

  public AutofixConfig setVerboseLogging(boolean verboseLogging) {
    this.verboseLogging = verboseLogging;
    return this;
  }

  public AutofixConfig setOffsetUnit(OffsetUnit offsetUnit) {
    this.offsetUnit = offsetUnit;
    return this;
  }
}
