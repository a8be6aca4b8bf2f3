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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.beust.jcommander.ParameterException;
import com.google.devtools.autofix.source.OffsetUnit;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class AutofixConfigTest {
  @Test
  public void testDefaults() {
    AutofixConfig config = new AutofixConfig("autofix");
    config.parseCommandLine(new String[0]);

    assertThat(config.getHelp()).isFalse();
    assertThat(config.getAutofix()).isFalse();
    assertThat(config.getDryRun()).isFalse();
    assertThat(config.getVerboseLogging()).isFalse();
    assertThat(config.getOffsetUnit()).isEqualTo(OffsetUnit.CHARACTERS);
    assertThat(config.shouldWriteFixes()).isFalse();
  }

  @Test
  public void testAutofix() {
    AutofixConfig config = new AutofixConfig("autofix");
    config.parseCommandLine(new String[] {"-a", "--verbose"});

    assertThat(config.getAutofix()).isTrue();
    assertThat(config.getVerboseLogging()).isTrue();
    assertThat(config.shouldWriteFixes()).isTrue();
  }

  @Test
  public void testDryRunWinsOverAutofix() {
    AutofixConfig config = new AutofixConfig("autofix");
    config.parseCommandLine(new String[] {"--autofix", "--dryrun"});

    assertThat(config.getAutofix()).isTrue();
    assertThat(config.getDryRun()).isTrue();
    assertThat(config.shouldWriteFixes()).isFalse();
  }

  @Test
  public void testOffsetUnit() {
    AutofixConfig config = new AutofixConfig("autofix");
    config.parseCommandLine(new String[] {"--offset_unit=UTF8_BYTES"});

    assertThat(config.getOffsetUnit()).isEqualTo(OffsetUnit.UTF8_BYTES);
  }

  @Test
  public void testUnknownFlag() {
    AutofixConfig config = new AutofixConfig("autofix");
    assertThrows(
        ParameterException.class, () -> config.parseCommandLine(new String[] {"--autofx"}));
  }

  @Test
  public void testSetters() {
    AutofixConfig config =
        new AutofixConfig("autofix").setAutofix(true).setOffsetUnit(OffsetUnit.UTF8_BYTES);

    assertThat(config.shouldWriteFixes()).isTrue();
    assertThat(config.getOffsetUnit()).isEqualTo(OffsetUnit.UTF8_BYTES);
    assertThat(config.setDryRun(true).shouldWriteFixes()).isFalse();
  }
}
