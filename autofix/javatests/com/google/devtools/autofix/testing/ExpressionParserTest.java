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

package com.google.devtools.autofix.testing;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.devtools.autofix.TemplateParseException;
import com.google.devtools.autofix.ast.ListKind;
import com.google.devtools.autofix.ast.Node;
import com.google.devtools.autofix.ast.NodeKind;
import com.google.devtools.autofix.source.SourceBuffer;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class ExpressionParserTest {
  @Test
  public void testCallSpans() throws Exception {
    SourceBuffer buffer = SourceBuffer.template("bar(baz, $...REST) ");
    Node call = ExpressionParser.parse(buffer);

    assertThat(call.origin()).hasValue(buffer.range(0, 18));
    Node args = call.children().get(2);
    assertThat(args.listKind()).hasValue(ListKind.ARGUMENTS);
    assertThat(args.origin()).hasValue(buffer.range(4, 17));
    assertThat(args.children()).hasSize(3);
    assertThat(args.children().get(1).separator()).isTrue();
    Node rest = args.children().get(2);
    assertThat(rest.kind()).isEqualTo(NodeKind.ELLIPSIS);
    assertThat(rest.name()).hasValue("REST");
    assertThat(rest.origin()).hasValue(buffer.range(9, 17));
  }

  @Test
  public void testEmptyArguments() throws Exception {
    SourceBuffer buffer = SourceBuffer.template("f( )");
    Node args = ExpressionParser.parse(buffer).children().get(2);
    assertThat(args.children()).isEmpty();
    assertThat(args.origin()).hasValue(buffer.range(3, 3));
  }

  @Test
  public void testBinary() throws Exception {
    SourceBuffer buffer = SourceBuffer.template("$X + 1");
    Node binary = ExpressionParser.parse(buffer);
    assertThat(binary.syntax()).isEqualTo("binary");
    assertThat(binary.children().get(0).kind()).isEqualTo(NodeKind.METAVARIABLE);
    assertThat(binary.children().get(1).origin()).hasValue(buffer.range(3, 4));
  }

  @Test
  public void testFind() {
    SourceBuffer buffer = SourceBuffer.target("foo(1, 42)");
    Node root = ExpressionParser.parseTarget(buffer);
    assertThat(ExpressionParser.find(root, buffer, "42").origin()).hasValue(buffer.range(7, 9));
    assertThrows(IllegalArgumentException.class, () -> ExpressionParser.find(root, buffer, "7"));
  }

  @Test
  public void testSyntaxError() {
    TemplateParseException e =
        assertThrows(
            TemplateParseException.class,
            () -> ExpressionParser.parse(SourceBuffer.template("f(1")));
    assertThat(e).hasMessageThat().contains("expected ')'");
  }
}
