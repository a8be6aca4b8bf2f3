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

package com.google.devtools.autofix.printer;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.devtools.autofix.UnprintableNodeException;
import com.google.devtools.autofix.ast.Node;
import com.google.devtools.autofix.ast.NodeKind;
import com.google.devtools.autofix.source.BufferId;
import com.google.devtools.autofix.source.Range;
import com.google.devtools.autofix.source.SourceBuffer;

/**
 * Renders a substituted fix tree to text.
 *
 * <p>For each node, in order of preference, the printer:
 *
 * <ol>
 *   <li>lifts the verbatim text of the node's origin, if the node was not altered by substitution;
 *   <li>prints the canonical text of a synthesized connective token;
 *   <li>prints the children of an altered composite or expanded sequence in order. When the
 *       composite has a template origin and a layout, the template text around and between its
 *       children is lifted as well;
 *   <li>otherwise fails with {@link UnprintableNodeException}. Nothing else is ever invented.
 * </ol>
 *
 * <p>Printing is a pure function of the tree and the two buffers.
 */
public class AutofixPrinter {
  private AutofixPrinter() {}

  /**
   * Renders {@code tree}, lifting text from {@code target} and {@code template}.
   *
   * @throws UnprintableNodeException if some node can neither be lifted nor synthesized
   * @throws com.google.devtools.autofix.source.OffsetUnitMismatchException if an origin does not
   *     address its buffer
   */
  public static RenderedFix print(Node tree, SourceBuffer target, SourceBuffer template)
      throws UnprintableNodeException {
    checkArgument(target.getId() == BufferId.TARGET, "not a target buffer: %s", target);
    checkArgument(template.getId() == BufferId.TEMPLATE, "not a template buffer: %s", template);
    return new PrintState(target, template).render(tree);
  }

  private static class PrintState {
    private final SourceBuffer target;
    private final SourceBuffer template;
    private final StringBuilder out = new StringBuilder();
    private int liftedFromTarget;
    private int liftedFromTemplate;
    private int synthesized;

    PrintState(SourceBuffer target, SourceBuffer template) {
      this.target = target;
      this.template = template;
    }

    RenderedFix render(Node tree) throws UnprintableNodeException {
      emit(tree);
      return RenderedFix.create(
          out.toString(), liftedFromTarget, liftedFromTemplate, synthesized);
    }

    private void emit(Node node) throws UnprintableNodeException {
      if (node.kind().isReference()) {
        throw new UnprintableNodeException(node, "placeholder was never substituted");
      }
      if (node.origin().isPresent() && !node.altered() && !node.containsReference()) {
        lift(node.origin().get());
      } else if (node.connective().isPresent()) {
        String text = node.connective().get().getText();
        out.append(text);
        synthesized += text.length();
      } else if (!node.children().isEmpty() || node.kind() == NodeKind.EXPANDED_SEQUENCE) {
        emitChildren(node);
      } else {
        throw new UnprintableNodeException(node, "no origin and no synthesized form");
      }
    }

    private void emitChildren(Node node) throws UnprintableNodeException {
      if (!node.origin().isPresent() || node.layout().isEmpty()) {
        for (Node child : node.children()) {
          emit(child);
        }
        return;
      }
      Range span = node.origin().get();
      int cursor = span.getStart();
      for (int i = 0; i < node.children().size(); i++) {
        Range slot = node.layout().get(i);
        if (!span.encloses(slot) || slot.getStart() < cursor) {
          throw new UnprintableNodeException(node, "child " + i + " is laid out at " + slot);
        }
        lift(span.withOffsets(cursor, slot.getStart()));
        emit(node.children().get(i));
        cursor = slot.getEnd();
      }
      lift(span.withOffsets(cursor, span.getEnd()));
    }

    private void lift(Range range) {
      CharSequence text = bufferOf(range).slice(range);
      out.append(text);
      if (range.getBuffer() == BufferId.TARGET) {
        liftedFromTarget += text.length();
      } else {
        liftedFromTemplate += text.length();
      }
    }

    private SourceBuffer bufferOf(Range range) {
      return range.getBuffer() == BufferId.TARGET ? target : template;
    }
  }
}
