/*
 * Copyright 2026 The Closure Compiler Authors.
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

package com.google.pycst.check;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.pycst.syntax.Node;

/**
 * A finding reported at a node of the tree being analyzed.
 *
 * @param type the type of the finding
 * @param description the formatted message
 * @param level the level the finding is reported at
 * @param node the node the finding is about
 */
public record AnalysisError(DiagnosticType type, String description, CheckLevel level, Node node) {

  public AnalysisError {
    checkNotNull(type);
    checkNotNull(description);
    checkNotNull(level);
    checkNotNull(node);
  }

  /** Creates a finding at the default level of {@code type}. */
  public static AnalysisError make(Node n, DiagnosticType type, String... arguments) {
    return make(n, type, type.level, arguments);
  }

  /** Creates a finding at {@code level}, overriding the default level of {@code type}. */
  public static AnalysisError make(
      Node n, DiagnosticType type, CheckLevel level, String... arguments) {
    return new AnalysisError(type, type.format(arguments), level, n);
  }

  public int getLineno() {
    return node.getLineno();
  }

  public int getCharno() {
    return node.getCharno();
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append(level).append(' ').append(type.key).append(": ").append(description);
    if (node.getLineno() >= 0) {
      sb.append(" at ").append(node.getLineno()).append(':').append(node.getCharno());
    }
    return sb.toString();
  }
}
