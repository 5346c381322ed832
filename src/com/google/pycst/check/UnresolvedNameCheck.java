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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.pycst.metadata.Access;
import com.google.pycst.metadata.MetadataWrapper;
import com.google.pycst.metadata.Scope;
import com.google.pycst.metadata.ScopeProvider;
import com.google.pycst.syntax.Node;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Reports every read or deletion of a name that no scope of the module binds and that is not a
 * builtin. Findings are ordered as the names appear in the tree.
 */
public final class UnresolvedNameCheck {
  private static final Logger logger = Logger.getLogger(UnresolvedNameCheck.class.getName());

  public static final DiagnosticType UNDEFINED_NAME =
      DiagnosticType.warning("PY_UNDEFINED_NAME", "Name ''{0}'' is not defined");

  private final ScopeProvider scopeProvider;
  private final CheckLevel level;

  public UnresolvedNameCheck() {
    this(new ScopeProvider(), UNDEFINED_NAME.level);
  }

  /**
   * @param scopeProvider the provider computing the scopes, which decides the builtin names
   * @param level the level findings are reported at; nothing is reported at {@link
   *     CheckLevel#OFF}
   */
  public UnresolvedNameCheck(ScopeProvider scopeProvider, CheckLevel level) {
    this.scopeProvider = checkNotNull(scopeProvider);
    this.level = checkNotNull(level);
  }

  /** Resolves the scopes of the wrapped module if needed and returns the findings. */
  public ImmutableList<AnalysisError> check(MetadataWrapper wrapper) {
    if (!level.isOn()) {
      return ImmutableList.of();
    }
    ImmutableMap<Node, Scope> scopes = wrapper.resolve(scopeProvider);
    ImmutableList.Builder<AnalysisError> errors = ImmutableList.builder();
    for (Map.Entry<Node, Scope> entry : scopes.entrySet()) {
      Node n = entry.getKey();
      if (!n.isName()) {
        continue;
      }
      for (Access access : entry.getValue().getAccesses(n.getString())) {
        if (access.getNode() == n && !access.isResolved()) {
          errors.add(AnalysisError.make(n, UNDEFINED_NAME, level, n.getString()));
        }
      }
    }
    ImmutableList<AnalysisError> result = errors.build();
    logger.fine("Found " + result.size() + " undefined names");
    return result;
  }
}
