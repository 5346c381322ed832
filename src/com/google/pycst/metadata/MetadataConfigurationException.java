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

package com.google.pycst.metadata;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;

/**
 * Thrown when the requested providers cannot be ordered, i.e. when a provider transitively
 * depends on itself. Nothing has been computed when this is thrown.
 */
public final class MetadataConfigurationException extends MetadataException {
  private static final long serialVersionUID = 1L;

  private final transient ImmutableList<BaseMetadataProvider<?>> cycle;

  MetadataConfigurationException(ImmutableList<BaseMetadataProvider<?>> cycle) {
    super(
        "Detected a dependency cycle between metadata providers: "
            + Joiner.on(" -> ").join(cycle));
    this.cycle = cycle;
  }

  /**
   * Returns the providers forming the cycle, in dependency order. The first provider is repeated
   * at the end.
   */
  public ImmutableList<BaseMetadataProvider<?>> getCycle() {
    return cycle;
  }
}
