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

import java.io.Serializable;

/** Options controlling how a {@link MetadataWrapper} resolves providers. */
public class MetadataOptions implements Serializable {
  private static final long serialVersionUID = 1L;

  /** Whether batchable providers that are ready together share one traversal. */
  private boolean batchTraversals = true;

  /** Whether a provider may only query the providers it declared as dependencies. */
  private boolean strictDependencyLookups = true;

  public MetadataOptions() {}

  public void setBatchTraversals(boolean batchTraversals) {
    this.batchTraversals = batchTraversals;
  }

  public boolean getBatchTraversals() {
    return batchTraversals;
  }

  public void setStrictDependencyLookups(boolean strictDependencyLookups) {
    this.strictDependencyLookups = strictDependencyLookups;
  }

  public boolean getStrictDependencyLookups() {
    return strictDependencyLookups;
  }

  @Override
  public String toString() {
    return "MetadataOptions{batchTraversals="
        + batchTraversals
        + ", strictDependencyLookups="
        + strictDependencyLookups
        + "}";
  }
}
