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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link ResourceLoader}. */
@RunWith(JUnit4.class)
public final class ResourceLoaderTest {

  @Test
  public void testLoadBuiltinNames() {
    assertThat(ResourceLoader.resourceExists(ScopeProvider.class, "python_builtins.txt")).isTrue();
    String text = ResourceLoader.loadTextResource(ScopeProvider.class, "python_builtins.txt");
    assertThat(text).contains("\nprint\n");
    assertThat(text).contains("\nValueError\n");
  }

  @Test
  public void testMissingResource() {
    assertThat(ResourceLoader.resourceExists(ScopeProvider.class, "missing.txt")).isFalse();
    assertThrows(
        IllegalArgumentException.class,
        () -> ResourceLoader.loadTextResource(ScopeProvider.class, "missing.txt"));
  }
}
