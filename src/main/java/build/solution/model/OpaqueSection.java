// Copyright 2025 The Bazel Authors. All rights reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package build.solution.model;

import build.solution.syntax.RawBlock;
import build.solution.syntax.SectionOrder;
import com.google.common.collect.ImmutableList;
import javax.annotation.Nullable;

/**
 * A section carried through the model without interpretation: a project section of a kind the
 * model does not know, or a global section other than the configuration and nesting tables.
 *
 * <p>Unlike {@link RawBlock}, an OpaqueSection carries no source location, so that two models
 * read from equivalent descriptors in different formats compare equal.
 *
 * @param name the section name, e.g. {@code ExtensibilityGlobals}
 * @param order the ordering qualifier it was declared with
 * @param entries the {@code key = value} lines as written, values still quoted
 */
public record OpaqueSection(String name, SectionOrder order, ImmutableList<Entry> entries) {

  /** A line of the section. {@code value} is null for a line without a separator. */
  public record Entry(String key, @Nullable String value) {}

  /** Copies the name, order and lines of {@code block}, dropping locations. */
  public static OpaqueSection of(RawBlock block) {
    ImmutableList.Builder<Entry> entries = ImmutableList.builder();
    for (RawBlock.Property property : block.properties()) {
      entries.add(new Entry(property.key(), property.value()));
    }
    return new OpaqueSection(block.name(), block.order(), entries.build());
  }

  /** Returns the value of the first line with the given key, or null. */
  @Nullable
  public String get(String key) {
    for (Entry entry : entries) {
      if (entry.key().equals(key)) {
        return entry.value();
      }
    }
    return null;
  }
}
