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

package build.solution.syntax;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import javax.annotation.Nullable;

/**
 * A block of a solution descriptor as recognized by the {@link BlockParser}, before any
 * interpretation: its kind, its header fields, its {@code key = value} lines in the order they were
 * written, and its nested blocks.
 *
 * <p>Sections of kinds the model builder does not know are kept as RawBlocks, so that they survive
 * a round trip through the model.
 */
@AutoValue
public abstract class RawBlock {

  /** A {@code key = value} line of a section. */
  public record Property(String key, @Nullable String value, Location location) {

    /** Whether the line had a separator; a bare {@code key} line has no value. */
    public boolean hasValue() {
      return value != null;
    }

    /** Returns the value with enclosing quotes removed, or the empty string if there is none. */
    public String unquotedValue(char quote) {
      return value == null ? "" : QuotedValues.unquote(value, quote);
    }
  }

  public abstract BlockKind kind();

  /** The location of the block's opening line. */
  public abstract Location location();

  /** The section name, e.g. {@code ProjectDependencies}; null for project and global blocks. */
  @Nullable
  public abstract String name();

  /** The ordering qualifier; null for project and global blocks. */
  @Nullable
  public abstract SectionOrder order();

  /**
   * The unquoted header fields of a project block: type token, display name, path and identifier.
   * Empty for other kinds.
   */
  public abstract ImmutableList<String> header();

  /** The {@code key = value} lines, in declaration order, duplicates included. */
  public abstract ImmutableList<Property> properties();

  /** The nested blocks, in declaration order. */
  public abstract ImmutableList<RawBlock> children();

  /** Returns the first property with the given key, or null. Keys compare exactly. */
  @Nullable
  public Property getProperty(String key) {
    for (Property property : properties()) {
      if (property.key().equals(key)) {
        return property;
      }
    }
    return null;
  }

  /** Returns the first nested section with the given name, or null. */
  @Nullable
  public RawBlock getSection(String sectionName) {
    for (RawBlock child : children()) {
      if (sectionName.equals(child.name())) {
        return child;
      }
    }
    return null;
  }

  public static Builder builder(BlockKind kind, Location location) {
    return new AutoValue_RawBlock.Builder()
        .kind(kind)
        .location(location)
        .header(ImmutableList.of());
  }

  /** Returns a section block with the given properties and no children. */
  public static RawBlock section(
      BlockKind kind, String name, SectionOrder order, Iterable<Property> properties) {
    Builder builder = builder(kind, Location.BUILTIN).name(name).order(order);
    builder.propertiesBuilder().addAll(properties);
    return builder.build();
  }

  @Override
  public final String toString() {
    StringBuilder buf = new StringBuilder(kind().openMarker());
    if (name() != null) {
      buf.append('(').append(name()).append(')');
    }
    if (!header().isEmpty()) {
      buf.append(header());
    }
    return buf.append(" at ").append(location()).toString();
  }

  /** Builder for {@link RawBlock}. */
  @AutoValue.Builder
  public abstract static class Builder {
    abstract Builder kind(BlockKind kind);

    abstract Builder location(Location location);

    public abstract Builder name(@Nullable String name);

    public abstract Builder order(@Nullable SectionOrder order);

    public abstract Builder header(ImmutableList<String> header);

    public abstract ImmutableList.Builder<Property> propertiesBuilder();

    public abstract ImmutableList.Builder<RawBlock> childrenBuilder();

    @CanIgnoreReturnValue
    public Builder addProperty(Property property) {
      propertiesBuilder().add(property);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder addChild(RawBlock child) {
      childrenBuilder().add(child);
      return this;
    }

    public abstract RawBlock build();
  }
}
