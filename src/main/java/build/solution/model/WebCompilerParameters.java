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

import com.google.auto.value.AutoValue;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import javax.annotation.Nullable;

/**
 * The web compiler parameters of a web project for one build configuration.
 *
 * <p>Every field is a string exactly as declared, without its quotes. A field that was not
 * declared is the empty string, never null: consumers test for emptiness, not for presence.
 */
@AutoValue
public abstract class WebCompilerParameters {

  /** The tool namespace of the parameters in {@code <Config>.<Namespace>.<Field>} keys. */
  public static final String TOOL_NAMESPACE = "AspNetCompiler";

  /** The fields, with the names they are declared under. Names compare case-sensitively. */
  public enum Field {
    VIRTUAL_PATH("VirtualPath"),
    PHYSICAL_PATH("PhysicalPath"),
    TARGET_PATH("TargetPath"),
    FORCE_OVERWRITE("ForceOverwrite"),
    UPDATEABLE("Updateable"),
    DEBUG("Debug"),
    KEY_FILE("KeyFile"),
    KEY_CONTAINER("KeyContainer"),
    DELAY_SIGN("DelaySign"),
    ALLOW_PARTIALLY_TRUSTED_CALLERS("AllowPartiallyTrustedCallers"),
    FIXED_NAMES("FixedNames");

    private final String declaredName;

    Field(String declaredName) {
      this.declaredName = declaredName;
    }

    public String declaredName() {
      return declaredName;
    }

    /** Returns the field declared under {@code name}, or null if there is none. */
    @Nullable
    public static Field forDeclaredName(String name) {
      for (Field field : values()) {
        if (field.declaredName.equals(name)) {
          return field;
        }
      }
      return null;
    }
  }

  /** Parameters with every field empty. */
  public static final WebCompilerParameters EMPTY = builder().build();

  public abstract String virtualPath();

  public abstract String physicalPath();

  public abstract String targetPath();

  public abstract String forceOverwrite();

  public abstract String updateable();

  public abstract String debug();

  public abstract String keyFile();

  public abstract String keyContainer();

  public abstract String delaySign();

  public abstract String allowPartiallyTrustedCallers();

  public abstract String fixedNames();

  /** Returns the value of {@code field}. */
  public String get(Field field) {
    switch (field) {
      case VIRTUAL_PATH:
        return virtualPath();
      case PHYSICAL_PATH:
        return physicalPath();
      case TARGET_PATH:
        return targetPath();
      case FORCE_OVERWRITE:
        return forceOverwrite();
      case UPDATEABLE:
        return updateable();
      case DEBUG:
        return debug();
      case KEY_FILE:
        return keyFile();
      case KEY_CONTAINER:
        return keyContainer();
      case DELAY_SIGN:
        return delaySign();
      case ALLOW_PARTIALLY_TRUSTED_CALLERS:
        return allowPartiallyTrustedCallers();
      case FIXED_NAMES:
        return fixedNames();
    }
    throw new IllegalStateException("unknown field " + field);
  }

  public static Builder builder() {
    Builder builder = new AutoValue_WebCompilerParameters.Builder();
    for (Field field : Field.values()) {
      builder.set(field, "");
    }
    return builder;
  }

  public abstract Builder toBuilder();

  /** Builder for {@link WebCompilerParameters}. All fields start out empty. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder virtualPath(String value);

    public abstract Builder physicalPath(String value);

    public abstract Builder targetPath(String value);

    public abstract Builder forceOverwrite(String value);

    public abstract Builder updateable(String value);

    public abstract Builder debug(String value);

    public abstract Builder keyFile(String value);

    public abstract Builder keyContainer(String value);

    public abstract Builder delaySign(String value);

    public abstract Builder allowPartiallyTrustedCallers(String value);

    public abstract Builder fixedNames(String value);

    /** Sets {@code field} to {@code value}. */
    @CanIgnoreReturnValue
    public Builder set(Field field, String value) {
      switch (field) {
        case VIRTUAL_PATH:
          return virtualPath(value);
        case PHYSICAL_PATH:
          return physicalPath(value);
        case TARGET_PATH:
          return targetPath(value);
        case FORCE_OVERWRITE:
          return forceOverwrite(value);
        case UPDATEABLE:
          return updateable(value);
        case DEBUG:
          return debug(value);
        case KEY_FILE:
          return keyFile(value);
        case KEY_CONTAINER:
          return keyContainer(value);
        case DELAY_SIGN:
          return delaySign(value);
        case ALLOW_PARTIALLY_TRUSTED_CALLERS:
          return allowPartiallyTrustedCallers(value);
        case FIXED_NAMES:
          return fixedNames(value);
      }
      throw new IllegalStateException("unknown field " + field);
    }

    public abstract WebCompilerParameters build();
  }
}
