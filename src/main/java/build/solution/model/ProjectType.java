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

import com.google.common.base.Ascii;
import com.google.common.collect.ImmutableMap;

/**
 * The logical type of a {@link ProjectEntry}, derived from the type token in the project block's
 * header.
 */
public enum ProjectType {
  /** A buildable project in the project-file format: C#, VB, F#, C++ and friends. */
  PROJECT,
  /** A virtual folder grouping other entries. Has no file and no configurations. */
  SOLUTION_FOLDER,
  /** A web site project, built by the web compiler with per-configuration parameters. */
  WEB_PROJECT,
  /** A web deployment project. */
  WEB_DEPLOYMENT_PROJECT,
  /** A shared project; its sources are compiled into the projects that import it. */
  SHARED_PROJECT,
  /** A type token that is not among the known ones. */
  UNRECOGNIZED;

  public static final String CSHARP_TYPE = "{FAE04EC0-301F-11D3-BF4B-00C04F79EFBC}";
  public static final String VISUAL_BASIC_TYPE = "{F184B08F-C81C-45F6-A57F-5ABD9991F28F}";
  public static final String FSHARP_TYPE = "{F2A71F9B-5D33-465A-A702-920D77279786}";
  public static final String CPS_TYPE = "{13B669BE-BB05-4DDF-9536-439F39A36129}";
  public static final String CPS_CSHARP_TYPE = "{9A19103F-16F7-4668-BE54-9A1E7A4F7556}";
  public static final String CPS_VISUAL_BASIC_TYPE = "{778DAE3C-4631-46EA-AA77-85C1314464D9}";
  public static final String CPS_FSHARP_TYPE = "{6EC3EE1D-3C4E-46DD-8F32-0CC8E7565705}";
  public static final String JSHARP_TYPE = "{E6FDF86B-F3D1-11D4-8576-0002A516ECE8}";
  public static final String CPP_TYPE = "{8BC9CEB8-8B4A-11D0-8D11-00A0C91BC942}";
  public static final String DATABASE_TYPE = "{C8D11400-126E-41CD-887F-60BD40844F9E}";
  public static final String SYNERGEX_TYPE = "{BBD0F5D1-1CC4-42FD-BA4C-A96779C64378}";
  public static final String WEB_DEPLOYMENT_TYPE = "{2CFEAB61-6A3B-4EB8-B523-560B4BEEF521}";
  public static final String WEB_SITE_TYPE = "{E24C65DC-7377-472B-9ABA-BC803B73C61A}";
  public static final String SOLUTION_FOLDER_TYPE = "{2150E333-8FDC-42A3-9474-1A3956D46DE8}";
  public static final String SHARED_PROJECT_TYPE = "{D954291E-2A0B-460D-934E-DC6B0785DB48}";

  // Keyed by the upper-cased token; tokens compare case-insensitively.
  private static final ImmutableMap<String, ProjectType> KNOWN_TYPES =
      ImmutableMap.<String, ProjectType>builder()
          .put(CSHARP_TYPE, PROJECT)
          .put(VISUAL_BASIC_TYPE, PROJECT)
          .put(FSHARP_TYPE, PROJECT)
          .put(CPS_TYPE, PROJECT)
          .put(CPS_CSHARP_TYPE, PROJECT)
          .put(CPS_VISUAL_BASIC_TYPE, PROJECT)
          .put(CPS_FSHARP_TYPE, PROJECT)
          .put(JSHARP_TYPE, PROJECT)
          .put(CPP_TYPE, PROJECT)
          .put(DATABASE_TYPE, PROJECT)
          .put(SYNERGEX_TYPE, PROJECT)
          .put(WEB_DEPLOYMENT_TYPE, WEB_DEPLOYMENT_PROJECT)
          .put(WEB_SITE_TYPE, WEB_PROJECT)
          .put(SOLUTION_FOLDER_TYPE, SOLUTION_FOLDER)
          .put(SHARED_PROJECT_TYPE, SHARED_PROJECT)
          .buildOrThrow();

  /** Classifies a type token. Tokens that are not known yield {@link #UNRECOGNIZED}. */
  public static ProjectType classify(String typeToken) {
    return KNOWN_TYPES.getOrDefault(Ascii.toUpperCase(typeToken.strip()), UNRECOGNIZED);
  }

  /** Whether entries of this type are built: neither folders nor shared or deployment projects. */
  public boolean isBuildable() {
    return this == PROJECT || this == WEB_PROJECT || this == UNRECOGNIZED;
  }
}
