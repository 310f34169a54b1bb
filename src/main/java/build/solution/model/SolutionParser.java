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

import build.solution.events.EventHandler;
import build.solution.events.StoredEventHandler;
import build.solution.events.TeeEventHandler;
import build.solution.syntax.BlockParser;
import build.solution.syntax.ParserInput;
import build.solution.syntax.SolutionOptions;
import build.solution.syntax.SyntaxError;

/**
 * Reads a legacy solution descriptor into a {@link SolutionModel}: scanning, block parsing, then
 * model assembly.
 *
 * <p>Each call is independent and keeps no state between calls. Warnings are both recorded on the
 * resulting model and passed to the caller's handler as they occur.
 */
public final class SolutionParser {

  private SolutionParser() {}

  /** Parses {@code input} with the default options, recording warnings only on the model. */
  public static SolutionModel parse(ParserInput input)
      throws SyntaxError.Exception, SolutionModelException {
    return parse(input, SolutionOptions.DEFAULT, EventHandler.NOOP);
  }

  /**
   * Parses {@code input}.
   *
   * @throws SyntaxError.Exception on the first structural error
   * @throws SolutionModelException if the entries do not form a consistent model
   */
  public static SolutionModel parse(
      ParserInput input, SolutionOptions options, EventHandler eventHandler)
      throws SyntaxError.Exception, SolutionModelException {
    StoredEventHandler collected = new StoredEventHandler();
    EventHandler handler = TeeEventHandler.of(collected, eventHandler);
    BlockParser.Result blocks = BlockParser.parse(input, options, handler);
    SolutionModel.Builder model = new ProjectModelBuilder(options, handler).assemble(blocks);
    return model.addWarnings(collected.getEvents()).build();
  }
}
