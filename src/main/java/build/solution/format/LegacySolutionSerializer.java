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

package build.solution.format;

import build.solution.events.EventHandler;
import build.solution.model.SolutionModel;
import build.solution.model.SolutionModelException;
import build.solution.model.SolutionParser;
import build.solution.syntax.ParserInput;
import build.solution.syntax.SolutionOptions;
import build.solution.syntax.SyntaxError;
import com.google.common.flogger.GoogleLogger;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads and writes the legacy text format. Parsing is synchronous: the returned futures are
 * already complete.
 */
public final class LegacySolutionSerializer implements SolutionSerializer {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private final SolutionOptions options;
  private final EventHandler eventHandler;

  public LegacySolutionSerializer(SolutionOptions options, EventHandler eventHandler) {
    this.options = options;
    this.eventHandler = eventHandler;
  }

  public LegacySolutionSerializer() {
    this(SolutionOptions.DEFAULT, EventHandler.NOOP);
  }

  @Override
  public SolutionFormat format() {
    return SolutionFormat.LEGACY;
  }

  /**
   * {@inheritDoc}
   *
   * <p>The future fails with a {@link SyntaxError.Exception} or a {@link SolutionModelException}
   * if the text is not a valid descriptor.
   */
  @Override
  public ListenableFuture<SolutionModel> openAsync(Path path) {
    ParserInput input;
    try {
      input = ParserInput.readFile(path);
    } catch (IOException e) {
      return Futures.immediateFailedFuture(
          new SolutionFormatException(path, "cannot read solution: " + e.getMessage(), e));
    }
    try {
      return Futures.immediateFuture(SolutionParser.parse(input, options, eventHandler));
    } catch (SyntaxError.Exception | SolutionModelException e) {
      return Futures.immediateFailedFuture(e);
    }
  }

  @Override
  public ListenableFuture<Void> saveAsync(Path path, SolutionModel model) {
    String text = LegacySolutionWriter.write(model, options);
    try {
      Files.writeString(path, text, StandardCharsets.UTF_8);
    } catch (IOException e) {
      return Futures.immediateFailedFuture(
          new SolutionFormatException(path, "cannot write solution: " + e.getMessage(), e));
    }
    logger.atFine().log("Wrote %d projects to %s", model.getProjects().size(), path);
    return Futures.immediateVoidFuture();
  }
}
