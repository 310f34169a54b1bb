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
import build.solution.syntax.SolutionOptions;
import build.solution.syntax.SyntaxError;
import com.google.common.collect.ImmutableMap;
import com.google.common.flogger.GoogleLogger;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.common.util.concurrent.MoreExecutors;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.ExecutionException;

/**
 * Loads solutions in whichever format they are stored in, and converts them between formats.
 *
 * <p>The bridge holds one {@link SolutionSerializer} per format. Which implementation reads a
 * format is decided by whoever constructs the bridge; nothing here consults global state. Each
 * call is independent, so concurrent loads of different files do not interfere.
 *
 * <p>The blocking methods wait for the serializer and rethrow its failure as the checked exception
 * it was: a {@link SolutionFormatException} for I/O and document problems, a {@link
 * SyntaxError.Exception} or {@link SolutionModelException} for an invalid legacy descriptor.
 */
public final class FormatBridge {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private final ImmutableMap<SolutionFormat, SolutionSerializer> serializers;

  public FormatBridge(Map<SolutionFormat, SolutionSerializer> serializers) {
    this.serializers = ImmutableMap.copyOf(serializers);
  }

  /** Returns a bridge with the legacy reader and an XML serializer running on {@code executor}. */
  public static FormatBridge create(
      SolutionOptions options, EventHandler eventHandler, ListeningExecutorService executor) {
    return new FormatBridge(
        ImmutableMap.of(
            SolutionFormat.LEGACY, new LegacySolutionSerializer(options, eventHandler),
            SolutionFormat.STRUCTURED, new XmlSolutionSerializer(executor)));
  }

  /** Returns a bridge with the default options that does all work on the calling thread. */
  public static FormatBridge create() {
    return create(
        SolutionOptions.DEFAULT, EventHandler.NOOP, MoreExecutors.newDirectExecutorService());
  }

  /** Returns the serializer for {@code format}. */
  public SolutionSerializer serializerFor(SolutionFormat format) throws SolutionFormatException {
    SolutionSerializer serializer = serializers.get(format);
    if (serializer == null) {
      throw new SolutionFormatException(null, "no serializer for the " + format + " format");
    }
    return serializer;
  }

  /** Starts loading the solution at {@code path}, in the format it is stored in. */
  public ListenableFuture<SolutionModel> loadAsync(Path path) {
    try {
      SolutionFormat format = SolutionFormat.detect(path);
      logger.atFine().log("Loading %s as %s", path, format);
      return serializerFor(format).openAsync(path);
    } catch (SolutionFormatException e) {
      return Futures.immediateFailedFuture(e);
    }
  }

  /** Loads the solution at {@code path}, in the format it is stored in. */
  public SolutionModel load(Path path)
      throws SolutionFormatException,
          SyntaxError.Exception,
          SolutionModelException,
          InterruptedException {
    return await(loadAsync(path), path);
  }

  /**
   * Starts converting the solution at {@code source} to the other format, written next to it
   * with that format's extension. The future yields the path written.
   */
  public ListenableFuture<Path> convertAsync(Path source) {
    try {
      SolutionFormat target = SolutionFormat.detect(source).other();
      return convertAsync(source, target.siblingOf(source));
    } catch (SolutionFormatException e) {
      return Futures.immediateFailedFuture(e);
    }
  }

  /**
   * Starts converting the solution at {@code source} and writing it to {@code target}. The target
   * format is the one of {@code target}'s extension, or the other format than the source's if the
   * extension is not a known one.
   */
  public ListenableFuture<Path> convertAsync(Path source, Path target) {
    SolutionFormat targetFormat = SolutionFormat.fromExtension(target);
    SolutionSerializer writer;
    try {
      writer =
          serializerFor(
              targetFormat != null ? targetFormat : SolutionFormat.detect(source).other());
    } catch (SolutionFormatException e) {
      return Futures.immediateFailedFuture(e);
    }
    ListenableFuture<Void> saved =
        Futures.transformAsync(
            loadAsync(source),
            model -> {
              logger.atFine().log("Converting %s to %s", source, target);
              return writer.saveAsync(target, model);
            },
            MoreExecutors.directExecutor());
    return Futures.transform(saved, unused -> target, MoreExecutors.directExecutor());
  }

  /** Converts the solution at {@code source} to the other format and returns the path written. */
  public Path convert(Path source)
      throws SolutionFormatException,
          SyntaxError.Exception,
          SolutionModelException,
          InterruptedException {
    return await(convertAsync(source), source);
  }

  /** Converts the solution at {@code source}, writing it to {@code target}. */
  public Path convert(Path source, Path target)
      throws SolutionFormatException,
          SyntaxError.Exception,
          SolutionModelException,
          InterruptedException {
    return await(convertAsync(source, target), source);
  }

  // Waits for future and rethrows its failure as the checked exception it was.
  private static <T> T await(ListenableFuture<T> future, Path path)
      throws SolutionFormatException,
          SyntaxError.Exception,
          SolutionModelException,
          InterruptedException {
    try {
      return future.get();
    } catch (InterruptedException e) {
      future.cancel(true);
      throw e;
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof SolutionFormatException formatException) {
        throw formatException;
      }
      if (cause instanceof SyntaxError.Exception syntaxException) {
        throw syntaxException;
      }
      if (cause instanceof SolutionModelException modelException) {
        throw modelException;
      }
      if (cause instanceof RuntimeException runtimeException) {
        throw runtimeException;
      }
      if (cause instanceof Error error) {
        throw error;
      }
      throw new SolutionFormatException(path, "serializer failed: " + cause, cause);
    }
  }
}
