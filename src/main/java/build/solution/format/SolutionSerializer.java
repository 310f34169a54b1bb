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

import build.solution.model.SolutionModel;
import com.google.common.util.concurrent.ListenableFuture;
import java.nio.file.Path;

/**
 * Reads and writes solution models in one file format.
 *
 * <p>Both operations are asynchronous and may complete on another thread. A failed future fails
 * with a {@link SolutionFormatException} for I/O and document problems; a legacy serializer may
 * also fail with the grammar or model errors of the text it reads. Cancelling a future cancels the
 * work where the implementation supports it.
 */
public interface SolutionSerializer {

  /** The format this serializer reads and writes. */
  SolutionFormat format();

  /** Reads the model stored at {@code path}. */
  ListenableFuture<SolutionModel> openAsync(Path path);

  /** Writes {@code model} to {@code path}, replacing any existing file. */
  ListenableFuture<Void> saveAsync(Path path, SolutionModel model);
}
