// Copyright 2024 The Bazel Authors. All rights reserved.
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
package dev.makedb.filedb;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Paths;

/** Deletes files from disk on behalf of the {@link IntermediateFileReaper}. */
public interface FileDeleter {

  /** Deletes through {@link Files#delete}, relative to the working directory. */
  FileDeleter FILESYSTEM = name -> Files.delete(Paths.get(name));

  /**
   * Deletes the file called {@code name}.
   *
   * @throws NoSuchFileException if there is no such file
   * @throws IOException if the file exists but could not be deleted
   */
  void delete(String name) throws IOException;
}
