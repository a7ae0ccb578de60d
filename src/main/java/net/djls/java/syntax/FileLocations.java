// Copyright 2026 The Bazel Authors. All rights reserved.
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

package net.djls.java.syntax;

import com.google.common.base.Preconditions;
import java.util.Arrays;

/**
 * FileLocations maps each source offset within a file to a Location. An offset is a (UTF-16) char
 * index such that {@code 0 <= offset <= size}. A Location is a (file, line, column) triple.
 */
final class FileLocations {

  private final int[] linestart; // maps line number (line >= 1) to char offset
  private final String file;
  private final int size; // size of file in chars

  private FileLocations(int[] linestart, String file, int size) {
    this.linestart = linestart;
    this.file = file;
    this.size = size;
  }

  static FileLocations create(char[] buffer, String file) {
    return new FileLocations(computeLinestart(buffer), file, buffer.length);
  }

  private static int[] computeLinestart(char[] buffer) {
    // Compute the start offset of each line (1-based).
    int[] linestart = new int[64];
    int n = 1; // linestart[0] is unused
    linestart[n++] = 0;
    for (int i = 0; i < buffer.length; i++) {
      if (buffer[i] == '\n') {
        if (n == linestart.length) {
          linestart = Arrays.copyOf(linestart, n * 2);
        }
        linestart[n++] = i + 1;
      }
    }
    return Arrays.copyOf(linestart, n);
  }

  String file() {
    return file;
  }

  // Returns the line number of the given offset.
  private int getLineAt(int offset) {
    Preconditions.checkArgument(
        0 <= offset && offset <= size, "offset %s out of range [0, %s]", offset, size);
    int i = Arrays.binarySearch(linestart, 1, linestart.length, offset);
    if (i < 0) {
      i = -i - 2;
    }
    return i;
  }

  /** Returns the location of the given char offset. */
  Location getLocation(int offset) {
    int line = getLineAt(Math.min(Math.max(offset, 0), size));
    int column = Math.min(Math.max(offset, 0), size) - linestart[line] + 1;
    return new Location(file, line, column);
  }
}
