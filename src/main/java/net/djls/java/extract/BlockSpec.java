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


package net.djls.java.extract;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import java.util.Collection;
import javax.annotation.Nullable;

/**
 * The block structure of a tag: the tag that closes it, the tags that may appear between the
 * opening and closing tags, and whether its contents are left unparsed.
 */
@AutoValue
public abstract class BlockSpec {

  /** The closing tag, such as {@code endif}, or null when the source does not settle it. */
  @Nullable
  public abstract String endTag();

  /** Tags such as {@code elif} and {@code else}, sorted. */
  public abstract ImmutableList<String> intermediates();

  /** Whether the contents are skipped rather than parsed, as for {@code comment}. */
  public abstract boolean opaque();

  public static BlockSpec create(
      @Nullable String endTag, Collection<String> intermediates, boolean opaque) {
    return new AutoValue_BlockSpec(endTag, ImmutableList.sortedCopyOf(intermediates), opaque);
  }

  /** Returns a block closed by {@code endTag} with nothing in between. */
  public static BlockSpec closedBy(String endTag) {
    return create(endTag, ImmutableList.of(), false);
  }
}
