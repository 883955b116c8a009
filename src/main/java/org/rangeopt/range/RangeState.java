/*
 * Copyright 2025 The Rangeopt Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.rangeopt.range;

import com.google.common.base.Preconditions;
import org.jspecify.annotations.Nullable;

/**
 * The analysis state of a single value: either {@link #UNINITIALIZED} (the analysis has visited
 * the value but learned nothing about it, e.g. because it is unreachable) or solved with a {@link
 * ConstantRange}. A value that the analysis has not visited has no RangeState at all.
 */
public final class RangeState {

  public static final RangeState UNINITIALIZED = new RangeState(null);

  private final @Nullable ConstantRange range;

  private RangeState(@Nullable ConstantRange range) {
    this.range = range;
  }

  public static RangeState solved(ConstantRange range) {
    return new RangeState(Preconditions.checkNotNull(range));
  }

  public boolean isUninitialized() {
    return range == null;
  }

  /** Returns the solved range; must not be called on {@link #UNINITIALIZED}. */
  public ConstantRange range() {
    Preconditions.checkState(range != null, "Range state is uninitialized");
    return range;
  }

  @Override
  public String toString() {
    return (range == null) ? "uninitialized" : range.toString();
  }
}
