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

import org.jspecify.annotations.Nullable;
import org.rangeopt.ir.Value;

/**
 * A read-only view of an {@link IntRangeAnalysis} that collapses its states into "known range" or
 * "unknown". Callers must treat unknown as "may be any value".
 */
public class RangeQuery {

  private final IntRangeAnalysis analysis;

  public RangeQuery(IntRangeAnalysis analysis) {
    this.analysis = analysis;
  }

  /**
   * Returns the solved range of {@code value}, or null if the analysis has no state for it or its
   * state is uninitialized.
   */
  public @Nullable ConstantRange query(Value value) {
    RangeState state = analysis.lookup(value);
    return (state == null || state.isUninitialized()) ? null : state.range();
  }
}
