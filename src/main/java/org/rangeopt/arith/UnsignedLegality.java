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

package org.rangeopt.arith;

import java.math.BigInteger;
import org.rangeopt.ir.Operation;
import org.rangeopt.ir.Value;
import org.rangeopt.range.ConstantRange;
import org.rangeopt.range.RangeQuery;

/**
 * Decides, from the ranges proven by a {@link RangeQuery}, whether values can be treated as
 * unsigned without changing the program's behavior.
 *
 * <p>The width of an {@code index} value depends on the target, and its range covers both 32-bit
 * and 64-bit targets. A non-negative index value is only considered safe if it would also fit in a
 * 32-bit unsigned index.
 */
public class UnsignedLegality {

  /** The largest value that an index may safely hold on any supported target. */
  public static final BigInteger SAFE_INDEX_UNSIGNED_MAX =
      BigInteger.ONE.shiftLeft(32).subtract(BigInteger.ONE);

  private final RangeQuery query;

  public UnsignedLegality(RangeQuery query) {
    this.query = query;
  }

  public RangeQuery query() {
    return query;
  }

  /**
   * True if {@code value} has a solved range that is non-negative and, if it is an {@code index},
   * within {@link #SAFE_INDEX_UNSIGNED_MAX}.
   */
  public boolean valueSafeToUnsign(Value value) {
    ConstantRange range = query.query(value);
    if (range == null || !range.isNonNegative()) {
      return false;
    }
    return !value.type().isIndex() || withinSafeBound(range);
  }

  /** True if every operand and every result of {@code op} is {@link #valueSafeToUnsign safe}. */
  public boolean operationSafeToUnsign(Operation op) {
    return op.operands().stream().allMatch(this::valueSafeToUnsign)
        && op.results().stream().allMatch(this::valueSafeToUnsign);
  }

  /**
   * True if {@code value} has a solved range that is non-negative and within {@link
   * #SAFE_INDEX_UNSIGNED_MAX}, whatever its type.
   */
  public boolean valueWithinSafeIndexBound(Value value) {
    ConstantRange range = query.query(value);
    return range != null && range.isNonNegative() && withinSafeBound(range);
  }

  private static boolean withinSafeBound(ConstantRange range) {
    return range.umin().compareTo(SAFE_INDEX_UNSIGNED_MAX) <= 0
        && range.umax().compareTo(SAFE_INDEX_UNSIGNED_MAX) <= 0;
  }
}
