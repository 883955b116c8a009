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

import com.google.common.flogger.FluentLogger;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.rangeopt.ir.ArithSemantics;
import org.rangeopt.ir.IntType;
import org.rangeopt.ir.OpKind;
import org.rangeopt.ir.Operation;
import org.rangeopt.ir.Region;
import org.rangeopt.ir.Value;

/**
 * Computes a {@link RangeState} for each value in a {@link Region}, and keeps them in a side table
 * keyed by {@link Value} identity.
 *
 * <p>States are only computed for values that don't already have one, so after some states have
 * been {@link #evict evicted} a subsequent {@link #solve} recomputes just those. Callers that
 * mutate the region are responsible for evicting the states of every value whose range may have
 * changed (including everything computed from such a value); see {@link
 * org.rangeopt.arith.RangeInvalidator}.
 *
 * <p>Operations after the region's first {@link OpKind#RETURN} are never executed; their results
 * are given the {@link RangeState#UNINITIALIZED} state, as is the result of any operation with an
 * uninitialized operand.
 */
public class IntRangeAnalysis {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final Map<Value, RangeState> states = new HashMap<>();

  /** The number of states computed by all calls to {@link #solve}. */
  private int numComputed;

  /**
   * Computes states for every value in {@code region} that does not already have one. Throws an
   * AnalysisException if an operand is not defined before its use or has a type that its operation
   * does not accept.
   */
  public void solve(Region region) throws AnalysisException {
    int prevComputed = numComputed;
    for (Value arg : region.arguments()) {
      if (!states.containsKey(arg)) {
        states.put(arg, RangeState.solved(argumentRange(arg)));
        ++numComputed;
      }
    }
    boolean reachable = true;
    List<ConstantRange> operandRanges = new ArrayList<>();
    for (Operation op : region.operations()) {
      if (op.kind().hasResult() && !states.containsKey(op.result())) {
        checkTypes(op);
        states.put(op.result(), visit(op, reachable, operandRanges));
        ++numComputed;
      }
      if (op.kind() == OpKind.RETURN) {
        reachable = false;
      }
    }
    logger.atFine().log(
        "Solved %s: %s states computed, %s total",
        region.location(),
        numComputed - prevComputed,
        states.size());
  }

  private RangeState visit(Operation op, boolean reachable, List<ConstantRange> operandRanges)
      throws AnalysisException {
    operandRanges.clear();
    boolean initialized = reachable;
    for (Value operand : op.operands()) {
      RangeState state = states.get(operand);
      if (state == null) {
        throw new AnalysisException(
            op.location(),
            String.format("operand %s of %s is not defined before use", operand, op));
      } else if (state.isUninitialized()) {
        initialized = false;
      } else {
        operandRanges.add(state.range());
      }
    }
    return initialized
        ? RangeState.solved(RangeInference.infer(op, operandRanges))
        : RangeState.UNINITIALIZED;
  }

  /**
   * Returns the range of an argument. The declared bounds of an {@code index} argument also apply
   * to its signed reading on a target with a 32-bit index.
   */
  private static ConstantRange argumentRange(Value arg) {
    int width = arg.type().width();
    if (!arg.hasAssumedBounds()) {
      return ConstantRange.full(width);
    }
    ConstantRange range = ConstantRange.fromSigned(width, arg.assumedMin(), arg.assumedMax());
    if (arg.type().isIndex()) {
      int narrow = IntType.MIN_INDEX_WIDTH;
      BigInteger lo = arg.assumedMin().max(ArithSemantics.signedMin(narrow));
      BigInteger hi = arg.assumedMax().min(ArithSemantics.signedMax(narrow));
      // If no value fits, the argument can't be passed on such a target.
      if (lo.compareTo(hi) <= 0) {
        range = range.union(ConstantRange.fromSigned(narrow, lo, hi).forWidth(width));
      }
    }
    return range;
  }

  /**
   * Verifies that {@code op}'s operand types are consistent with its kind and result type; they
   * may not be if the region was modified carelessly.
   */
  private static void checkTypes(Operation op) throws AnalysisException {
    IntType resultType = op.result().type();
    boolean ok =
        switch (op.kind().shape) {
          case BINARY ->
              op.operand(0).type() == resultType && op.operand(1).type() == resultType;
          case COMPARE -> op.operand(0).type() == op.operand(1).type();
          case CAST -> isValidCast(op.kind(), op.operand(0).type(), resultType);
          default -> true;
        };
    if (!ok) {
      throw new AnalysisException(op.location(), "operand types do not match " + op);
    }
  }

  private static boolean isValidCast(OpKind kind, IntType from, IntType to) {
    return switch (kind) {
      case EXT_SI, EXT_UI -> !from.isIndex() && !to.isIndex() && to.width() > from.width();
      case TRUNC -> !from.isIndex() && !to.isIndex() && to.width() < from.width();
      // A cast between two index values is an identity, which is left for folding.
      case INDEX_CAST, INDEX_CAST_UI -> from.isIndex() || to.isIndex();
      default -> false;
    };
  }

  /** Returns the state for {@code value}, or null if it has none. */
  public @Nullable RangeState lookup(Value value) {
    return states.get(value);
  }

  /** Removes the state for {@code value}, if it has one; returns true if it did. */
  @CanIgnoreReturnValue
  public boolean evict(Value value) {
    return states.remove(value) != null;
  }

  /** The number of values that currently have a state. */
  public int numStates() {
    return states.size();
  }
}
