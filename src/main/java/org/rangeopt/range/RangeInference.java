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

import static org.rangeopt.range.ConstantRange.fromSigned;
import static org.rangeopt.range.ConstantRange.fromUnsigned;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.function.BinaryOperator;
import java.util.stream.Stream;
import org.jspecify.annotations.Nullable;
import org.rangeopt.ir.ArithSemantics;
import org.rangeopt.ir.CmpPredicate;
import org.rangeopt.ir.IntType;
import org.rangeopt.ir.OpKind;
import org.rangeopt.ir.Operation;

/**
 * Static-only class with the transfer function for each {@link OpKind}: given ranges for an
 * operation's operands, returns a range for its result.
 *
 * <p>Bounds are computed exactly (using BigIntegers) and then checked against the result width; if
 * the exact bounds don't fit (i.e. the operation may wrap) that reading of the result is
 * unconstrained. Division by zero is undefined behavior, so divisors are assumed to be non-zero.
 *
 * <p>An operation with an {@code index} operand or result is inferred twice, as it would run with
 * a {@link IntType#MIN_INDEX_WIDTH 32-bit} and with a {@link IntType#INDEX_ANALYSIS_WIDTH 64-bit}
 * index, and the result covers both.
 */
public class RangeInference {

  private RangeInference() {}

  /** Returns a sound range for the result of {@code op}, whatever the target's index width. */
  public static ConstantRange infer(Operation op, List<ConstantRange> operands) {
    ConstantRange wide = infer(op, operands, IntType.INDEX_ANALYSIS_WIDTH);
    if (!hasIndexType(op)) {
      return wide;
    }
    List<ConstantRange> narrowOperands = new ArrayList<>(operands.size());
    for (int i = 0; i < operands.size(); i++) {
      ConstantRange operand = operands.get(i);
      narrowOperands.add(
          op.operand(i).type().isIndex() ? operand.forWidth(IntType.MIN_INDEX_WIDTH) : operand);
    }
    ConstantRange narrow = infer(op, narrowOperands, IntType.MIN_INDEX_WIDTH);
    return wide.union(narrow.forWidth(wide.width()));
  }

  private static boolean hasIndexType(Operation op) {
    return op.result().type().isIndex()
        || op.operands().stream().anyMatch(v -> v.type().isIndex());
  }

  /**
   * Returns a range for the result of {@code op} when {@code index} values are {@code indexWidth}
   * bits wide; index operand ranges must already be at that width.
   */
  private static ConstantRange infer(Operation op, List<ConstantRange> operands, int indexWidth) {
    int width = ArithSemantics.widthOf(op.result().type(), indexWidth);
    OpKind kind = op.kind();
    switch (kind.shape) {
      case NULLARY:
        return ConstantRange.constant(width, op.constantValue());
      case CAST:
        return inferCast(kind, operands.get(0), width);
      case COMPARE:
        {
          Boolean decided = decide(op.predicate(), operands.get(0), operands.get(1));
          return (decided == null)
              ? ConstantRange.full(1)
              : ConstantRange.constant(1, decided ? 1 : 0);
        }
      case BINARY:
        return inferBinary(kind, operands.get(0), operands.get(1), width);
      default:
        throw new IllegalArgumentException("No result range for " + kind);
    }
  }

  private static ConstantRange inferCast(OpKind kind, ConstantRange a, int width) {
    if (width == a.width()) {
      // An index cast between index and an integer of the same width.
      return a;
    }
    boolean signed = (kind == OpKind.EXT_SI || kind == OpKind.INDEX_CAST);
    if (width > a.width()) {
      return signed
          ? fromSigned(width, a.smin(), a.smax())
          : fromUnsigned(width, a.umin(), a.umax());
    }
    // Truncation preserves whichever reading already fits in the narrower width.
    return fromSigned(width, a.smin(), a.smax()).intersect(fromUnsigned(width, a.umin(), a.umax()));
  }

  private static ConstantRange inferBinary(
      OpKind kind, ConstantRange a, ConstantRange b, int width) {
    switch (kind) {
      case ADD:
        return fromSigned(width, a.smin().add(b.smin()), a.smax().add(b.smax()))
            .intersect(fromUnsigned(width, a.umin().add(b.umin()), a.umax().add(b.umax())));
      case SUB:
        {
          ConstantRange signed =
              fromSigned(width, a.smin().subtract(b.smax()), a.smax().subtract(b.smin()));
          BigInteger ulo = a.umin().subtract(b.umax());
          // If ulo is negative the subtraction may wrap.
          return (ulo.signum() < 0)
              ? signed
              : signed.intersect(fromUnsigned(width, ulo, a.umax().subtract(b.umin())));
        }
      case MUL:
        return signedCorners(width, a, b, BigInteger::multiply)
            .intersect(
                fromUnsigned(width, a.umin().multiply(b.umin()), a.umax().multiply(b.umax())));
      case DIV_UI:
        return unsignedDivision(width, a, b, BigInteger::divide);
      case CEIL_DIV_UI:
        return unsignedDivision(width, a, b, ArithSemantics::ceilDiv);
      case DIV_SI:
        return signedDivision(width, a, b, BigInteger::divide);
      case CEIL_DIV_SI:
        return signedDivision(width, a, b, ArithSemantics::ceilDiv);
      case FLOOR_DIV_SI:
        return signedDivision(width, a, b, ArithSemantics::floorDiv);
      case REM_UI:
        return unsignedRemainder(width, a, b);
      case REM_SI:
        return signedRemainder(width, a, b);
      case MIN_SI:
        return fromSigned(width, a.smin().min(b.smin()), a.smax().min(b.smax()));
      case MAX_SI:
        return fromSigned(width, a.smin().max(b.smin()), a.smax().max(b.smax()));
      case MIN_UI:
        return fromUnsigned(width, a.umin().min(b.umin()), a.umax().min(b.umax()));
      case MAX_UI:
        return fromUnsigned(width, a.umin().max(b.umin()), a.umax().max(b.umax()));
      default:
        throw new AssertionError(kind);
    }
  }

  /**
   * Applies {@code fn} to each corner of the signed rectangle {@code a x b} and returns the range
   * spanned by the results. Only valid for functions that are monotonic in each argument over the
   * rectangle.
   */
  private static ConstantRange signedCorners(
      int width, ConstantRange a, ConstantRange b, BinaryOperator<BigInteger> fn) {
    List<BigInteger> corners =
        Stream.of(
                fn.apply(a.smin(), b.smin()),
                fn.apply(a.smin(), b.smax()),
                fn.apply(a.smax(), b.smin()),
                fn.apply(a.smax(), b.smax()))
            .toList();
    BigInteger lo = corners.stream().min(BigInteger::compareTo).orElseThrow();
    BigInteger hi = corners.stream().max(BigInteger::compareTo).orElseThrow();
    return fromSigned(width, lo, hi);
  }

  private static ConstantRange unsignedDivision(
      int width, ConstantRange a, ConstantRange b, BinaryOperator<BigInteger> fn) {
    if (b.umin().signum() == 0) {
      // Dividing by anything other than zero can't increase the dividend.
      return fromUnsigned(width, BigInteger.ZERO, a.umax());
    }
    return fromUnsigned(width, fn.apply(a.umin(), b.umax()), fn.apply(a.umax(), b.umin()));
  }

  private static ConstantRange signedDivision(
      int width, ConstantRange a, ConstantRange b, BinaryOperator<BigInteger> fn) {
    if (b.containsSigned(BigInteger.ZERO)) {
      return ConstantRange.full(width);
    }
    // With a divisor of constant sign each of these divisions is monotonic in both arguments, and
    // an overflowing quotient (MIN / -1) falls outside the signed range and gives the full range.
    return signedCorners(width, a, b, fn);
  }

  private static ConstantRange unsignedRemainder(int width, ConstantRange a, ConstantRange b) {
    if (a.umax().compareTo(b.umin()) < 0) {
      // The dividend is always less than the divisor.
      return fromUnsigned(width, a.umin(), a.umax());
    }
    BigInteger hi = a.umax();
    if (b.umin().signum() > 0) {
      hi = hi.min(b.umax().subtract(BigInteger.ONE));
    }
    return fromUnsigned(width, BigInteger.ZERO, hi);
  }

  private static ConstantRange signedRemainder(int width, ConstantRange a, ConstantRange b) {
    if (b.containsSigned(BigInteger.ZERO)) {
      return ConstantRange.full(width);
    }
    BigInteger maxDivisor = b.smin().abs().max(b.smax().abs());
    BigInteger m = maxDivisor.subtract(BigInteger.ONE);
    // The result has the sign of the dividend and a smaller magnitude than the divisor.
    BigInteger lo = a.smin().signum() >= 0 ? BigInteger.ZERO : a.smin().max(m.negate());
    BigInteger hi = a.smax().signum() <= 0 ? BigInteger.ZERO : a.smax().min(m);
    return fromSigned(width, lo, hi);
  }

  /**
   * Returns the value of {@code predicate} applied to operands in ranges {@code a} and {@code b}
   * if it is the same for all such operands, or null if it may vary.
   */
  static @Nullable Boolean decide(CmpPredicate predicate, ConstantRange a, ConstantRange b) {
    return switch (predicate) {
      case EQ -> decideEq(a, b);
      case NE -> negate(decideEq(a, b));
      case SLT -> decideLess(a.smin(), a.smax(), b.smin(), b.smax(), false);
      case SLE -> decideLess(a.smin(), a.smax(), b.smin(), b.smax(), true);
      case SGT -> decideLess(b.smin(), b.smax(), a.smin(), a.smax(), false);
      case SGE -> decideLess(b.smin(), b.smax(), a.smin(), a.smax(), true);
      case ULT -> decideLess(a.umin(), a.umax(), b.umin(), b.umax(), false);
      case ULE -> decideLess(a.umin(), a.umax(), b.umin(), b.umax(), true);
      case UGT -> decideLess(b.umin(), b.umax(), a.umin(), a.umax(), false);
      case UGE -> decideLess(b.umin(), b.umax(), a.umin(), a.umax(), true);
    };
  }

  /** Decides {@code x < y} (or {@code x <= y} if {@code orEqual}) for x, y in the given ranges. */
  private static @Nullable Boolean decideLess(
      BigInteger xMin, BigInteger xMax, BigInteger yMin, BigInteger yMax, boolean orEqual) {
    int always = xMax.compareTo(yMin);
    int never = xMin.compareTo(yMax);
    if (orEqual ? always <= 0 : always < 0) {
      return true;
    } else if (orEqual ? never > 0 : never >= 0) {
      return false;
    }
    return null;
  }

  private static @Nullable Boolean decideEq(ConstantRange a, ConstantRange b) {
    if (a.isSingleValue() && b.isSingleValue()) {
      return a.singleValue().equals(b.singleValue());
    }
    boolean disjoint =
        a.smax().compareTo(b.smin()) < 0
            || b.smax().compareTo(a.smin()) < 0
            || a.umax().compareTo(b.umin()) < 0
            || b.umax().compareTo(a.umin()) < 0;
    return disjoint ? Boolean.FALSE : null;
  }

  private static @Nullable Boolean negate(@Nullable Boolean b) {
    return (b == null) ? null : !b;
  }
}
