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

package org.rangeopt.ir;

import java.math.BigInteger;
import java.util.List;

/**
 * Static-only class defining the concrete behavior of each {@link OpKind}.
 *
 * <p>Runtime values are represented as non-negative BigIntegers less than {@code 2^width} (the
 * "unsigned canonical" form); {@link #toSigned} converts to the signed reading. Behavior that is
 * undefined at runtime (division by zero, signed division overflow) throws an ArithmeticException.
 */
public class ArithSemantics {

  private ArithSemantics() {}

  /** Returns {@code 2^width}. */
  public static BigInteger modulus(int width) {
    return BigInteger.ONE.shiftLeft(width);
  }

  /** The smallest signed integer representable in {@code width} bits. */
  public static BigInteger signedMin(int width) {
    return BigInteger.ONE.shiftLeft(width - 1).negate();
  }

  /** The largest signed integer representable in {@code width} bits. */
  public static BigInteger signedMax(int width) {
    return BigInteger.ONE.shiftLeft(width - 1).subtract(BigInteger.ONE);
  }

  /** The largest unsigned integer representable in {@code width} bits. */
  public static BigInteger unsignedMax(int width) {
    return modulus(width).subtract(BigInteger.ONE);
  }

  /** Reduces {@code v} modulo {@code 2^width}. */
  public static BigInteger toUnsigned(BigInteger v, int width) {
    return v.mod(modulus(width));
  }

  /** Returns the signed reading of the low {@code width} bits of {@code v}. */
  public static BigInteger toSigned(BigInteger v, int width) {
    BigInteger u = toUnsigned(v, width);
    return u.testBit(width - 1) ? u.subtract(modulus(width)) : u;
  }

  /** Integer division rounding towards negative infinity. */
  public static BigInteger floorDiv(BigInteger a, BigInteger b) {
    BigInteger[] qr = a.divideAndRemainder(b);
    if (qr[1].signum() != 0 && qr[1].signum() != b.signum()) {
      return qr[0].subtract(BigInteger.ONE);
    }
    return qr[0];
  }

  /** Integer division rounding towards positive infinity. */
  public static BigInteger ceilDiv(BigInteger a, BigInteger b) {
    BigInteger[] qr = a.divideAndRemainder(b);
    if (qr[1].signum() != 0 && qr[1].signum() == b.signum()) {
      return qr[0].add(BigInteger.ONE);
    }
    return qr[0];
  }

  /** The number of bits used for values of {@code type} when {@code index} has the given width. */
  public static int widthOf(IntType type, int indexWidth) {
    return type.isIndex() ? indexWidth : type.width();
  }

  /**
   * Computes the result of {@code op} given its operand values (in unsigned canonical form), with
   * {@code index} values {@code indexWidth} bits wide. Returns the result in unsigned canonical
   * form.
   */
  public static BigInteger evaluate(Operation op, List<BigInteger> args, int indexWidth) {
    OpKind kind = op.kind();
    int width = widthOf(op.result().type(), indexWidth);
    switch (kind.shape) {
      case NULLARY:
        return toUnsigned(op.constantValue(), width);
      case CAST:
        return evaluateCast(kind, args.get(0), widthOf(op.operand(0).type(), indexWidth), width);
      case COMPARE:
        {
          int opWidth = widthOf(op.operand(0).type(), indexWidth);
          CmpPredicate predicate = op.predicate();
          int comparison =
              predicate.isSigned()
                  ? toSigned(args.get(0), opWidth).compareTo(toSigned(args.get(1), opWidth))
                  : args.get(0).compareTo(args.get(1));
          return predicate.holds(comparison) ? BigInteger.ONE : BigInteger.ZERO;
        }
      case BINARY:
        return evaluateBinary(kind, args.get(0), args.get(1), width);
      default:
        throw new IllegalArgumentException("Cannot evaluate " + kind);
    }
  }

  private static BigInteger evaluateCast(OpKind kind, BigInteger a, int fromWidth, int toWidth) {
    boolean widening = toWidth > fromWidth;
    return switch (kind) {
      case EXT_SI -> toUnsigned(toSigned(a, fromWidth), toWidth);
      case EXT_UI -> a;
      case TRUNC -> toUnsigned(a, toWidth);
      case INDEX_CAST ->
          widening ? toUnsigned(toSigned(a, fromWidth), toWidth) : toUnsigned(a, toWidth);
      case INDEX_CAST_UI -> toUnsigned(a, toWidth);
      default -> throw new AssertionError();
    };
  }

  private static BigInteger evaluateBinary(OpKind kind, BigInteger a, BigInteger b, int width) {
    BigInteger sa = toSigned(a, width);
    BigInteger sb = toSigned(b, width);
    BigInteger result;
    switch (kind) {
      case ADD -> result = a.add(b);
      case SUB -> result = a.subtract(b);
      case MUL -> result = a.multiply(b);
      case DIV_SI -> result = checkSigned(sa.divide(checkDivisor(sb)), width);
      case DIV_UI -> result = a.divide(checkDivisor(b));
      case CEIL_DIV_SI -> result = checkSigned(ceilDiv(sa, checkDivisor(sb)), width);
      case CEIL_DIV_UI -> result = ceilDiv(a, checkDivisor(b));
      case FLOOR_DIV_SI -> result = checkSigned(floorDiv(sa, checkDivisor(sb)), width);
      case REM_SI -> result = sa.remainder(checkDivisor(sb));
      case REM_UI -> result = a.mod(checkDivisor(b));
      case MIN_SI -> result = sa.min(sb);
      case MIN_UI -> result = a.min(b);
      case MAX_SI -> result = sa.max(sb);
      case MAX_UI -> result = a.max(b);
      default -> throw new AssertionError();
    }
    return toUnsigned(result, width);
  }

  private static BigInteger checkDivisor(BigInteger divisor) {
    if (divisor.signum() == 0) {
      throw new ArithmeticException("division by zero");
    }
    return divisor;
  }

  private static BigInteger checkSigned(BigInteger quotient, int width) {
    if (quotient.compareTo(signedMax(width)) > 0) {
      throw new ArithmeticException("signed division overflow");
    }
    return quotient;
  }
}
