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

import static org.rangeopt.ir.ArithSemantics.modulus;
import static org.rangeopt.ir.ArithSemantics.signedMax;
import static org.rangeopt.ir.ArithSemantics.signedMin;
import static org.rangeopt.ir.ArithSemantics.unsignedMax;

import com.google.common.base.Preconditions;
import java.math.BigInteger;
import java.util.Objects;
import org.rangeopt.ir.ArithSemantics;

/**
 * A ConstantRange describes the possible runtime values of a {@code width}-bit integer twice: as an
 * interval {@code [smin, smax]} of its signed reading and as an interval {@code [umin, umax]} of
 * its unsigned reading. Both intervals are sound over-approximations of the same set of bit
 * patterns, so each may be tighter than the other.
 *
 * <p>The range of an {@code index} value is kept at its widest possible width, and covers every
 * target: on a target with a narrower index the value's signed reading still lies in {@code [smin,
 * smax]}, and its unsigned reading in {@code [umin, umax]} (see {@link #forWidth}).
 *
 * <p>ConstantRanges are immutable.
 */
public final class ConstantRange {

  private final int width;
  private final BigInteger smin;
  private final BigInteger smax;
  private final BigInteger umin;
  private final BigInteger umax;

  private ConstantRange(
      int width, BigInteger smin, BigInteger smax, BigInteger umin, BigInteger umax) {
    assert smin.compareTo(smax) <= 0 && umin.compareTo(umax) <= 0;
    this.width = width;
    this.smin = smin;
    this.smax = smax;
    this.umin = umin;
    this.umax = umax;
  }

  /** The range that includes every {@code width}-bit value. */
  public static ConstantRange full(int width) {
    return new ConstantRange(
        width, signedMin(width), signedMax(width), BigInteger.ZERO, unsignedMax(width));
  }

  /** The range containing just {@code value} (which is reduced modulo {@code 2^width}). */
  public static ConstantRange constant(int width, BigInteger value) {
    BigInteger s = ArithSemantics.toSigned(value, width);
    BigInteger u = ArithSemantics.toUnsigned(value, width);
    return new ConstantRange(width, s, s, u, u);
  }

  public static ConstantRange constant(int width, long value) {
    return constant(width, BigInteger.valueOf(value));
  }

  /**
   * Returns the range of values whose signed reading lies in {@code [lo, hi]}, or the full range if
   * that interval does not fit in {@code width} signed bits (i.e. the computation that produced it
   * could overflow).
   */
  public static ConstantRange fromSigned(int width, BigInteger lo, BigInteger hi) {
    Preconditions.checkArgument(lo.compareTo(hi) <= 0, "Empty range [%s, %s]", lo, hi);
    if (lo.compareTo(signedMin(width)) < 0 || hi.compareTo(signedMax(width)) > 0) {
      return full(width);
    }
    if (lo.signum() >= 0) {
      return new ConstantRange(width, lo, hi, lo, hi);
    } else if (hi.signum() < 0) {
      BigInteger m = modulus(width);
      return new ConstantRange(width, lo, hi, lo.add(m), hi.add(m));
    }
    // The interval includes both -1 and 0, which are the largest and smallest unsigned values.
    return new ConstantRange(width, lo, hi, BigInteger.ZERO, unsignedMax(width));
  }

  public static ConstantRange fromSigned(int width, long lo, long hi) {
    return fromSigned(width, BigInteger.valueOf(lo), BigInteger.valueOf(hi));
  }

  /**
   * Returns the range of values whose unsigned reading lies in {@code [lo, hi]}, or the full range
   * if that interval does not fit in {@code width} unsigned bits.
   */
  public static ConstantRange fromUnsigned(int width, BigInteger lo, BigInteger hi) {
    Preconditions.checkArgument(lo.compareTo(hi) <= 0, "Empty range [%s, %s]", lo, hi);
    if (lo.signum() < 0 || hi.compareTo(unsignedMax(width)) > 0) {
      return full(width);
    }
    BigInteger sMax = signedMax(width);
    if (hi.compareTo(sMax) <= 0) {
      return new ConstantRange(width, lo, hi, lo, hi);
    } else if (lo.compareTo(sMax) > 0) {
      BigInteger m = modulus(width);
      return new ConstantRange(width, lo.subtract(m), hi.subtract(m), lo, hi);
    }
    // The interval includes both the largest and smallest signed values.
    return new ConstantRange(width, signedMin(width), sMax, lo, hi);
  }

  public static ConstantRange fromUnsigned(int width, long lo, long hi) {
    return fromUnsigned(width, BigInteger.valueOf(lo), BigInteger.valueOf(hi));
  }

  /**
   * Returns a range that includes only values in both {@code this} and {@code other}. Both ranges
   * must describe the same (non-empty) set of values, e.g. because they were computed from the
   * signed and unsigned readings of the same operation's inputs.
   */
  public ConstantRange intersect(ConstantRange other) {
    Preconditions.checkArgument(width == other.width, "Width mismatch");
    return new ConstantRange(
        width,
        smin.max(other.smin),
        smax.min(other.smax),
        umin.max(other.umin),
        umax.min(other.umax));
  }

  /**
   * Returns the smallest range that includes every value of both {@code this} and {@code other},
   * taking the hull of each reading separately.
   */
  public ConstantRange union(ConstantRange other) {
    Preconditions.checkArgument(width == other.width, "Width mismatch");
    return new ConstantRange(
        width,
        smin.min(other.smin),
        smax.max(other.smax),
        umin.min(other.umin),
        umax.max(other.umax));
  }

  /**
   * Returns this range as seen at {@code newWidth} bits, treating each reading separately: each
   * interval is clamped to the values representable at the new width, and a reading with no
   * representable value becomes unconstrained. Widening a range this way sign-extends its signed
   * reading and zero-extends its unsigned reading.
   *
   * <p>Used for {@code index} values, whose ranges describe the same signed and unsigned readings
   * on targets of different widths.
   */
  public ConstantRange forWidth(int newWidth) {
    BigInteger sLo = smin.max(signedMin(newWidth));
    BigInteger sHi = smax.min(signedMax(newWidth));
    if (sLo.compareTo(sHi) > 0) {
      sLo = signedMin(newWidth);
      sHi = signedMax(newWidth);
    }
    BigInteger uLo = umin;
    BigInteger uHi = umax.min(unsignedMax(newWidth));
    if (uLo.compareTo(uHi) > 0) {
      uLo = BigInteger.ZERO;
      uHi = unsignedMax(newWidth);
    }
    return new ConstantRange(newWidth, sLo, sHi, uLo, uHi);
  }

  public int width() {
    return width;
  }

  public BigInteger smin() {
    return smin;
  }

  public BigInteger smax() {
    return smax;
  }

  public BigInteger umin() {
    return umin;
  }

  public BigInteger umax() {
    return umax;
  }

  /** True if the signed reading of every value in this range is non-negative. */
  public boolean isNonNegative() {
    return smin.signum() >= 0;
  }

  /** True if the signed reading of {@code value} is a possible member of this range. */
  public boolean containsSigned(BigInteger value) {
    return smin.compareTo(value) <= 0 && value.compareTo(smax) <= 0;
  }

  /** True if this range contains exactly one value. */
  public boolean isSingleValue() {
    return smin.equals(smax) || umin.equals(umax);
  }

  /** If {@link #isSingleValue}, returns that value's signed reading. */
  public BigInteger singleValue() {
    Preconditions.checkState(isSingleValue());
    return smin.equals(smax) ? smin : ArithSemantics.toSigned(umin, width);
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof ConstantRange other
        && width == other.width
        && smin.equals(other.smin)
        && smax.equals(other.smax)
        && umin.equals(other.umin)
        && umax.equals(other.umax);
  }

  @Override
  public int hashCode() {
    return Objects.hash(width, smin, smax, umin, umax);
  }

  @Override
  public String toString() {
    return String.format("i%d s[%s, %s] u[%s, %s]", width, smin, smax, umin, umax);
  }
}
