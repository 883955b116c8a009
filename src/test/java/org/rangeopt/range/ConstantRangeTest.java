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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import java.math.BigInteger;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class ConstantRangeTest {

  @Test
  public void full() {
    assertThat(ConstantRange.full(8).toString()).isEqualTo("i8 s[-128, 127] u[0, 255]");
    assertThat(ConstantRange.full(1).toString()).isEqualTo("i1 s[-1, 0] u[0, 1]");
  }

  @Test
  public void constant() {
    ConstantRange r = ConstantRange.constant(8, 255);
    assertThat(r.toString()).isEqualTo("i8 s[-1, -1] u[255, 255]");
    assertThat(r.isSingleValue()).isTrue();
    assertThat(r.singleValue()).isEqualTo(BigInteger.valueOf(-1));
    assertThat(ConstantRange.constant(8, -1)).isEqualTo(r);
  }

  @Test
  public void fromSigned() {
    assertThat(ConstantRange.fromSigned(8, 3, 5).toString()).isEqualTo("i8 s[3, 5] u[3, 5]");
    assertThat(ConstantRange.fromSigned(8, -3, -1).toString())
        .isEqualTo("i8 s[-3, -1] u[253, 255]");
    // Spans -1 and 0, so the unsigned reading is unconstrained.
    assertThat(ConstantRange.fromSigned(8, -3, 5).toString())
        .isEqualTo("i8 s[-3, 5] u[0, 255]");
    // Doesn't fit.
    assertThat(ConstantRange.fromSigned(8, 0, 200)).isEqualTo(ConstantRange.full(8));
    assertThat(ConstantRange.fromSigned(8, -129, 0)).isEqualTo(ConstantRange.full(8));
  }

  @Test
  public void fromUnsigned() {
    assertThat(ConstantRange.fromUnsigned(8, 200, 250).toString())
        .isEqualTo("i8 s[-56, -6] u[200, 250]");
    assertThat(ConstantRange.fromUnsigned(8, 100, 200).toString())
        .isEqualTo("i8 s[-128, 127] u[100, 200]");
    assertThat(ConstantRange.fromUnsigned(8, 0, 256)).isEqualTo(ConstantRange.full(8));
    assertThat(ConstantRange.fromUnsigned(8, -1, 5)).isEqualTo(ConstantRange.full(8));
  }

  @Test
  public void emptyIntervalsAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> ConstantRange.fromSigned(8, 5, 4));
    assertThrows(IllegalArgumentException.class, () -> ConstantRange.fromUnsigned(8, 5, 4));
  }

  @Test
  public void intersect() {
    ConstantRange r =
        ConstantRange.fromSigned(8, -3, 5).intersect(ConstantRange.fromUnsigned(8, 0, 200));
    assertThat(r.toString()).isEqualTo("i8 s[-3, 5] u[0, 200]");
    assertThrows(
        IllegalArgumentException.class,
        () -> ConstantRange.full(8).intersect(ConstantRange.full(16)));
  }

  @Test
  public void union() {
    ConstantRange r = ConstantRange.fromSigned(8, 1, 3).union(ConstantRange.fromSigned(8, -2, -1));
    assertThat(r.toString()).isEqualTo("i8 s[-2, 3] u[1, 255]");
    assertThrows(
        IllegalArgumentException.class,
        () -> ConstantRange.full(8).union(ConstantRange.full(16)));
  }

  @Test
  public void forWidth() {
    // Widening keeps both readings.
    assertThat(ConstantRange.fromSigned(32, -1, 1).forWidth(64).toString())
        .isEqualTo("i64 s[-1, 1] u[0, 4294967295]");
    // Narrowing clamps each reading separately.
    assertThat(ConstantRange.fromUnsigned(64, 0, 4294967300L).forWidth(32).toString())
        .isEqualTo("i32 s[0, 2147483647] u[0, 4294967295]");
    // No value of this range is representable in 32 bits.
    assertThat(ConstantRange.fromSigned(64, 1L << 32, 1L << 33).forWidth(32))
        .isEqualTo(ConstantRange.full(32));
  }

  @Test
  public void singleValueFromEitherReading() {
    // Only the unsigned reading identifies the value.
    ConstantRange r =
        ConstantRange.fromUnsigned(8, 127, 128).intersect(ConstantRange.fromUnsigned(8, 128, 200));
    assertThat(r.toString()).isEqualTo("i8 s[-128, -56] u[128, 128]");
    assertThat(r.isSingleValue()).isTrue();
    assertThat(r.singleValue()).isEqualTo(BigInteger.valueOf(-128));
    assertThat(ConstantRange.fromSigned(8, 1, 2).isSingleValue()).isFalse();
    assertThrows(IllegalStateException.class, () -> ConstantRange.full(8).singleValue());
  }

  @Test
  public void predicates() {
    ConstantRange r = ConstantRange.fromSigned(16, -2, 7);
    assertThat(r.isNonNegative()).isFalse();
    assertThat(ConstantRange.fromSigned(16, 0, 7).isNonNegative()).isTrue();
    assertThat(r.containsSigned(BigInteger.ZERO)).isTrue();
    assertThat(r.containsSigned(BigInteger.valueOf(8))).isFalse();
    assertThat(r.width()).isEqualTo(16);
  }
}
