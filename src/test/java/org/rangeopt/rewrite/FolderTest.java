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

package org.rangeopt.rewrite;

import static com.google.common.truth.Truth.assertThat;

import java.math.BigInteger;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.rangeopt.ir.CmpPredicate;
import org.rangeopt.ir.IntType;
import org.rangeopt.ir.OpKind;
import org.rangeopt.ir.Operation;
import org.rangeopt.ir.Region;
import org.rangeopt.ir.Value;

@RunWith(JUnit4.class)
public class FolderTest {

  private final Region region = new Region();
  private final PatternRewriter rewriter = new PatternRewriter(region, new RewriteListener() {});

  /** Folds the operation defining {@code v}, and returns the value that replaced it (or null). */
  private Value fold(Value v) {
    Operation ret = region.ret(v);
    if (!Folder.tryFold(v.definingOp(), rewriter)) {
      return null;
    }
    assertThat(v.definingOp().isErased()).isTrue();
    return ret.operand(0);
  }

  private static BigInteger constantValue(Value v) {
    assertThat(v.definingOp().kind()).isEqualTo(OpKind.CONSTANT);
    return v.definingOp().constantValue();
  }

  @Test
  public void foldsWrappingArithmetic() {
    Value sum =
        region.add(
            OpKind.ADD,
            IntType.I8,
            region.constant(IntType.I8, 200),
            region.constant(IntType.I8, 100));
    // 300 wraps to 44.
    assertThat(constantValue(fold(sum))).isEqualTo(BigInteger.valueOf(44));
  }

  @Test
  public void foldsSignedDivision() {
    Value quotient =
        region.add(
            OpKind.FLOOR_DIV_SI,
            IntType.I32,
            region.constant(IntType.I32, -7),
            region.constant(IntType.I32, 2));
    assertThat(constantValue(fold(quotient))).isEqualTo(BigInteger.valueOf(-4));
  }

  @Test
  public void foldsComparison() {
    Value lt =
        region.compare(
            CmpPredicate.ULT, region.constant(IntType.I16, -1), region.constant(IntType.I16, 5));
    // -1 is the largest unsigned value.
    assertThat(constantValue(fold(lt))).isEqualTo(BigInteger.ZERO);
  }

  @Test
  public void foldsCasts() {
    Value ext = region.add(OpKind.EXT_SI, IntType.I32, region.constant(IntType.I8, -3));
    assertThat(constantValue(fold(ext))).isEqualTo(BigInteger.valueOf(-3));
  }

  @Test
  public void foldsIdentityCast() {
    Value a = region.addArgument(IntType.I64);
    Value cast = region.add(OpKind.INDEX_CAST_UI, IntType.INDEX, a);
    // As left by retyping a producer.
    a.setType(IntType.INDEX);
    assertThat(fold(cast)).isSameInstanceAs(a);
  }

  @Test
  public void doesNotFoldUndefinedBehavior() {
    Value divByZero =
        region.add(
            OpKind.DIV_UI,
            IntType.I8,
            region.constant(IntType.I8, 1),
            region.constant(IntType.I8, 0));
    assertThat(fold(divByZero)).isNull();
    Value overflow =
        region.add(
            OpKind.DIV_SI,
            IntType.I8,
            region.constant(IntType.I8, -128),
            region.constant(IntType.I8, -1));
    assertThat(fold(overflow)).isNull();
  }

  @Test
  public void doesNotFoldNonConstants() {
    Value a = region.addArgument(IntType.I32);
    Value product = region.add(OpKind.MUL, IntType.I32, a, region.constant(IntType.I32, 1));
    assertThat(fold(product)).isNull();
  }

  @Test
  public void doesNotFoldIndexValues() {
    Value cast = region.add(OpKind.INDEX_CAST, IntType.INDEX, region.constant(IntType.I32, 5));
    assertThat(fold(cast)).isNull();
  }
}
