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

import com.google.common.collect.ImmutableList;
import org.rangeopt.ir.OpKind;
import org.rangeopt.rewrite.RewritePattern;

/** Static-only class that assembles the patterns applied by {@link OptimizeIntArithmetic}. */
public class ArithPatterns {

  private ArithPatterns() {}

  /**
   * Returns the signed-to-unsigned conversions (one per entry of {@link
   * ConvertOpToUnsigned#SIGNED_TO_UNSIGNED}) and index cast sinking.
   */
  public static ImmutableList<RewritePattern> unsignedPatterns(UnsignedLegality legality) {
    ImmutableList.Builder<RewritePattern> builder = ImmutableList.builder();
    for (OpKind kind : ConvertOpToUnsigned.SIGNED_TO_UNSIGNED.keySet()) {
      builder.add(new ConvertOpToUnsigned(kind, legality));
    }
    builder.add(new SinkIndexCastIntoProducer(legality));
    return builder.build();
  }

  /** Returns every pattern used by {@link OptimizeIntArithmetic}. */
  public static ImmutableList<RewritePattern> all(UnsignedLegality legality) {
    return ImmutableList.<RewritePattern>builder()
        .addAll(unsignedPatterns(legality))
        .add(new MaterializeKnownConstant(legality.query()))
        .add(new DeleteTrivialRem(OpKind.REM_UI, legality))
        .add(new DeleteTrivialRem(OpKind.REM_SI, legality))
        .addAll(ArithCanonicalizations.patterns())
        .build();
  }
}
