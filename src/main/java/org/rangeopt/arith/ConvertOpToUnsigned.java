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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import org.rangeopt.ir.OpKind;
import org.rangeopt.ir.Operation;
import org.rangeopt.rewrite.PatternRewriter;
import org.rangeopt.rewrite.RewritePattern;

/**
 * Replaces a signed operation with its unsigned counterpart when all of its operands and results
 * are known to be non-negative (see {@link UnsignedLegality#operationSafeToUnsign}). Operands,
 * result type and attributes are unchanged.
 */
public class ConvertOpToUnsigned extends RewritePattern {

  /**
   * Each signed kind that can be converted, and its replacement. Floor division maps to plain
   * unsigned division, since floor and truncating division agree on non-negative operands.
   */
  public static final ImmutableMap<OpKind, OpKind> SIGNED_TO_UNSIGNED =
      ImmutableMap.<OpKind, OpKind>builder()
          .put(OpKind.CEIL_DIV_SI, OpKind.CEIL_DIV_UI)
          .put(OpKind.DIV_SI, OpKind.DIV_UI)
          .put(OpKind.FLOOR_DIV_SI, OpKind.DIV_UI)
          .put(OpKind.INDEX_CAST, OpKind.INDEX_CAST_UI)
          .put(OpKind.REM_SI, OpKind.REM_UI)
          .put(OpKind.MIN_SI, OpKind.MIN_UI)
          .put(OpKind.MAX_SI, OpKind.MAX_UI)
          .put(OpKind.EXT_SI, OpKind.EXT_UI)
          .buildOrThrow();

  private final UnsignedLegality legality;
  private final OpKind unsignedKind;

  /** {@code signedKind} must be one of the keys of {@link #SIGNED_TO_UNSIGNED}. */
  public ConvertOpToUnsigned(OpKind signedKind, UnsignedLegality legality) {
    super(signedKind);
    Preconditions.checkArgument(
        SIGNED_TO_UNSIGNED.containsKey(signedKind), "%s has no unsigned counterpart", signedKind);
    this.unsignedKind = SIGNED_TO_UNSIGNED.get(signedKind);
    this.legality = legality;
  }

  @Override
  public boolean matchAndRewrite(Operation op, PatternRewriter rewriter) {
    if (!legality.operationSafeToUnsign(op)) {
      return false;
    }
    rewriter.replaceOpWithNewOp(
        op, unsignedKind, op.result().type(), op.operands(), op.attributes());
    return true;
  }
}
