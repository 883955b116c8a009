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

import com.google.common.base.Ascii;
import org.jspecify.annotations.Nullable;

/** The comparisons that an {@link OpKind#CMP} operation may perform. */
public enum CmpPredicate {
  EQ,
  NE,
  SLT,
  SLE,
  SGT,
  SGE,
  ULT,
  ULE,
  UGT,
  UGE;

  /** The lower-case name used in textual IR. */
  public final String mnemonic = Ascii.toLowerCase(name());

  /** True if the operands are compared as signed integers; false for unsigned and equality. */
  public boolean isSigned() {
    return this == SLT || this == SLE || this == SGT || this == SGE;
  }

  /**
   * Given the result of comparing the operands (negative, zero, or positive, as from {@link
   * Comparable#compareTo}) under the appropriate interpretation, returns the predicate's value.
   */
  public boolean holds(int comparison) {
    return switch (this) {
      case EQ -> comparison == 0;
      case NE -> comparison != 0;
      case SLT, ULT -> comparison < 0;
      case SLE, ULE -> comparison <= 0;
      case SGT, UGT -> comparison > 0;
      case SGE, UGE -> comparison >= 0;
    };
  }

  /** Returns the predicate with the given mnemonic, or null if there is none. */
  public static @Nullable CmpPredicate forMnemonic(String mnemonic) {
    for (CmpPredicate p : values()) {
      if (p.mnemonic.equals(mnemonic)) {
        return p;
      }
    }
    return null;
  }

  @Override
  public String toString() {
    return mnemonic;
  }
}
