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

package org.rangeopt.util;

import java.util.List;
import java.util.function.IntFunction;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/** Static-only class with methods for building strings for printing and logging. */
public class StringUtil {

  private StringUtil() {}

  /**
   * Constructs a string by calling the given IntFunction for each int from 0 to size-1, calling
   * {@code String.valueOf()} on each element, separating them with {@code ", "}, and adding the
   * given prefix and suffix.
   */
  public static String joinElements(
      String prefix, String suffix, int size, IntFunction<Object> elements) {
    assert size >= 0;
    return IntStream.range(0, size)
        .mapToObj(i -> String.valueOf(elements.apply(i)))
        .collect(Collectors.joining(", ", prefix, suffix));
  }

  /** Joins the elements of {@code list} as {@link #joinElements} does. */
  public static String joinAll(String prefix, String suffix, List<?> list) {
    return joinElements(prefix, suffix, list.size(), list::get);
  }

  private static final int ID_LENGTH = 4;

  /**
   * Returns a short, arbitrary string useful for telling apart values and operations that print
   * the same way.
   */
  public static String id(Object x) {
    if (x == null) {
      return "null";
    }
    String hash = Integer.toHexString(System.identityHashCode(x));
    return hash.substring(Math.max(0, hash.length() - ID_LENGTH));
  }
}
