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

/**
 * The outcome of {@link GreedyPatternRewriter#apply}.
 *
 * @param changed true if the IR was changed at all
 * @param converged true if the final scan of the region made no changes
 * @param numRewrites the number of successful pattern applications, folds, and dead operation
 *     removals
 */
public record GreedyRewriteResult(boolean changed, boolean converged, int numRewrites) {}
