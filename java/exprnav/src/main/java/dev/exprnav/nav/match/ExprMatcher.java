/**
 * (c) Copyright 2025 SpiralDB Inc. All rights reserved.
 * <p>
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * <p>
 * http://www.apache.org/licenses/LICENSE-2.0
 * <p>
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package dev.exprnav.nav.match;

import static com.google.common.base.Preconditions.checkNotNull;

import dev.exprnav.nav.NavigableExpr;

/**
 * Predicate over a {@link NavigableExpr}, used with {@link ExprMatchers#matchDescendants} and
 * {@link ExprMatchers#matchSubset}. Matchers must be free of side effects.
 */
@FunctionalInterface
public interface ExprMatcher {
    boolean matches(NavigableExpr expr);

    default ExprMatcher and(ExprMatcher other) {
        checkNotNull(other, "other");
        return expr -> matches(expr) && other.matches(expr);
    }

    default ExprMatcher or(ExprMatcher other) {
        checkNotNull(other, "other");
        return expr -> matches(expr) || other.matches(expr);
    }

    default ExprMatcher negate() {
        return expr -> !matches(expr);
    }
}
