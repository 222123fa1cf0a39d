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
package dev.exprnav.nav;

import java.util.Optional;

/**
 * Comprehension generated by a macro. The node parts are empty only when the adapter did not fit the kind.
 */
public interface NavigableComprehensionExpr {
    Optional<NavigableExpr> iterRange();

    String iterVar();

    String accuVar();

    Optional<NavigableExpr> accuInit();

    Optional<NavigableExpr> loopCondition();

    Optional<NavigableExpr> loopStep();

    Optional<NavigableExpr> result();
}
