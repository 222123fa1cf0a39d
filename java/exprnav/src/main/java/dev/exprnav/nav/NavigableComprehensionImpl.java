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

import dev.exprnav.api.Expr;
import dev.exprnav.api.expressions.Comprehension;
import java.util.Optional;
import java.util.function.Function;

final class NavigableComprehensionImpl implements NavigableComprehensionExpr {
    private final NavigableExprImpl nav;
    private final Optional<Comprehension> comprehension;

    NavigableComprehensionImpl(NavigableExprImpl nav, Optional<Comprehension> comprehension) {
        this.nav = nav;
        this.comprehension = comprehension;
    }

    @Override
    public Optional<NavigableExpr> iterRange() {
        return child(Comprehension::getIterRange);
    }

    @Override
    public String iterVar() {
        return comprehension.map(Comprehension::getIterVar).orElse("");
    }

    @Override
    public String accuVar() {
        return comprehension.map(Comprehension::getAccuVar).orElse("");
    }

    @Override
    public Optional<NavigableExpr> accuInit() {
        return child(Comprehension::getAccuInit);
    }

    @Override
    public Optional<NavigableExpr> loopCondition() {
        return child(Comprehension::getLoopCondition);
    }

    @Override
    public Optional<NavigableExpr> loopStep() {
        return child(Comprehension::getLoopStep);
    }

    @Override
    public Optional<NavigableExpr> result() {
        return child(Comprehension::getResult);
    }

    private Optional<NavigableExpr> child(Function<Comprehension, Expr> part) {
        return comprehension.map(part).map(nav::createChild);
    }
}
