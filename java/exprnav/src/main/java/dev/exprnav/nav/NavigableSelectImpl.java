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

import dev.exprnav.api.expressions.Select;
import java.util.Optional;

final class NavigableSelectImpl implements NavigableSelectExpr {
    private final NavigableExprImpl nav;
    private final Optional<Select> select;

    NavigableSelectImpl(NavigableExprImpl nav, Optional<Select> select) {
        this.nav = nav;
        this.select = select;
    }

    @Override
    public Optional<NavigableExpr> operand() {
        return select.map(s -> nav.createChild(s.getOperand()));
    }

    @Override
    public String fieldName() {
        return select.map(Select::getField).orElse("");
    }

    @Override
    public boolean isTestOnly() {
        return select.map(Select::isTestOnly).orElse(false);
    }
}
