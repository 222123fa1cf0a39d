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

import com.google.common.collect.ImmutableList;
import dev.exprnav.api.expressions.CreateList;
import java.util.List;
import java.util.Optional;

final class NavigableListImpl implements NavigableListExpr {
    private final NavigableExprImpl nav;
    private final Optional<CreateList> list;

    NavigableListImpl(NavigableExprImpl nav, Optional<CreateList> list) {
        this.nav = nav;
        this.list = list;
    }

    @Override
    public List<NavigableExpr> elements() {
        return list.isPresent() ? nav.children() : ImmutableList.of();
    }

    @Override
    public List<Integer> optionalIndices() {
        return list.map(CreateList::getOptionalIndices).orElse(ImmutableList.of());
    }

    @Override
    public int size() {
        return list.map(l -> l.getElements().size()).orElse(0);
    }
}
