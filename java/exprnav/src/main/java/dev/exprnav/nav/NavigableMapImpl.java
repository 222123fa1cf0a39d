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
import dev.exprnav.api.expressions.CreateStruct;
import java.util.List;
import java.util.Optional;

final class NavigableMapImpl implements NavigableMapExpr {
    private final NavigableExprImpl nav;
    private final Optional<CreateStruct> map;

    NavigableMapImpl(NavigableExprImpl nav, Optional<CreateStruct> map) {
        this.nav = nav;
        this.map = map;
    }

    @Override
    public List<NavigableEntry> entries() {
        if (map.isEmpty()) {
            return ImmutableList.of();
        }
        List<CreateStruct.Entry> rawEntries = map.get().getEntries();
        ImmutableList.Builder<NavigableEntry> entries = ImmutableList.builderWithExpectedSize(rawEntries.size());
        for (CreateStruct.Entry entry : rawEntries) {
            entries.add(ImmutableNavigableEntry.of(
                    nav.createChild(entry.getMapKey().orElseThrow()),
                    nav.createChild(entry.getValue()),
                    entry.isOptionalEntry()));
        }
        return entries.build();
    }

    @Override
    public int size() {
        return map.map(m -> m.getEntries().size()).orElse(0);
    }
}
