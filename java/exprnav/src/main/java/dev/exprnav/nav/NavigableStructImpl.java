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

final class NavigableStructImpl implements NavigableStructExpr {
    private final NavigableExprImpl nav;
    private final Optional<CreateStruct> struct;

    NavigableStructImpl(NavigableExprImpl nav, Optional<CreateStruct> struct) {
        this.nav = nav;
        this.struct = struct;
    }

    @Override
    public String typeName() {
        return struct.map(CreateStruct::getMessageName).orElse("");
    }

    @Override
    public List<NavigableField> fields() {
        if (struct.isEmpty()) {
            return ImmutableList.of();
        }
        List<CreateStruct.Entry> fieldInits = struct.get().getEntries();
        ImmutableList.Builder<NavigableField> fields = ImmutableList.builderWithExpectedSize(fieldInits.size());
        for (CreateStruct.Entry field : fieldInits) {
            fields.add(ImmutableNavigableField.of(
                    field.getFieldKey().orElse(""), nav.createChild(field.getValue()), field.isOptionalEntry()));
        }
        return fields.build();
    }
}
