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
package dev.exprnav.api;

import dev.exprnav.api.types.Type;
import java.util.Map;
import org.immutables.value.Value;

/**
 * An expression tree together with the static types the checker resolved for its nodes.
 */
@Value.Immutable
public interface CheckedAst {
    /**
     * Root of the expression tree.
     */
    Expr expr();

    /**
     * Resolved type for each node id. Ids without an entry are treated as dynamically typed.
     */
    Map<Long, Type> typeMap();

    static CheckedAst of(Expr expr, Map<Long, Type> typeMap) {
        return ImmutableCheckedAst.builder().expr(expr).typeMap(typeMap).build();
    }

    static ImmutableCheckedAst.Builder builder() {
        return ImmutableCheckedAst.builder();
    }
}
