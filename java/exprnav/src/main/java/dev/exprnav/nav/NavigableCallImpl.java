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
import dev.exprnav.api.expressions.Call;
import dev.exprnav.api.types.Type;
import java.util.List;
import java.util.Optional;

final class NavigableCallImpl implements NavigableCallExpr {
    private final NavigableExprImpl nav;
    private final Optional<Call> call;

    NavigableCallImpl(NavigableExprImpl nav, Optional<Call> call) {
        this.nav = nav;
        this.call = call;
    }

    @Override
    public String functionName() {
        return call.map(Call::getFunction).orElse("");
    }

    @Override
    public Optional<NavigableExpr> target() {
        return call.flatMap(Call::getTarget).map(nav::createChild);
    }

    @Override
    public List<NavigableExpr> args() {
        return call.map(c -> nav.createChildren(c.getArgs())).orElse(ImmutableList.of());
    }

    @Override
    public Type returnType() {
        return nav.type();
    }
}
