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
import dev.exprnav.api.expressions.Comprehension;
import dev.exprnav.api.expressions.CreateList;
import dev.exprnav.api.expressions.CreateStruct;
import dev.exprnav.api.expressions.Select;
import java.util.List;

/**
 * Builds the children of a node. Each {@link ExprKind} has exactly one factory, picked by {@link ExprClassifier}.
 */
@FunctionalInterface
interface ChildFactory {
    ChildFactory NONE = nav -> ImmutableList.of();

    ChildFactory SELECT = nav -> ImmutableList.of(nav.createChild(((Select) nav.variant()).getOperand()));

    /**
     * Target first when present, then the arguments.
     */
    ChildFactory CALL = nav -> {
        Call call = (Call) nav.variant();
        ImmutableList.Builder<NavigableExpr> children = ImmutableList.builderWithExpectedSize(call.getArgs().size() + 1);
        call.getTarget().ifPresent(target -> children.add(nav.createChild(target)));
        return children.addAll(nav.createChildren(call.getArgs())).build();
    };

    ChildFactory LIST = nav -> nav.createChildren(((CreateList) nav.variant()).getElements());

    /**
     * Field values only, field names are not nodes.
     */
    ChildFactory STRUCT = nav -> {
        List<CreateStruct.Entry> entries = ((CreateStruct) nav.variant()).getEntries();
        ImmutableList.Builder<NavigableExpr> children = ImmutableList.builderWithExpectedSize(entries.size());
        for (CreateStruct.Entry entry : entries) {
            children.add(nav.createChild(entry.getValue()));
        }
        return children.build();
    };

    /**
     * Each key immediately followed by its value.
     */
    ChildFactory MAP = nav -> {
        List<CreateStruct.Entry> entries = ((CreateStruct) nav.variant()).getEntries();
        ImmutableList.Builder<NavigableExpr> children = ImmutableList.builderWithExpectedSize(entries.size() * 2);
        for (CreateStruct.Entry entry : entries) {
            children.add(nav.createChild(entry.getMapKey().orElseThrow()));
            children.add(nav.createChild(entry.getValue()));
        }
        return children.build();
    };

    ChildFactory COMPREHENSION = nav -> {
        Comprehension comprehension = (Comprehension) nav.variant();
        return ImmutableList.of(
                nav.createChild(comprehension.getIterRange()),
                nav.createChild(comprehension.getAccuInit()),
                nav.createChild(comprehension.getLoopCondition()),
                nav.createChild(comprehension.getLoopStep()),
                nav.createChild(comprehension.getResult()));
    };

    List<NavigableExpr> create(NavigableExprImpl nav);
}
