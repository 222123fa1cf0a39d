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
package dev.exprnav.api.expressions;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.primitives.Ints;
import dev.exprnav.api.Expr;
import java.util.List;
import java.util.Objects;

/**
 * List literal {@code [e1, ?e2, ...]}. Elements at the optional indices are only included when their value is
 * present.
 */
public final class CreateList implements Expr {
    private final long id;
    private final ImmutableList<Expr> elements;
    private final ImmutableList<Integer> optionalIndices;

    private CreateList(long id, List<Expr> elements, List<Integer> optionalIndices) {
        this.id = id;
        this.elements = ImmutableList.copyOf(elements);
        this.optionalIndices = ImmutableList.copyOf(optionalIndices);
        for (int index : this.optionalIndices) {
            checkArgument(
                    index >= 0 && index < this.elements.size(),
                    "optional index %s out of range for %s elements",
                    index,
                    this.elements.size());
        }
    }

    public static CreateList of(long id, Expr... elements) {
        return new CreateList(id, ImmutableList.copyOf(elements), ImmutableList.of());
    }

    public static CreateList of(long id, List<Expr> elements, int... optionalIndices) {
        return new CreateList(id, elements, Ints.asList(optionalIndices));
    }

    @Override
    public long id() {
        return id;
    }

    public List<Expr> getElements() {
        return elements;
    }

    public List<Integer> getOptionalIndices() {
        return optionalIndices;
    }

    @Override
    public String type() {
        return "list";
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
        return visitor.visitCreateList(this);
    }

    @Override
    public String toString() {
        return "[" + Joiner.on(", ").join(elements) + "]";
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        CreateList that = (CreateList) o;
        return id == that.id
                && Objects.equals(elements, that.elements)
                && Objects.equals(optionalIndices, that.optionalIndices);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, elements, optionalIndices);
    }
}
