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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import dev.exprnav.api.Expr;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Function call. Receiver-style calls such as {@code name.greet()} carry the receiver as the target, which is never
 * part of {@link #getArgs()}.
 */
public final class Call implements Expr {
    private final long id;
    private final String function;
    private final Optional<Expr> target;
    private final ImmutableList<Expr> args;

    private Call(long id, String function, Optional<Expr> target, List<Expr> args) {
        this.id = id;
        this.function = checkNotNull(function, "function");
        this.target = target;
        this.args = ImmutableList.copyOf(args);
    }

    public static Call function(long id, String function, Expr... args) {
        return new Call(id, function, Optional.empty(), ImmutableList.copyOf(args));
    }

    public static Call function(long id, String function, List<Expr> args) {
        return new Call(id, function, Optional.empty(), args);
    }

    public static Call method(long id, String function, Expr target, Expr... args) {
        return new Call(id, function, Optional.of(checkNotNull(target, "target")), ImmutableList.copyOf(args));
    }

    @Override
    public long id() {
        return id;
    }

    public String getFunction() {
        return function;
    }

    public Optional<Expr> getTarget() {
        return target;
    }

    public List<Expr> getArgs() {
        return args;
    }

    @Override
    public String type() {
        return "call";
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
        return visitor.visitCall(this);
    }

    @Override
    public String toString() {
        String call = function + "(" + Joiner.on(", ").join(args) + ")";
        return target.map(t -> t + "." + call).orElse(call);
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        Call call = (Call) o;
        return id == call.id
                && Objects.equals(function, call.function)
                && Objects.equals(target, call.target)
                && Objects.equals(args, call.args);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, function, target, args);
    }
}
