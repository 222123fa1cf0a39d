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
package dev.exprnav.api.types;

import static com.google.common.base.Preconditions.checkState;

import com.google.common.base.Joiner;
import java.util.List;
import org.immutables.value.Value;

/**
 * Static type resolved by the type checker.
 */
@Value.Immutable
public interface Type {
    TypeKind kind();

    /**
     * Display name, e.g. {@code int}, {@code list} or a fully qualified message name.
     */
    String name();

    /**
     * Type parameters, e.g. the element type of a list.
     */
    List<Type> parameters();

    @Value.Check
    default void check() {
        checkState(
                kind().isParameterized() || parameters().isEmpty(),
                "type %s of kind %s cannot take parameters",
                name(),
                kind());
    }

    @Value.Lazy
    default String display() {
        if (parameters().isEmpty()) {
            return name();
        }
        return name() + "(" + Joiner.on(", ").join(parameters().stream().map(Type::display).iterator()) + ")";
    }

    static ImmutableType.Builder builder() {
        return ImmutableType.builder();
    }
}
