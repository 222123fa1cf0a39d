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
package dev.exprnav.api.values;

import static com.google.common.base.Preconditions.checkNotNull;

import dev.exprnav.api.types.Type;
import dev.exprnav.api.types.Types;
import java.nio.ByteBuffer;
import java.util.Objects;
import java.util.Optional;

/**
 * Runtime value paired with its type.
 */
public final class Val {
    public static final Val NULL = new Val(Types.NULL, null);

    private final Type type;
    private final Object value;

    private Val(Type type, Object value) {
        this.type = type;
        this.value = value;
    }

    public static Val of(Type type, Object value) {
        return new Val(checkNotNull(type, "type"), checkNotNull(value, "value"));
    }

    public Type getType() {
        return type;
    }

    /**
     * Java representation of the value, empty for {@link #NULL}. Bytes are exposed as a read-only
     * {@link ByteBuffer}.
     */
    public Optional<Object> getValue() {
        return Optional.ofNullable(value);
    }

    /**
     * Cast the value to the expected Java type.
     *
     * @throws ClassCastException if the value has a different representation
     * @throws java.util.NoSuchElementException if this is {@link #NULL}
     */
    public <T> T as(Class<T> javaType) {
        return javaType.cast(getValue().orElseThrow());
    }

    @Override
    public String toString() {
        return type.display() + "(" + value + ")";
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        Val val = (Val) o;
        return Objects.equals(type, val.type) && Objects.equals(value, val.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, value);
    }
}
