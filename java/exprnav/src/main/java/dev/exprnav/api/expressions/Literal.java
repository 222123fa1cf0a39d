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

import com.google.common.base.Objects;
import com.google.common.primitives.UnsignedLong;
import dev.exprnav.api.Expr;
import java.util.Arrays;

/**
 * Constant literal. The wrapped value is the raw payload as the parser recorded it; turning it into a runtime value
 * is the job of a {@link dev.exprnav.api.values.LiteralConverter}.
 */
public abstract class Literal<T> implements Expr {
    private final long id;
    private final T value;

    private Literal(long id, T value) {
        this.id = id;
        this.value = value;
    }

    @Override
    public long id() {
        return id;
    }

    public T getValue() {
        return this.value;
    }

    @Override
    public String type() {
        return "literal";
    }

    @Override
    public String toString() {
        return String.valueOf(value);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(id, getClass(), getValue());
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        Literal<?> literal = (Literal<?>) o;
        return id == literal.id && Objects.equal(value, literal.value);
    }

    public static Literal<Void> nullLit(long id) {
        return new NullLiteral(id);
    }

    public static Literal<Boolean> bool(long id, boolean value) {
        return new BoolLiteral(id, value);
    }

    public static Literal<Long> int64(long id, long value) {
        return new Int64Literal(id, value);
    }

    public static Literal<UnsignedLong> uint64(long id, UnsignedLong value) {
        return new Uint64Literal(id, value);
    }

    public static Literal<Double> float64(long id, double value) {
        return new DoubleLiteral(id, value);
    }

    public static Literal<String> string(long id, String value) {
        return new StringLiteral(id, value);
    }

    public static Literal<byte[]> bytes(long id, byte[] value) {
        return new BytesLiteral(id, value.clone());
    }

    /**
     * A literal whose constant kind was never set. Well-formed trees never contain one.
     */
    public static Literal<Void> unset(long id) {
        return new UnsetLiteral(id);
    }

    @Override
    public <R> R accept(Expr.Visitor<R> visitor) {
        return visitor.visitLiteral(this);
    }

    public abstract <U> U acceptLiteralVisitor(LiteralVisitor<U> visitor);

    public interface LiteralVisitor<U> {
        U visitNull();

        U visitBool(boolean literal);

        U visitInt64(long literal);

        U visitUint64(UnsignedLong literal);

        U visitDouble(double literal);

        U visitString(String literal);

        U visitBytes(byte[] literal);

        U visitUnset();
    }

    static final class NullLiteral extends Literal<Void> {
        NullLiteral(long id) {
            super(id, null);
        }

        @Override
        public String toString() {
            return "null";
        }

        @Override
        public <U> U acceptLiteralVisitor(LiteralVisitor<U> visitor) {
            return visitor.visitNull();
        }
    }

    static final class BoolLiteral extends Literal<Boolean> {
        BoolLiteral(long id, Boolean value) {
            super(id, value);
        }

        @Override
        public <U> U acceptLiteralVisitor(LiteralVisitor<U> visitor) {
            return visitor.visitBool(getValue());
        }
    }

    static final class Int64Literal extends Literal<Long> {
        Int64Literal(long id, Long value) {
            super(id, value);
        }

        @Override
        public <U> U acceptLiteralVisitor(LiteralVisitor<U> visitor) {
            return visitor.visitInt64(getValue());
        }
    }

    static final class Uint64Literal extends Literal<UnsignedLong> {
        Uint64Literal(long id, UnsignedLong value) {
            super(id, value);
        }

        @Override
        public String toString() {
            return getValue() + "u";
        }

        @Override
        public <U> U acceptLiteralVisitor(LiteralVisitor<U> visitor) {
            return visitor.visitUint64(getValue());
        }
    }

    static final class DoubleLiteral extends Literal<Double> {
        DoubleLiteral(long id, Double value) {
            super(id, value);
        }

        @Override
        public <U> U acceptLiteralVisitor(LiteralVisitor<U> visitor) {
            return visitor.visitDouble(getValue());
        }
    }

    static final class StringLiteral extends Literal<String> {
        StringLiteral(long id, String value) {
            super(id, value);
        }

        @Override
        public String toString() {
            return "\"" + getValue() + "\"";
        }

        @Override
        public <U> U acceptLiteralVisitor(LiteralVisitor<U> visitor) {
            return visitor.visitString(getValue());
        }
    }

    static final class BytesLiteral extends Literal<byte[]> {
        BytesLiteral(long id, byte[] value) {
            super(id, value);
        }

        // Arrays compare by identity, so content equality is handled here.
        @Override
        public boolean equals(Object o) {
            if (!(o instanceof BytesLiteral)) return false;
            BytesLiteral other = (BytesLiteral) o;
            return id() == other.id() && Arrays.equals(getValue(), other.getValue());
        }

        @Override
        public int hashCode() {
            return 31 * Long.hashCode(id()) + Arrays.hashCode(getValue());
        }

        @Override
        public String toString() {
            return "b\"" + Arrays.toString(getValue()) + "\"";
        }

        @Override
        public <U> U acceptLiteralVisitor(LiteralVisitor<U> visitor) {
            return visitor.visitBytes(getValue().clone());
        }
    }

    static final class UnsetLiteral extends Literal<Void> {
        UnsetLiteral(long id) {
            super(id, null);
        }

        @Override
        public String toString() {
            return "<unset>";
        }

        @Override
        public <U> U acceptLiteralVisitor(LiteralVisitor<U> visitor) {
            return visitor.visitUnset();
        }
    }
}
