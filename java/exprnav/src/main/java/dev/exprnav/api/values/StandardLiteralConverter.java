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

import com.google.common.primitives.UnsignedLong;
import dev.exprnav.api.expressions.Literal;
import dev.exprnav.api.types.Types;
import java.nio.ByteBuffer;
import java.util.Optional;

/**
 * Converts each literal kind to the {@link Val} of the matching primitive type.
 */
public final class StandardLiteralConverter implements LiteralConverter {
    public static final StandardLiteralConverter INSTANCE = new StandardLiteralConverter();

    private static final Literal.LiteralVisitor<Optional<Val>> TO_VAL = new Literal.LiteralVisitor<>() {
        @Override
        public Optional<Val> visitNull() {
            return Optional.of(Val.NULL);
        }

        @Override
        public Optional<Val> visitBool(boolean literal) {
            return Optional.of(Val.of(Types.BOOL, literal));
        }

        @Override
        public Optional<Val> visitInt64(long literal) {
            return Optional.of(Val.of(Types.INT, literal));
        }

        @Override
        public Optional<Val> visitUint64(UnsignedLong literal) {
            return Optional.of(Val.of(Types.UINT, literal));
        }

        @Override
        public Optional<Val> visitDouble(double literal) {
            return Optional.of(Val.of(Types.DOUBLE, literal));
        }

        @Override
        public Optional<Val> visitString(String literal) {
            return Optional.of(Val.of(Types.STRING, literal));
        }

        @Override
        public Optional<Val> visitBytes(byte[] literal) {
            return Optional.of(Val.of(Types.BYTES, ByteBuffer.wrap(literal).asReadOnlyBuffer()));
        }

        @Override
        public Optional<Val> visitUnset() {
            return Optional.empty();
        }
    };

    private StandardLiteralConverter() {}

    @Override
    public Val convert(Literal<?> literal) throws LiteralConversionException {
        Optional<Val> val = literal.acceptLiteralVisitor(TO_VAL);
        if (val.isEmpty()) {
            throw new LiteralConversionException(literal.id(), "literal " + literal.id() + " has no constant kind set");
        }
        return val.get();
    }
}
