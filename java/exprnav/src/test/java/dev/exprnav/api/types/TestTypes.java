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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

public final class TestTypes {
    @Test
    public void testDisplay() {
        assertEquals("dyn", Types.DYN.display());
        assertEquals("list(int)", Types.listOf(Types.INT).display());
        assertEquals("map(string, list(dyn))", Types.mapOf(Types.STRING, Types.listOf(Types.DYN)).display());
        assertEquals("type(acme.Person)", Types.typeOf(Types.structOf("acme.Person")).display());
    }

    @Test
    public void testStructuralEquality() {
        assertEquals(Types.listOf(Types.INT), Types.listOf(Types.INT));
        assertEquals(Types.structOf("acme.Person"), Types.structOf("acme.Person"));
    }

    @Test
    public void testScalarTypesTakeNoParameters() {
        assertThrows(
                IllegalStateException.class,
                () -> Type.builder()
                        .kind(TypeKind.INT)
                        .name("int")
                        .addParameters(Types.STRING)
                        .build());
        assertThrows(IllegalArgumentException.class, () -> Types.structOf(""));
    }
}
