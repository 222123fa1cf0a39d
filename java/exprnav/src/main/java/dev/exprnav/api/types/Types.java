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

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Well-known types and factories for parameterized ones.
 */
public final class Types {
    /**
     * Dynamic type. Also the type of any node the checker recorded nothing for.
     */
    public static final Type DYN = simple(TypeKind.DYN, "dyn");

    public static final Type ANY = simple(TypeKind.ANY, "google.protobuf.Any");
    public static final Type NULL = simple(TypeKind.NULL, "null_type");
    public static final Type BOOL = simple(TypeKind.BOOL, "bool");
    public static final Type INT = simple(TypeKind.INT, "int");
    public static final Type UINT = simple(TypeKind.UINT, "uint");
    public static final Type DOUBLE = simple(TypeKind.DOUBLE, "double");
    public static final Type STRING = simple(TypeKind.STRING, "string");
    public static final Type BYTES = simple(TypeKind.BYTES, "bytes");
    public static final Type DURATION = simple(TypeKind.DURATION, "google.protobuf.Duration");
    public static final Type TIMESTAMP = simple(TypeKind.TIMESTAMP, "google.protobuf.Timestamp");
    public static final Type ERROR = simple(TypeKind.ERROR, "error");

    private Types() {}

    public static Type listOf(Type elemType) {
        return Type.builder()
                .kind(TypeKind.LIST)
                .name("list")
                .addParameters(elemType)
                .build();
    }

    public static Type mapOf(Type keyType, Type valueType) {
        return Type.builder()
                .kind(TypeKind.MAP)
                .name("map")
                .addParameters(keyType, valueType)
                .build();
    }

    public static Type structOf(String messageName) {
        checkArgument(!messageName.isEmpty(), "message name must not be empty");
        return simple(TypeKind.STRUCT, messageName);
    }

    public static Type typeOf(Type type) {
        return Type.builder().kind(TypeKind.TYPE).name("type").addParameters(type).build();
    }

    private static Type simple(TypeKind kind, String name) {
        return Type.builder().kind(kind).name(name).build();
    }
}
