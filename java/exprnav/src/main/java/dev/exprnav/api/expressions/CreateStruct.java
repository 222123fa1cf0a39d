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
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import dev.exprnav.api.Expr;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Struct or map literal.
 * <p>
 * A non-empty message name makes this a message construction {@code Msg{field: value}} whose entries are field
 * initializers. An empty message name makes it a map literal {@code {key: value}} whose entries carry key
 * expressions.
 */
public final class CreateStruct implements Expr {
    private final long id;
    private final String messageName;
    private final ImmutableList<Entry> entries;

    private CreateStruct(long id, String messageName, List<Entry> entries) {
        this.id = id;
        this.messageName = checkNotNull(messageName, "messageName");
        this.entries = ImmutableList.copyOf(entries);
    }

    public static CreateStruct message(long id, String messageName, Entry... fields) {
        checkArgument(!messageName.isEmpty(), "message name must not be empty");
        for (Entry field : fields) {
            checkArgument(field.getFieldKey().isPresent(), "entry %s of %s is not a field initializer", field.id(), id);
        }
        return new CreateStruct(id, messageName, ImmutableList.copyOf(fields));
    }

    public static CreateStruct map(long id, Entry... entries) {
        for (Entry entry : entries) {
            checkArgument(entry.getMapKey().isPresent(), "entry %s of %s is not a map entry", entry.id(), id);
        }
        return new CreateStruct(id, "", ImmutableList.copyOf(entries));
    }

    @Override
    public long id() {
        return id;
    }

    public String getMessageName() {
        return messageName;
    }

    public List<Entry> getEntries() {
        return entries;
    }

    @Override
    public String type() {
        return "struct";
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
        return visitor.visitCreateStruct(this);
    }

    @Override
    public String toString() {
        return messageName + "{" + Joiner.on(", ").join(entries) + "}";
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        CreateStruct that = (CreateStruct) o;
        return id == that.id && Objects.equals(messageName, that.messageName) && Objects.equals(entries, that.entries);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, messageName, entries);
    }

    /**
     * A single initializer: either a named field or a map key, followed by the value expression.
     */
    public static final class Entry {
        private final long id;
        private final Optional<String> fieldKey;
        private final Optional<Expr> mapKey;
        private final Expr value;
        private final boolean optionalEntry;

        private Entry(long id, Optional<String> fieldKey, Optional<Expr> mapKey, Expr value, boolean optionalEntry) {
            this.id = id;
            this.fieldKey = fieldKey;
            this.mapKey = mapKey;
            this.value = checkNotNull(value, "value");
            this.optionalEntry = optionalEntry;
        }

        public static Entry field(long id, String name, Expr value) {
            return field(id, name, value, false);
        }

        public static Entry field(long id, String name, Expr value, boolean optionalEntry) {
            return new Entry(id, Optional.of(checkNotNull(name, "name")), Optional.empty(), value, optionalEntry);
        }

        public static Entry mapEntry(long id, Expr key, Expr value) {
            return mapEntry(id, key, value, false);
        }

        public static Entry mapEntry(long id, Expr key, Expr value, boolean optionalEntry) {
            return new Entry(id, Optional.empty(), Optional.of(checkNotNull(key, "key")), value, optionalEntry);
        }

        public long id() {
            return id;
        }

        /**
         * Field name for message initializers, empty for map entries.
         */
        public Optional<String> getFieldKey() {
            return fieldKey;
        }

        /**
         * Key expression for map entries, empty for message initializers.
         */
        public Optional<Expr> getMapKey() {
            return mapKey;
        }

        public Expr getValue() {
            return value;
        }

        public boolean isOptionalEntry() {
            return optionalEntry;
        }

        @Override
        public String toString() {
            String key = fieldKey.orElseGet(() -> mapKey.map(Object::toString).orElse(""));
            return (optionalEntry ? "?" : "") + key + ": " + value;
        }

        @Override
        public boolean equals(Object o) {
            if (o == null || getClass() != o.getClass()) return false;
            Entry entry = (Entry) o;
            return id == entry.id
                    && optionalEntry == entry.optionalEntry
                    && Objects.equals(fieldKey, entry.fieldKey)
                    && Objects.equals(mapKey, entry.mapKey)
                    && Objects.equals(value, entry.value);
        }

        @Override
        public int hashCode() {
            return Objects.hash(id, fieldKey, mapKey, value, optionalEntry);
        }
    }
}
