package io.github.cartly.engine.immutables;

/*-
 * #%L
 * cartly
 * %%
 * Copyright (C) 2017 Patrik Duditš
 * %%
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * 
 *      http://www.apache.org/licenses/LICENSE-2.0
 * 
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * #L%
 */

import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.databind.DatabindContext;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.jsontype.impl.TypeIdResolverBase;
import com.fasterxml.jackson.databind.type.TypeFactory;

/**
 * Maps the JSON {@code type} property of {@link ImmutableEvent} subclasses to generated classes.
 * <p>
 * Type {@code ItemAdded} resolves to {@code ImmutableItemAddedEvent} in the package of the base type Jackson
 * initializes this resolver with, which is the reverse of {@link ImmutableEvent#getType()}. An id without such a class
 * resolves to {@code null}, and Jackson then reports an invalid type id.
 */
public class ImmutableEventTypeResolver extends TypeIdResolverBase {

    private String packagePrefix;

    @Override
    public void init(JavaType baseType) {
        Package pkg = baseType.getRawClass().getPackage();
        packagePrefix = pkg == null ? "" : pkg.getName() + ".";
    }

    @Override
    public JavaType typeFromId(DatabindContext context, String id) {
        return typeFromId(id, context.getTypeFactory());
    }

    JavaType typeFromId(String id, TypeFactory typeFactory) {
        try {
            Class<?> generated = typeFactory.findClass(packagePrefix + "Immutable" + id + "Event");
            return typeFactory.constructType(generated);
        } catch (ClassNotFoundException unknown) {
            return null;
        }
    }

    @Override
    public String idFromValue(Object value) {
        return typeOf(value);
    }

    @Override
    public String idFromValueAndType(Object value, Class<?> suggestedType) {
        return typeOf(value);
    }

    @Override
    public JsonTypeInfo.Id getMechanism() {
        return JsonTypeInfo.Id.CUSTOM;
    }

    private static String typeOf(Object value) {
        if (!(value instanceof ImmutableEvent)) {
            throw new IllegalArgumentException("Only ImmutableEvent instances carry a type id, got " + value);
        }
        return ((ImmutableEvent) value).getType();
    }
}
