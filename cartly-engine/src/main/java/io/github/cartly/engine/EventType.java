package io.github.cartly.engine;

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

/**
 * Type names of events, derived from class names. {@code ItemAddedEvent} is stored as {@code ItemAdded}.
 */
public final class EventType {

    private static final String EVENT_SUFFIX = "Event";

    private EventType() {
    }

    public static String defaultTypeName(Class<?> clazz) {
        return strip(clazz.getSimpleName(), "", EVENT_SUFFIX);
    }

    /**
     * Type name of a generated class, {@code ImmutableItemAddedEvent} with prefix {@code Immutable} gives
     * {@code ItemAdded}.
     */
    public static String fromClassStripping(Class<?> clazz, String prefix, String suffix) {
        return strip(clazz.getSimpleName(), prefix, suffix);
    }

    /**
     * Remove the prefix and suffix where present. A name that would become empty is returned unchanged.
     */
    static String strip(String name, String prefix, String suffix) {
        String result = name;
        if (!prefix.isEmpty() && result.startsWith(prefix)) {
            result = result.substring(prefix.length());
        }
        if (!suffix.isEmpty() && result.endsWith(suffix)) {
            result = result.substring(0, result.length() - suffix.length());
        }
        return result.isEmpty() ? name : result;
    }
}
