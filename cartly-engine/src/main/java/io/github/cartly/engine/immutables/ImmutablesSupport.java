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

import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.immutables.value.Value;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Style of event packages. Put it on {@code package-info.java} of the package holding the events of an entity.
 * <p>Generated implementations stay package private behind the nested {@code Builder} of each event, accessors
 * may use {@code get} and {@code is} prefixes, and the values are bound to Jackson.</p>
 */
@Target({ ElementType.PACKAGE, ElementType.TYPE })
@Retention(RetentionPolicy.CLASS)
@Value.Style(overshadowImplementation = true,
        optionalAcceptNullable = true,
        depluralize = true,
        jdkOnly = true,
        get = { "get*", "is*" },
        visibility = Value.Style.ImplementationVisibility.PACKAGE)
@JsonSerialize
public @interface ImmutablesSupport {

}
