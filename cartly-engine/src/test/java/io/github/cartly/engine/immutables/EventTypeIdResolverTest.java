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

import com.fasterxml.jackson.databind.type.TypeFactory;
import io.github.cartly.engine.immutables.events.VoucherRedeemedEvent;
import io.github.cartly.engine.immutables.events.VoucherIssuedEvent;
import io.github.cartly.engine.immutables.events.VoucherEvent;
import org.junit.Before;
import org.junit.Test;

import java.time.Instant;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public class EventTypeIdResolverTest {

    private ImmutableEventTypeResolver resolver;
    private TypeFactory tf;

    @Before
    public void setUp() {
        resolver = new ImmutableEventTypeResolver();
        tf = TypeFactory.defaultInstance();
        resolver.init(tf.constructType(VoucherEvent.class));
    }

    @Test
    public void type_id_generated_for_supported_types() {
        VoucherIssuedEvent event = new VoucherIssuedEvent.Builder().entityId("test")
                .entityStateVersion(1)
                .timestamp(Instant.now())
                .code("SPRING-10")
                .issuer("marketing")
                .build();
        assertEquals("VoucherIssued", resolver.idFromValueAndType(event, VoucherIssuedEvent.class));
        assertEquals("VoucherIssued", resolver.idFromValue(event));
    }

    @Test(expected = IllegalArgumentException.class)
    public void type_id_generation_fails_on_unsupported_types() {
        resolver.idFromValue(13);
    }

    @Test
    public void class_is_instantiated_for_supported_types() {
        assertTrue(VoucherIssuedEvent.class.isAssignableFrom(resolver.typeFromId("VoucherIssued", tf)
                .getRawClass()));
        assertTrue(VoucherRedeemedEvent.class.isAssignableFrom(resolver.typeFromId("VoucherRedeemed", tf)
                .getRawClass()));
    }

    @Test
    public void unknown_type_id_resolves_to_nothing() {
        assertNull(resolver.typeFromId("VoucherExpired", tf));
    }
}
