package io.github.cartly.engine.store;

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

import io.github.cartly.engine.EventHeader;

import java.time.Instant;

/**
 * Placeholder for a logged event that current code cannot deserialize, e. g. written by newer version of the system.
 * Non-strict event logs deliver it in place of the original, so that the entity still advances its version past it.
 */
public final class UnrecognizedEvent extends EventHeader {
    private final String type;
    private final int payloadVersion;

    public UnrecognizedEvent(String entityId, long entityStateVersion, Instant timestamp, String type,
            int payloadVersion) {
        super(entityId, entityStateVersion, timestamp);
        this.type = type;
        this.payloadVersion = payloadVersion;
    }

    @Override
    public String getType() {
        return type;
    }

    public int getPayloadVersion() {
        return payloadVersion;
    }
}
