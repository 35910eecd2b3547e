package io.github.cartly.engine.supervision;

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
 * Request could not be executed, because its entity exhausted its restarts. The entity stays stopped until it is
 * explicitly restarted.
 */
public class EntityStoppedException extends RuntimeException {
    private final String entityId;

    public EntityStoppedException(String entityId, Throwable cause) {
        super("Entity " + entityId + " is stopped after exhausting its restarts", cause);
        this.entityId = entityId;
    }

    public String getEntityId() {
        return entityId;
    }
}
