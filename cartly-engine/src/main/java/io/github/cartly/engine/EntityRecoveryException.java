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
 * Entity could not be brought to its latest state, because reading of its log or replay of an event failed.
 */
public class EntityRecoveryException extends RuntimeException {
    private final String entityId;

    public EntityRecoveryException(String entityId, Throwable cause) {
        super("Recovery of entity " + entityId + " failed: " + cause.getMessage(), cause);
        this.entityId = entityId;
    }

    public String getEntityId() {
        return entityId;
    }
}
