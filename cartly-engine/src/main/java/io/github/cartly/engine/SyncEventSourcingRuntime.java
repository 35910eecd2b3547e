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

import io.github.cartly.engine.dispatch.DispatchingEventSourcingRuntime;

/**
 * Runtime of entities that execute requests synchronously on the dispatcher thread.
 * @param <E> type of entity
 * @see SyncEntity
 */
public abstract class SyncEventSourcingRuntime<E extends SyncEntity> extends DispatchingEventSourcingRuntime<E> {

    @Override
    protected <RS, R extends Request<RS>> RS invokeEntity(E entity, R request) throws Exception {
        return entity.execute(request);
    }

}
