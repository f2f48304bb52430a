package io.github.goodees.decider.example.cart.events;

/*-
 * #%L
 * decider
 * %%
 * Copyright (C) 2017 - 2018 Patrik Duditš
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

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.immutables.value.Value;

/**
 * Cart was created for a client.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableInitialized.class)
@JsonDeserialize(as = ImmutableInitialized.class)
public interface Initialized extends CartEvent {
    String getClientId();

    static Initialized of(String clientId) {
        return ImmutableInitialized.builder().clientId(clientId).build();
    }
}
