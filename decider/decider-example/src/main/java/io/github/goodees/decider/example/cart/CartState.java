package io.github.goodees.decider.example.cart;

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

import org.immutables.value.Value;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Folded state of a shopping cart.
 */
@Value.Immutable
public interface CartState {
    Optional<String> getClientId();

    @Value.Default
    default CartStatus getStatus() {
        return CartStatus.PENDING;
    }

    List<CartItem> getItems();

    Optional<Instant> getConfirmedAt();

    Optional<Long> getConfirmedOriginEpoch();

    default boolean isClosed() {
        return getStatus() == CartStatus.CONFIRMED;
    }

    static CartState initial() {
        return ImmutableCartState.builder().build();
    }
}
