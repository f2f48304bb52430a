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

import io.github.goodees.decider.core.AsyncDecision;
import io.github.goodees.decider.core.Decision;
import io.github.goodees.decider.core.DomainRuleViolationException;
import io.github.goodees.decider.core.Fold;
import io.github.goodees.decider.core.Outcome;
import io.github.goodees.decider.core.StreamCategory;
import io.github.goodees.decider.core.cache.StateCache;
import io.github.goodees.decider.core.matching.TypeSwitchFold;
import io.github.goodees.decider.core.store.StreamStore;
import io.github.goodees.decider.example.cart.events.CartEvent;
import io.github.goodees.decider.example.cart.events.Confirmed;
import io.github.goodees.decider.example.cart.events.Initialized;
import io.github.goodees.decider.example.cart.events.ItemAdded;
import io.github.goodees.decider.example.cart.events.ItemRemoved;
import io.github.goodees.decider.example.cart.events.Registering;
import io.github.goodees.decider.immutables.JacksonEventCodec;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Supplier;

/**
 * Shopping cart aggregate: how carts evolve with events, and the decisions that can be made about a cart.
 */
public final class ShoppingCart {
    public static final String CATEGORY = "ShoppingCart";

    public static final Fold<CartState, CartEvent> FOLD = TypeSwitchFold.builder(CartState.initial(), CartEvent.class)
            .on(Initialized.class, (s, e) -> ImmutableCartState.copyOf(s).withClientId(e.getClientId()))
            .on(ItemAdded.class, ShoppingCart::itemAdded)
            .on(ItemRemoved.class, ShoppingCart::itemRemoved)
            .on(Confirmed.class, (s, e) -> ImmutableCartState.copyOf(s)
                    .withStatus(CartStatus.CONFIRMED)
                    .withConfirmedAt(e.getConfirmedAt()))
            .on(Registering.class, (s, e) -> ImmutableCartState.copyOf(s).withConfirmedOriginEpoch(e.getOriginEpoch()))
            .build();

    private ShoppingCart() {
    }

    public static JacksonEventCodec<CartEvent> codec() {
        return JacksonEventCodec.builder(CartEvent.class)
                .register(Initialized.class)
                .register(ItemAdded.class)
                .register(ItemRemoved.class)
                .register(Confirmed.class)
                .register(Registering.class)
                .build();
    }

    public static StreamCategory<CartState, CartEvent> category(StreamStore store) {
        return StreamCategory.builder(CATEGORY, FOLD).store(store).codec(codec()).build();
    }

    public static StreamCategory<CartState, CartEvent> category(StreamStore store, StateCache<CartState> cache) {
        return StreamCategory.builder(CATEGORY, FOLD).store(store).codec(codec()).cache(cache).build();
    }

    private static CartState itemAdded(CartState state, ItemAdded event) {
        List<CartItem> items = new ArrayList<>(state.getItems().size() + 1);
        boolean merged = false;
        for (CartItem item : state.getItems()) {
            if (!merged && item.matches(event.getProductId(), event.getUnitPrice())) {
                items.add(ImmutableCartItem.copyOf(item).withQuantity(item.getQuantity() + event.getQuantity()));
                merged = true;
            } else {
                items.add(item);
            }
        }
        if (!merged) {
            items.add(CartItem.of(event.getProductId(), event.getQuantity(), event.getUnitPrice()));
        }
        return ImmutableCartState.copyOf(state).withItems(items);
    }

    private static CartState itemRemoved(CartState state, ItemRemoved event) {
        List<CartItem> items = new ArrayList<>(state.getItems());
        items.removeIf(item -> item.matches(event.getProductId(), event.getUnitPrice()));
        return ImmutableCartState.copyOf(state).withItems(items);
    }

    /**
     * Assign cart to a client. Cart that already has a client is left as is.
     */
    public static Decision<CartState, CartEvent, Void> initialize(String clientId) {
        return Decision.of(state -> state.getClientId().isPresent()
                ? Collections.<CartEvent>emptyList()
                : Collections.<CartEvent>singletonList(Initialized.of(clientId)));
    }

    /**
     * Add pieces of a product, at the price the calculator gives at the time of the decision.
     */
    public static AsyncDecision<CartState, CartEvent, Void> add(PriceCalculator calculator, String productId,
            int quantity) {
        return state -> {
            requireOpen(state, "Adding product item");
            return calculator.calculatePrice(productId, quantity)
                    .thenApply(price -> Outcome.<CartEvent>events(
                        Collections.singletonList(ItemAdded.of(productId, quantity, price))));
        };
    }

    public static Decision<CartState, CartEvent, Void> remove(String productId, BigDecimal unitPrice) {
        return Decision.of(state -> {
            requireOpen(state, "Removing product item");
            return Collections.<CartEvent>singletonList(ItemRemoved.of(productId, unitPrice));
        });
    }

    /**
     * Confirm the cart. Confirming confirmed cart changes nothing.
     */
    public static Decision<CartState, CartEvent, Void> confirm(Instant at) {
        return Decision.of(state -> state.isClosed()
                ? Collections.<CartEvent>emptyList()
                : Collections.<CartEvent>singletonList(Confirmed.at(at)));
    }

    /**
     * Summarize confirmed cart, and register it in the active epoch unless it is registered already. The epoch of
     * the first registration is kept.
     * @param activeEpoch supplier of the epoch being currently filled
     * @return decision resulting in the view and the origin epoch
     */
    public static AsyncDecision<CartState, CartEvent, CartSummary> summarizeWithOriginEpoch(
            Supplier<? extends CompletionStage<Long>> activeEpoch) {
        return state -> {
            if (!state.isClosed()) {
                throw new DomainRuleViolationException("Summarizing cart in " + state.getStatus()
                        + " status is not allowed.");
            }
            CartView view = render(state).orElseThrow(
                () -> new DomainRuleViolationException("Confirmed cart has no client"));
            Optional<Long> registered = state.getConfirmedOriginEpoch();
            if (registered.isPresent()) {
                return CompletableFuture.completedFuture(
                    Outcome.<CartSummary, CartEvent>noEvents(ImmutableCartSummary.of(view, registered.get())));
            }
            return activeEpoch.get().thenApply(epoch -> Outcome.<CartSummary, CartEvent>of(
                ImmutableCartSummary.of(view, epoch), Collections.singletonList(Registering.of(epoch))));
        };
    }

    /**
     * Details of a cart, empty while the cart has no client.
     */
    public static Optional<CartView> render(CartState state) {
        return state.getClientId().map(clientId -> ImmutableCartView.builder()
                .clientId(clientId)
                .status(state.getStatus())
                .items(state.getItems())
                .build());
    }

    private static void requireOpen(CartState state, String operation) {
        if (state.isClosed()) {
            throw new DomainRuleViolationException(operation + " for cart in " + state.getStatus()
                    + " status is not allowed.");
        }
    }
}
