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

import io.github.goodees.decider.core.ConcurrencyExhaustedException;
import io.github.goodees.decider.core.StreamCategory;
import io.github.goodees.decider.core.store.StreamStoreException;
import io.github.goodees.decider.example.cart.events.CartEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Supplier;

/**
 * Operations on shopping carts. Every call resolves a decider for the cart, and all of them can be invoked
 * concurrently for the same cart.
 */
public class ShoppingCartService {
    private static final Logger logger = LoggerFactory.getLogger(ShoppingCartService.class);

    private final StreamCategory<CartState, CartEvent> carts;
    private final PriceCalculator priceCalculator;

    public ShoppingCartService(StreamCategory<CartState, CartEvent> carts, PriceCalculator priceCalculator) {
        this.carts = Objects.requireNonNull(carts, "Cart category must be specified");
        this.priceCalculator = Objects.requireNonNull(priceCalculator, "Price calculator must be specified");
    }

    public void initialize(String cartId, String clientId) throws StreamStoreException, ConcurrencyExhaustedException {
        carts.resolve(cartId).transact(ShoppingCart.initialize(clientId));
    }

    public CompletableFuture<Void> add(String cartId, String productId, int quantity) {
        return carts.resolve(cartId).transactAsync(ShoppingCart.add(priceCalculator, productId, quantity));
    }

    public void remove(String cartId, String productId, BigDecimal unitPrice)
            throws StreamStoreException, ConcurrencyExhaustedException {
        carts.resolve(cartId).transact(ShoppingCart.remove(productId, unitPrice));
    }

    public void confirm(String cartId, Instant at) throws StreamStoreException, ConcurrencyExhaustedException {
        carts.resolve(cartId).transact(ShoppingCart.confirm(at));
        logger.debug("Cart {} confirmed", cartId);
    }

    /**
     * Details of the cart. Reads through the cache, so includes writes made through this service.
     * @param cartId the cart
     * @return the details, empty if the cart was not initialized
     * @throws StreamStoreException when reading the cart fails
     */
    public Optional<CartView> read(String cartId) throws StreamStoreException {
        return carts.resolve(cartId).query(ShoppingCart::render);
    }

    /**
     * Summarize confirmed cart and decide the epoch its registration starts in.
     * @param cartId the cart
     * @param activeEpoch supplier of currently active epoch
     * @return the summary, or failure with {@link io.github.goodees.decider.core.DomainRuleViolationException} when
     * the cart is not confirmed
     */
    public CompletableFuture<CartSummary> summarizeWithOriginEpoch(String cartId,
            Supplier<? extends CompletionStage<Long>> activeEpoch) {
        return carts.resolve(cartId).transactAsync(ShoppingCart.summarizeWithOriginEpoch(activeEpoch));
    }

    /**
     * View of the cart with the version it is based on.
     */
    public VersionedCartView summarizeWithVersion(String cartId) throws StreamStoreException {
        return carts.resolve(cartId).queryState(
            s -> ImmutableVersionedCartView.of(ShoppingCart.render(s.getState()), s.getVersion()));
    }
}
