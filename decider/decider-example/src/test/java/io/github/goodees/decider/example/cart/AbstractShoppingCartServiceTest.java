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

import io.github.goodees.decider.core.DomainRuleViolationException;
import io.github.goodees.decider.core.store.StreamStore;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TestName;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import static org.hamcrest.CoreMatchers.instanceOf;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.fail;

/**
 * Shopping cart scenarios, run against each store.
 */
public abstract class AbstractShoppingCartServiceTest {
    protected static final BigDecimal PRICE = new BigDecimal("9.99");

    @Rule
    public TestName testName = new TestName();
    protected ShoppingCartService service;

    protected abstract StreamStore createStore();

    @Before
    public void setUpService() {
        service = new ShoppingCartService(ShoppingCart.category(createStore()),
            (productId, quantity) -> CompletableFuture.completedFuture(PRICE));
    }

    protected String cartId() {
        return testName.getMethodName();
    }

    protected long version(String cartId) throws Exception {
        return service.summarizeWithVersion(cartId).getVersion();
    }

    @Test
    public void cart_lifecycle() throws Exception {
        String cartId = cartId();
        service.initialize(cartId, "client-1");
        assertEquals(1, version(cartId));
        service.add(cartId, "apple", 1).get(5, TimeUnit.SECONDS);
        service.add(cartId, "apple", 2).get(5, TimeUnit.SECONDS);
        assertEquals(3, version(cartId));
        service.confirm(cartId, Instant.parse("2018-03-01T10:15:30Z"));
        assertEquals(4, version(cartId));

        CartView view = service.read(cartId).get();
        assertEquals("client-1", view.getClientId());
        assertEquals(CartStatus.CONFIRMED, view.getStatus());
        assertEquals(Collections.singletonList(CartItem.of("apple", 3, PRICE)), view.getItems());

        try {
            service.add(cartId, "pear", 1).get(5, TimeUnit.SECONDS);
            fail("Adding to confirmed cart should fail");
        } catch (ExecutionException e) {
            assertThat(e.getCause(), instanceOf(DomainRuleViolationException.class));
        }
        assertEquals(4, version(cartId));
    }

    @Test
    public void concurrent_adds_of_different_products_both_commit() throws Exception {
        String cartId = cartId();
        // both writers price their product against the same version before either appends
        CyclicBarrier bothDecided = new CyclicBarrier(2);
        AtomicInteger pricings = new AtomicInteger();
        ShoppingCartService racing = new ShoppingCartService(ShoppingCart.category(createStore()),
            (productId, quantity) -> {
                if (pricings.incrementAndGet() <= 2) {
                    try {
                        bothDecided.await(10, TimeUnit.SECONDS);
                    } catch (Exception e) {
                        CompletableFuture<BigDecimal> failed = new CompletableFuture<>();
                        failed.completeExceptionally(e);
                        return failed;
                    }
                }
                return CompletableFuture.completedFuture(PRICE);
            });
        racing.initialize(cartId, "client-1");

        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            List<Future<?>> writers = new ArrayList<>();
            for (String product : Arrays.asList("apple", "pear")) {
                writers.add(executor.submit(() -> {
                    racing.add(cartId, product, 1).get(10, TimeUnit.SECONDS);
                    return null;
                }));
            }
            for (Future<?> writer : writers) {
                writer.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(3, pricings.get());
        VersionedCartView versioned = racing.summarizeWithVersion(cartId);
        assertEquals(3, versioned.getVersion());
        Set<String> products = versioned.getView().get().getItems().stream()
                .map(CartItem::getProductId).collect(Collectors.toSet());
        assertEquals(new HashSet<>(Arrays.asList("apple", "pear")), products);
    }

    @Test
    public void initialization_is_idempotent() throws Exception {
        String cartId = cartId();
        service.initialize(cartId, "client-1");
        service.initialize(cartId, "client-2");
        assertEquals(1, version(cartId));
        assertEquals("client-1", service.read(cartId).get().getClientId());
    }

    @Test
    public void removed_item_leaves_cart() throws Exception {
        String cartId = cartId();
        service.initialize(cartId, "client-1");
        service.add(cartId, "apple", 1).get(5, TimeUnit.SECONDS);
        service.add(cartId, "pear", 1).get(5, TimeUnit.SECONDS);
        service.remove(cartId, "apple", new BigDecimal("9.990"));
        assertEquals(Collections.singletonList(CartItem.of("pear", 1, PRICE)), service.read(cartId).get().getItems());
        assertEquals(4, version(cartId));
    }

    @Test
    public void origin_epoch_is_registered_once() throws Exception {
        String cartId = cartId();
        service.initialize(cartId, "client-1");
        service.confirm(cartId, Instant.now());
        CartSummary first = service.summarizeWithOriginEpoch(cartId, () -> CompletableFuture.completedFuture(7L))
                .get(5, TimeUnit.SECONDS);
        assertEquals(7L, first.getOriginEpoch());
        assertEquals(3, version(cartId));
        CartSummary second = service.summarizeWithOriginEpoch(cartId, () -> CompletableFuture.completedFuture(9L))
                .get(5, TimeUnit.SECONDS);
        assertEquals(7L, second.getOriginEpoch());
        assertEquals(first.getView(), second.getView());
        assertEquals(3, version(cartId));
    }

    @Test
    public void pending_cart_cannot_be_summarized() throws Exception {
        String cartId = cartId();
        service.initialize(cartId, "client-1");
        try {
            service.summarizeWithOriginEpoch(cartId, () -> CompletableFuture.completedFuture(7L))
                    .get(5, TimeUnit.SECONDS);
            fail("Summarizing pending cart should fail");
        } catch (ExecutionException e) {
            assertThat(e.getCause(), instanceOf(DomainRuleViolationException.class));
        }
    }

    @Test
    public void unknown_cart_has_no_view() throws Exception {
        assertEquals(Optional.empty(), service.read(cartId()));
        VersionedCartView versioned = service.summarizeWithVersion(cartId());
        assertFalse(versioned.getView().isPresent());
        assertEquals(0, versioned.getVersion());
    }
}
