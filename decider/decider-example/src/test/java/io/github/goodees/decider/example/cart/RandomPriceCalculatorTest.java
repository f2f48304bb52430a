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

import org.junit.Test;

import java.math.BigDecimal;
import java.util.Random;
import java.util.concurrent.TimeUnit;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class RandomPriceCalculatorTest {
    private final RandomPriceCalculator calculator = new RandomPriceCalculator(new Random(17));

    private BigDecimal price(String productId, int quantity) throws Exception {
        return calculator.calculatePrice(productId, quantity).toCompletableFuture().get(1, TimeUnit.SECONDS);
    }

    @Test
    public void product_keeps_its_price() throws Exception {
        BigDecimal first = price("apple", 1);
        assertEquals(first, price("apple", 5));
    }

    @Test
    public void prices_are_in_cents_within_range() throws Exception {
        for (int i = 0; i < 50; i++) {
            BigDecimal price = price("product-" + i, 1);
            assertEquals(2, price.scale());
            assertTrue(price.compareTo(BigDecimal.ONE) >= 0);
            assertTrue(price.compareTo(new BigDecimal("100")) <= 0);
        }
    }
}
