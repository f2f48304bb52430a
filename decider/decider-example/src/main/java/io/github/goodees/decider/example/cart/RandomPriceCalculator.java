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

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Random;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Made up prices for demonstration. Every product gets random price on first request, and keeps it.
 */
public class RandomPriceCalculator implements PriceCalculator {
    private final ConcurrentMap<String, BigDecimal> prices = new ConcurrentHashMap<>();
    private final Random random;

    public RandomPriceCalculator() {
        this(new Random());
    }

    public RandomPriceCalculator(Random random) {
        this.random = random;
    }

    @Override
    public CompletionStage<BigDecimal> calculatePrice(String productId, int quantity) {
        return CompletableFuture.completedFuture(prices.computeIfAbsent(productId, this::randomPrice));
    }

    private BigDecimal randomPrice(String productId) {
        // 1.00 to 100.00
        synchronized (random) {
            return BigDecimal.valueOf(100 + random.nextInt(9901), 2).setScale(2, RoundingMode.UNNECESSARY);
        }
    }
}
