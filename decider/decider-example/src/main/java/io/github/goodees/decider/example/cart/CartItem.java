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

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.immutables.value.Value;

import java.math.BigDecimal;

/**
 * Pieces of one product at one price. Same product added at different prices makes separate items.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableCartItem.class)
@JsonDeserialize(as = ImmutableCartItem.class)
public interface CartItem {
    String getProductId();

    int getQuantity();

    BigDecimal getUnitPrice();

    /**
     * Whether this item is the product at the price. Prices are compared by value, {@code 10.0} matches {@code 10}.
     * @param productId the product
     * @param unitPrice the price
     * @return true when the item holds the product at that price
     */
    default boolean matches(String productId, BigDecimal unitPrice) {
        return getProductId().equals(productId) && getUnitPrice().compareTo(unitPrice) == 0;
    }

    static CartItem of(String productId, int quantity, BigDecimal unitPrice) {
        return ImmutableCartItem.builder().productId(productId).quantity(quantity).unitPrice(unitPrice).build();
    }
}
