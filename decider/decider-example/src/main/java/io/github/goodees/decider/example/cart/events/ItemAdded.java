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

import java.math.BigDecimal;

@Value.Immutable
@JsonSerialize(as = ImmutableItemAdded.class)
@JsonDeserialize(as = ImmutableItemAdded.class)
public interface ItemAdded extends CartEvent {
    String getProductId();

    /**
     * Number of pieces added. Events written before quantity was recorded added single piece.
     * @return the quantity
     */
    @Value.Default
    default int getQuantity() {
        return 1;
    }

    BigDecimal getUnitPrice();

    static ItemAdded of(String productId, int quantity, BigDecimal unitPrice) {
        return ImmutableItemAdded.builder().productId(productId).quantity(quantity).unitPrice(unitPrice).build();
    }
}
