/**
 * Shopping cart aggregate built on {@link io.github.goodees.decider.core.Decider}.
 */
@ImmutablesSupport
package io.github.goodees.decider.example.cart;

import io.github.goodees.decider.immutables.ImmutablesSupport;
