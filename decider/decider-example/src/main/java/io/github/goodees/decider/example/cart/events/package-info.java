/**
 * Events of a shopping cart. Type tags are the simple names of the interfaces, so a renamed interface has to be
 * registered under its previous name as well.
 */
@ImmutablesSupport
package io.github.goodees.decider.example.cart.events;

import io.github.goodees.decider.immutables.ImmutablesSupport;
