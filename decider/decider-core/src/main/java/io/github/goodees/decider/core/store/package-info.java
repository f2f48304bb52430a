/**
 * Append-only event streams with conditional append.
 */
package io.github.goodees.decider.core.store;
