package io.github.goodees.decider.core;

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

import io.github.goodees.decider.core.store.StreamStoreException;
import org.junit.Test;

import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class RetryPolicyTest {
    private final StreamId id = StreamId.of("Cart", "1");
    private final StreamStoreException conflict = StreamStoreException.versionConflict(id, 1, 2);

    @Test
    public void default_policy_allows_three_retries() {
        RetryPolicy policy = RetryPolicy.defaultPolicy();
        assertTrue(policy.shouldRetry(id, conflict, 1));
        assertTrue(policy.shouldRetry(id, conflict, 3));
        assertFalse(policy.shouldRetry(id, conflict, 4));
    }

    @Test
    public void never_does_not_retry() {
        assertFalse(RetryPolicy.never().shouldRetry(id, conflict, 1));
    }

    @Test(expected = IllegalArgumentException.class)
    public void negative_retries_are_rejected() {
        RetryPolicy.maxRetries(-1);
    }
}
