/*-
 * =================================LICENSE_START==================================
 * qbatch-core
 * ====================================SECTION=====================================
 * Copyright (C) 2025 aleph0
 * ====================================SECTION=====================================
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
 * ==================================LICENSE_END===================================
 */
package io.aleph0.qbatch.core.listener;

public record ListenerMetrics(
    /**
     * The number of cycles that have finished
     */
    long cycles,

    /**
     * The number of cycles that ended {@link CycleOutcome#PROCESSED processed}
     */
    long processedCycles,

    /**
     * The number of cycles that ended {@link CycleOutcome#REJECTED rejected}
     */
    long rejectedCycles,

    /**
     * The number of cycles that ended {@link CycleOutcome#EMPTY empty}
     */
    long emptyCycles,

    /**
     * The number of cycles that ended {@link CycleOutcome#FAILED failed}
     */
    long failedCycles,

    /**
     * The number of messages retrieved
     */
    long received,

    /**
     * The number of messages deleted
     */
    long deleted,

    /**
     * The number of messages returned to the queue for retry
     */
    long retried,

    /**
     * The number of cycles in which at least one retrieval failed
     */
    long retrievalFailures,

    /**
     * The number of cycles in which at least one delete or retry failed
     */
    long completionFailures) {
}
