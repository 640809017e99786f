/*-
 * =================================LICENSE_START==================================
 * qbatch-gcp
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
package io.aleph0.qbatch.gcp;

public record PubsubQueueClientMetrics(
    /**
     * The number of messages pulled from the subscription
     */
    long pulled,

    /**
     * The number of messages acknowledged, including messages moved to the poison topic
     */
    long acknowledged,

    /**
     * The number of retried messages whose ack deadline was modified for redelivery
     */
    long deadlinesModified,

    /**
     * The number of messages published to the poison topic
     */
    long poisoned) {
}
