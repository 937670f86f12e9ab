/*
 * Copyright 2012-2017 the original author or authors.
 *
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
 */

package com.arakelian.jsontree;

/**
 * Builds a fresh sibling chain for one container and releases every node collected so far as a
 * unit when construction of the container fails.
 */
final class SiblingChain {
    private JsonNode head;

    private JsonNode tail;

    void append(final JsonNode node) {
        if (head == null) {
            head = node;
        } else {
            tail.setNext(node);
        }
        tail = node;
    }

    /**
     * Hands the chain over to the given container, which owns it from then on.
     *
     * @param container
     *            array or object node
     */
    void attachTo(final JsonNode container) {
        container.setChild(head);
        head = null;
        tail = null;
    }

    /**
     * Deletes every node collected so far.
     *
     * @param context
     *            context whose allocator created the nodes
     */
    void release(final JsonContext context) {
        if (head != null) {
            context.deleteChain(head);
        }
        head = null;
        tail = null;
    }
}
