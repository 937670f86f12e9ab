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

import com.google.common.base.Preconditions;

/**
 * Node that borrows the payload of another node: its type, number, text and members are those of
 * the target. The reference has its own key and sibling links, so the same value can appear in
 * several containers, but it never modifies or releases what it borrows.
 */
public final class JsonReference extends JsonNode {
    private final JsonNode target;

    JsonReference(final JsonNode target) {
        Preconditions.checkArgument(target != null, "target must be non-null");
        // a reference to a reference borrows the underlying payload directly
        this.target = target instanceof JsonReference ? ((JsonReference) target).target : target;
    }

    @Override
    public JsonNode getFirstChild() {
        return target.getFirstChild();
    }

    @Override
    public int getInt() {
        return target.getInt();
    }

    @Override
    public double getNumber() {
        return target.getNumber();
    }

    /**
     * Returns the node whose payload this reference borrows.
     *
     * @return the borrowed node
     */
    public JsonNode getTarget() {
        return target;
    }

    @Override
    public JsonType getType() {
        return target.getType();
    }

    @Override
    public boolean isReference() {
        return true;
    }

    @Override
    public double setNumber(final double number) {
        throw new IllegalStateException("payload of a reference cannot be modified");
    }

    @Override
    byte[] text() {
        return target.text();
    }
}
