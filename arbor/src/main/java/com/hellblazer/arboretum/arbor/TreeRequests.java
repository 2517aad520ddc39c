/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Arboretum.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.arboretum.arbor;

import com.hellblazer.arboretum.animation.OperationKind;
import com.hellblazer.arboretum.animation.OperationRequest;

import java.util.ArrayList;
import java.util.List;

/**
 * Controller requests for the search tree engines.
 * <pre>
 * var controller = new AnimationController&lt;&gt;(avl);
 * controller.enqueueAll(TreeRequests.insertAll(List.of(30, 20, 10)));
 * </pre>
 *
 * @author hal.hildebrand
 */
public final class TreeRequests {

    private TreeRequests() {
    }

    public static <K extends Comparable<? super K>, E extends SearchTreeEngine<K>> OperationRequest<E> insert(
    K value) {
        return new OperationRequest<E>(OperationKind.INSERT, "insert " + value, e -> e.insert(value));
    }

    public static <K extends Comparable<? super K>, E extends SearchTreeEngine<K>> OperationRequest<E> search(
    K target) {
        return new OperationRequest<E>(OperationKind.SEARCH, "search " + target, e -> e.search(target));
    }

    public static <K extends Comparable<? super K>, E extends SearchTreeEngine<K>> OperationRequest<E> delete(
    K target) {
        return new OperationRequest<E>(OperationKind.DELETE, "delete " + target, e -> e.delete(target));
    }

    public static <K extends Comparable<? super K>, E extends SearchTreeEngine<K>> OperationRequest<E> traverse(
    TraversalOrder order) {
        return new OperationRequest<E>(OperationKind.TRAVERSE, order + " traversal", e -> e.traverse(order));
    }

    /**
     * One insert request per value, in order, for batch execution.
     */
    public static <K extends Comparable<? super K>, E extends SearchTreeEngine<K>> List<OperationRequest<E>> insertAll(
    Iterable<? extends K> values) {
        var requests = new ArrayList<OperationRequest<E>>();
        for (var value : values) {
            requests.add(insert(value));
        }
        return requests;
    }
}
