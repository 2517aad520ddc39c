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
package com.hellblazer.arboretum.animation;

import java.util.Objects;
import java.util.function.Predicate;

/**
 * A request for one animated operation, issued by an {@link AnimationController} once its structure is idle.
 *
 * @param kind        the operation kind, which selects the animation duration
 * @param description human readable description for logs and events
 * @param issuer      issues the request on the structure; returns false when the request is a domain no-op (e.g. a
 *                    duplicate insert) and no animation was started
 * @param <S>         the structure type
 * @author hal.hildebrand
 */
public record OperationRequest<S extends AnimatedStructure>(OperationKind kind, String description,
                                                            Predicate<? super S> issuer) {

    public OperationRequest {
        Objects.requireNonNull(kind, "kind cannot be null");
        Objects.requireNonNull(description, "description cannot be null");
        Objects.requireNonNull(issuer, "issuer cannot be null");
    }

    /**
     * Issue the request on the structure.
     *
     * @param structure the target structure, which must be idle
     * @return true if an animation was started
     */
    public boolean issue(S structure) {
        return issuer.test(structure);
    }

    @Override
    public String toString() {
        return kind + " " + description;
    }
}
