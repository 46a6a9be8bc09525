/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Quadrille.
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
package com.hellblazer.quadrille.quadtree;

/**
 * Constants shared by the search tree implementation
 *
 * @author hal.hildebrand
 */
public final class Constants {

    /**
     * A node holding this many distinct values or fewer never has children
     */
    public static final int MIN_DATA_SIZE = 3;

    private Constants() {
        throw new IllegalStateException("Utility class");
    }
}
