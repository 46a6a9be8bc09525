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

import java.util.EnumSet;
import java.util.Set;

/**
 * The four quadrants of a search space. Each code carries a distinct bit so that a value belonging to several
 * quadrants at once can be described by a single mask.
 * <p>
 * The tree itself addresses children by code only; the mask helpers are for predicate implementations that report
 * quadrant membership as a mask.
 *
 * @author hal.hildebrand
 */
public enum RegionCode {
    UPPER_LEFT(1 << 0), UPPER_RIGHT(1 << 1), LOWER_LEFT(1 << 2), LOWER_RIGHT(1 << 3);

    /** Mask with every quadrant bit set */
    public static final int ALL = 0b1111;

    private final int bit;

    RegionCode(int bit) {
        this.bit = bit;
    }

    /**
     * Decode a mask into the quadrants whose bits are set
     *
     * @param mask bitwise or of quadrant bits
     * @return the quadrants present in the mask
     * @throws IllegalArgumentException if the mask carries bits outside the four quadrants
     */
    public static Set<RegionCode> fromMask(int mask) {
        if ((mask & ~ALL) != 0) {
            throw new IllegalArgumentException("Invalid region mask: 0x" + Integer.toHexString(mask));
        }
        var codes = EnumSet.noneOf(RegionCode.class);
        for (var code : values()) {
            if (code.isSet(mask)) {
                codes.add(code);
            }
        }
        return codes;
    }

    /**
     * Encode a set of quadrants as a mask
     */
    public static int toMask(Set<RegionCode> codes) {
        var mask = 0;
        for (var code : codes) {
            mask |= code.bit;
        }
        return mask;
    }

    public int bit() {
        return bit;
    }

    /**
     * @return true if this quadrant's bit is set in the mask
     */
    public boolean isSet(int mask) {
        return (mask & bit) != 0;
    }

    public boolean isUpper() {
        return this == UPPER_LEFT || this == UPPER_RIGHT;
    }

    public boolean isLeft() {
        return this == UPPER_LEFT || this == LOWER_LEFT;
    }
}
