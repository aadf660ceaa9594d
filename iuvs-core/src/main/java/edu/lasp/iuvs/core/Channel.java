/*
 * Copyright (c) 2023.  Brockmann Consult GmbH (info@brockmann-consult.de)
 *
 * This program is free software; you can redistribute it and/or modify it
 * under the terms of the GNU General Public License as published by the Free
 * Software Foundation; either version 3 of the License, or (at your option)
 * any later version.
 * This program is distributed in the hope that it will be useful, but WITHOUT
 * ANY WARRANTY; without even the implied warranty of MERCHANTABILITY or
 * FITNESS FOR A PARTICULAR PURPOSE. See the GNU General Public License for
 * more details.
 *
 * You should have received a copy of the GNU General Public License along
 * with this program; if not, see http://www.gnu.org/licenses/
 *
 */

package edu.lasp.iuvs.core;

/**
 * IUVS detector channel enumeration
 */
public enum Channel {
    FUV, MUV;

    /**
     * Parses the channel keyword as written to the file headers ('fuv', 'MUV', ...).
     *
     * @param keyword - the header keyword
     * @return the channel
     */
    public static Channel fromKeyword(String keyword) {
        if (keyword == null) {
            throw new IuvsProcessingException("Missing channel keyword");
        }
        try {
            return valueOf(keyword.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IuvsProcessingException("Unknown IUVS channel: '" + keyword + "'", e);
        }
    }
}
