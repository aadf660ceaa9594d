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
 * Raised when a single input file cannot be processed. The message names the offending metadata or
 * auxiliary data.
 */
public class IuvsProcessingException extends RuntimeException {

    public IuvsProcessingException(String message) {
        super(message);
    }

    public IuvsProcessingException(String message, Throwable cause) {
        super(message, cause);
    }

    public IuvsProcessingException(Throwable cause) {
        super(cause);
    }
}
