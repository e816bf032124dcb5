/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.sorwood.reader;

/**
 * Base class of the failures a query against a {@link SorFileReader} may report.
 * A missing value is not a failure.
 */
public class SorReadException extends RuntimeException {

    public SorReadException(String message) {
        super(message);
    }
}
