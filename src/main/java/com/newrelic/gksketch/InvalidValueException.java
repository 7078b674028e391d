// Copyright 2021 New Relic Corporation. All rights reserved.
// SPDX-License-Identifier: Apache-2.0
// This file is part of the GkSketch project.

package com.newrelic.gksketch;

// Thrown on insert of a value that has no place in a total order, such as null or NaN.
// The sketch is left unmodified.
public class InvalidValueException extends IllegalArgumentException {
    private static final long serialVersionUID = 1L;

    public InvalidValueException(final String message) {
        super(message);
    }
}
