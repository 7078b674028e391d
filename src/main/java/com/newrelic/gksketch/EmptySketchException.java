// Copyright 2021 New Relic Corporation. All rights reserved.
// SPDX-License-Identifier: Apache-2.0
// This file is part of the GkSketch project.

package com.newrelic.gksketch;

// Thrown when a value is requested from a sketch that has absorbed no observation.
public class EmptySketchException extends IllegalStateException {
    private static final long serialVersionUID = 1L;

    public EmptySketchException(final String message) {
        super(message);
    }
}
