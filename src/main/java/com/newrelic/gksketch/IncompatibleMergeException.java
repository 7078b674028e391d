// Copyright 2021 New Relic Corporation. All rights reserved.
// SPDX-License-Identifier: Apache-2.0
// This file is part of the GkSketch project.

package com.newrelic.gksketch;

// Thrown when two sketches differ in value type or compressor option. Neither sketch is modified.
public class IncompatibleMergeException extends IllegalArgumentException {
    private static final long serialVersionUID = 1L;

    public IncompatibleMergeException(final String message) {
        super(message);
    }
}
