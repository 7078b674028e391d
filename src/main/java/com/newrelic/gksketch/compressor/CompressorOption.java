// Copyright 2021 New Relic Corporation. All rights reserved.
// SPDX-License-Identifier: Apache-2.0
// This file is part of the GkSketch project.

package com.newrelic.gksketch.compressor;

import java.util.function.Supplier;

public enum CompressorOption implements Supplier<SummaryCompressor> {
    CLASSIC {
        public SummaryCompressor getCompressor() {
            return ClassicCompressor.INSTANCE;
        }
    },
    MODIFIED {
        public SummaryCompressor getCompressor() {
            // Same error bound as CLASSIC. Usually fewer entries, and a much cheaper merge.
            return ModifiedCompressor.INSTANCE;
        }
    };

    abstract public SummaryCompressor getCompressor();

    @Override
    public SummaryCompressor get() {
        return getCompressor();
    }
}
