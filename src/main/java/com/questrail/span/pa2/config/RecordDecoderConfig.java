package com.questrail.span.pa2.config;

import com.questrail.span.pa2.internal.time.SystemWallClock;
import com.questrail.span.pa2.internal.time.WallClock;
import com.questrail.span.pa2.observability.DecodeObservabilitySink;
import com.questrail.span.pa2.observability.NullObservabilitySink;
import com.questrail.span.pa2.schema.RecordRegistry;
import com.questrail.span.pa2.schema.StandardRecordSchemas;

import java.util.Objects;

/**
 * Aggregated configuration for a PA2 record decoder.
 */
public record RecordDecoderConfig(
    RecordRegistry registry,
    DecodeObservabilitySink observability,
    WallClock clock
) {
    public RecordDecoderConfig {
        Objects.requireNonNull(registry, "registry");
        Objects.requireNonNull(observability, "observability");
        Objects.requireNonNull(clock, "clock");
    }

    /**
     * Standard PA2 layouts, no observability.
     */
    public static RecordDecoderConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private RecordRegistry registry = StandardRecordSchemas.registry();
        private DecodeObservabilitySink observability = NullObservabilitySink.INSTANCE;
        private WallClock clock = SystemWallClock.INSTANCE;

        public Builder withRegistry(RecordRegistry registry) {
            this.registry = registry;
            return this;
        }

        public Builder withObservability(DecodeObservabilitySink observability) {
            this.observability = observability;
            return this;
        }

        public Builder withClock(WallClock clock) {
            this.clock = clock;
            return this;
        }

        public RecordDecoderConfig build() {
            return new RecordDecoderConfig(registry, observability, clock);
        }
    }
}
