package com.questrail.echosrv.net;

import java.util.Objects;
import java.util.OptionalInt;

/**
 * How a server obtains its socket: bind fresh, adopt an inherited descriptor, or try
 * adoption first and fall back to binding.
 *
 * <p>Chosen once per server configuration and never changed afterwards.</p>
 */
public sealed interface BindStrategy
        permits BindStrategy.Bind, BindStrategy.Inherit, BindStrategy.InheritOrBind
{
    /** Always create a fresh socket; inherited descriptors are never consulted. */
    record Bind(BindTarget target) implements BindStrategy {
        public Bind {
            Objects.requireNonNull(target, "target");
        }
    }

    /** Always adopt this descriptor; an invalid descriptor is a hard failure. */
    record Inherit(int descriptor) implements BindStrategy {
        public Inherit {
            if (descriptor < 0) {
                throw new IllegalArgumentException("descriptor must be >= 0");
            }
        }
    }

    /**
     * Prefer adoption (explicit descriptor, else the service name's inherited descriptor),
     * degrade to binding {@code fallback}.
     */
    record InheritOrBind(OptionalInt descriptor, BindTarget fallback) implements BindStrategy {
        public InheritOrBind {
            Objects.requireNonNull(descriptor, "descriptor");
            Objects.requireNonNull(fallback, "fallback");
            if (descriptor.isPresent() && descriptor.getAsInt() < 0) {
                throw new IllegalArgumentException("descriptor must be >= 0");
            }
        }
    }

    static BindStrategy bind(BindTarget target) {
        return new Bind(target);
    }

    static BindStrategy inherit(int descriptor) {
        return new Inherit(descriptor);
    }

    static BindStrategy inheritOrBind(BindTarget fallback) {
        return new InheritOrBind(OptionalInt.empty(), fallback);
    }

    static BindStrategy inheritOrBind(int descriptor, BindTarget fallback) {
        return new InheritOrBind(OptionalInt.of(descriptor), fallback);
    }
}
