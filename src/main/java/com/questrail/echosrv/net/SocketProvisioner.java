package com.questrail.echosrv.net;

import com.questrail.echosrv.error.BindFailedException;
import com.questrail.echosrv.error.FdInheritanceException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.OptionalInt;

/**
 * SocketProvisioner
 * =============================================================================
 * Turns a {@link BindStrategy} into a ready socket handle.
 *
 * <h2>Resolution</h2>
 * <ul>
 *   <li>{@code Bind}: bind the target; inheritance is never consulted.</li>
 *   <li>{@code Inherit}: adopt the descriptor; validation failure is fatal.</li>
 *   <li>{@code InheritOrBind}: explicit descriptor, else the service name's inherited
 *       descriptor, else bind the fallback. A descriptor that fails validation also
 *       falls back.</li>
 * </ul>
 */
public final class SocketProvisioner
{
    private static final Logger log = LoggerFactory.getLogger(SocketProvisioner.class);

    private final DescriptorValidator validator;

    public SocketProvisioner() {
        this(NativeDescriptorValidator.INSTANCE);
    }

    public SocketProvisioner(DescriptorValidator validator) {
        this.validator = Objects.requireNonNull(validator, "validator");
    }

    public static SocketSource resolve(BindStrategy strategy, String serviceName, InheritanceConfig inheritance) {
        Objects.requireNonNull(strategy, "strategy");
        Objects.requireNonNull(inheritance, "inheritance");

        if (strategy instanceof BindStrategy.Bind bind) {
            return new SocketSource.Bind(bind.target());
        }
        if (strategy instanceof BindStrategy.Inherit inherit) {
            return new SocketSource.Inherit(inherit.descriptor());
        }

        BindStrategy.InheritOrBind preferred = (BindStrategy.InheritOrBind) strategy;
        if (preferred.descriptor().isPresent()) {
            return new SocketSource.Inherit(preferred.descriptor().getAsInt());
        }
        if (serviceName != null) {
            OptionalInt inherited = inheritance.descriptorFor(serviceName);
            if (inherited.isPresent()) {
                return new SocketSource.Inherit(inherited.getAsInt());
            }
        }
        return new SocketSource.Bind(preferred.fallback());
    }

    public <H> H build(SocketFactory<H> factory,
                       BindStrategy strategy,
                       String serviceName,
                       InheritanceConfig inheritance) {
        Objects.requireNonNull(factory, "factory");

        SocketSource source = resolve(strategy, serviceName, inheritance);
        if (source instanceof SocketSource.Bind bind) {
            return bindFresh(factory, bind.target());
        }

        int fd = ((SocketSource.Inherit) source).descriptor();
        try {
            ValidatedDescriptor validated = validator.validate(fd, factory.socketKind(), factory.acceptedFamilies());
            H handle = factory.adopt(validated);
            log.info("Adopted inherited fd {} as {} ({})", fd, factory.description(), validated.family());
            return handle;
        } catch (FdInheritanceException e) {
            if (strategy instanceof BindStrategy.InheritOrBind preferred) {
                log.warn("Inherited fd {} rejected for {}: {}; binding {} instead",
                        fd, factory.description(), e.getMessage(), preferred.fallback());
                return bindFresh(factory, preferred.fallback());
            }
            throw e;
        }
    }

    private static <H> H bindFresh(SocketFactory<H> factory, BindTarget target) {
        if (!targetMatches(factory, target)) {
            throw new BindFailedException("Cannot bind " + factory.description() + " to " + target
                    + ": address kind does not match the transport");
        }
        return factory.bind(target);
    }

    static boolean targetMatches(SocketFactory<?> factory, BindTarget target) {
        boolean local = factory.acceptedFamilies().contains(AddressFamily.UNIX);
        return local ? target.isUnix() : target.isNetwork();
    }
}
