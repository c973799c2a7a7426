package org.truetranslation.sword.core.reference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ServiceLoader;

public final class ReferenceProviders {
    private static final Logger LOG = LoggerFactory.getLogger(ReferenceProviders.class);

    private ReferenceProviders() {
    }

    /**
     * The first provider registered under {@code META-INF/services}, or an
     * {@link UnavailableReferenceProvider} when there is none.
     */
    public static ReferenceProvider load() {
        return load(ReferenceProviders.class.getClassLoader());
    }

    static ReferenceProvider load(ClassLoader classLoader) {
        for (ReferenceProvider provider : ServiceLoader.load(ReferenceProvider.class, classLoader)) {
            LOG.debug("Using reference provider {}", provider.getClass().getName());
            return provider;
        }
        return new UnavailableReferenceProvider();
    }
}
