package com.libragraph.docfields.extraction.registry;

import com.libragraph.docfields.extraction.api.FieldResolver;
import com.libragraph.docfields.extraction.api.Strategy;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Central registry mapping each {@link Strategy} to its {@link FieldResolver}.
 * All resolver beans are discovered via CDI.
 */
@ApplicationScoped
public class ResolverRegistry {

    private static final Logger log = Logger.getLogger(ResolverRegistry.class);

    @Inject
    Instance<FieldResolver> resolvers;

    private final Map<Strategy, FieldResolver> registry = new EnumMap<>(Strategy.class);

    /**
     * Builds a registry outside the container, e.g. for unit tests.
     */
    public static ResolverRegistry of(FieldResolver... resolvers) {
        ResolverRegistry registry = new ResolverRegistry();
        for (FieldResolver resolver : resolvers) {
            registry.register(resolver);
        }
        return registry;
    }

    @PostConstruct
    void init() {
        for (FieldResolver resolver : resolvers) {
            register(resolver);
            log.infof("Registered resolver: %s → %s",
                    resolver.strategy().label(), resolver.getClass().getSimpleName());
        }
        log.infof("ResolverRegistry initialized with %d strategies", registry.size());
    }

    private void register(FieldResolver resolver) {
        Strategy strategy = resolver.strategy();
        if (strategy == null || strategy == Strategy.UNKNOWN) {
            throw new IllegalStateException(
                    "Resolver " + resolver.getClass().getName() + " must declare a concrete strategy");
        }
        FieldResolver existing = registry.put(strategy, resolver);
        if (existing != null) {
            throw new IllegalStateException(
                    "Duplicate resolver for strategy '" + strategy.label() + "': " +
                            existing.getClass().getName() + " and " + resolver.getClass().getName());
        }
    }

    /**
     * Finds the resolver for a strategy. {@link Strategy#UNKNOWN} never has one.
     */
    public Optional<FieldResolver> lookup(Strategy strategy) {
        return Optional.ofNullable(registry.get(strategy));
    }

    public Set<Strategy> strategies() {
        return Collections.unmodifiableSet(registry.keySet());
    }

    public int size() {
        return registry.size();
    }
}
