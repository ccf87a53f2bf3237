package io.stagecraft.core.resource;

import io.stagecraft.core.util.Immutables;
import java.util.Comparator;

/// Identity of a managed resource: a service, network, volume, cloud instance, ...
///
/// Value equality over all four components. Only {@code namespace} is optional
/// on the wire; every component is normalised to the empty string when absent.
///
/// @param kind      resource kind, e.g. `service`, `network`, `volume`, `droplet`
/// @param name      logical name
/// @param provider  owning provider, e.g. `docker-compose`, `digitalocean`
/// @param namespace optional grouping, empty when unused
public record ResourceRef(String kind, String name, String provider, String namespace) {

    /// Kind then name, the order planners must emit snapshot resources in.
    public static final Comparator<ResourceRef> KIND_THEN_NAME =
            Comparator.comparing(ResourceRef::kind)
                    .thenComparing(ResourceRef::name)
                    .thenComparing(ResourceRef::provider)
                    .thenComparing(ResourceRef::namespace);

    public ResourceRef {
        kind = Immutables.orEmpty(kind);
        name = Immutables.orEmpty(name);
        provider = Immutables.orEmpty(provider);
        namespace = Immutables.orEmpty(namespace);
    }

    /// Creates a reference without a namespace.
    ///
    /// @param kind resource kind
    /// @param name logical name
    /// @param provider owning provider
    /// @return new reference, never null
    public static ResourceRef of(String kind, String name, String provider) {
        return new ResourceRef(kind, name, provider, "");
    }

    /// Returns an empty reference, used by steps that target nothing in particular.
    ///
    /// @return reference with all components empty, never null
    public static ResourceRef none() {
        return new ResourceRef("", "", "", "");
    }
}
