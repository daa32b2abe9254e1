package io.b2mash.b2b.bidsubmission.portal;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class PortalAdapterRegistry {

  private static final Logger log = LoggerFactory.getLogger(PortalAdapterRegistry.class);

  // Built at startup: portal id -> adapter bean
  private final Map<String, PortalAdapter> adapters = new TreeMap<>();

  public PortalAdapterRegistry(List<PortalAdapter> adapterBeans) {
    // Fail fast if two adapters claim the same portal id.
    for (var adapter : adapterBeans) {
      var existing = adapters.putIfAbsent(adapter.portalId(), adapter);
      if (existing != null) {
        throw new IllegalStateException(
            "Duplicate PortalAdapter: portal="
                + adapter.portalId()
                + " registered by both "
                + existing.getClass().getName()
                + " and "
                + adapter.getClass().getName());
      }
    }
    log.info("Registered portal adapters: {}", adapters.keySet());
  }

  public Optional<PortalAdapter> find(String portalId) {
    return Optional.ofNullable(adapters.get(portalId));
  }

  /**
   * Resolves the adapter for a portal.
   *
   * @throws IllegalArgumentException if no adapter is registered for the portal
   */
  public PortalAdapter resolve(String portalId) {
    var adapter = adapters.get(portalId);
    if (adapter == null) {
      throw new IllegalArgumentException("No portal adapter registered for portal=" + portalId);
    }
    return adapter;
  }

  /** Lists registered portal ids in alphabetical order. */
  public List<String> availablePortals() {
    return List.copyOf(adapters.keySet());
  }
}
