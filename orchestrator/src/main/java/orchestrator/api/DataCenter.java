package orchestrator.api;

import java.util.List;

/**
 * A data center and the storage domains attached to it.
 */
public interface DataCenter {

    String id();

    String name();

    List<StorageDomain> storageDomains();

    /**
     * Fetches one attached storage domain by name.
     *
     * @return the domain, or null if none is attached under that name
     */
    StorageDomain storageDomain(String name);
}
