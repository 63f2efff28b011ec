package orchestrator.activation;

import orchestrator.api.DataCenter;
import orchestrator.api.Host;
import orchestrator.api.HostState;
import orchestrator.api.ManagementApi;
import orchestrator.api.StorageDomain;
import orchestrator.api.StorageDomainState;
import orchestrator.exceptions.ConvergenceTimeoutException;
import orchestrator.exceptions.TransientRejectionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Drives activation and deactivation of storage domains and hosts through the
 * management API and waits for the observed state to converge.
 *
 * <p>Ordering between groups is the caller's job. Per data center:
 * <ul>
 *   <li>activation: master domains first, then the others</li>
 *   <li>deactivation: non-master domains first, then the master</li>
 * </ul>
 * {@link #activateAllStorageDomains(ManagementApi)} and
 * {@link #deactivateAllStorageDomains(ManagementApi)} apply that order.
 *
 * <p>Transient rejections are handled according to a fixed
 * {@link RejectionPolicy} per operation:
 * <ul>
 *   <li>storage domains: {@link RejectionPolicy#PROPAGATE}</li>
 *   <li>host deactivation: {@link RejectionPolicy#REQUEUE}</li>
 *   <li>host activation: {@link RejectionPolicy#SWALLOW}</li>
 * </ul>
 *
 * <p>Convergence is polled with the long bound for storage domains and the
 * short bound for hosts; an elapsed bound raises {@link ConvergenceTimeoutException}.
 */
public final class ActivationController {

    private static final Logger log = LoggerFactory.getLogger(ActivationController.class);

    public static final RejectionPolicy STORAGE_DOMAIN_POLICY = RejectionPolicy.PROPAGATE;
    public static final RejectionPolicy HOST_DEACTIVATION_POLICY = RejectionPolicy.REQUEUE;
    public static final RejectionPolicy HOST_ACTIVATION_POLICY = RejectionPolicy.SWALLOW;

    private final PollingConfig polling;
    private final ConvergencePoller poller;

    public ActivationController(PollingConfig polling) {
        this(polling, new ConvergencePoller(polling.pollInterval()));
    }

    public ActivationController(PollingConfig polling, ConvergencePoller poller) {
        this.polling = Objects.requireNonNull(polling, "polling");
        this.poller = Objects.requireNonNull(poller, "poller");
    }

    /**
     * Activates a group of storage domains and waits until each is active.
     *
     * @param api the management API
     * @param domains the group; every request is issued before polling starts
     * @throws TransientRejectionException if a request is rejected
     * @throws ConvergenceTimeoutException if a domain does not become active in time
     */
    public void activateStorageDomains(ManagementApi api, List<? extends StorageDomain> domains) {
        transitionStorageDomains(api, domains, "activate", StorageDomain::activate, StorageDomainState.ACTIVE);
    }

    /**
     * Moves a group of storage domains to maintenance and waits until each is there.
     *
     * @param api the management API
     * @param domains the group; every request is issued before polling starts
     * @throws TransientRejectionException if a request is rejected
     * @throws ConvergenceTimeoutException if a domain does not reach maintenance in time
     */
    public void deactivateStorageDomains(ManagementApi api, List<? extends StorageDomain> domains) {
        transitionStorageDomains(api, domains, "deactivate", StorageDomain::deactivate, StorageDomainState.MAINTENANCE);
    }

    /**
     * Activates every storage domain, data center by data center, masters first.
     */
    public void activateAllStorageDomains(ManagementApi api) {
        for (DataCenter dc : api.dataCenters()) {
            List<StorageDomain> domains = dc.storageDomains();
            activateStorageDomains(api, masters(domains, true));
            activateStorageDomains(api, masters(domains, false));
        }
        log.info("Storage domains activated");
    }

    /**
     * Deactivates every storage domain, data center by data center, masters last.
     */
    public void deactivateAllStorageDomains(ManagementApi api) {
        for (DataCenter dc : api.dataCenters()) {
            List<StorageDomain> domains = dc.storageDomains();
            deactivateStorageDomains(api, masters(domains, false));
            deactivateStorageDomains(api, masters(domains, true));
        }
        log.info("Storage domains in maintenance");
    }

    /**
     * Moves every host to maintenance. Rejected requests are retried until
     * accepted, then each host is polled for maintenance.
     *
     * @throws ConvergenceTimeoutException if a host does not reach maintenance in time
     */
    public void deactivateAllHosts(ManagementApi api) {
        List<Host> hosts = api.hosts();
        RequestDispatcher.issueAll("maintenance", hosts, Host::name, Host::deactivate, HOST_DEACTIVATION_POLICY);

        for (Host host : api.hosts()) {
            String name = host.name();
            log.debug("Waiting for {} to go into maintenance", name);
            poller.await("host " + name + " in " + HostState.MAINTENANCE, polling.shortTimeout(),
                    () -> hostState(api, name) == HostState.MAINTENANCE);
        }
        log.info("Hosts in maintenance");
    }

    /**
     * Activates every host, ignoring rejected requests, then polls each host
     * until it is up.
     *
     * @throws ConvergenceTimeoutException if a host does not come up in time
     */
    public void activateAllHosts(ManagementApi api) {
        List<String> names = api.hosts().stream().map(Host::name).toList();
        RequestDispatcher.issueAll("activate", names, n -> n, n -> {
            Host host = api.host(n);
            if (host != null) host.activate();
        }, HOST_ACTIVATION_POLICY);

        for (String name : names) {
            poller.await("host " + name + " " + HostState.UP, polling.shortTimeout(),
                    () -> hostState(api, name) == HostState.UP);
        }
        log.info("Hosts activated");
    }

    private void transitionStorageDomains(ManagementApi api,
                                          List<? extends StorageDomain> domains,
                                          String action,
                                          RequestDispatcher.Request<StorageDomain> request,
                                          StorageDomainState target) {
        if (domains.isEmpty()) return;

        RequestDispatcher.issueAll(action, domains, StorageDomain::name, request, STORAGE_DOMAIN_POLICY);

        for (StorageDomain sd : domains) {
            DataCenter dc = api.dataCenter(sd.dataCenterId());
            if (dc == null) {
                throw new IllegalStateException("Storage domain " + sd.name()
                        + " refers to unknown data center " + sd.dataCenterId());
            }
            String name = sd.name();
            poller.await("storage domain " + name + " " + target, polling.longTimeout(),
                    () -> domainState(dc, name) == target);
        }
    }

    private static List<StorageDomain> masters(List<StorageDomain> domains, boolean master) {
        return domains.stream().filter(sd -> sd.isMaster() == master).toList();
    }

    private static StorageDomainState domainState(DataCenter dc, String name) {
        StorageDomain sd = dc.storageDomain(name);
        return sd != null ? sd.state() : null;
    }

    private static HostState hostState(ManagementApi api, String name) {
        Host host = api.host(name);
        return host != null ? host.state() : null;
    }
}
