package com.sports.sync.merge;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Groups records of different providers into entity clusters by unioning
 * {@link IdentityLink}s. A cluster holds at most one record per provider: a link
 * that would put two records of the same provider into one cluster is rejected
 * and both clusters stay as they were. Accepted links are never undone.
 *
 * <p>Not thread-safe; one graph belongs to one synchronization call.</p>
 */
public class IdentifierGraph {
    private static final Logger log = LoggerFactory.getLogger(IdentifierGraph.class);

    private final Map<RecordRef, Cluster> clusterOf = new HashMap<>();
    private final List<IdentityLink> acceptedLinks = new ArrayList<>();
    private final List<IdentityLink> rejectedLinks = new ArrayList<>();

    /**
     * Registers a record as its own cluster; no-op if already known.
     */
    public void add(RecordRef ref) {
        clusterOf.computeIfAbsent(ref, Cluster::new);
    }

    /**
     * Unions the clusters of both records of the link.
     *
     * @return true if the records now share a cluster, false if the link was rejected
     */
    public boolean link(IdentityLink link) {
        add(link.left());
        add(link.right());
        Cluster a = clusterOf.get(link.left());
        Cluster b = clusterOf.get(link.right());
        if (a == b) {
            return true;
        }
        for (Integer provider : b.members.keySet()) {
            if (a.members.containsKey(provider)) {
                log.debug("Rejecting link {} -> {} ({}): provider {} already present in cluster",
                        link.left(), link.right(), link.stage(), provider);
                rejectedLinks.add(link);
                return false;
            }
        }

        Cluster target = a.members.size() >= b.members.size() ? a : b;
        Cluster source = target == a ? b : a;
        for (RecordRef member : source.members.values()) {
            target.members.put(member.provider(), member);
            clusterOf.put(member, target);
        }
        acceptedLinks.add(link);
        return true;
    }

    /**
     * True if the record shares its cluster with at least one other record.
     */
    public boolean isLinked(RecordRef ref) {
        Cluster cluster = clusterOf.get(ref);
        return cluster != null && cluster.members.size() > 1;
    }

    public List<IdentityLink> getAcceptedLinks() {
        return Collections.unmodifiableList(acceptedLinks);
    }

    public List<IdentityLink> getRejectedLinks() {
        return Collections.unmodifiableList(rejectedLinks);
    }

    /**
     * All clusters, each as a provider-ordered member list, ordered by their
     * lowest member (first provider's input order first).
     */
    public List<List<RecordRef>> clusters() {
        List<List<RecordRef>> result = new ArrayList<>();
        for (Cluster cluster : new HashSet<>(clusterOf.values())) {
            result.add(List.copyOf(cluster.members.values()));
        }
        result.sort((x, y) -> x.get(0).compareTo(y.get(0)));
        return result;
    }

    private static final class Cluster {
        private final TreeMap<Integer, RecordRef> members = new TreeMap<>();

        private Cluster(RecordRef first) {
            members.put(first.provider(), first);
        }
    }
}
