package com.tracker.hierarchy.service;

import com.tracker.hierarchy.model.ContainerLocator;
import com.tracker.hierarchy.model.FetchedNode;

import java.util.Collection;
import java.util.List;

/**
 * Read access to the tracking service.
 * Calls are blocking; implementations pace themselves against the service quota.
 */
public interface HierarchySource {

    /**
     * Fetch the declared root container.
     *
     * @param locator group and group-local number of the root
     * @return the root container
     * @throws RootNotFoundException if the root does not exist or cannot be read
     */
    FetchedNode getRoot(ContainerLocator locator);

    /**
     * Direct child containers of a container, using the service's own parent filter.
     *
     * @param container the parent container
     * @return children in the order the service returned them
     * @throws TransientFetchException if the call failed
     */
    List<FetchedNode> getChildren(FetchedNode container);

    /**
     * Leaf items attached to a container.
     *
     * @param container the owning container
     * @return leaf items in the order the service returned them
     * @throws TransientFetchException if the call failed
     */
    List<FetchedNode> getLeafItems(FetchedNode container);

    /**
     * Every container of the given groups, without any parent filter.
     * A group that cannot be listed contributes nothing.
     *
     * @param groupIds scope of the fetch
     * @return all containers found
     */
    List<FetchedNode> getAllContainersInScope(Collection<Long> groupIds);
}
