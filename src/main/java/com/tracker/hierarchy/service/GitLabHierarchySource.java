package com.tracker.hierarchy.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.tracker.hierarchy.constants.HierarchyConstants;
import com.tracker.hierarchy.model.ContainerLocator;
import com.tracker.hierarchy.model.FetchedNode;
import com.tracker.hierarchy.util.GitLabNodeConverter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.function.Function;

/**
 * Hierarchy source over the GitLab v4 REST API.
 *
 * Containers are epics, leaf items are the issues attached to an epic. Every call is
 * followed by a fixed pause to stay inside the API quota; there is no retry.
 */
@Slf4j
@Service
public class GitLabHierarchySource implements HierarchySource {

    private static final String EPIC_URI = "/groups/{groupId}/epics/{iid}";
    private static final String CHILD_EPICS_URI = "/groups/{groupId}/epics?parent_id={parentId}&per_page={perPage}&page={page}";
    private static final String GROUP_EPICS_URI = "/groups/{groupId}/epics?per_page={perPage}&page={page}";
    private static final String EPIC_ISSUES_URI = "/groups/{groupId}/epics/{iid}/issues?per_page={perPage}&page={page}";

    private final RestTemplate restTemplate;
    private final long rateLimitDelayMs;
    private final int pageSize;

    public GitLabHierarchySource(
            @Qualifier("gitLabRestTemplate") RestTemplate restTemplate,
            @Value("${gitlab.rate-limit-delay-ms:500}") long rateLimitDelayMs,
            @Value("${gitlab.page-size:100}") int pageSize) {
        this.restTemplate = restTemplate;
        this.rateLimitDelayMs = rateLimitDelayMs;
        this.pageSize = Math.min(Math.max(pageSize, 1), HierarchyConstants.GitLab.MAX_PAGE_SIZE);
    }

    @Override
    public FetchedNode getRoot(ContainerLocator locator) {
        log.debug("[Source] fetching epic {}", locator);

        if (Thread.currentThread().isInterrupted()) {
            throw new FetchInterruptedException("Interrupted before fetching epic " + locator);
        }

        JsonNode body;
        try {
            body = restTemplate.getForObject(EPIC_URI, JsonNode.class, locator.getGroupId(), locator.getIid());
        } catch (HttpClientErrorException.NotFound e) {
            throw new RootNotFoundException(locator, "Epic " + locator + " not found", e);
        } catch (RestClientException e) {
            throw new RootNotFoundException(locator, "Failed to fetch epic " + locator + ": " + e.getMessage(), e);
        }
        pace();

        FetchedNode root = GitLabNodeConverter.convertEpic(body, locator.getGroupId());
        if (root == null) {
            throw new RootNotFoundException(locator, "Epic " + locator + " returned an unusable payload");
        }
        return root;
    }

    /**
     * Relies on the {@code parent_id} filter, which some GitLab versions ignore.
     * Use the batch strategy when children come back wrong.
     */
    @Override
    public List<FetchedNode> getChildren(FetchedNode container) {
        log.debug("[Source] fetching child epics of {}", container.getId());
        try {
            return fetchAllPages(
                    page -> restTemplate.getForEntity(CHILD_EPICS_URI, JsonNode.class,
                            container.getGroupId(), container.getInternalId(), pageSize, page),
                    body -> GitLabNodeConverter.convertEpicList(body, container.getGroupId()));
        } catch (RestClientException e) {
            throw new TransientFetchException("Failed to fetch child epics of " + container.getId(), e);
        }
    }

    @Override
    public List<FetchedNode> getLeafItems(FetchedNode container) {
        log.debug("[Source] fetching issues of {}", container.getId());
        try {
            return fetchAllPages(
                    page -> restTemplate.getForEntity(EPIC_ISSUES_URI, JsonNode.class,
                            container.getGroupId(), container.getIid(), pageSize, page),
                    GitLabNodeConverter::convertIssueList);
        } catch (RestClientException e) {
            throw new TransientFetchException("Failed to fetch issues of " + container.getId(), e);
        }
    }

    @Override
    public List<FetchedNode> getAllContainersInScope(Collection<Long> groupIds) {
        List<FetchedNode> all = new ArrayList<>();
        if (groupIds == null || groupIds.isEmpty()) {
            log.warn("[Source] empty scope, no epics fetched");
            return all;
        }

        log.info("[Source] fetching epics from {} group(s)", groupIds.size());
        for (Long groupId : groupIds) {
            if (groupId == null) {
                continue;
            }
            try {
                List<FetchedNode> epics = fetchAllPages(
                        page -> restTemplate.getForEntity(GROUP_EPICS_URI, JsonNode.class, groupId, pageSize, page),
                        body -> GitLabNodeConverter.convertEpicList(body, groupId));
                log.info("[Source] fetched {} epic(s) from group {}", epics.size(), groupId);
                all.addAll(epics);
            } catch (RestClientException e) {
                log.warn("[Source] could not list epics of group {}: {}", groupId, e.getMessage());
            }
        }

        log.info("[Source] fetched {} epic(s) in total", all.size());
        return all;
    }

    /**
     * Follow {@code X-Next-Page} until the last page. A header that does not move
     * forward ends the listing.
     */
    private List<FetchedNode> fetchAllPages(Function<Integer, ResponseEntity<JsonNode>> call,
                                            Function<JsonNode, List<FetchedNode>> converter) {
        List<FetchedNode> nodes = new ArrayList<>();
        Integer page = 1;
        while (page != null) {
            if (Thread.currentThread().isInterrupted()) {
                throw new FetchInterruptedException("Interrupted before requesting page " + page);
            }
            ResponseEntity<JsonNode> response = call.apply(page);
            nodes.addAll(converter.apply(response.getBody()));
            page = nextPage(response, page);
            pace();
        }
        return nodes;
    }

    private Integer nextPage(ResponseEntity<JsonNode> response, int currentPage) {
        String next = response.getHeaders().getFirst(HierarchyConstants.GitLab.NEXT_PAGE_HEADER);
        if (next == null || next.trim().isEmpty()) {
            return null;
        }
        int nextPage;
        try {
            nextPage = Integer.parseInt(next.trim());
        } catch (NumberFormatException e) {
            log.warn("[Source] ignoring malformed {} header: {}", HierarchyConstants.GitLab.NEXT_PAGE_HEADER, next);
            return null;
        }
        if (nextPage <= currentPage) {
            log.warn("[Source] {} header points back to page {} from page {}, stopping",
                    HierarchyConstants.GitLab.NEXT_PAGE_HEADER, nextPage, currentPage);
            return null;
        }
        return nextPage;
    }

    private void pace() {
        if (rateLimitDelayMs <= 0) {
            return;
        }
        try {
            Thread.sleep(rateLimitDelayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FetchInterruptedException("Interrupted while pacing GitLab calls", e);
        }
    }
}
