package com.tracker.hierarchy.service;

import com.tracker.hierarchy.model.ContainerLocator;
import com.tracker.hierarchy.model.FetchedNode;
import com.tracker.hierarchy.model.NodeState;
import com.tracker.hierarchy.model.NodeType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

/**
 * GitLabHierarchySource against a mocked GitLab API
 */
public class GitLabHierarchySourceTest {

    private static final String API = "https://gitlab.example/api/v4";

    private MockRestServiceServer server;
    private GitLabHierarchySource source;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplateBuilder().rootUri(API).build();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        source = new GitLabHierarchySource(restTemplate, 0, 100);
    }

    @Test
    void testRootEpicIsConverted() {
        server.expect(requestTo(API + "/groups/10/epics/1"))
                .andExpect(method(HttpMethod.GET))
                .andRespond(withSuccess(epicJson(501, 1, null, "opened")
                        .replace("\"due_date\":null", "\"due_date\":\"2024-06-30\""), MediaType.APPLICATION_JSON));

        FetchedNode root = source.getRoot(new ContainerLocator(10, 1));

        assertEquals("epic:10#1", root.getId());
        assertEquals(501, root.getInternalId());
        assertEquals(NodeType.CONTAINER, root.getType());
        assertNull(root.getParentInternalId());
        assertEquals(NodeState.OPENED, root.getState());
        assertEquals("alice", root.getAuthorUsername());
        assertEquals(Arrays.asList("team::core", "roadmap"), root.getLabels());
        assertEquals(LocalDate.of(2024, 6, 30), root.getDueDate());
        assertNotNull(root.getCreatedAt());
        server.verify();
    }

    @Test
    void testMissingRootIsFatal() {
        server.expect(requestTo(API + "/groups/10/epics/99"))
                .andRespond(withStatus(HttpStatus.NOT_FOUND));

        RootNotFoundException e = assertThrows(RootNotFoundException.class,
                () -> source.getRoot(new ContainerLocator(10, 99)));
        assertEquals(new ContainerLocator(10, 99), e.getRoot());
    }

    @Test
    void testRootServerErrorIsFatal() {
        server.expect(requestTo(API + "/groups/10/epics/1"))
                .andRespond(withServerError());

        assertThrows(RootNotFoundException.class, () -> source.getRoot(new ContainerLocator(10, 1)));
    }

    @Test
    void testChildrenFollowNextPageHeader() {
        HttpHeaders firstPage = new HttpHeaders();
        firstPage.add("X-Next-Page", "2");
        server.expect(requestTo(API + "/groups/10/epics?parent_id=501&per_page=100&page=1"))
                .andRespond(withSuccess("[" + epicJson(502, 2, 501L, "opened") + "]", MediaType.APPLICATION_JSON)
                        .headers(firstPage));
        HttpHeaders lastPage = new HttpHeaders();
        lastPage.add("X-Next-Page", "");
        server.expect(requestTo(API + "/groups/10/epics?parent_id=501&per_page=100&page=2"))
                .andRespond(withSuccess("[" + epicJson(503, 3, 501L, "closed") + "]", MediaType.APPLICATION_JSON)
                        .headers(lastPage));

        List<FetchedNode> children = source.getChildren(epic(501, 1));

        assertEquals(Arrays.asList("epic:10#2", "epic:10#3"),
                children.stream().map(FetchedNode::getId).collect(Collectors.toList()));
        assertEquals(Long.valueOf(501), children.get(0).getParentInternalId());
        assertTrue(children.get(1).isClosed());
        server.verify();
    }

    @Test
    void testLeafItemsAreConverted() {
        String issue = "{\"id\":9001,\"iid\":4,\"project_id\":77,\"title\":\"Fix login\",\"state\":\"closed\","
                + "\"assignee\":{\"username\":\"bob\"},\"weight\":3,\"labels\":[],"
                + "\"created_at\":\"2024-01-01T09:00:00.000Z\",\"closed_at\":\"2024-01-06T09:00:00.000Z\"}";
        server.expect(requestTo(API + "/groups/10/epics/1/issues?per_page=100&page=1"))
                .andRespond(withSuccess("[" + issue + ", {\"id\":9002}]", MediaType.APPLICATION_JSON));

        List<FetchedNode> issues = source.getLeafItems(epic(501, 1));

        assertEquals(1, issues.size(), "payload without iid is dropped");
        FetchedNode leaf = issues.get(0);
        assertEquals("issue:77#4", leaf.getId());
        assertEquals(NodeType.LEAF, leaf.getType());
        assertEquals("bob", leaf.getAssigneeUsername());
        assertEquals(Integer.valueOf(3), leaf.getWeight());
        assertNotNull(leaf.getClosedAt());
    }

    @Test
    void testLeafFetchFailureIsTransient() {
        server.expect(requestTo(API + "/groups/10/epics/1/issues?per_page=100&page=1"))
                .andRespond(withServerError());

        assertThrows(TransientFetchException.class, () -> source.getLeafItems(epic(501, 1)));
    }

    @Test
    void testScopeSkipsFailingGroup() {
        server.expect(requestTo(API + "/groups/10/epics?per_page=100&page=1"))
                .andRespond(withSuccess("[" + epicJson(501, 1, null, "opened") + ","
                        + epicJson(502, 2, 501L, "opened") + "]", MediaType.APPLICATION_JSON));
        server.expect(requestTo(API + "/groups/20/epics?per_page=100&page=1"))
                .andRespond(withStatus(HttpStatus.FORBIDDEN));

        List<FetchedNode> all = source.getAllContainersInScope(Arrays.asList(10L, 20L));

        assertEquals(2, all.size());
        server.verify();
    }

    @Test
    void testRepeatedNextPageEndsListing() {
        HttpHeaders samePage = new HttpHeaders();
        samePage.add("X-Next-Page", "1");
        server.expect(requestTo(API + "/groups/10/epics/1/issues?per_page=100&page=1"))
                .andRespond(withSuccess("[]", MediaType.APPLICATION_JSON).headers(samePage));

        List<FetchedNode> issues = source.getLeafItems(epic(501, 1));

        assertTrue(issues.isEmpty());
        server.verify();
    }

    @Test
    void testInterruptedThreadStopsBeforeCalling() {
        Thread.currentThread().interrupt();
        try {
            assertThrows(FetchInterruptedException.class, () -> source.getChildren(epic(501, 1)));
            assertThrows(FetchInterruptedException.class, () -> source.getAllContainersInScope(Arrays.asList(10L)));
            assertThrows(FetchInterruptedException.class, () -> source.getRoot(new ContainerLocator(10, 1)));
        } finally {
            Thread.interrupted();
        }
        server.verify();
    }

    private static FetchedNode epic(long internalId, long iid) {
        return FetchedNode.builder()
                .id("epic:10#" + iid)
                .internalId(internalId)
                .iid(iid)
                .type(NodeType.CONTAINER)
                .groupId(10L)
                .state(NodeState.OPENED)
                .build();
    }

    private static String epicJson(long id, long iid, Long parentId, String state) {
        return "{\"id\":" + id + ",\"iid\":" + iid + ",\"group_id\":10,"
                + "\"parent_id\":" + parentId + ",\"title\":\"Epic " + iid + "\",\"state\":\"" + state + "\","
                + "\"web_url\":\"https://gitlab.example/groups/g/-/epics/" + iid + "\","
                + "\"author\":{\"username\":\"alice\"},\"labels\":[\"team::core\",\"roadmap\"],"
                + "\"created_at\":\"2024-01-01T09:00:00.000Z\",\"updated_at\":\"2024-01-02T09:00:00.000Z\","
                + "\"closed_at\":null,\"due_date\":null}";
    }
}
