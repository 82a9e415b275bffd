package com.ryuqq.conductor.core.graph;

import com.ryuqq.conductor.core.exception.GraphException;
import com.ryuqq.conductor.core.model.Budget;
import com.ryuqq.conductor.core.model.DependencyEdge;
import com.ryuqq.conductor.core.model.ResourceId;
import com.ryuqq.conductor.core.model.SubtaskId;
import com.ryuqq.conductor.core.model.TaskId;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Task를 Budget 제한을 지키는 Subtask DAG로 분해.
 *
 * <p><strong>처리 순서:</strong></p>
 * <ol>
 *   <li>검증: 빈 리소스 집합, 집합 밖 리소스를 가리키는 간선, 순환 (자기 간선 포함)</li>
 *   <li>결정적 위상 정렬: 동률은 (Affinity 키, 그룹 내 연결 요소, 리소스 ID) 순</li>
 *   <li>청크 분할: Affinity 그룹마다 열린 청크 하나에 리소스를 채우고,
 *       가득 찼거나 청크 간 순환이 생기면 새 청크를 엶</li>
 *   <li>리소스 간선을 청크 간 의존성으로 투영</li>
 * </ol>
 *
 * <p>같은 입력에 대해 항상 같은 Subtask 목록과 ID를 만듭니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class TaskGraphBuilder {

    private final CostEstimator costEstimator;
    private final AffinityFunction affinity;

    /**
     * 기본 구현 (비용 0, 디렉토리 Affinity).
     */
    public TaskGraphBuilder() {
        this(CostEstimator.zero(), AffinityFunction.byDirectory());
    }

    public TaskGraphBuilder(CostEstimator costEstimator, AffinityFunction affinity) {
        if (costEstimator == null) {
            throw new IllegalArgumentException("costEstimator cannot be null");
        }
        if (affinity == null) {
            throw new IllegalArgumentException("affinity cannot be null");
        }
        this.costEstimator = costEstimator;
        this.affinity = affinity;
    }

    /**
     * 새 Task ID로 그래프 빌드.
     *
     * @see #build(TaskId, String, Collection, Collection, Budget)
     */
    public TaskGraph build(String description, Collection<ResourceId> resources,
                           Collection<DependencyEdge> edges, Budget budget) {
        return build(TaskId.random(), description, resources, edges, budget);
    }

    /**
     * 그래프 빌드.
     *
     * @param taskId Task ID
     * @param description Task 설명
     * @param resources 리소스 집합 (중복은 무시)
     * @param edges 리소스 간 의존성 (null이면 없음)
     * @param budget Subtask 크기와 oversized 기준
     * @return Subtask DAG
     * @throws IllegalArgumentException 인자가 null인 경우
     * @throws GraphException 리소스 집합이 비었거나, 알 수 없는 리소스를 가리키거나, 순환이 있는 경우
     */
    public TaskGraph build(TaskId taskId, String description, Collection<ResourceId> resources,
                           Collection<DependencyEdge> edges, Budget budget) {
        if (taskId == null) {
            throw new IllegalArgumentException("taskId cannot be null");
        }
        if (description == null) {
            throw new IllegalArgumentException("description cannot be null");
        }
        if (resources == null) {
            throw new IllegalArgumentException("resources cannot be null");
        }
        if (budget == null) {
            throw new IllegalArgumentException("budget cannot be null");
        }

        TreeSet<ResourceId> nodes = new TreeSet<>(resources);
        if (nodes.isEmpty()) {
            throw new GraphException(GraphException.Kind.EMPTY_RESOURCE_SET, "Resource set is empty");
        }

        Map<ResourceId, Set<ResourceId>> successors = new HashMap<>();
        Map<ResourceId, Set<ResourceId>> predecessors = new HashMap<>();
        for (ResourceId node : nodes) {
            successors.put(node, new TreeSet<>());
            predecessors.put(node, new TreeSet<>());
        }
        Set<DependencyEdge> distinctEdges = new LinkedHashSet<>();
        if (edges != null) {
            for (DependencyEdge edge : edges) {
                if (!nodes.contains(edge.prerequisite()) || !nodes.contains(edge.dependent())) {
                    throw new GraphException(GraphException.Kind.UNKNOWN_RESOURCE,
                        "Edge references a resource outside the set: " + edge);
                }
                successors.get(edge.prerequisite()).add(edge.dependent());
                predecessors.get(edge.dependent()).add(edge.prerequisite());
                distinctEdges.add(edge);
            }
        }

        Map<ResourceId, String> groups = new HashMap<>();
        for (ResourceId node : nodes) {
            String key = affinity.keyOf(node);
            if (key == null) {
                throw new IllegalArgumentException("Affinity key cannot be null (resource: " + node + ")");
            }
            groups.put(node, key);
        }
        Map<ResourceId, ResourceId> components = componentsWithinGroups(nodes, successors, groups);

        List<ResourceId> order = topologicalOrder(nodes, successors, predecessors, groups, components);
        List<Chunk> chunks = chunk(order, predecessors, groups, budget);

        List<SubtaskSpec> subtasks = new ArrayList<>();
        for (int i = 0; i < chunks.size(); i++) {
            Chunk chunk = chunks.get(i);
            List<SubtaskId> dependencies = new ArrayList<>();
            for (Integer prerequisite : chunk.prerequisites) {
                dependencies.add(SubtaskId.of(taskId, prerequisite + 1));
            }
            subtasks.add(new SubtaskSpec(SubtaskId.of(taskId, i + 1), chunk.resources, dependencies, chunk.oversized));
        }
        return new TaskGraph(taskId, description, new ArrayList<>(nodes), subtasks, new ArrayList<>(distinctEdges));
    }

    /**
     * 같은 Affinity 그룹 안의 간선만으로 연결 요소를 구하고, 요소의 최소 리소스 ID를 대표로 반환.
     */
    private static Map<ResourceId, ResourceId> componentsWithinGroups(TreeSet<ResourceId> nodes,
                                                                      Map<ResourceId, Set<ResourceId>> successors,
                                                                      Map<ResourceId, String> groups) {
        Map<ResourceId, Set<ResourceId>> undirected = new HashMap<>();
        for (ResourceId node : nodes) {
            undirected.put(node, new HashSet<>());
        }
        for (ResourceId from : nodes) {
            for (ResourceId to : successors.get(from)) {
                if (groups.get(from).equals(groups.get(to))) {
                    undirected.get(from).add(to);
                    undirected.get(to).add(from);
                }
            }
        }

        Map<ResourceId, ResourceId> representative = new HashMap<>();
        for (ResourceId start : nodes) {
            if (representative.containsKey(start)) {
                continue;
            }
            // nodes는 정렬되어 있으므로 처음 만나는 노드가 요소의 최소 ID
            Deque<ResourceId> stack = new ArrayDeque<>();
            stack.push(start);
            representative.put(start, start);
            while (!stack.isEmpty()) {
                ResourceId current = stack.pop();
                for (ResourceId neighbor : undirected.get(current)) {
                    if (!representative.containsKey(neighbor)) {
                        representative.put(neighbor, start);
                        stack.push(neighbor);
                    }
                }
            }
        }
        return representative;
    }

    /**
     * Kahn 알고리즘 기반 결정적 위상 정렬.
     *
     * @throws GraphException 순환이 있는 경우
     */
    private static List<ResourceId> topologicalOrder(TreeSet<ResourceId> nodes,
                                                     Map<ResourceId, Set<ResourceId>> successors,
                                                     Map<ResourceId, Set<ResourceId>> predecessors,
                                                     Map<ResourceId, String> groups,
                                                     Map<ResourceId, ResourceId> components) {
        Comparator<ResourceId> tieBreak = Comparator
            .comparing((ResourceId id) -> groups.get(id))
            .thenComparing((ResourceId id) -> components.get(id))
            .thenComparing(Comparator.naturalOrder());

        Map<ResourceId, Integer> inDegree = new HashMap<>();
        PriorityQueue<ResourceId> ready = new PriorityQueue<>(tieBreak);
        for (ResourceId node : nodes) {
            int degree = predecessors.get(node).size();
            inDegree.put(node, degree);
            if (degree == 0) {
                ready.add(node);
            }
        }

        List<ResourceId> order = new ArrayList<>(nodes.size());
        while (!ready.isEmpty()) {
            ResourceId next = ready.poll();
            order.add(next);
            for (ResourceId dependent : successors.get(next)) {
                int remaining = inDegree.merge(dependent, -1, Integer::sum);
                if (remaining == 0) {
                    ready.add(dependent);
                }
            }
        }

        if (order.size() < nodes.size()) {
            Set<ResourceId> cyclic = new TreeSet<>(nodes);
            order.forEach(cyclic::remove);
            throw new GraphException(GraphException.Kind.CYCLIC, "Dependency cycle among resources: " + cyclic);
        }
        return order;
    }

    private List<Chunk> chunk(List<ResourceId> order, Map<ResourceId, Set<ResourceId>> predecessors,
                              Map<ResourceId, String> groups, Budget budget) {
        List<Chunk> chunks = new ArrayList<>();
        Map<ResourceId, Integer> chunkOf = new HashMap<>();
        Map<String, Integer> openChunk = new TreeMap<>();

        for (ResourceId resource : order) {
            Set<Integer> prerequisiteChunks = new TreeSet<>();
            for (ResourceId predecessor : predecessors.get(resource)) {
                prerequisiteChunks.add(chunkOf.get(predecessor));
            }

            int target;
            if (costEstimator.estimate(resource) > budget.softThreshold()) {
                target = open(chunks, true);
            } else {
                String group = groups.get(resource);
                Integer candidate = openChunk.get(group);
                if (candidate == null
                    || chunks.get(candidate).resources.size() >= budget.maxResourcesPerSubtask()
                    || wouldCreateCycle(chunks, candidate, prerequisiteChunks)) {
                    candidate = open(chunks, false);
                    openChunk.put(group, candidate);
                }
                target = candidate;
            }

            Chunk chunk = chunks.get(target);
            chunk.resources.add(resource);
            chunkOf.put(resource, target);
            for (Integer prerequisite : prerequisiteChunks) {
                if (prerequisite != target) {
                    chunk.prerequisites.add(prerequisite);
                    chunks.get(prerequisite).dependents.add(target);
                }
            }
        }
        return chunks;
    }

    private static int open(List<Chunk> chunks, boolean oversized) {
        chunks.add(new Chunk(oversized));
        return chunks.size() - 1;
    }

    /**
     * candidate 청크에서 출발해 선행 청크 중 하나에 도달할 수 있으면,
     * 그 선행 청크 → candidate 간선을 추가할 때 순환이 생김.
     */
    private static boolean wouldCreateCycle(List<Chunk> chunks, int candidate, Set<Integer> prerequisiteChunks) {
        if (prerequisiteChunks.isEmpty()) {
            return false;
        }
        Set<Integer> visited = new HashSet<>();
        Deque<Integer> stack = new ArrayDeque<>();
        stack.push(candidate);
        while (!stack.isEmpty()) {
            int current = stack.pop();
            for (Integer next : chunks.get(current).dependents) {
                if (prerequisiteChunks.contains(next)) {
                    return true;
                }
                if (visited.add(next)) {
                    stack.push(next);
                }
            }
        }
        return false;
    }

    private static final class Chunk {
        private final boolean oversized;
        private final List<ResourceId> resources = new ArrayList<>();
        private final Set<Integer> prerequisites = new TreeSet<>();
        private final Set<Integer> dependents = new TreeSet<>();

        private Chunk(boolean oversized) {
            this.oversized = oversized;
        }
    }
}
